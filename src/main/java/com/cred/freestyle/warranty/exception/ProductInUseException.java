package com.cred.freestyle.warranty.exception;

/**
 * Exception thrown when deleting a product that still has serial numbers.
 *
 * @author Warranty Platform Team
 */
public class ProductInUseException extends RuntimeException {

    private final Long productId;
    private final long serialCount;

    public ProductInUseException(Long productId, long serialCount) {
        super(String.format("Product %d cannot be deleted: %d serial number(s) are associated with it",
                productId, serialCount));
        this.productId = productId;
        this.serialCount = serialCount;
    }

    public Long getProductId() {
        return productId;
    }

    public long getSerialCount() {
        return serialCount;
    }
}
