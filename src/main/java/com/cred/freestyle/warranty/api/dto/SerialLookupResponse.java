package com.cred.freestyle.warranty.api.dto;

import com.cred.freestyle.warranty.domain.model.Product;
import com.cred.freestyle.warranty.domain.model.SerialRecord;

/**
 * Public serial lookup result. Carries no owner or bill details.
 *
 * @author Warranty Platform Team
 */
public class SerialLookupResponse {

    private String serialNumber;
    private Long productId;
    private String productName;
    private String status;
    private Boolean registered;

    public SerialLookupResponse() {
    }

    public static SerialLookupResponse fromEntity(SerialRecord record, Product product) {
        SerialLookupResponse response = new SerialLookupResponse();
        response.setSerialNumber(record.getSerialNumber());
        response.setProductId(record.getProductId());
        response.setProductName(product != null ? product.getName() : null);
        response.setStatus(record.getStatus().name());
        response.setRegistered(record.isRegistered());
        return response;
    }

    // Getters and setters
    public String getSerialNumber() {
        return serialNumber;
    }

    public void setSerialNumber(String serialNumber) {
        this.serialNumber = serialNumber;
    }

    public Long getProductId() {
        return productId;
    }

    public void setProductId(Long productId) {
        this.productId = productId;
    }

    public String getProductName() {
        return productName;
    }

    public void setProductName(String productName) {
        this.productName = productName;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Boolean getRegistered() {
        return registered;
    }

    public void setRegistered(Boolean registered) {
        this.registered = registered;
    }
}
