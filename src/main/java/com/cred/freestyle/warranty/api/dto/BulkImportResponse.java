package com.cred.freestyle.warranty.api.dto;

import com.cred.freestyle.warranty.domain.model.BulkImportResult;

import java.util.List;

/**
 * Response DTO for a bulk import.
 *
 * @author Warranty Platform Team
 */
public class BulkImportResponse {

    private Long productId;
    private Integer addedCount;
    private List<String> duplicatesFound;
    private List<String> errors;
    private String message;

    public BulkImportResponse() {
    }

    public static BulkImportResponse fromResult(BulkImportResult result) {
        BulkImportResponse response = new BulkImportResponse();
        response.setProductId(result.getProductId());
        response.setAddedCount(result.getAddedCount());
        response.setDuplicatesFound(result.getDuplicatesFound());
        response.setErrors(result.getErrors());
        response.setMessage(String.format("%d serial number(s) added, %d duplicate(s), %d error(s)",
                result.getAddedCount(), result.getDuplicatesFound().size(), result.getErrors().size()));
        return response;
    }

    // Getters and setters
    public Long getProductId() {
        return productId;
    }

    public void setProductId(Long productId) {
        this.productId = productId;
    }

    public Integer getAddedCount() {
        return addedCount;
    }

    public void setAddedCount(Integer addedCount) {
        this.addedCount = addedCount;
    }

    public List<String> getDuplicatesFound() {
        return duplicatesFound;
    }

    public void setDuplicatesFound(List<String> duplicatesFound) {
        this.duplicatesFound = duplicatesFound;
    }

    public List<String> getErrors() {
        return errors;
    }

    public void setErrors(List<String> errors) {
        this.errors = errors;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
