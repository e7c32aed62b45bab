package com.cred.freestyle.warranty.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for importing a JSON list of serial numbers into a product.
 *
 * @author Warranty Platform Team
 */
public class BulkImportRequest {

    @NotNull(message = "serialNumbers is required")
    @Size(max = 50000, message = "At most 50000 serial numbers per import")
    private List<String> serialNumbers;

    public BulkImportRequest() {
    }

    public BulkImportRequest(List<String> serialNumbers) {
        this.serialNumbers = serialNumbers;
    }

    // Getters and setters
    public List<String> getSerialNumbers() {
        return serialNumbers;
    }

    public void setSerialNumbers(List<String> serialNumbers) {
        this.serialNumbers = serialNumbers;
    }
}
