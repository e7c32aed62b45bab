package com.cred.freestyle.warranty.api.dto;

import com.cred.freestyle.warranty.domain.model.LedgerCounts;

/**
 * Response DTO for inventory rollups. productId is null for the overall rollup.
 *
 * @author Warranty Platform Team
 */
public class InventoryResponse {

    private Long productId;
    private Long totalUploaded;
    private Long totalAssigned;
    private Long inventoryLeft;

    public InventoryResponse() {
    }

    public static InventoryResponse fromCounts(Long productId, LedgerCounts counts) {
        InventoryResponse response = new InventoryResponse();
        response.setProductId(productId);
        response.setTotalUploaded(counts.getUploaded());
        response.setTotalAssigned(counts.getAssigned());
        response.setInventoryLeft(counts.getAvailable());
        return response;
    }

    // Getters and setters
    public Long getProductId() {
        return productId;
    }

    public void setProductId(Long productId) {
        this.productId = productId;
    }

    public Long getTotalUploaded() {
        return totalUploaded;
    }

    public void setTotalUploaded(Long totalUploaded) {
        this.totalUploaded = totalUploaded;
    }

    public Long getTotalAssigned() {
        return totalAssigned;
    }

    public void setTotalAssigned(Long totalAssigned) {
        this.totalAssigned = totalAssigned;
    }

    public Long getInventoryLeft() {
        return inventoryLeft;
    }

    public void setInventoryLeft(Long inventoryLeft) {
        this.inventoryLeft = inventoryLeft;
    }
}
