package com.cred.freestyle.warranty.api.controller;

import com.cred.freestyle.warranty.api.dto.InventoryResponse;
import com.cred.freestyle.warranty.api.dto.ProductRequest;
import com.cred.freestyle.warranty.api.dto.ProductResponse;
import com.cred.freestyle.warranty.domain.model.Product;
import com.cred.freestyle.warranty.security.SecurityUtils;
import com.cred.freestyle.warranty.service.InventoryAggregator;
import com.cred.freestyle.warranty.service.ProductService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for the product catalog and inventory dashboard.
 *
 * @author Warranty Platform Team
 */
@RestController
@RequestMapping("/api/v1")
public class ProductController {

    private final ProductService productService;
    private final InventoryAggregator inventoryAggregator;

    public ProductController(ProductService productService, InventoryAggregator inventoryAggregator) {
        this.productService = productService;
        this.inventoryAggregator = inventoryAggregator;
    }

    /**
     * Active products, for the registration form. Public.
     */
    @GetMapping("/products")
    public ResponseEntity<List<ProductResponse>> getActiveProducts() {
        return ResponseEntity.ok(toResponses(productService.getActiveProducts()));
    }

    @GetMapping("/admin/products")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<ProductResponse>> getAllProducts() {
        return ResponseEntity.ok(toResponses(productService.getAllProducts()));
    }

    @PostMapping("/admin/products")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ProductResponse> createProduct(@Valid @RequestBody ProductRequest request) {
        Product product = productService.createProduct(request.getName(), request.getDescription(),
                request.getIsActive(), SecurityUtils.currentActor());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProductResponse.fromEntity(product));
    }

    @PutMapping("/admin/products/{productId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ProductResponse> updateProduct(
            @PathVariable Long productId,
            @Valid @RequestBody ProductRequest request
    ) {
        Product product = productService.updateProduct(productId, request.getName(), request.getDescription(),
                request.getIsActive(), SecurityUtils.currentActor());
        return ResponseEntity.ok(ProductResponse.fromEntity(product));
    }

    /**
     * Delete a product. Rejected with 409 while serial numbers reference it.
     */
    @DeleteMapping("/admin/products/{productId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteProduct(@PathVariable Long productId) {
        productService.deleteProduct(productId, SecurityUtils.currentActor());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/admin/products/{productId}/inventory")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<InventoryResponse> getProductInventory(@PathVariable Long productId) {
        return ResponseEntity.ok(InventoryResponse.fromCounts(productId, inventoryAggregator.productInventory(productId)));
    }

    /**
     * Uploaded, assigned and available counts across all products.
     */
    @GetMapping("/admin/inventory")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<InventoryResponse> getOverallInventory() {
        return ResponseEntity.ok(InventoryResponse.fromCounts(null, inventoryAggregator.overallInventory()));
    }

    private static List<ProductResponse> toResponses(List<Product> products) {
        return products.stream()
                .map(ProductResponse::fromEntity)
                .collect(Collectors.toList());
    }
}
