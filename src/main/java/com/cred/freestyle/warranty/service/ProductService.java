package com.cred.freestyle.warranty.service;

import com.cred.freestyle.warranty.domain.model.Product;
import com.cred.freestyle.warranty.domain.model.SerialRecord;
import com.cred.freestyle.warranty.exception.ProductInUseException;
import com.cred.freestyle.warranty.exception.ResourceNotFoundException;
import com.cred.freestyle.warranty.infrastructure.audit.AuditActions;
import com.cred.freestyle.warranty.infrastructure.audit.AuditLogSink;
import com.cred.freestyle.warranty.infrastructure.cache.RedisCacheService;
import com.cred.freestyle.warranty.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service for the product catalog that serial numbers are imported against.
 *
 * @author Warranty Platform Team
 */
@Service
public class ProductService {

    private static final Logger logger = LoggerFactory.getLogger(ProductService.class);

    public static final int MAX_PAGE_SIZE = 100;

    private final ProductRepository productRepository;
    private final SerialLedgerStore ledgerStore;
    private final AuditLogSink auditLogSink;
    private final RedisCacheService cacheService;

    public ProductService(
            ProductRepository productRepository,
            SerialLedgerStore ledgerStore,
            AuditLogSink auditLogSink,
            RedisCacheService cacheService
    ) {
        this.productRepository = productRepository;
        this.ledgerStore = ledgerStore;
        this.auditLogSink = auditLogSink;
        this.cacheService = cacheService;
    }

    public boolean exists(Long productId) {
        return productId != null && productRepository.existsById(productId);
    }

    /**
     * Get a product by ID.
     *
     * @throws ResourceNotFoundException if the product does not exist
     */
    public Product getProduct(Long productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", String.valueOf(productId)));
    }

    public List<Product> getActiveProducts() {
        return productRepository.findByIsActiveTrueOrderByNameAsc();
    }

    public List<Product> getAllProducts() {
        return productRepository.findAllByOrderByNameAsc();
    }

    /**
     * Create a product.
     *
     * @param name Display name
     * @param description Optional description
     * @param active Whether the product is listed for customers (defaults to true)
     * @param actor Administrator performing the change
     * @return Saved product
     */
    public Product createProduct(String name, String description, Boolean active, String actor) {
        Product product = productRepository.save(Product.builder()
                .name(name.trim())
                .description(description)
                .isActive(active == null ? Boolean.TRUE : active)
                .build());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("name", product.getName());
        details.put("is_active", product.getIsActive());
        auditLogSink.record(actor, AuditActions.CREATE_PRODUCT, AuditActions.TARGET_PRODUCT,
                String.valueOf(product.getProductId()), details);

        logger.info("Product {} created: {}", product.getProductId(), product.getName());
        return product;
    }

    /**
     * Update a product's name, description and active flag. Null arguments keep the current value.
     *
     * @throws ResourceNotFoundException if the product does not exist
     */
    public Product updateProduct(Long productId, String name, String description, Boolean active, String actor) {
        Product product = getProduct(productId);

        Map<String, Object> changes = new LinkedHashMap<>();
        if (name != null && !name.trim().equals(product.getName())) {
            changes.put("name", Map.of("old", product.getName(), "new", name.trim()));
            product.setName(name.trim());
        }
        if (description != null && !description.equals(product.getDescription())) {
            changes.put("description", "updated");
            product.setDescription(description);
        }
        if (active != null && !active.equals(product.getIsActive())) {
            changes.put("is_active", Map.of("old", product.getIsActive(), "new", active));
            product.setIsActive(active);
        }

        if (changes.isEmpty()) {
            logger.debug("No changes for product {}", productId);
            return product;
        }

        Product saved = productRepository.save(product);
        auditLogSink.record(actor, AuditActions.UPDATE_PRODUCT, AuditActions.TARGET_PRODUCT,
                String.valueOf(productId), changes);
        logger.info("Product {} updated: {}", productId, changes.keySet());
        return saved;
    }

    /**
     * Delete a product that has no serial numbers.
     *
     * @throws ResourceNotFoundException if the product does not exist
     * @throws ProductInUseException if serial numbers reference the product
     */
    public void deleteProduct(Long productId, String actor) {
        Product product = getProduct(productId);

        long serialCount = ledgerStore.countByProduct(productId);
        if (serialCount > 0) {
            logger.warn("Refusing to delete product {}: {} serial number(s) attached", productId, serialCount);
            throw new ProductInUseException(productId, serialCount);
        }

        try {
            productRepository.delete(product);
        } catch (DataIntegrityViolationException e) {
            // A concurrent import attached serials after the count
            logger.warn("Product {} gained serial numbers during delete", productId);
            throw new ProductInUseException(productId, ledgerStore.countByProduct(productId));
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("name", product.getName());
        auditLogSink.record(actor, AuditActions.DELETE_PRODUCT, AuditActions.TARGET_PRODUCT,
                String.valueOf(productId), details);
        cacheService.evictInventory(productId);

        logger.info("Product {} deleted by {}", productId, actor);
    }

    /**
     * Page through the serial numbers uploaded for a product, ordered by serial.
     *
     * @throws ResourceNotFoundException if the product does not exist
     */
    public Page<SerialRecord> listSerials(Long productId, int page, int size) {
        getProduct(productId);
        int pageSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        return ledgerStore.findByProduct(productId,
                PageRequest.of(Math.max(page, 0), pageSize, Sort.by("serialNumber")));
    }
}
