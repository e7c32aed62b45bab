package com.cred.freestyle.warranty.service;

import com.cred.freestyle.warranty.domain.model.LedgerCounts;
import com.cred.freestyle.warranty.exception.ResourceNotFoundException;
import com.cred.freestyle.warranty.infrastructure.cache.RedisCacheService;
import com.cred.freestyle.warranty.infrastructure.metrics.CloudWatchMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Read-only inventory rollups over the ledger.
 *
 * Counts come from a single aggregate query and are cached briefly in Redis;
 * writers evict the cache after each commit. Values may trail concurrent
 * writes but are always computed from one consistent read.
 *
 * @author Warranty Platform Team
 */
@Service
public class InventoryAggregator {

    private static final Logger logger = LoggerFactory.getLogger(InventoryAggregator.class);

    private static final String CACHE_TYPE = "inventory";

    private final SerialLedgerStore ledgerStore;
    private final ProductService productService;
    private final RedisCacheService cacheService;
    private final CloudWatchMetricsService metricsService;

    public InventoryAggregator(
            SerialLedgerStore ledgerStore,
            ProductService productService,
            RedisCacheService cacheService,
            CloudWatchMetricsService metricsService
    ) {
        this.ledgerStore = ledgerStore;
        this.productService = productService;
        this.cacheService = cacheService;
        this.metricsService = metricsService;
    }

    /**
     * Uploaded, assigned and available counts for one product.
     *
     * @param productId Product ID
     * @return Ledger counts (available = max(0, uploaded - assigned))
     * @throws ResourceNotFoundException if the product does not exist
     */
    public LedgerCounts productInventory(Long productId) {
        Optional<LedgerCounts> cached = cacheService.getProductInventory(productId);
        if (cached.isPresent()) {
            metricsService.recordCacheHit(CACHE_TYPE);
            return cached.get();
        }
        metricsService.recordCacheMiss(CACHE_TYPE);

        if (!productService.exists(productId)) {
            throw new ResourceNotFoundException("Product", String.valueOf(productId));
        }

        LedgerCounts counts = ledgerStore.countsByProduct(productId);
        cacheService.setProductInventory(productId, counts);
        logger.debug("Inventory for product {}: uploaded={}, assigned={}, available={}",
                productId, counts.getUploaded(), counts.getAssigned(), counts.getAvailable());
        return counts;
    }

    /**
     * Uploaded, assigned and available counts across all products.
     */
    public LedgerCounts overallInventory() {
        Optional<LedgerCounts> cached = cacheService.getOverallInventory();
        if (cached.isPresent()) {
            metricsService.recordCacheHit(CACHE_TYPE);
            return cached.get();
        }
        metricsService.recordCacheMiss(CACHE_TYPE);

        LedgerCounts counts = ledgerStore.countsOverall();
        cacheService.setOverallInventory(counts);
        return counts;
    }
}
