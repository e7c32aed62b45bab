package com.cred.freestyle.warranty.infrastructure.cache;

import com.cred.freestyle.warranty.domain.model.LedgerCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis cache for inventory rollups.
 *
 * The ledger in the database is the source of truth; cached counts are a
 * short-lived read optimization and are evicted whenever a claim, release
 * or import commits. Every operation swallows Redis errors so an unavailable
 * cache degrades to database reads.
 *
 * Cache Keys:
 * - inventory:product:{product_id} -> "uploaded:assigned"
 * - inventory:overall -> "uploaded:assigned"
 *
 * @author Warranty Platform Team
 */
@Service
public class RedisCacheService {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheService.class);

    private static final String PRODUCT_INVENTORY_PREFIX = "inventory:product:";
    private static final String OVERALL_INVENTORY_KEY = "inventory:overall";

    private final StringRedisTemplate redisTemplate;
    private final Duration inventoryTtl;

    public RedisCacheService(
            StringRedisTemplate redisTemplate,
            @Value("${warranty.cache.inventory-ttl-seconds:30}") long inventoryTtlSeconds
    ) {
        this.redisTemplate = redisTemplate;
        this.inventoryTtl = Duration.ofSeconds(inventoryTtlSeconds);
    }

    /**
     * Get cached inventory counts for a product.
     *
     * @param productId Product ID
     * @return Optional containing cached counts
     */
    public Optional<LedgerCounts> getProductInventory(Long productId) {
        return get(PRODUCT_INVENTORY_PREFIX + productId);
    }

    public void setProductInventory(Long productId, LedgerCounts counts) {
        set(PRODUCT_INVENTORY_PREFIX + productId, counts);
    }

    public Optional<LedgerCounts> getOverallInventory() {
        return get(OVERALL_INVENTORY_KEY);
    }

    public void setOverallInventory(LedgerCounts counts) {
        set(OVERALL_INVENTORY_KEY, counts);
    }

    /**
     * Evict the product's cached counts and the overall rollup.
     *
     * @param productId Product ID
     */
    public void evictInventory(Long productId) {
        try {
            redisTemplate.delete(List.of(PRODUCT_INVENTORY_PREFIX + productId, OVERALL_INVENTORY_KEY));
            logger.debug("Evicted inventory cache for product {}", productId);
        } catch (Exception e) {
            logger.error("Error evicting inventory cache for product: {}", productId, e);
        }
    }

    private Optional<LedgerCounts> get(String key) {
        try {
            String value = redisTemplate.opsForValue().get(key);
            if (value == null) {
                logger.debug("Cache miss for {}", key);
                return Optional.empty();
            }
            String[] parts = value.split(":");
            if (parts.length != 2) {
                logger.warn("Ignoring malformed cache value for {}: {}", key, value);
                return Optional.empty();
            }
            logger.debug("Cache hit for {}", key);
            return Optional.of(new LedgerCounts(Long.parseLong(parts[0]), Long.parseLong(parts[1])));
        } catch (Exception e) {
            logger.error("Error reading inventory cache for key: {}", key, e);
            return Optional.empty();
        }
    }

    private void set(String key, LedgerCounts counts) {
        try {
            redisTemplate.opsForValue().set(key, counts.getUploaded() + ":" + counts.getAssigned(), inventoryTtl);
            logger.debug("Cached inventory for {}: uploaded={}, assigned={}",
                    key, counts.getUploaded(), counts.getAssigned());
        } catch (Exception e) {
            logger.error("Error writing inventory cache for key: {}", key, e);
        }
    }
}
