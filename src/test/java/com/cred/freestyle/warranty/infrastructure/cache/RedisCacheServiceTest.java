package com.cred.freestyle.warranty.infrastructure.cache;

import com.cred.freestyle.warranty.domain.model.LedgerCounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RedisCacheService.
 * Tests the inventory value format and that Redis failures never escape.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RedisCacheService Unit Tests")
class RedisCacheServiceTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisCacheService cacheService;

    @BeforeEach
    void setUp() {
        cacheService = new RedisCacheService(redisTemplate, 30);
    }

    @Test
    @DisplayName("setProductInventory - Should store uploaded:assigned with the configured TTL")
    void setProductInventory_StoresValueWithTtl() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        // When
        cacheService.setProductInventory(7L, new LedgerCounts(120L, 45L));

        // Then
        verify(valueOperations).set("inventory:product:7", "120:45", Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("getProductInventory - CacheHit: Should parse the stored counts")
    void getProductInventory_CacheHit() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("inventory:product:7")).thenReturn("120:45");

        // When
        Optional<LedgerCounts> counts = cacheService.getProductInventory(7L);

        // Then
        assertThat(counts).isPresent();
        assertThat(counts.get().getAvailable()).isEqualTo(75L);
    }

    @Test
    @DisplayName("getProductInventory - Malformed value: Should be treated as a miss")
    void getProductInventory_MalformedValue_Miss() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("inventory:product:7")).thenReturn("garbage");

        // When / Then
        assertThat(cacheService.getProductInventory(7L)).isEmpty();
    }

    @Test
    @DisplayName("getOverallInventory - Redis down: Should return empty instead of failing")
    void getOverallInventory_RedisDown_ReturnsEmpty() {
        // Given
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("connection refused"));

        // When / Then
        assertThat(cacheService.getOverallInventory()).isEmpty();
    }

    @Test
    @DisplayName("evictInventory - Should remove the product key and the overall rollup")
    void evictInventory_RemovesProductAndOverall() {
        // When
        cacheService.evictInventory(7L);

        // Then
        verify(redisTemplate).delete(List.of("inventory:product:7", "inventory:overall"));
    }

    @Test
    @DisplayName("evictInventory - Redis down: Should not throw")
    void evictInventory_RedisDown_DoesNotThrow() {
        // Given
        when(redisTemplate.delete(anyCollection())).thenThrow(new RedisConnectionFailureException("connection refused"));

        // When / Then
        assertThatCode(() -> cacheService.evictInventory(7L)).doesNotThrowAnyException();
    }
}
