package com.cred.freestyle.warranty.infrastructure.audit;

import com.cred.freestyle.warranty.domain.model.AuditEntry;
import com.cred.freestyle.warranty.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.warranty.repository.AuditEntryRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AuditLogSink.
 * Tests that audit writes are isolated, retried once on transient errors and never thrown.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AuditLogSink Unit Tests")
class AuditLogSinkTest {

    @Mock
    private AuditEntryRepository auditEntryRepository;

    @Mock
    private CloudWatchMetricsService metricsService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private AuditLogSink auditLogSink;

    private Map<String, Object> details;

    @BeforeEach
    void setUp() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        auditLogSink = new AuditLogSink(auditEntryRepository, new ObjectMapper(), metricsService, transactionManager, 0);

        details = new LinkedHashMap<>();
        details.put("serial_number", "SN-001");
        details.put("product_id", 3L);
    }

    @Test
    @DisplayName("record - Success: Should persist one entry with JSON details in its own transaction")
    void record_Success_PersistsEntry() {
        // When
        auditLogSink.record("user-1", AuditActions.REGISTER_SERIAL, AuditActions.TARGET_SERIAL, "SN-001", details);

        // Then
        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditEntryRepository).save(captor.capture());
        AuditEntry entry = captor.getValue();
        assertThat(entry.getActor()).isEqualTo("user-1");
        assertThat(entry.getAction()).isEqualTo("register_serial");
        assertThat(entry.getTargetType()).isEqualTo("SerialNumber");
        assertThat(entry.getTargetId()).isEqualTo("SN-001");
        assertThat(entry.getDetails()).isEqualTo("{\"serial_number\":\"SN-001\",\"product_id\":3}");
        assertThat(entry.getOccurredAt()).isNotNull();

        ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertThat(definition.getValue().getPropagationBehavior())
                .isEqualTo(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        verify(metricsService, never()).recordAuditDropped(anyString());
    }

    @Test
    @DisplayName("record - Transient failure once: Should retry and persist")
    void record_TransientFailureOnce_Retries() {
        // Given
        when(auditEntryRepository.save(any(AuditEntry.class)))
                .thenThrow(new CannotAcquireLockException("database is locked"))
                .thenAnswer(invocation -> invocation.getArgument(0));

        // When
        auditLogSink.record("user-1", AuditActions.REGISTER_SERIAL, AuditActions.TARGET_SERIAL, "SN-001", details);

        // Then
        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditEntryRepository, times(2)).save(captor.capture());
        List<AuditEntry> attempts = captor.getAllValues();
        assertThat(attempts.get(0)).isNotSameAs(attempts.get(1));
        assertThat(attempts.get(1).getOccurredAt()).isEqualTo(attempts.get(0).getOccurredAt());
        verify(metricsService, never()).recordAuditDropped(anyString());
    }

    @Test
    @DisplayName("record - Transient failure twice: Should drop the entry without throwing")
    void record_TransientFailureTwice_Drops() {
        // Given
        when(auditEntryRepository.save(any(AuditEntry.class)))
                .thenThrow(new CannotAcquireLockException("database is locked"));

        // When / Then
        assertThatCode(() -> auditLogSink.record("admin-1", AuditActions.DISASSOCIATE_SERIAL,
                AuditActions.TARGET_SERIAL, "SN-001", details)).doesNotThrowAnyException();

        verify(auditEntryRepository, times(2)).save(any(AuditEntry.class));
        verify(metricsService).recordAuditDropped(AuditActions.DISASSOCIATE_SERIAL);
    }

    @Test
    @DisplayName("record - Non-transient failure: Should drop immediately without retrying")
    void record_NonTransientFailure_DropsWithoutRetry() {
        // Given
        when(auditEntryRepository.save(any(AuditEntry.class)))
                .thenThrow(new DataIntegrityViolationException("value too long"));

        // When
        auditLogSink.record("admin-1", AuditActions.BULK_ADD_SERIALS, AuditActions.TARGET_PRODUCT, "5", details);

        // Then
        verify(auditEntryRepository, times(1)).save(any(AuditEntry.class));
        verify(metricsService).recordAuditDropped(AuditActions.BULK_ADD_SERIALS);
    }

    @Test
    @DisplayName("record - Null details: Should store an empty JSON object")
    void record_NullDetails_StoresEmptyObject() {
        // When
        auditLogSink.record("admin-1", AuditActions.DELETE_PRODUCT, AuditActions.TARGET_PRODUCT, "5", null);

        // Then
        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditEntryRepository).save(captor.capture());
        assertThat(captor.getValue().getDetails()).isEqualTo("{}");
    }
}
