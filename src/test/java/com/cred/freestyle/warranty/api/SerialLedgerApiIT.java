package com.cred.freestyle.warranty.api;

import com.cred.freestyle.warranty.domain.model.CustomerAccount;
import com.cred.freestyle.warranty.infrastructure.cache.RedisCacheService;
import com.cred.freestyle.warranty.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.warranty.infrastructure.metrics.CloudWatchMetricsService;
import com.cred.freestyle.warranty.repository.AuditEntryRepository;
import com.cred.freestyle.warranty.repository.CustomerAccountRepository;
import com.cred.freestyle.warranty.repository.ProductRepository;
import com.cred.freestyle.warranty.repository.SerialRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.nio.charset.StandardCharsets;

import static com.cred.freestyle.warranty.testutil.TestDataBuilder.aProduct;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full-stack API integration tests for the serial ledger.
 * Runs import, registration, lookup and disassociation through the real
 * security chain, services and database.
 */
@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:warrantydb;DB_CLOSE_DELAY=-1",
    "spring.datasource.driver-class-name=org.h2.Driver",
    "spring.jpa.hibernate.ddl-auto=create-drop",
    "spring.data.redis.enabled=false",
    "spring.kafka.admin.auto-create=false",
    "cloud.aws.cloudwatch.enabled=false",
    "warranty.evidence.storage-dir=target/test-bills"
})
@AutoConfigureMockMvc
@DisplayName("Serial Ledger API Integration Tests")
class SerialLedgerApiIT {

    private static final String ADMIN = "admin-1";
    private static final String CUSTOMER = "dealer-1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private SerialRecordRepository serialRecordRepository;

    @Autowired
    private CustomerAccountRepository customerAccountRepository;

    @Autowired
    private AuditEntryRepository auditEntryRepository;

    @MockBean
    private RedisCacheService redisCacheService;

    @MockBean
    private CloudWatchMetricsService cloudWatchMetricsService;

    @MockBean
    private KafkaProducerService kafkaProducerService;

    private Long productId;

    @BeforeEach
    void setUp() {
        // Clean up
        auditEntryRepository.deleteAll();
        serialRecordRepository.deleteAll();
        productRepository.deleteAll();
        customerAccountRepository.deleteAll();

        productId = productRepository.save(aProduct().name("Inverter 5kVA").build()).getProductId();

        customerAccountRepository.save(CustomerAccount.builder()
                .userId(CUSTOMER)
                .companyName("Sharma Electricals")
                .isActive(true)
                .canRegisterSerials(true)
                .build());
        customerAccountRepository.save(CustomerAccount.builder()
                .userId("dealer-2")
                .companyName("Blocked Traders")
                .isActive(true)
                .canRegisterSerials(false)
                .build());
    }

    private MockHttpServletRequestBuilder asAdmin(MockHttpServletRequestBuilder request) {
        return request.header("X-User-Id", ADMIN).header("X-User-Role", "ADMIN");
    }

    private MockMultipartFile bill() {
        return new MockMultipartFile("bill", "invoice.pdf", "application/pdf",
                "%PDF-1.4 invoice".getBytes(StandardCharsets.UTF_8));
    }

    private void importSerials(String json) throws Exception {
        mockMvc.perform(asAdmin(post("/api/v1/admin/products/{productId}/serials", productId))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json))
                .andExpect(status().isCreated());
    }

    // ========================================
    // Full Lifecycle
    // ========================================

    @Test
    @DisplayName("Import, register, look up, disassociate: Serial returns to inventory")
    void fullLifecycle_SerialReturnsToInventory() throws Exception {
        importSerials("{\"serialNumbers\": [\"inv-1001\", \"INV-1002\"]}");

        mockMvc.perform(multipart("/api/v1/users/{userId}/serials", CUSTOMER)
                        .file(bill())
                        .param("serialNumber", " inv-1001 ")
                        .header("X-User-Id", CUSTOMER))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.serialNumber").value("INV-1001"))
                .andExpect(jsonPath("$.status").value("REGISTERED"))
                .andExpect(jsonPath("$.ownerId").value(CUSTOMER))
                .andExpect(jsonPath("$.evidenceReference").isNotEmpty());

        mockMvc.perform(get("/api/v1/serials/{serialNumber}", "INV-1001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.productName").value("Inverter 5kVA"))
                .andExpect(jsonPath("$.registered").value(true));

        mockMvc.perform(asAdmin(get("/api/v1/admin/products/{productId}/inventory", productId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalUploaded").value(2))
                .andExpect(jsonPath("$.totalAssigned").value(1))
                .andExpect(jsonPath("$.inventoryLeft").value(1));

        mockMvc.perform(asAdmin(delete("/api/v1/admin/users/{userId}/serials/{serialNumber}", CUSTOMER, "INV-1001")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("AVAILABLE"))
                .andExpect(jsonPath("$.disassociatedFromUser").value(CUSTOMER));

        mockMvc.perform(get("/api/v1/users/{userId}/serials", CUSTOMER)
                        .header("X-User-Id", CUSTOMER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));

        mockMvc.perform(asAdmin(get("/api/v1/admin/audit-logs").param("action", "disassociate_serial")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.items[0].actor").value(ADMIN));
    }

    // ========================================
    // Registration Failures
    // ========================================

    @Test
    @DisplayName("Second registration of the same serial: Returns 409")
    void registerSerial_AlreadyClaimed_Returns409() throws Exception {
        importSerials("{\"serialNumbers\": [\"INV-2001\"]}");
        customerAccountRepository.save(CustomerAccount.builder()
                .userId("dealer-3")
                .isActive(true)
                .canRegisterSerials(true)
                .build());

        mockMvc.perform(multipart("/api/v1/users/{userId}/serials", CUSTOMER)
                        .file(bill())
                        .param("serialNumber", "INV-2001")
                        .header("X-User-Id", CUSTOMER))
                .andExpect(status().isCreated());

        mockMvc.perform(multipart("/api/v1/users/{userId}/serials", "dealer-3")
                        .file(bill())
                        .param("serialNumber", "INV-2001")
                        .header("X-User-Id", "dealer-3"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.serialNumber").value("INV-2001"));
    }

    @Test
    @DisplayName("Unknown serial: Returns 404")
    void registerSerial_Unknown_Returns404() throws Exception {
        mockMvc.perform(multipart("/api/v1/users/{userId}/serials", CUSTOMER)
                        .file(bill())
                        .param("serialNumber", "NOPE-1")
                        .header("X-User-Id", CUSTOMER))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("User without registration rights: Returns 403")
    void registerSerial_IneligibleUser_Returns403() throws Exception {
        importSerials("{\"serialNumbers\": [\"INV-3001\"]}");

        mockMvc.perform(multipart("/api/v1/users/{userId}/serials", "dealer-2")
                        .file(bill())
                        .param("serialNumber", "INV-3001")
                        .header("X-User-Id", "dealer-2"))
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/api/v1/serials/{serialNumber}", "INV-3001"))
                .andExpect(jsonPath("$.registered").value(false));
    }

    @Test
    @DisplayName("Registering for another user: Returns 403")
    void registerSerial_OtherUser_Returns403() throws Exception {
        mockMvc.perform(multipart("/api/v1/users/{userId}/serials", "dealer-2")
                        .file(bill())
                        .param("serialNumber", "INV-3001")
                        .header("X-User-Id", CUSTOMER))
                .andExpect(status().isForbidden());
    }

    // ========================================
    // Import and Access Control
    // ========================================

    @Test
    @DisplayName("Re-importing the same batch: Reports duplicates and adds nothing")
    void reimport_ReportsDuplicates() throws Exception {
        importSerials("{\"serialNumbers\": [\"INV-4001\", \"INV-4002\"]}");

        mockMvc.perform(asAdmin(post("/api/v1/admin/products/{productId}/serials", productId))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"serialNumbers\": [\"INV-4001\", \"INV-4002\"]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.addedCount").value(0))
                .andExpect(jsonPath("$.duplicatesFound", containsInAnyOrder("INV-4001", "INV-4002")));
    }

    @Test
    @DisplayName("Customer calling an admin endpoint: Returns 403")
    void adminEndpoint_AsCustomer_Returns403() throws Exception {
        mockMvc.perform(post("/api/v1/admin/products/{productId}/serials", productId)
                        .header("X-User-Id", CUSTOMER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"serialNumbers\": [\"INV-5001\"]}"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("Public lookup of an unknown serial: Returns 404")
    void lookup_Unknown_Returns404() throws Exception {
        mockMvc.perform(get("/api/v1/serials/{serialNumber}", "UNKNOWN-1"))
                .andExpect(status().isNotFound());
    }
}
