package com.cred.freestyle.warranty.api.controller;

import com.cred.freestyle.warranty.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.warranty.domain.model.EvidenceFile;
import com.cred.freestyle.warranty.domain.model.SerialRecord;
import com.cred.freestyle.warranty.exception.InvalidSerialNumberException;
import com.cred.freestyle.warranty.exception.LedgerUnavailableException;
import com.cred.freestyle.warranty.exception.SerialAlreadyClaimedException;
import com.cred.freestyle.warranty.exception.UserNotEligibleException;
import com.cred.freestyle.warranty.service.SerialRegistrationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.cred.freestyle.warranty.testutil.TestDataBuilder.aSerial;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for SerialRegistrationController using MockMvc.
 * Tests HTTP layer in isolation with mocked service dependencies.
 */
@WebMvcTest(SerialRegistrationController.class)
@ContextConfiguration(classes = {SerialRegistrationController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("SerialRegistrationController Tests")
class SerialRegistrationControllerTest {

    private static final String USER_ID = "user-123";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SerialRegistrationService registrationService;

    private static MockMultipartFile bill() {
        return new MockMultipartFile("bill", "invoice.pdf", "application/pdf",
                "%PDF-1.4".getBytes(StandardCharsets.UTF_8));
    }

    // ========================================
    // POST /api/v1/users/{userId}/serials Tests
    // ========================================

    @Test
    @WithMockUser(username = USER_ID)
    @DisplayName("POST /users/{userId}/serials - Valid registration returns 201 Created")
    void registerSerial_Valid_Returns201() throws Exception {
        // Given
        SerialRecord registered = aSerial().serialNumber("SN-001").productId(3L).registeredTo(USER_ID).build();
        when(registrationService.registerSerial(eq(USER_ID), eq("sn-001"), any(EvidenceFile.class)))
                .thenReturn(registered);

        // When / Then
        mockMvc.perform(multipart("/api/v1/users/{userId}/serials", USER_ID)
                        .file(bill())
                        .param("serialNumber", "sn-001"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.serialNumber").value("SN-001"))
                .andExpect(jsonPath("$.status").value("REGISTERED"))
                .andExpect(jsonPath("$.ownerId").value(USER_ID))
                .andExpect(jsonPath("$.productId").value(3));

        verify(registrationService).registerSerial(eq(USER_ID), eq("sn-001"),
                argThat(file -> "invoice.pdf".equals(file.getOriginalFilename()) && file.getSize() == 8));
    }

    @Test
    @WithMockUser(username = "someone-else")
    @DisplayName("POST /users/{userId}/serials - Registering for another user returns 403 Forbidden")
    void registerSerial_OtherUser_Returns403() throws Exception {
        // When / Then
        mockMvc.perform(multipart("/api/v1/users/{userId}/serials", USER_ID)
                        .file(bill())
                        .param("serialNumber", "SN-001"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(registrationService);
    }

    @Test
    @WithMockUser(username = "admin-1", roles = "ADMIN")
    @DisplayName("POST /users/{userId}/serials - Admin may register on behalf of a user")
    void registerSerial_Admin_Returns201() throws Exception {
        // Given
        when(registrationService.registerSerial(eq(USER_ID), eq("SN-001"), any(EvidenceFile.class)))
                .thenReturn(aSerial().serialNumber("SN-001").registeredTo(USER_ID).build());

        // When / Then
        mockMvc.perform(multipart("/api/v1/users/{userId}/serials", USER_ID)
                        .file(bill())
                        .param("serialNumber", "SN-001"))
                .andExpect(status().isCreated());
    }

    @Test
    @WithMockUser(username = USER_ID)
    @DisplayName("POST /users/{userId}/serials - Missing bill returns 400 Bad Request")
    void registerSerial_MissingBill_Returns400() throws Exception {
        // When / Then
        mockMvc.perform(multipart("/api/v1/users/{userId}/serials", USER_ID)
                        .param("serialNumber", "SN-001"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(registrationService);
    }

    @Test
    @WithMockUser(username = USER_ID)
    @DisplayName("POST /users/{userId}/serials - Malformed serial returns 400 Bad Request")
    void registerSerial_MalformedSerial_Returns400() throws Exception {
        // Given
        when(registrationService.registerSerial(eq(USER_ID), eq("SN 001"), any(EvidenceFile.class)))
                .thenThrow(new InvalidSerialNumberException("SN 001"));

        // When / Then
        mockMvc.perform(multipart("/api/v1/users/{userId}/serials", USER_ID)
                        .file(bill())
                        .param("serialNumber", "SN 001"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    @WithMockUser(username = USER_ID)
    @DisplayName("POST /users/{userId}/serials - Serial already registered returns 409 Conflict")
    void registerSerial_AlreadyClaimed_Returns409() throws Exception {
        // Given
        when(registrationService.registerSerial(eq(USER_ID), eq("SN-001"), any(EvidenceFile.class)))
                .thenThrow(new SerialAlreadyClaimedException("SN-001"));

        // When / Then
        mockMvc.perform(multipart("/api/v1/users/{userId}/serials", USER_ID)
                        .file(bill())
                        .param("serialNumber", "SN-001"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Serial Already Registered"))
                .andExpect(jsonPath("$.details.serialNumber").value("SN-001"));
    }

    @Test
    @WithMockUser(username = USER_ID)
    @DisplayName("POST /users/{userId}/serials - Ineligible user returns 403 Forbidden")
    void registerSerial_NotEligible_Returns403() throws Exception {
        // Given
        when(registrationService.registerSerial(eq(USER_ID), eq("SN-001"), any(EvidenceFile.class)))
                .thenThrow(new UserNotEligibleException(USER_ID));

        // When / Then
        mockMvc.perform(multipart("/api/v1/users/{userId}/serials", USER_ID)
                        .file(bill())
                        .param("serialNumber", "SN-001"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.details.userId").value(USER_ID));
    }

    @Test
    @WithMockUser(username = USER_ID)
    @DisplayName("POST /users/{userId}/serials - Ledger unavailable returns 503 with Retry-After")
    void registerSerial_LedgerUnavailable_Returns503() throws Exception {
        // Given
        when(registrationService.registerSerial(eq(USER_ID), eq("SN-001"), any(EvidenceFile.class)))
                .thenThrow(new LedgerUnavailableException("claim", 3, null));

        // When / Then
        mockMvc.perform(multipart("/api/v1/users/{userId}/serials", USER_ID)
                        .file(bill())
                        .param("serialNumber", "SN-001"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().exists("Retry-After"));
    }

    // ========================================
    // GET /api/v1/users/{userId}/serials Tests
    // ========================================

    @Test
    @WithMockUser(username = USER_ID)
    @DisplayName("GET /users/{userId}/serials - Returns the user's registered serials")
    void getRegisteredSerials_Returns200() throws Exception {
        // Given
        when(registrationService.findRegisteredSerials(USER_ID)).thenReturn(List.of(
                aSerial().serialNumber("SN-002").registeredTo(USER_ID).build(),
                aSerial().serialNumber("SN-001").registeredTo(USER_ID).build()));

        // When / Then
        mockMvc.perform(get("/api/v1/users/{userId}/serials", USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].serialNumber").value("SN-002"));
    }

    @Test
    @WithMockUser(username = "someone-else")
    @DisplayName("GET /users/{userId}/serials - Another user's list returns 403 Forbidden")
    void getRegisteredSerials_OtherUser_Returns403() throws Exception {
        // When / Then
        mockMvc.perform(get("/api/v1/users/{userId}/serials", USER_ID))
                .andExpect(status().isForbidden());

        verifyNoInteractions(registrationService);
    }
}
