package com.cred.freestyle.warranty.api.controller;

import com.cred.freestyle.warranty.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.warranty.exception.InvalidSerialNumberException;
import com.cred.freestyle.warranty.exception.SerialNotFoundException;
import com.cred.freestyle.warranty.service.ProductService;
import com.cred.freestyle.warranty.service.SerialRegistrationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import static com.cred.freestyle.warranty.testutil.TestDataBuilder.aProduct;
import static com.cred.freestyle.warranty.testutil.TestDataBuilder.aSerial;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for the public serial lookup.
 */
@WebMvcTest(SerialLookupController.class)
@ContextConfiguration(classes = {SerialLookupController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("SerialLookupController Tests")
class SerialLookupControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SerialRegistrationService registrationService;

    @MockBean
    private ProductService productService;

    @Test
    @DisplayName("GET /serials/{serial} - Registered serial shows product and status but not the owner")
    void lookupSerial_Registered_HidesOwner() throws Exception {
        // Given
        when(registrationService.lookupSerial("sn-001"))
                .thenReturn(aSerial().serialNumber("SN-001").productId(3L).registeredTo("user-123").build());
        when(productService.getProduct(3L)).thenReturn(aProduct().productId(3L).name("Inverter 5kVA").build());

        // When / Then
        mockMvc.perform(get("/api/v1/serials/{serialNumber}", "sn-001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.serialNumber").value("SN-001"))
                .andExpect(jsonPath("$.productName").value("Inverter 5kVA"))
                .andExpect(jsonPath("$.registered").value(true))
                .andExpect(jsonPath("$.ownerId").doesNotExist())
                .andExpect(jsonPath("$.evidenceReference").doesNotExist());
    }

    @Test
    @DisplayName("GET /serials/{serial} - Unknown serial returns 404 Not Found")
    void lookupSerial_Unknown_Returns404() throws Exception {
        // Given
        when(registrationService.lookupSerial("SN-404")).thenThrow(new SerialNotFoundException("SN-404"));

        // When / Then
        mockMvc.perform(get("/api/v1/serials/{serialNumber}", "SN-404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details.serialNumber").value("SN-404"));
    }

    @Test
    @DisplayName("GET /serials/{serial} - Malformed serial returns 400 Bad Request")
    void lookupSerial_Malformed_Returns400() throws Exception {
        // Given
        when(registrationService.lookupSerial("SN#1")).thenThrow(new InvalidSerialNumberException("SN#1"));

        // When / Then
        mockMvc.perform(get("/api/v1/serials/{serialNumber}", "SN#1"))
                .andExpect(status().isBadRequest());
    }
}
