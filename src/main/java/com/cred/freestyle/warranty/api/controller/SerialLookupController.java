package com.cred.freestyle.warranty.api.controller;

import com.cred.freestyle.warranty.api.dto.SerialLookupResponse;
import com.cred.freestyle.warranty.domain.model.Product;
import com.cred.freestyle.warranty.domain.model.SerialRecord;
import com.cred.freestyle.warranty.service.ProductService;
import com.cred.freestyle.warranty.service.SerialRegistrationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public serial number lookup. Exposes product and status only, never the
 * owner or the bill.
 *
 * @author Warranty Platform Team
 */
@RestController
@RequestMapping("/api/v1/serials")
public class SerialLookupController {

    private final SerialRegistrationService registrationService;
    private final ProductService productService;

    public SerialLookupController(
            SerialRegistrationService registrationService,
            ProductService productService
    ) {
        this.registrationService = registrationService;
        this.productService = productService;
    }

    @GetMapping("/{serialNumber}")
    public ResponseEntity<SerialLookupResponse> lookupSerial(@PathVariable String serialNumber) {
        SerialRecord record = registrationService.lookupSerial(serialNumber);
        Product product = productService.getProduct(record.getProductId());
        return ResponseEntity.ok(SerialLookupResponse.fromEntity(record, product));
    }
}
