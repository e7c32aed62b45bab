package com.cred.freestyle.warranty.api.controller;

import com.cred.freestyle.warranty.api.dto.SerialRecordResponse;
import com.cred.freestyle.warranty.domain.model.EvidenceFile;
import com.cred.freestyle.warranty.domain.model.SerialRecord;
import com.cred.freestyle.warranty.exception.InvalidEvidenceException;
import com.cred.freestyle.warranty.security.SecurityUtils;
import com.cred.freestyle.warranty.service.SerialRegistrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for customer serial registration.
 * Customers register a serial number against a bill and list their registrations.
 *
 * @author Warranty Platform Team
 */
@RestController
@RequestMapping("/api/v1/users/{userId}/serials")
public class SerialRegistrationController {

    private static final Logger logger = LoggerFactory.getLogger(SerialRegistrationController.class);

    private final SerialRegistrationService registrationService;

    public SerialRegistrationController(SerialRegistrationService registrationService) {
        this.registrationService = registrationService;
    }

    /**
     * Register a serial number to the user.
     *
     * Authorization: User can only register serials for themselves
     *
     * @param userId Customer user ID
     * @param serialNumber Serial number as printed on the product
     * @param bill Proof of purchase (pdf, jpg, jpeg or png)
     * @return The registered serial
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<SerialRecordResponse> registerSerial(
            @PathVariable String userId,
            @RequestParam("serialNumber") String serialNumber,
            @RequestPart("bill") MultipartFile bill
    ) {
        SecurityUtils.verifyUserAccess(userId);

        logger.info("Registering serial - user: {}, serial: {}", userId, serialNumber);

        SerialRecord record = registrationService.registerSerial(userId, serialNumber, toEvidenceFile(bill));

        return ResponseEntity.status(HttpStatus.CREATED).body(SerialRecordResponse.fromEntity(record));
    }

    /**
     * List serials currently registered to the user, newest first.
     */
    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<SerialRecordResponse>> getRegisteredSerials(@PathVariable String userId) {
        SecurityUtils.verifyUserAccess(userId);

        List<SerialRecordResponse> serials = registrationService.findRegisteredSerials(userId).stream()
                .map(SerialRecordResponse::fromEntity)
                .collect(Collectors.toList());

        return ResponseEntity.ok(serials);
    }

    private static EvidenceFile toEvidenceFile(MultipartFile bill) {
        try {
            return new EvidenceFile(bill.getOriginalFilename(), bill.getContentType(), bill.getBytes());
        } catch (IOException e) {
            logger.warn("Could not read uploaded bill {}", bill.getOriginalFilename(), e);
            throw new InvalidEvidenceException("The uploaded bill could not be read");
        }
    }
}
