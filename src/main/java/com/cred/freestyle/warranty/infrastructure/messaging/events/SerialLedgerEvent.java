package com.cred.freestyle.warranty.infrastructure.messaging.events;

import java.time.Instant;
import java.util.UUID;

/**
 * Event describing a committed change to the serial ledger.
 * Published to Kafka for downstream consumers (CRM sync, warranty claims).
 *
 * Event Types:
 * - SERIAL_REGISTERED: a serial was claimed by a customer
 * - SERIAL_DISASSOCIATED: a registration was released by an administrator
 * - SERIALS_IMPORTED: a bulk import added new AVAILABLE serials to a product
 *
 * @author Warranty Platform Team
 */
public class SerialLedgerEvent {

    private String eventId;
    private EventType eventType;
    private String serialNumber;
    private Long productId;
    private String userId;
    private String actor;
    private Integer count;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public SerialLedgerEvent() {
    }

    private SerialLedgerEvent(EventType eventType, String serialNumber, Long productId,
                              String userId, String actor, Integer count) {
        this.eventId = UUID.randomUUID().toString();
        this.eventType = eventType;
        this.serialNumber = serialNumber;
        this.productId = productId;
        this.userId = userId;
        this.actor = actor;
        this.count = count;
        this.timestamp = Instant.now();
    }

    public static SerialLedgerEvent registered(String serialNumber, Long productId, String userId) {
        return new SerialLedgerEvent(EventType.SERIAL_REGISTERED, serialNumber, productId, userId, userId, 1);
    }

    public static SerialLedgerEvent disassociated(String serialNumber, Long productId,
                                                  String previousOwnerId, String actor) {
        return new SerialLedgerEvent(EventType.SERIAL_DISASSOCIATED, serialNumber, productId,
                previousOwnerId, actor, 1);
    }

    public static SerialLedgerEvent imported(Long productId, int count, String actor) {
        return new SerialLedgerEvent(EventType.SERIALS_IMPORTED, null, productId, null, actor, count);
    }

    /**
     * Partition key: the serial for single-serial events, the product for imports.
     */
    public String partitionKey() {
        return serialNumber != null ? serialNumber : String.valueOf(productId);
    }

    // Getters and setters
    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    public void setSerialNumber(String serialNumber) {
        this.serialNumber = serialNumber;
    }

    public Long getProductId() {
        return productId;
    }

    public void setProductId(Long productId) {
        this.productId = productId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getActor() {
        return actor;
    }

    public void setActor(String actor) {
        this.actor = actor;
    }

    public Integer getCount() {
        return count;
    }

    public void setCount(Integer count) {
        this.count = count;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    /**
     * Event type enum.
     */
    public enum EventType {
        SERIAL_REGISTERED,
        SERIAL_DISASSOCIATED,
        SERIALS_IMPORTED
    }

    @Override
    public String toString() {
        return "SerialLedgerEvent{" +
                "eventId='" + eventId + '\'' +
                ", eventType=" + eventType +
                ", serialNumber='" + serialNumber + '\'' +
                ", productId=" + productId +
                ", userId='" + userId + '\'' +
                ", actor='" + actor + '\'' +
                ", count=" + count +
                ", timestamp=" + timestamp +
                '}';
    }
}
