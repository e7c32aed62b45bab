package com.cred.freestyle.warranty;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the warranty registration portal.
 *
 * System Overview:
 * - Serial-number inventory ledger (available → registered → available)
 * - Customers claim a serial by uploading a purchase bill
 * - Administrators bulk-import serials per product and disassociate registrations
 * - Every ledger state change is recorded in a durable audit trail
 *
 * Architecture:
 * - API Layer: REST controllers with validation
 * - Service Layer: registration engine, bulk import reconciler, inventory aggregation
 * - Data Access Layer: JPA repositories with conditional (compare-and-swap) updates
 * - Infrastructure Layer: Redis cache, Kafka ledger events, CloudWatch metrics, evidence storage
 *
 * @author Warranty Platform Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableKafka
@EnableScheduling
public class WarrantyRegistrationApplication {

    public static void main(String[] args) {
        SpringApplication.run(WarrantyRegistrationApplication.class, args);
    }
}
