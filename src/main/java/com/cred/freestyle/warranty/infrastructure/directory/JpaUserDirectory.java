package com.cred.freestyle.warranty.infrastructure.directory;

import com.cred.freestyle.warranty.repository.CustomerAccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * User directory backed by the customer_accounts table.
 *
 * @author Warranty Platform Team
 */
@Component
public class JpaUserDirectory implements UserDirectory {

    private static final Logger logger = LoggerFactory.getLogger(JpaUserDirectory.class);

    private final CustomerAccountRepository customerAccountRepository;

    public JpaUserDirectory(CustomerAccountRepository customerAccountRepository) {
        this.customerAccountRepository = customerAccountRepository;
    }

    @Override
    public boolean isEligibleToRegister(String userId) {
        if (userId == null || userId.isBlank()) {
            return false;
        }
        boolean eligible = customerAccountRepository.existsByUserIdAndIsActiveTrueAndCanRegisterSerialsTrue(userId);
        logger.debug("Registration eligibility for user {}: {}", userId, eligible);
        return eligible;
    }
}
