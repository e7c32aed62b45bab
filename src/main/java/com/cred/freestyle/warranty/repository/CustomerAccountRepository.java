package com.cred.freestyle.warranty.repository;

import com.cred.freestyle.warranty.domain.model.CustomerAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for CustomerAccount entity.
 *
 * @author Warranty Platform Team
 */
@Repository
public interface CustomerAccountRepository extends JpaRepository<CustomerAccount, String> {

    boolean existsByUserIdAndIsActiveTrueAndCanRegisterSerialsTrue(String userId);
}
