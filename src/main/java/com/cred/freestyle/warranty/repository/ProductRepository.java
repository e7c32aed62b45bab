package com.cred.freestyle.warranty.repository;

import com.cred.freestyle.warranty.domain.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Product entity.
 *
 * @author Warranty Platform Team
 */
@Repository
public interface ProductRepository extends JpaRepository<Product, Long> {

    /**
     * Find all active products, ordered by name.
     *
     * @return List of active products
     */
    List<Product> findByIsActiveTrueOrderByNameAsc();

    List<Product> findAllByOrderByNameAsc();
}
