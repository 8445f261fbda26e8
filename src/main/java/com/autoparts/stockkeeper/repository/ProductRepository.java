package com.autoparts.stockkeeper.repository;

import com.autoparts.stockkeeper.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ProductRepository extends JpaRepository<Product, Long>, JpaSpecificationExecutor<Product> {

    // Active products not yet linked from the given product, excluding the product itself
    @Query("SELECT p FROM Product p WHERE p.id <> :productId AND p.active = true AND p.id NOT IN "
            + "(SELECT r.relatedProduct.id FROM ProductRelation r WHERE r.mainProduct.id = :productId) "
            + "ORDER BY p.name ASC")
    List<Product> findAvailableRelationTargets(@Param("productId") Long productId);
}
