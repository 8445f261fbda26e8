package com.autoparts.stockkeeper.repository;

import com.autoparts.stockkeeper.model.ProductRelation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface ProductRelationRepository extends JpaRepository<ProductRelation, Long> {

    boolean existsByMainProductIdAndRelatedProductId(Long mainProductId, Long relatedProductId);

    long countByMainProductId(Long mainProductId);

    @Query("SELECT r FROM ProductRelation r JOIN FETCH r.relatedProduct p "
            + "WHERE r.mainProduct.id = :productId AND p.active = true ORDER BY r.id ASC")
    List<ProductRelation> findActiveByMainProductId(@Param("productId") Long productId);

    @Query("SELECT r.mainProduct.id, COUNT(r) FROM ProductRelation r WHERE r.mainProduct.id IN :ids GROUP BY r.mainProduct.id")
    List<Object[]> countByMainProductIds(@Param("ids") Collection<Long> ids); // Returns [mainProductId, edgeCount]

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ProductRelation r WHERE r.mainProduct.id = :productId OR r.relatedProduct.id = :productId")
    int deleteAllTouchingProduct(@Param("productId") Long productId);
}
