package com.autoparts.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.Check;

import java.time.LocalDateTime;

/**
 * Directed cross-sell edge. Linking A to B does not link B to A.
 */
@Entity
@Table(name = "product_relations", uniqueConstraints = @UniqueConstraint(name = "uk_product_relation_pair", columnNames = {
        "main_product_id", "related_product_id" }))
@Check(constraints = "main_product_id <> related_product_id")
@Data
public class ProductRelation {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "main_product_id", nullable = false)
    private Product mainProduct;

    @ManyToOne(optional = false)
    @JoinColumn(name = "related_product_id", nullable = false)
    private Product relatedProduct;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
