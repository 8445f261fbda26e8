package com.autoparts.stockkeeper.service;

import com.autoparts.stockkeeper.dto.ProductSummary;
import com.autoparts.stockkeeper.dto.RelatedProduct;
import com.autoparts.stockkeeper.model.Product;
import com.autoparts.stockkeeper.model.ProductRelation;
import com.autoparts.stockkeeper.repository.ProductRelationRepository;
import com.autoparts.stockkeeper.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maintains the directed "related products" graph used for cross-sell
 * suggestions. Edges are never mirrored: linking A to B leaves B without an
 * edge to A.
 */
@Service
public class RelationService {

    private static final Logger logger = LoggerFactory.getLogger(RelationService.class);

    private final ProductRelationRepository relationRepository;
    private final ProductRepository productRepository;
    private final CatalogService catalogService;

    public RelationService(ProductRelationRepository relationRepository, ProductRepository productRepository,
            CatalogService catalogService) {
        this.relationRepository = relationRepository;
        this.productRepository = productRepository;
        this.catalogService = catalogService;
    }

    /**
     * Edges leaving the product whose target is active, in insertion order.
     */
    @Transactional(readOnly = true)
    public List<RelatedProduct> listRelated(Long productId) {
        List<ProductRelation> relations = relationRepository.findActiveByMainProductId(productId);
        if (relations.isEmpty()) {
            return List.of();
        }

        List<Product> targets = relations.stream().map(ProductRelation::getRelatedProduct)
                .collect(Collectors.toList());
        List<ProductSummary> summaries = catalogService.summarize(targets);

        List<RelatedProduct> result = new ArrayList<>(relations.size());
        for (int i = 0; i < relations.size(); i++) {
            ProductRelation relation = relations.get(i);
            result.add(new RelatedProduct(relation.getId(), productId, summaries.get(i), relation.getCreatedAt()));
        }
        return result;
    }

    /**
     * Active products that can still be linked from the given product.
     */
    @Transactional(readOnly = true)
    public List<ProductSummary> listAvailableTargets(Long productId) {
        return catalogService.summarize(productRepository.findAvailableRelationTargets(productId));
    }

    /**
     * @return the new edge id, or empty when the edge would point at the
     *         product itself, already exists, or references a missing product
     */
    @Transactional
    public Optional<Long> addRelation(Long mainProductId, Long relatedProductId) {
        if (mainProductId == null || relatedProductId == null || mainProductId.equals(relatedProductId)) {
            logger.warn("Rejected relation {} -> {}: self relation", mainProductId, relatedProductId);
            return Optional.empty();
        }
        if (relationRepository.existsByMainProductIdAndRelatedProductId(mainProductId, relatedProductId)) {
            logger.warn("Relation {} -> {} already exists", mainProductId, relatedProductId);
            return Optional.empty();
        }

        Optional<Product> main = productRepository.findById(mainProductId);
        Optional<Product> related = productRepository.findById(relatedProductId);
        if (main.isEmpty() || related.isEmpty()) {
            logger.warn("Rejected relation {} -> {}: product not found", mainProductId, relatedProductId);
            return Optional.empty();
        }

        ProductRelation relation = new ProductRelation();
        relation.setMainProduct(main.get());
        relation.setRelatedProduct(related.get());
        ProductRelation saved = relationRepository.save(relation);
        logger.info("Linked product {} -> {} (relation {})", mainProductId, relatedProductId, saved.getId());
        return Optional.of(saved.getId());
    }

    @Transactional
    public void removeRelation(Long relationId) {
        relationRepository.deleteById(relationId);
        logger.info("Removed relation {}", relationId);
    }

    @Transactional(readOnly = true)
    public long countRelated(Long productId) {
        return relationRepository.countByMainProductId(productId);
    }
}
