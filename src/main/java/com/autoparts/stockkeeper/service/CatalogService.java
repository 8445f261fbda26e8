package com.autoparts.stockkeeper.service;

import com.autoparts.stockkeeper.dto.ProductForm;
import com.autoparts.stockkeeper.dto.ProductQuery;
import com.autoparts.stockkeeper.dto.ProductSortKey;
import com.autoparts.stockkeeper.dto.ProductSummary;
import com.autoparts.stockkeeper.exception.InvalidProductException;
import com.autoparts.stockkeeper.exception.ProductInUseException;
import com.autoparts.stockkeeper.exception.ProductNotFoundException;
import com.autoparts.stockkeeper.model.Manufacturer;
import com.autoparts.stockkeeper.model.Product;
import com.autoparts.stockkeeper.repository.ManufacturerRepository;
import com.autoparts.stockkeeper.repository.ProductRelationRepository;
import com.autoparts.stockkeeper.repository.ProductRepository;
import com.autoparts.stockkeeper.repository.ProductSpecifications;
import com.autoparts.stockkeeper.repository.SalesRecordRepository;
import com.autoparts.stockkeeper.util.MoneyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
public class CatalogService {

    private static final Logger logger = LoggerFactory.getLogger(CatalogService.class);

    private final ProductRepository productRepository;
    private final ManufacturerRepository manufacturerRepository;
    private final ProductRelationRepository relationRepository;
    private final SalesRecordRepository salesRepository;

    public CatalogService(ProductRepository productRepository, ManufacturerRepository manufacturerRepository,
            ProductRelationRepository relationRepository, SalesRecordRepository salesRepository) {
        this.productRepository = productRepository;
        this.manufacturerRepository = manufacturerRepository;
        this.relationRepository = relationRepository;
        this.salesRepository = salesRepository;
    }

    /**
     * Every product of the given manufacturer (or all products when the filter
     * is null), active or not. Ordered by name unless {@code sortKey} is
     * {@link ProductSortKey#PRICE}.
     */
    @Transactional(readOnly = true)
    public List<ProductSummary> listProducts(Long manufacturerId, ProductSortKey sortKey, Sort.Direction direction) {
        return listProducts(new ProductQuery(manufacturerId, null, true, sortKey, direction));
    }

    @Transactional(readOnly = true)
    public List<ProductSummary> listProducts(ProductQuery query) {
        Specification<Product> spec = Specification.where(null);
        if (query.manufacturerId() != null) {
            spec = spec.and(ProductSpecifications.hasManufacturer(query.manufacturerId()));
        }
        if (query.search() != null && !query.search().isBlank()) {
            spec = spec.and(ProductSpecifications.nameContains(query.search()));
        }
        if (!query.includeInactive()) {
            spec = spec.and(ProductSpecifications.isActive());
        }

        List<Product> products = productRepository.findAll(spec, toSort(query.sortKey(), query.direction()));
        return summarize(products);
    }

    @Transactional(readOnly = true)
    public Optional<ProductSummary> getProduct(Long id) {
        return productRepository.findById(id)
                .map(p -> ProductSummary.of(p, relationRepository.countByMainProductId(p.getId())));
    }

    /**
     * Inserts the product when the form has no id, otherwise overwrites every
     * mutable field of the existing row.
     *
     * @return the id of the saved product
     */
    @Transactional
    public Long saveProduct(ProductForm form) {
        String name = form.name() == null ? "" : form.name().trim();
        if (name.isEmpty()) {
            throw new InvalidProductException("Product name is required.");
        }
        checkLength("Product name", name, Product.NAME_MAX_LENGTH);
        checkLength("Description", form.description(), Product.DESCRIPTION_MAX_LENGTH);
        checkLength("Image path", form.imagePath(), Product.IMAGE_PATH_MAX_LENGTH);

        Product product;
        if (form.id() != null) {
            product = productRepository.findById(form.id())
                    .orElseThrow(() -> new ProductNotFoundException(form.id()));
            product.setUpdatedAt(LocalDateTime.now());
        } else {
            product = new Product();
        }

        product.setName(name);
        product.setPrice(MoneyUtils.normalizePrice(form.price()));
        product.setDescription(form.description());
        product.setImagePath(form.imagePath());
        product.setManufacturer(resolveManufacturer(form.manufacturerId()));
        product.setActive(form.active());

        Product saved = productRepository.save(product);
        logger.info("{} product {} ({}), price {}", form.id() == null ? "Created" : "Updated", saved.getId(),
                saved.getName(), saved.getPrice());
        return saved.getId();
    }

    /**
     * Removes the product together with every relation edge that touches it.
     * The ledger keeps a reference to every sold product, so a product with
     * sales records is never deleted: callers must deactivate it through
     * {@link #saveProduct(ProductForm)} instead. An unknown id is a no-op.
     *
     * @throws ProductInUseException if any sales record references the product
     */
    @Transactional
    public void deleteProduct(Long id) {
        long salesCount = salesRepository.countByProductId(id);
        if (salesCount > 0) {
            throw new ProductInUseException(id, salesCount);
        }

        // Edges first, the product row is still referenced by them
        int removedEdges = relationRepository.deleteAllTouchingProduct(id);
        productRepository.deleteById(id);
        logger.info("Deleted product {} and {} relation edges", id, removedEdges);
    }

    @Transactional(readOnly = true)
    public List<Manufacturer> listManufacturers() {
        return manufacturerRepository.findAllByOrderByNameAsc();
    }

    @Transactional
    public Manufacturer findOrCreateManufacturer(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Manufacturer name is required.");
        }
        if (trimmed.length() > Manufacturer.NAME_MAX_LENGTH) {
            throw new IllegalArgumentException(
                    "Manufacturer name cannot exceed " + Manufacturer.NAME_MAX_LENGTH + " characters.");
        }
        return manufacturerRepository.findByName(trimmed).orElseGet(() -> {
            Manufacturer manufacturer = new Manufacturer();
            manufacturer.setName(trimmed);
            logger.info("Created manufacturer {}", trimmed);
            return manufacturerRepository.save(manufacturer);
        });
    }

    /**
     * Decorates products with their outgoing edge counts using one grouped
     * count query.
     */
    public List<ProductSummary> summarize(List<Product> products) {
        if (products.isEmpty()) {
            return List.of();
        }
        List<Long> ids = products.stream().map(Product::getId).collect(Collectors.toList());
        Map<Long, Long> counts = new HashMap<>();
        for (Object[] row : relationRepository.countByMainProductIds(ids)) {
            counts.put((Long) row[0], (Long) row[1]);
        }
        return products.stream()
                .map(p -> ProductSummary.of(p, counts.getOrDefault(p.getId(), 0L)))
                .collect(Collectors.toList());
    }

    private static void checkLength(String field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new InvalidProductException(field + " cannot exceed " + maxLength + " characters.");
        }
    }

    private Manufacturer resolveManufacturer(Long manufacturerId) {
        if (manufacturerId == null) {
            return null;
        }
        return manufacturerRepository.findById(manufacturerId)
                .orElseThrow(() -> new InvalidProductException("Manufacturer not found: " + manufacturerId));
    }

    private static Sort toSort(ProductSortKey sortKey, Sort.Direction direction) {
        Sort.Direction dir = direction != null ? direction : Sort.Direction.ASC;
        if (sortKey == ProductSortKey.PRICE) {
            return Sort.by(dir, ProductSortKey.PRICE.getProperty()).and(Sort.by(ProductSortKey.NAME.getProperty()));
        }
        return Sort.by(dir, ProductSortKey.NAME.getProperty());
    }
}
