package com.autoparts.stockkeeper.config;

import com.autoparts.stockkeeper.dto.ProductForm;
import com.autoparts.stockkeeper.model.Manufacturer;
import com.autoparts.stockkeeper.repository.ProductRepository;
import com.autoparts.stockkeeper.repository.SalesRecordRepository;
import com.autoparts.stockkeeper.service.CatalogService;
import com.autoparts.stockkeeper.service.RelationService;
import com.autoparts.stockkeeper.service.SalesLedgerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Demonstration catalog. Every step checks row counts first, so running it
 * again against a populated database changes nothing.
 */
@Component
public class SampleDataSeeder {

    private static final Logger logger = LoggerFactory.getLogger(SampleDataSeeder.class);

    static final List<String> MANUFACTURERS = List.of(
            "Toyota", "Honda", "Ford", "BMW", "Mercedes",
            "Audi", "Volkswagen", "Nissan", "Hyundai", "Kia");

    private record SampleProduct(String name, String price, String description, String manufacturer) {
    }

    private static final List<SampleProduct> PRODUCTS = List.of(
            new SampleProduct("Engine oil 5W-30", "2500.00", "Synthetic engine oil", "Toyota"),
            new SampleProduct("Air filter", "1200.00", "Cabin air filter", "Toyota"),
            new SampleProduct("Brake pads", "4500.00", "Front brake pads", "Honda"),
            new SampleProduct("Battery 60Ah", "8500.00", "Lead-acid battery", "Ford"),
            new SampleProduct("Spark plugs", "1800.00", "Iridium spark plugs", "Toyota"),
            new SampleProduct("Tyres 205/55 R16", "12000.00", "Summer tyres", "BMW"),
            new SampleProduct("Shock absorbers", "7500.00", "Front shock absorbers", "Honda"),
            new SampleProduct("Timing belt", "3200.00", "Camshaft timing belt", "Toyota"),
            new SampleProduct("Brake fluid", "800.00", "DOT 4 brake fluid", "Ford"),
            new SampleProduct("Coolant", "1500.00", "Antifreeze -40C", "Toyota"));

    // 1-based positions in PRODUCTS: main -> related
    private static final int[][] RELATIONS = {
            { 1, 2 }, { 1, 5 }, { 1, 10 }, { 3, 9 }, { 3, 4 }, { 6, 7 }, { 6, 3 }, { 8, 1 }, { 8, 5 } };

    private final CatalogService catalogService;
    private final RelationService relationService;
    private final SalesLedgerService salesLedgerService;
    private final ProductRepository productRepository;
    private final SalesRecordRepository salesRepository;
    private final ShopProperties properties;
    private final Random random = new Random();

    public SampleDataSeeder(CatalogService catalogService, RelationService relationService,
            SalesLedgerService salesLedgerService, ProductRepository productRepository,
            SalesRecordRepository salesRepository, ShopProperties properties) {
        this.catalogService = catalogService;
        this.relationService = relationService;
        this.salesLedgerService = salesLedgerService;
        this.productRepository = productRepository;
        this.salesRepository = salesRepository;
        this.properties = properties;
    }

    @Transactional
    public void seed() {
        Map<String, Long> manufacturerIds = new HashMap<>();
        for (String name : MANUFACTURERS) {
            Manufacturer manufacturer = catalogService.findOrCreateManufacturer(name);
            manufacturerIds.put(name, manufacturer.getId());
        }

        if (productRepository.count() > 0) {
            logger.info("Catalog already populated, skipping sample data");
            return;
        }

        List<Long> productIds = new ArrayList<>();
        for (SampleProduct sample : PRODUCTS) {
            ProductForm form = new ProductForm(null, sample.name(), new BigDecimal(sample.price()),
                    sample.description(), "", manufacturerIds.get(sample.manufacturer()), true);
            productIds.add(catalogService.saveProduct(form));
        }

        for (int[] pair : RELATIONS) {
            relationService.addRelation(productIds.get(pair[0] - 1), productIds.get(pair[1] - 1));
        }

        if (salesRepository.count() == 0) {
            ShopProperties.Seed seed = properties.getSeed();
            LocalDateTime now = LocalDateTime.now();
            for (int i = 0; i < seed.getSalesCount(); i++) {
                Long productId = productIds.get(random.nextInt(productIds.size()));
                int quantity = 1 + random.nextInt(5);
                LocalDateTime saleDate = now.minusDays(random.nextInt(seed.getSalesDaysBack() + 1));
                salesLedgerService.recordSale(productId, quantity, "Customer " + (i + 1), saleDate);
            }
        }

        logger.info("Inserted sample data: {} products, {} relations, {} sales", productIds.size(),
                RELATIONS.length, salesRepository.count());
    }
}
