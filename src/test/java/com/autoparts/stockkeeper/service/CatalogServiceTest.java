package com.autoparts.stockkeeper.service;

import com.autoparts.stockkeeper.dto.ProductForm;
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
import com.autoparts.stockkeeper.repository.SalesRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CatalogServiceTest {

    @Mock
    private ProductRepository productRepository;
    @Mock
    private ManufacturerRepository manufacturerRepository;
    @Mock
    private ProductRelationRepository relationRepository;
    @Mock
    private SalesRecordRepository salesRepository;

    @InjectMocks
    private CatalogService catalogService;

    private Manufacturer toyota;

    @BeforeEach
    void setUp() {
        toyota = new Manufacturer();
        toyota.setId(1L);
        toyota.setName("Toyota");
    }

    @Test
    void saveProduct_ShouldInsertAndReturnNewId() {
        when(manufacturerRepository.findById(1L)).thenReturn(Optional.of(toyota));
        when(productRepository.save(any(Product.class))).thenAnswer(i -> {
            Product p = i.getArgument(0);
            p.setId(7L);
            return p;
        });

        Long id = catalogService.saveProduct(ProductForm.create("  Oil  ", new BigDecimal("2500"), 1L));

        assertEquals(7L, id);
        ArgumentCaptor<Product> captor = ArgumentCaptor.forClass(Product.class);
        verify(productRepository).save(captor.capture());
        assertEquals("Oil", captor.getValue().getName());
        assertEquals(new BigDecimal("2500.00"), captor.getValue().getPrice());
        assertEquals(toyota, captor.getValue().getManufacturer());
        assertTrue(captor.getValue().isActive());
    }

    @Test
    void saveProduct_ShouldRejectBlankName() {
        assertThrows(InvalidProductException.class,
                () -> catalogService.saveProduct(ProductForm.create("   ", BigDecimal.TEN, null)));
        verifyNoInteractions(productRepository);
    }

    @Test
    void saveProduct_ShouldRejectOverlongNameAndDescription() {
        String longName = "x".repeat(Product.NAME_MAX_LENGTH + 1);
        ProductForm longDescription = new ProductForm(null, "Oil", BigDecimal.ONE,
                "d".repeat(Product.DESCRIPTION_MAX_LENGTH + 1), null, null, true);

        Exception exception = assertThrows(InvalidProductException.class,
                () -> catalogService.saveProduct(ProductForm.create(longName, BigDecimal.ONE, null)));
        assertThrows(InvalidProductException.class, () -> catalogService.saveProduct(longDescription));

        assertTrue(exception.getMessage().contains("Product name"));
        verifyNoInteractions(productRepository, manufacturerRepository);
    }

    @Test
    void saveProduct_ShouldRejectNegativePrice() {
        Exception exception = assertThrows(InvalidProductException.class,
                () -> catalogService.saveProduct(ProductForm.create("Oil", new BigDecimal("-0.01"), null)));

        assertTrue(exception.getMessage().contains("negative"));
        verify(productRepository, never()).save(any());
    }

    @Test
    void saveProduct_ShouldRejectUnknownManufacturer() {
        when(manufacturerRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(InvalidProductException.class,
                () -> catalogService.saveProduct(ProductForm.create("Oil", BigDecimal.ONE, 99L)));
        verify(productRepository, never()).save(any());
    }

    @Test
    void saveProduct_ShouldOverwriteExistingAndRefreshTimestamp() {
        LocalDateTime before = LocalDateTime.now().minusDays(3);
        Product existing = new Product();
        existing.setId(5L);
        existing.setName("Old name");
        existing.setPrice(new BigDecimal("10.00"));
        existing.setManufacturer(toyota);
        existing.setUpdatedAt(before);

        when(productRepository.findById(5L)).thenReturn(Optional.of(existing));
        when(productRepository.save(existing)).thenReturn(existing);

        ProductForm form = new ProductForm(5L, "New name", new BigDecimal("12.50"), "desc", "img/a.png", null,
                false);
        Long id = catalogService.saveProduct(form);

        assertEquals(5L, id);
        assertEquals("New name", existing.getName());
        assertEquals(new BigDecimal("12.50"), existing.getPrice());
        assertEquals("img/a.png", existing.getImagePath());
        assertNull(existing.getManufacturer());
        assertFalse(existing.isActive());
        assertTrue(existing.getUpdatedAt().isAfter(before));
    }

    @Test
    void saveProduct_ShouldFail_WhenUpdatingMissingProduct() {
        when(productRepository.findById(42L)).thenReturn(Optional.empty());

        ProductForm form = ProductForm.create("Ghost", BigDecimal.ONE, null).withId(42L);

        assertThrows(ProductNotFoundException.class, () -> catalogService.saveProduct(form));
    }

    @Test
    void deleteProduct_ShouldRemoveRelationsBeforeProduct() {
        when(salesRepository.countByProductId(3L)).thenReturn(0L);
        when(relationRepository.deleteAllTouchingProduct(3L)).thenReturn(2);

        catalogService.deleteProduct(3L);

        InOrder inOrder = inOrder(relationRepository, productRepository);
        inOrder.verify(relationRepository).deleteAllTouchingProduct(3L);
        inOrder.verify(productRepository).deleteById(3L);
    }

    @Test
    void deleteProduct_ShouldRefuse_WhenLedgerReferencesProduct() {
        when(salesRepository.countByProductId(3L)).thenReturn(4L);

        Exception exception = assertThrows(ProductInUseException.class, () -> catalogService.deleteProduct(3L));

        assertTrue(exception.getMessage().contains("4 sales records"));
        verifyNoInteractions(relationRepository);
        verify(productRepository, never()).deleteById(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void listProducts_ShouldDecorateWithManufacturerAndRelationCount() {
        Product oil = new Product();
        oil.setId(1L);
        oil.setName("Oil");
        oil.setPrice(new BigDecimal("2500.00"));
        oil.setManufacturer(toyota);

        Product filter = new Product();
        filter.setId(2L);
        filter.setName("Filter");
        filter.setPrice(new BigDecimal("1200.00"));

        when(productRepository.findAll(any(Specification.class), any(Sort.class))).thenReturn(List.of(oil, filter));
        when(relationRepository.countByMainProductIds(anyCollection()))
                .thenReturn(Collections.singletonList(new Object[] { 1L, 3L }));

        List<ProductSummary> result = catalogService.listProducts(null, null, null);

        assertEquals(2, result.size());
        assertEquals("Toyota", result.get(0).manufacturerName());
        assertEquals(1L, result.get(0).manufacturerId());
        assertEquals(3L, result.get(0).relatedProductsCount());
        assertNull(result.get(1).manufacturerName());
        assertEquals(0L, result.get(1).relatedProductsCount());
    }

    @Test
    @SuppressWarnings("unchecked")
    void listProducts_ShouldSortByPriceThenName() {
        when(productRepository.findAll(any(Specification.class), any(Sort.class))).thenReturn(List.of());

        List<ProductSummary> result = catalogService.listProducts(null, ProductSortKey.PRICE, Sort.Direction.DESC);

        assertTrue(result.isEmpty());
        ArgumentCaptor<Sort> sort = ArgumentCaptor.forClass(Sort.class);
        verify(productRepository).findAll(any(Specification.class), sort.capture());
        assertEquals(Sort.Direction.DESC, sort.getValue().getOrderFor("price").getDirection());
        assertEquals(Sort.Direction.ASC, sort.getValue().getOrderFor("name").getDirection());
        verifyNoInteractions(relationRepository);
    }

    @Test
    void getProduct_ShouldReturnEmpty_WhenAbsent() {
        when(productRepository.findById(8L)).thenReturn(Optional.empty());

        assertTrue(catalogService.getProduct(8L).isEmpty());
    }

    @Test
    void findOrCreateManufacturer_ShouldReuseExisting() {
        when(manufacturerRepository.findByName("Toyota")).thenReturn(Optional.of(toyota));

        Manufacturer result = catalogService.findOrCreateManufacturer(" Toyota ");

        assertSame(toyota, result);
        verify(manufacturerRepository, never()).save(any());
    }
}
