package com.autoparts.stockkeeper.service;

import com.autoparts.stockkeeper.dto.SaleRow;
import com.autoparts.stockkeeper.dto.SalesStatistics;
import com.autoparts.stockkeeper.exception.InvalidSaleException;
import com.autoparts.stockkeeper.exception.ProductNotFoundException;
import com.autoparts.stockkeeper.model.Product;
import com.autoparts.stockkeeper.model.SalesRecord;
import com.autoparts.stockkeeper.repository.ProductRepository;
import com.autoparts.stockkeeper.repository.SalesRecordRepository;
import com.autoparts.stockkeeper.util.MoneyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;

@Service
public class SalesLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(SalesLedgerService.class);

    private final SalesRecordRepository salesRepository;
    private final ProductRepository productRepository;

    public SalesLedgerService(SalesRecordRepository salesRepository, ProductRepository productRepository) {
        this.salesRepository = salesRepository;
        this.productRepository = productRepository;
    }

    @Transactional
    public Long recordSale(Long productId, int quantity, String customerInfo) {
        return recordSale(productId, quantity, customerInfo, null);
    }

    /**
     * Appends a sale priced at the product's current price. The total is
     * stored with the record and is not affected by later price changes.
     *
     * @param saleDate when the sale happened, or null for now
     */
    @Transactional
    public Long recordSale(Long productId, int quantity, String customerInfo, LocalDateTime saleDate) {
        if (quantity <= 0) {
            throw new InvalidSaleException("Quantity must be positive: " + quantity);
        }
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));

        BigDecimal total = product.getPrice().multiply(BigDecimal.valueOf(quantity))
                .setScale(MoneyUtils.SCALE, RoundingMode.HALF_UP);
        if (!MoneyUtils.fitsTotal(total)) {
            throw new InvalidSaleException("Sale total is too large: " + total);
        }
        String note = customerInfo == null || customerInfo.isBlank() ? null : customerInfo.trim();
        if (note != null && note.length() > SalesRecord.CUSTOMER_INFO_MAX_LENGTH) {
            throw new InvalidSaleException(
                    "Customer info cannot exceed " + SalesRecord.CUSTOMER_INFO_MAX_LENGTH + " characters.");
        }

        SalesRecord sale = new SalesRecord();
        sale.setProduct(product);
        sale.setQuantity(quantity);
        sale.setTotalAmount(total);
        sale.setSaleDate(saleDate);
        sale.setCustomerInfo(note);

        SalesRecord saved = salesRepository.save(sale);
        logger.info("Recorded sale {}: product {} x{} = {}", saved.getId(), productId, quantity, total);
        return saved.getId();
    }

    /**
     * Most recent sales first, optionally for a single product.
     */
    @Transactional(readOnly = true)
    public List<SaleRow> listSales(Long productId) {
        if (productId == null) {
            return salesRepository.findAllRows();
        }
        return salesRepository.findRowsByProductId(productId);
    }

    public SalesStatistics computeStatistics(List<SaleRow> sales) {
        if (sales == null || sales.isEmpty()) {
            return SalesStatistics.EMPTY;
        }
        long totalQuantity = 0;
        BigDecimal revenue = BigDecimal.ZERO;
        for (SaleRow sale : sales) {
            totalQuantity += sale.quantity();
            revenue = revenue.add(sale.totalAmount());
        }
        BigDecimal average = revenue.divide(BigDecimal.valueOf(sales.size()), MoneyUtils.SCALE,
                RoundingMode.HALF_UP);
        return new SalesStatistics(totalQuantity, revenue, average);
    }

    @Transactional(readOnly = true)
    public SalesStatistics statisticsFor(Long productId) {
        return computeStatistics(listSales(productId));
    }
}
