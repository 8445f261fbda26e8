package com.autoparts.stockkeeper.repository;

import com.autoparts.stockkeeper.dto.SaleRow;
import com.autoparts.stockkeeper.model.SalesRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SalesRecordRepository extends JpaRepository<SalesRecord, Long> {

    long countByProductId(Long productId);

    @Query("SELECT new com.autoparts.stockkeeper.dto.SaleRow(s.id, p.id, p.name, s.quantity, s.saleDate, "
            + "s.totalAmount, s.customerInfo, s.createdAt) FROM SalesRecord s JOIN s.product p "
            + "ORDER BY s.saleDate DESC, s.id DESC")
    List<SaleRow> findAllRows();

    @Query("SELECT new com.autoparts.stockkeeper.dto.SaleRow(s.id, p.id, p.name, s.quantity, s.saleDate, "
            + "s.totalAmount, s.customerInfo, s.createdAt) FROM SalesRecord s JOIN s.product p "
            + "WHERE p.id = :productId ORDER BY s.saleDate DESC, s.id DESC")
    List<SaleRow> findRowsByProductId(@Param("productId") Long productId);
}
