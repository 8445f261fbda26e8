package com.autoparts.stockkeeper.repository;

import com.autoparts.stockkeeper.model.Manufacturer;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ManufacturerRepository extends JpaRepository<Manufacturer, Long> {
    Optional<Manufacturer> findByName(String name);

    List<Manufacturer> findAllByOrderByNameAsc();
}
