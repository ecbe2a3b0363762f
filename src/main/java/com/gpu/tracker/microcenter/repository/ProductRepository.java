package com.gpu.tracker.microcenter.repository;

import com.gpu.tracker.microcenter.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ProductRepository extends JpaRepository<Product, Long> {
    Optional<Product> findBySkuAndStoreId(String sku, Long storeId);
}
