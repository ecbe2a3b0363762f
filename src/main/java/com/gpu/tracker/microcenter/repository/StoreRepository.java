package com.gpu.tracker.microcenter.repository;

import com.gpu.tracker.microcenter.model.Store;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface StoreRepository extends JpaRepository<Store, Long> {
    Optional<Store> findByNameAndCity(String name, String city);
}
