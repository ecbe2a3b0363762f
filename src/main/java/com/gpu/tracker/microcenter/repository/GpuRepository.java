package com.gpu.tracker.microcenter.repository;

import com.gpu.tracker.microcenter.model.Gpu;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface GpuRepository extends JpaRepository<Gpu, Long> {
    Optional<Gpu> findByFullName(String fullName);
}
