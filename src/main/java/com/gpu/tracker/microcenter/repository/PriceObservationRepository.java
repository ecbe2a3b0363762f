package com.gpu.tracker.microcenter.repository;

import com.gpu.tracker.microcenter.model.PriceObservation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PriceObservationRepository extends JpaRepository<PriceObservation, Long> {

    // "latest" is the highest id per product, i.e. insertion order, not observedAt
    @Query("""
            SELECT p.id AS productId,
                   g.brand AS brand,
                   g.modelName AS modelName,
                   g.manufacturer AS manufacturer,
                   g.fullName AS fullName,
                   s.id AS storeId,
                   s.name AS storeName,
                   s.city AS city,
                   s.state AS state,
                   p.sku AS sku,
                   p.productUrl AS productUrl,
                   p.lastSeenImageUrl AS lastSeenImageUrl,
                   o.price AS price,
                   o.stockStatus AS stockStatus,
                   o.observedAt AS observedAt
            FROM PriceObservation o
            JOIN Product p ON p.id = o.productId
            JOIN Gpu g ON g.id = p.gpuId
            JOIN Store s ON s.id = p.storeId
            WHERE o.id IN (
                SELECT MAX(latest.id)
                FROM PriceObservation latest
                GROUP BY latest.productId
            )
            ORDER BY o.price DESC, p.id ASC
            """)
    List<SnapshotProjection> findLatestSnapshots();

    List<PriceObservation> findByProductIdOrderByObservedAtAscIdAsc(Long productId);

    long countByProductId(Long productId);
}
