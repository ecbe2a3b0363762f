package com.gpu.tracker.microcenter.service;

import com.gpu.tracker.microcenter.model.PriceHistoryPointDTO;
import com.gpu.tracker.microcenter.model.ProductSnapshotDTO;
import com.gpu.tracker.microcenter.repository.PriceObservationRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional(readOnly = true)
public class PriceQueryService {
    private final PriceObservationRepository priceObservationRepository;

    public PriceQueryService(PriceObservationRepository priceObservationRepository) {
        this.priceObservationRepository = priceObservationRepository;
    }

    public List<ProductSnapshotDTO> listLatest() {
        return priceObservationRepository.findLatestSnapshots().stream()
                .map(row -> new ProductSnapshotDTO(
                        row.getProductId(),
                        row.getBrand(),
                        row.getModelName(),
                        row.getManufacturer(),
                        row.getFullName(),
                        row.getStoreId(),
                        row.getStoreName(),
                        row.getCity(),
                        row.getState(),
                        row.getSku(),
                        row.getProductUrl(),
                        row.getLastSeenImageUrl(),
                        row.getPrice(),
                        row.getStockStatus(),
                        row.getObservedAt()
                ))
                .toList();
    }

    public List<PriceHistoryPointDTO> history(Long productId) {
        if (productId == null || productId <= 0) {
            throw new IllegalArgumentException("product id must be a positive number");
        }
        return priceObservationRepository.findByProductIdOrderByObservedAtAscIdAsc(productId).stream()
                .map(observation -> new PriceHistoryPointDTO(
                        observation.getId(),
                        observation.getPrice(),
                        observation.getStockStatus(),
                        observation.getObservedAt()
                ))
                .toList();
    }
}
