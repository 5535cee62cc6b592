package com.infomedia.abacox.pnrquality.service;

import com.infomedia.abacox.pnrquality.db.repository.PnrRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static com.infomedia.abacox.pnrquality.config.CachingConfig.DELIVERY_SYSTEMS;
import static com.infomedia.abacox.pnrquality.config.CachingConfig.OFFICES;

/**
 * Values available for the dashboard selectors.
 */
@Service
@RequiredArgsConstructor
public class DimensionLookupService {

    private final PnrRepository pnrRepository;

    @Transactional(readOnly = true)
    @Cacheable(DELIVERY_SYSTEMS)
    public List<String> getDeliverySystems() {
        return pnrRepository.findDistinctDeliverySystems();
    }

    /**
     * Offices that have PNRs issued through any of the given delivery systems; all offices
     * when no delivery system is selected.
     */
    @Transactional(readOnly = true)
    @Cacheable(OFFICES)
    public List<String> getOfficesByDeliverySystems(List<String> deliverySystems) {
        if (deliverySystems == null || deliverySystems.isEmpty()) {
            return pnrRepository.findDistinctOffices();
        }
        return pnrRepository.findDistinctOfficesByDeliverySystems(deliverySystems);
    }
}
