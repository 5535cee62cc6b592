package com.infomedia.abacox.pnrquality.service;

import com.infomedia.abacox.pnrquality.db.repository.PassengerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import static com.infomedia.abacox.pnrquality.config.CachingConfig.QUALITY_SUMMARY;

@Service
@Log4j2
@RequiredArgsConstructor
public class PassengerService {

    private final PassengerRepository passengerRepository;

    /**
     * Replaces a meal code on every passenger that carries it, e.g. a misspelled special
     * meal request. Replacing with a blank code removes the meal.
     *
     * @return number of passengers updated
     */
    @Transactional
    @CacheEvict(cacheNames = QUALITY_SUMMARY, allEntries = true)
    public int correctMealCode(String from, String to) {
        if (from == null || from.isBlank()) {
            throw new IllegalArgumentException("Meal code to replace must not be blank");
        }
        String target = to == null ? "" : to.trim();
        int updated = passengerRepository.updateMeal(from.trim(), target);
        log.info("Corrected meal code '{}' to '{}' on {} passengers", from.trim(), target, updated);
        return updated;
    }
}
