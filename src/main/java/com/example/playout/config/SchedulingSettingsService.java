package com.example.playout.config;

import com.example.playout.fill.RotationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class SchedulingSettingsService {

    private static final Logger logger = LoggerFactory.getLogger(SchedulingSettingsService.class);

    private final SchedulingSettingsRepository repository;

    public SchedulingSettingsService(SchedulingSettingsRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public SchedulingSettings current() {
        return repository.findFirstByOrderByIdAsc().orElseGet(() -> repository.save(new SchedulingSettings()));
    }

    /**
     * Rotation order as category tokens. Cached until the settings change.
     */
    @Cacheable(CacheConfig.SCHEDULING_SETTINGS)
    @Transactional
    public List<String> rotationOrder() {
        return current().rotationTokens();
    }

    @CacheEvict(value = CacheConfig.SCHEDULING_SETTINGS, allEntries = true)
    @Transactional
    public SchedulingSettings updateRotationOrder(List<String> tokens) {
        // Validates every token; throws IllegalArgumentException on unknown categories
        RotationConfig rotation = RotationConfig.fromTokens(tokens);
        SchedulingSettings settings = current();
        settings.setRotationOrder(String.join(",", rotation.tokens()));
        SchedulingSettings saved = repository.save(settings);
        logger.info("Rotation order updated to {}", saved.getRotationOrder());
        return saved;
    }
}
