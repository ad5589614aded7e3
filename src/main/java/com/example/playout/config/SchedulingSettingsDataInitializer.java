package com.example.playout.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class SchedulingSettingsDataInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(SchedulingSettingsDataInitializer.class);

    private final SchedulingSettingsRepository repository;

    public SchedulingSettingsDataInitializer(SchedulingSettingsRepository repository) {
        this.repository = repository;
    }

    @Override
    public void run(String... args) throws Exception {
        if (repository.count() > 0) {
            logger.info("Scheduling settings already present, skipping seed.");
            return;
        }
        SchedulingSettings saved = repository.save(new SchedulingSettings());
        logger.info("Seeded scheduling settings with rotation order {}", saved.getRotationOrder());
    }
}
