package com.example.playout.config;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SchedulingSettingsRepository extends JpaRepository<SchedulingSettings, Long> {

    Optional<SchedulingSettings> findFirstByOrderByIdAsc();
}
