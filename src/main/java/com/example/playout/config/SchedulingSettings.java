package com.example.playout.config;

import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * Editor-managed scheduling configuration. A single row; the rotation order is stored
 * as comma separated category tokens.
 */
@Entity
@Table(name = "scheduling_settings")
public class SchedulingSettings {

    public static final String DEFAULT_ROTATION = "id,short_form,long_form,spots";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "rotation_order", nullable = false, length = 512)
    private String rotationOrder = DEFAULT_ROTATION;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }

    public List<String> rotationTokens() {
        return Arrays.stream(rotationOrder.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getRotationOrder() { return rotationOrder; }
    public void setRotationOrder(String rotationOrder) { this.rotationOrder = rotationOrder; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }
}
