package com.payment.checkout.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Catalog course. Owned by the catalog; this service only reads it.
 */
@Entity
@Table(name = "courses")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CourseEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "slug", nullable = false, unique = true)
    private String slug;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "price_cents", nullable = false)
    private Integer priceCents;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "track")
    private String track;

    @Column(name = "area")
    private String area;

    @Column(name = "workload_hours")
    private Integer workloadHours;

    @Column(name = "modality")
    private String modality;

    @Column(name = "duration_months_min")
    private Integer durationMonthsMin;

    @Column(name = "duration_months_max")
    private Integer durationMonthsMax;

    @Column(name = "tcc_required")
    private Boolean tccRequired;

    @Column(name = "created_at", insertable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", insertable = false, updatable = false)
    private Instant updatedAt;
}
