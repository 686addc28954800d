package com.forecastaccuracy.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * One snapshotted day of a run. ACTUAL rows use {@code value} only; FORECAST rows
 * carry the point forecast in {@code value} plus the optional band.
 */
@Entity
@Table(
    name = "run_series_points",
    indexes = @Index(name = "idx_point_run_date", columnList = "run_id, point_date")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunSeriesPoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "run_id", nullable = false)
    private ForecastRun run;

    @Column(name = "point_date", nullable = false)
    private LocalDate pointDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private SeriesKind kind;

    @Column(name = "point_value")
    private Double value;

    private Double p05;
    private Double p95;
}
