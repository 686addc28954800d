package com.forecastaccuracy.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(
    name = "forecast_runs",
    indexes = {
        @Index(name = "idx_run_stream",  columnList = "stream_key"),
        @Index(name = "idx_run_created", columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ForecastRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "stream_key", nullable = false, length = 50)
    private String streamKey;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "horizon_days")
    private int horizonDays;

    @Column(name = "history_days")
    private int historyDays;

    @Column(name = "backtest_days")
    private int backtestDays;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RunStatus status;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(length = 255)
    private String message;

    @Column(length = 2000)
    private String error;

    @Column(name = "request_id", length = 64)
    private String requestId;
}
