package com.forecastaccuracy.repository;

import com.forecastaccuracy.entity.RunSeriesPoint;
import com.forecastaccuracy.entity.SeriesKind;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface RunSeriesPointRepository extends JpaRepository<RunSeriesPoint, Long> {

    List<RunSeriesPoint> findByRunIdAndKindOrderByPointDateAsc(UUID runId, SeriesKind kind);

    long countByRunId(UUID runId);
}
