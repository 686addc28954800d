package com.forecastaccuracy.repository;

import com.forecastaccuracy.entity.ForecastRun;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface ForecastRunRepository extends JpaRepository<ForecastRun, UUID> {

    Page<ForecastRun> findAllByOrderByCreatedAtDesc(Pageable pageable);

    Page<ForecastRun> findByStreamKeyOrderByCreatedAtDesc(String streamKey, Pageable pageable);
}
