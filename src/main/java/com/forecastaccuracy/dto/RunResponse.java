package com.forecastaccuracy.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.forecastaccuracy.entity.RunStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunResponse {
    UUID id;
    String streamKey;
    RunStatus status;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate startDate;
    int horizonDays;
    int historyDays;
    int backtestDays;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant finishedAt;
    String message;
    String error;
    UUID jobId;
    String requestId;
    Map<String, String> links;
}
