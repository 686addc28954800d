package com.forecastaccuracy.controller;

import com.forecastaccuracy.client.ForecasterClient;
import com.forecastaccuracy.service.StreamKeyResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class StreamController {

    private final StreamKeyResolver streamKeyResolver;
    private final ForecasterClient  forecasterClient;

    @GetMapping("/streams")
    public ResponseEntity<Map<String, List<String>>> streams() {
        return ResponseEntity.ok(Map.of("streams", streamKeyResolver.allowed()));
    }

    @GetMapping("/forecaster/health")
    public Mono<ResponseEntity<Map<String, Object>>> forecasterHealth() {
        return forecasterClient.isHealthy()
            .map(healthy -> ResponseEntity
                .status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.<String, Object>of("forecaster", healthy ? "UP" : "DOWN")));
    }
}
