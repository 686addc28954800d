package com.forecastaccuracy.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.forecastaccuracy.dto.ActualPointDto;
import com.forecastaccuracy.dto.ForecastPointDto;
import com.forecastaccuracy.exception.ForecasterApiException;
import com.forecastaccuracy.exception.ForecasterUnavailableException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Client of the upstream forecasting service that owns the model and the raw actuals.
 * Points come back as raw DTOs; malformed ones are dropped later by the point mapper.
 */
@Slf4j
@Component
public class ForecasterClient {

    @Value("${forecaster.api.base-url}")
    private String baseUrl;

    @Value("${forecaster.api.timeout-seconds:10}")
    private int timeoutSeconds;

    private WebClient webClient;
    private final ObjectMapper mapper = new ObjectMapper();

    @PostConstruct
    void init() {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
        this.webClient = WebClient.builder()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", "application/json")
            .build();
        log.info("ForecasterClient ready | baseUrl={} | timeoutSeconds={}", baseUrl, timeoutSeconds);
    }

    public Mono<List<ActualPointDto>> fetchActuals(String streamKey, String requestId) {
        WebClient.RequestHeadersSpec<?> call = webClient.get()
            .uri("/actuals/{stream}", streamKey)
            .header("X-Request-ID", requestId);
        return exchange(call, "actuals").map(this::toActualPoints);
    }

    public Mono<List<ForecastPointDto>> fetchForecast(
            String streamKey, LocalDate startDate, int horizonDays, String requestId) {
        ObjectNode body = mapper.createObjectNode();
        body.put("start_date", startDate.format(DateTimeFormatter.ISO_DATE));
        body.put("horizon_days", horizonDays);

        WebClient.RequestHeadersSpec<?> call = webClient.post()
            .uri("/forecast/{stream}", streamKey)
            .header("X-Request-ID", requestId)
            .bodyValue(body);
        return exchange(call, "forecast").map(this::toForecastPoints);
    }

    /**
     * 4xx becomes {@link ForecasterApiException}, 5xx and exhausted connection retries
     * become {@link ForecasterUnavailableException}.
     */
    private Mono<JsonNode> exchange(WebClient.RequestHeadersSpec<?> call, String what) {
        return call.retrieve()
            .onStatus(HttpStatusCode::is4xxClientError, resp -> resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(b -> new ForecasterApiException("Forecaster rejected " + what + " request (4xx): " + b)))
            .onStatus(HttpStatusCode::is5xxServerError, resp -> resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(b -> new ForecasterUnavailableException(new RuntimeException(b))))
            .bodyToMono(JsonNode.class)
            .retryWhen(Retry.backoff(2, Duration.ofMillis(300))
                .filter(ex -> ex instanceof WebClientRequestException)
                .onRetryExhaustedThrow((retrySpec, signal) -> new ForecasterUnavailableException(signal.failure())))
            .onErrorMap(WebClientRequestException.class, ForecasterUnavailableException::new)
            .doOnError(ex -> log.error("Forecaster {} call failed | {}", what, ex.getMessage()));
    }

    public Mono<Boolean> isHealthy() {
        return webClient.get().uri("/health").retrieve()
            .bodyToMono(JsonNode.class)
            .map(json -> json.hasNonNull("status") && "ok".equals(json.get("status").asText()))
            .onErrorReturn(false);
    }

    private List<ActualPointDto> toActualPoints(JsonNode json) {
        if (json == null || !json.isArray()) {
            throw new ForecasterApiException("Forecaster actuals response is not an array: " + json);
        }
        List<ActualPointDto> out = new ArrayList<>(json.size());
        for (JsonNode node : json) {
            out.add(ActualPointDto.builder()
                .date(readOptionalText(node, "date"))
                .value(readOptionalDouble(node, "value"))
                .actual(readOptionalDouble(node, "actual"))
                .build());
        }
        return out;
    }

    private List<ForecastPointDto> toForecastPoints(JsonNode json) {
        if (json == null || !json.has("forecast") || !json.get("forecast").isArray()) {
            throw new ForecasterApiException("Forecaster response missing 'forecast' array: " + json);
        }
        JsonNode points = json.get("forecast");
        List<ForecastPointDto> out = new ArrayList<>(points.size());
        for (JsonNode node : points) {
            out.add(ForecastPointDto.builder()
                .date(readOptionalText(node, "date"))
                .forecast(readOptionalDouble(node, "forecast"))
                .p05(readOptionalDouble(node, "p05"))
                .p95(readOptionalDouble(node, "p95"))
                .build());
        }
        return out;
    }

    private String readOptionalText(JsonNode json, String key) {
        JsonNode node = json.get(key);
        return (node == null || node.isNull()) ? null : node.asText();
    }

    private Double readOptionalDouble(JsonNode json, String key) {
        JsonNode node = json.get(key);
        return (node == null || node.isNull() || !node.isNumber()) ? null : node.asDouble();
    }
}
