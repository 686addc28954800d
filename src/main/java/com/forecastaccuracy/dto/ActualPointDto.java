package com.forecastaccuracy.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Raw actual observation. Upstream payloads use either {@code value} or {@code actual}.
 */
@Value
@Builder
@Jacksonized
public class ActualPointDto {
    String date;
    Double value;
    Double actual;
}
