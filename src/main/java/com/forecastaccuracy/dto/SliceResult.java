package com.forecastaccuracy.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * One independently computed part of a dashboard response. Exactly one of
 * {@code data} and {@code error} is set.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SliceResult<T> {
    T data;
    String error;

    public static <T> SliceResult<T> ok(T data) {
        return SliceResult.<T>builder().data(data).build();
    }

    public static <T> SliceResult<T> failed(String error) {
        return SliceResult.<T>builder().error(error).build();
    }
}
