package com.forecastaccuracy.service;

import com.forecastaccuracy.exception.UnknownStreamException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Normalises stream keys such as {@code "XGB_Export"} to {@code "export"} and
 * rejects keys outside {@code streams.allowed}.
 */
@Component
public class StreamKeyResolver {

    private static final List<String> STRIPPED_PREFIXES = List.of("xgb_", "model_", "forecast_");

    @Value("${streams.allowed:export,import,tra_export,tra_import}")
    private List<String> allowed;

    public String resolve(String raw) {
        String key = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (String prefix : STRIPPED_PREFIXES) {
            if (key.startsWith(prefix)) {
                key = key.substring(prefix.length());
                break;
            }
        }
        if (!allowed.contains(key)) {
            throw new UnknownStreamException(raw, allowed);
        }
        return key;
    }

    public List<String> allowed() {
        return List.copyOf(allowed);
    }
}
