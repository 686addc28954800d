package com.forecastaccuracy.exception;

import java.util.Collection;

public class UnknownStreamException extends ForecastAccuracyException {
    public UnknownStreamException(String streamKey, Collection<String> allowed) {
        super("UNKNOWN_STREAM", "Unknown stream '" + streamKey + "'. Allowed: " + allowed);
    }
}
