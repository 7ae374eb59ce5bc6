package com.ukboards.network.model;

import java.time.Duration;

public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    String body,
    String retryAfter,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isTransportError() {
        return errorCode != null;
    }
}
