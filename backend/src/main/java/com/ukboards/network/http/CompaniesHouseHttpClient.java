package com.ukboards.network.http;

import com.ukboards.config.BoardsProperties;
import com.ukboards.network.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.ExecutorService;

/**
 * One authenticated GET against the Companies House REST API per call. Retries and status handling
 * live in {@link com.ukboards.network.companies.CompaniesHouseQueryService}.
 */
@Service
public class CompaniesHouseHttpClient {
    private final BoardsProperties.CompaniesHouse properties;
    private final HttpClient client;

    public CompaniesHouseHttpClient(
        BoardsProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties.getCompaniesHouse();
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(this.properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String path, Map<String, ?> params) {
        String url = buildUrl(path, params);
        Instant startedAt = Instant.now();
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("Accept", "application/json")
                .header("Authorization", basicAuth(properties.getApiKey()))
                .GET()
                .build();
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] bytes = response.body();
            return new HttpFetchResult(
                url,
                response.statusCode(),
                bytes == null ? null : new String(bytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Retry-After").orElse(null),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, "invalid_url", e.getMessage());
        }
    }

    public String buildUrl(String path, Map<String, ?> params) {
        StringBuilder url = new StringBuilder(properties.getUrl());
        if (path != null && !path.startsWith("/")) {
            url.append('/');
        }
        url.append(path == null ? "" : path);
        if (params != null && !params.isEmpty()) {
            StringJoiner query = new StringJoiner("&");
            for (Map.Entry<String, ?> entry : params.entrySet()) {
                query.add(
                    URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8)
                        + "="
                        + URLEncoder.encode(String.valueOf(entry.getValue()), StandardCharsets.UTF_8)
                );
            }
            url.append('?').append(query);
        }
        return url.toString();
    }

    // Companies House expects the key as the user name and an empty password.
    static String basicAuth(String apiKey) {
        String credentials = (apiKey == null ? "" : apiKey) + ":";
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            null,
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }
}
