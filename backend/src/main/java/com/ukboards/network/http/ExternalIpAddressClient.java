package com.ukboards.network.http;

import com.ukboards.config.BoardsProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Looks up this machine's external IP address, which registry API keys are restricted to.
 */
@Service
public class ExternalIpAddressClient {
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final BoardsProperties properties;
    private final HttpClient client;

    public ExternalIpAddressClient(BoardsProperties properties) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(TIMEOUT)
            .build();
    }

    /**
     * @throws RegistryConnectionException when the check service cannot be reached
     */
    public String currentIpAddress() {
        String url = properties.getExternalIpCheckUrl();
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(url)).timeout(TIMEOUT).GET().build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new RegistryConnectionException(
                    RegistryConnectionException.DEFAULT_MESSAGE + " (" + url + " returned " + response.statusCode() + ")"
                );
            }
            return response.body() == null ? "" : response.body().trim();
        } catch (IOException e) {
            throw new RegistryConnectionException(RegistryConnectionException.DEFAULT_MESSAGE, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryConnectionException("Interrupted while checking external IP address at " + url, e);
        }
    }
}
