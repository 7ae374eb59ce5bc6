package com.ukboards.network.companies;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ukboards.config.BoardsProperties;
import com.ukboards.network.http.CompaniesHouseHttpClient;
import com.ukboards.network.http.ExternalIpAddressClient;
import com.ukboards.network.http.QueryTrialsExhaustedException;
import com.ukboards.network.http.RegistryConnectionException;
import com.ukboards.network.http.RegistryPermissionException;
import com.ukboards.network.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Companies House queries with the registry's status policy and pagination applied.
 *
 * <p>An empty result means the entity is missing or the registry kept failing in a way worth
 * skipping (404, repeated 500s). Permission, connectivity and retry exhaustion are thrown.
 */
@Service
public class CompaniesHouseQueryService {
    public static final String TOTAL_RESULTS = "total_results";
    public static final String ITEMS_PER_PAGE = "items_per_page";
    public static final String START_INDEX = "start_index";
    public static final String ITEMS = "items";
    public static final String ITEMS_PER_QUERY_LIST = "items_per_query_list";

    private static final Logger log = LoggerFactory.getLogger(CompaniesHouseQueryService.class);

    private final BoardsProperties.CompaniesHouse properties;
    private final CompaniesHouseHttpClient httpClient;
    private final ExternalIpAddressClient ipAddressClient;
    private final ObjectMapper objectMapper;

    public CompaniesHouseQueryService(
        BoardsProperties properties,
        CompaniesHouseHttpClient httpClient,
        ExternalIpAddressClient ipAddressClient,
        ObjectMapper objectMapper
    ) {
        this.properties = properties.getCompaniesHouse();
        this.httpClient = httpClient;
        this.ipAddressClient = ipAddressClient;
        this.objectMapper = objectMapper;
    }

    public Optional<JsonNode> query(String path) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(ITEMS_PER_PAGE, properties.getItemsPerPage());
        return query(path, params, true);
    }

    public Optional<JsonNode> query(String path, Map<String, Object> params, boolean paginate) {
        int maxTrials = properties.getMaxTrials();
        int serverErrors = 0;
        for (int attempt = 1; attempt <= maxTrials; attempt++) {
            HttpFetchResult result = httpClient.get(path, params);
            if (result.isTransportError()) {
                handleTransportError(path, result);
                if (attempt < maxTrials) {
                    sleep(properties.getRetrySleepMs(), path);
                }
                continue;
            }
            int status = result.statusCode();
            if (status == 200) {
                Optional<JsonNode> parsed = parse(path, result.body());
                if (parsed.isEmpty() || !paginate) {
                    return parsed;
                }
                return Optional.of(paginate(path, params, parsed.get()));
            }
            log.warn("Status code {} from {} after {} ms", status, path, result.duration().toMillis());
            if (status == 401 || status == 403) {
                throw new RegistryPermissionException(
                    path,
                    properties.getApiKeyEnvName(),
                    properties.getApiKeyPath(),
                    ipAddressClient.currentIpAddress()
                );
            }
            if (status == 404) {
                log.error("Skipping {}", path);
                return Optional.empty();
            }
            long sleepMs = properties.getRetrySleepMs();
            if (status == 500) {
                serverErrors++;
                if (serverErrors >= properties.getServerErrorTrials()) {
                    log.warn("Skipping {} after {} server error(s)", path, serverErrors);
                    return Optional.empty();
                }
            } else if (status == 502) {
                log.warn("Adding a {} ms wait", properties.getOverloadSleepMs());
                sleep(properties.getOverloadSleepMs(), path);
            } else if (status == 429) {
                sleepMs = retryAfterMs(result.retryAfter(), sleepMs);
            }
            if (attempt < maxTrials) {
                log.warn("Trying again in {} ms...", sleepMs);
                sleep(sleepMs, path);
            }
        }
        throw new QueryTrialsExhaustedException(maxTrials, httpClient.buildUrl(path, params));
    }

    private void handleTransportError(String path, HttpFetchResult result) {
        String code = result.errorCode();
        if ("timeout".equals(code)) {
            log.warn("Timed out querying {} after {} ms: {}", path, result.duration().toMillis(), result.errorMessage());
            return;
        }
        throw new RegistryConnectionException(
            "Could not reach Companies House at " + result.requestedUrl() + " (" + code + "): " + result.errorMessage()
        );
    }

    private Optional<JsonNode> parse(String path, String body) {
        if (body == null || body.isBlank()) {
            log.warn("Empty response body from {}", path);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(body));
        } catch (JsonProcessingException e) {
            log.warn("Could not parse response from {}: {}", path, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Fetches the remaining pages of a listing and merges their items, in request order, into a
     * copy of the first page. {@code items_per_query_list} holds the item count of every page
     * that contributed.
     *
     * <p>Each follow-up page starts where the items received so far end, since the registry may
     * return fewer items than asked for. A page that fails is skipped by one page size; an empty
     * page ends the listing.
     */
    JsonNode paginate(String path, Map<String, Object> params, JsonNode firstPage) {
        if (!firstPage.isObject() || !firstPage.has(TOTAL_RESULTS) || !firstPage.has(ITEMS_PER_PAGE)) {
            return firstPage;
        }
        JsonNode firstItems = firstPage.get(ITEMS);
        int received = firstItems != null && firstItems.isArray() ? firstItems.size() : 0;
        int total = firstPage.get(TOTAL_RESULTS).asInt(0);
        int startIndex = params.containsKey(START_INDEX) ? Integer.parseInt(String.valueOf(params.get(START_INDEX))) : 0;
        if (received == 0 || startIndex + received >= total) {
            return firstPage;
        }
        int pageSize = properties.getItemsPerPage();
        int reportedPageSize = firstPage.get(ITEMS_PER_PAGE).asInt(0);
        int stride = reportedPageSize > 0 ? Math.min(reportedPageSize, pageSize) : pageSize;

        ObjectNode merged = ((ObjectNode) firstPage).deepCopy();
        ArrayNode items = objectMapper.createArrayNode();
        ArrayNode counts = objectMapper.createArrayNode();
        items.addAll((ArrayNode) firstItems);
        counts.add(received);
        int offset = startIndex + received;
        int queries = 1 + (total - offset + stride - 1) / stride;
        int queryNumber = 2;
        while (offset < total) {
            Map<String, Object> pageParams = new LinkedHashMap<>(params);
            pageParams.put(ITEMS_PER_PAGE, pageSize);
            pageParams.put(START_INDEX, offset);
            Optional<JsonNode> page = query(path, pageParams, false);
            JsonNode pageItems = page.map(node -> node.get(ITEMS)).orElse(null);
            if (pageItems == null || !pageItems.isArray()) {
                log.warn(
                    "Could not extend dict of pagination records for {} at {} of {} queries.",
                    path,
                    queryNumber,
                    queries
                );
                offset += stride;
                queryNumber++;
                continue;
            }
            if (pageItems.isEmpty()) {
                log.warn("Empty page for {} at start_index {} of {} results", path, offset, total);
                break;
            }
            items.addAll((ArrayNode) pageItems);
            counts.add(pageItems.size());
            offset += pageItems.size();
            queryNumber++;
        }
        merged.set(ITEMS, items);
        merged.set(ITEMS_PER_QUERY_LIST, counts);
        return merged;
    }

    private long retryAfterMs(String retryAfter, long fallbackMs) {
        if (retryAfter == null || retryAfter.isBlank()) {
            return fallbackMs;
        }
        try {
            return Math.max(0L, Long.parseLong(retryAfter.trim()) * 1000L);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header {}", retryAfter);
            return fallbackMs;
        }
    }

    private void sleep(long sleepMs, String path) {
        if (sleepMs <= 0) {
            return;
        }
        try {
            Thread.sleep(sleepMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryConnectionException("Interrupted while waiting to retry " + path, e);
        }
    }
}
