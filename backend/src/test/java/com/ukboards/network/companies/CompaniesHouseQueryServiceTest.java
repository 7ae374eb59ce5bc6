package com.ukboards.network.companies;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ukboards.config.BoardsProperties;
import com.ukboards.network.http.CompaniesHouseHttpClient;
import com.ukboards.network.http.ExternalIpAddressClient;
import com.ukboards.network.http.QueryTrialsExhaustedException;
import com.ukboards.network.http.RegistryConnectionException;
import com.ukboards.network.http.RegistryPermissionException;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@ExtendWith(OutputCaptureExtension.class)
class CompaniesHouseQueryServiceTest {
    private MockWebServer server;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        server = new MockWebServer();
        executor = Executors.newFixedThreadPool(1);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private CompaniesHouseQueryService service(BoardsProperties properties) {
        return new CompaniesHouseQueryService(
            properties,
            new CompaniesHouseHttpClient(properties, executor),
            new ExternalIpAddressClient(properties),
            new ObjectMapper()
        );
    }

    @Test
    void returnsParsedRecordAndSendsApiKeyAsBasicAuth() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"company_name\": \"PUNCHDRUNK\"}"));
        server.start();

        Optional<JsonNode> company = service(CompaniesHouseFixtures.properties(server)).query("/company/04547069");

        assertThat(company).isPresent();
        assertThat(company.get().get("company_name").asText()).isEqualTo("PUNCHDRUNK");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/company/04547069");
        assertThat(request.getRequestUrl().queryParameter("items_per_page")).isEqualTo("50");
        // "a-test-key:" in base64
        assertThat(request.getHeader("Authorization")).isEqualTo("Basic YS10ZXN0LWtleTo=");
    }

    @Test
    void forbiddenQueryReportsExternalIpAddress() throws Exception {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if ("/checkip".equals(request.getPath())) {
                    return new MockResponse().setResponseCode(200).setBody("203.0.113.7\n");
                }
                return new MockResponse().setResponseCode(403);
            }
        });
        server.start();
        CompaniesHouseQueryService service = service(CompaniesHouseFixtures.properties(server));

        RegistryPermissionException error = catchThrowableOfType(
            () -> service.query("/company/04547069"),
            RegistryPermissionException.class
        );

        assertThat(error).isNotNull();
        assertThat(error.getIpAddress()).isEqualTo("203.0.113.7");
        assertThat(error.getMessage())
            .contains("Query: /company/04547069")
            .contains("COMPANIES_HOUSE_KEY")
            .contains("(203.0.113.7)");
    }

    @Test
    void missingEntityIsEmptyWithoutRetrying() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.start();

        Optional<JsonNode> company = service(CompaniesHouseFixtures.properties(server)).query("/company/00000001");

        assertThat(company).isEmpty();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void repeatedServerErrorsAreSkipped() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(500));
        server.start();
        BoardsProperties properties = CompaniesHouseFixtures.properties(server);
        properties.getCompaniesHouse().setMaxTrials(4);

        Optional<JsonNode> company = service(properties).query("/company/04547069");

        assertThat(company).isEmpty();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void rateLimitedQueryIsRetried() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "0"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"company_name\": \"SHARED EXPERIENCE LIMITED\"}"));
        server.start();

        Optional<JsonNode> company = service(CompaniesHouseFixtures.properties(server)).query("/company/01254833");

        assertThat(company).map(json -> json.get("company_name").asText()).contains("SHARED EXPERIENCE LIMITED");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void overloadedRegistryIsRetried() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(502));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"company_name\": \"PUNCHDRUNK\"}"));
        server.start();

        Optional<JsonNode> company = service(CompaniesHouseFixtures.properties(server)).query("/company/04547069");

        assertThat(company).map(json -> json.get("company_name").asText()).contains("PUNCHDRUNK");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void exhaustedTrialsAreThrown() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(429));
        server.enqueue(new MockResponse().setResponseCode(429));
        server.start();
        CompaniesHouseQueryService service = service(CompaniesHouseFixtures.properties(server));

        assertThatThrownBy(() -> service.query("/company/01254833"))
            .isInstanceOf(QueryTrialsExhaustedException.class)
            .hasMessageStartingWith("Failed 2 attempt(s) querying ")
            .hasMessageContaining("/company/01254833");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void remainingPagesAreMergedIntoFirstPage() throws Exception {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String start = request.getRequestUrl().queryParameter("start_index");
                if (start == null) {
                    return json("{\"total_results\": 5, \"items_per_page\": 2, "
                        + "\"items\": [{\"name\": \"A\"}, {\"name\": \"B\"}]}");
                }
                if ("2".equals(start)) {
                    return json("{\"items\": [{\"name\": \"C\"}, {\"name\": \"D\"}]}");
                }
                return json("{\"items\": [{\"name\": \"E\"}]}");
            }
        });
        server.start();
        BoardsProperties properties = CompaniesHouseFixtures.properties(server);
        properties.getCompaniesHouse().setItemsPerPage(2);

        JsonNode officers = service(properties).query("/company/04547069/officers").orElseThrow();

        assertThat(officers.get("items").size()).isEqualTo(5);
        assertThat(officers.get("items").get(4).get("name").asText()).isEqualTo("E");
        assertThat(officers.get("items_per_query_list").toString()).isEqualTo("[2,2,1]");
        assertThat(officers.get("total_results").asInt()).isEqualTo(5);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void shortPagesAreFollowedFromTheLastItemReceived() throws Exception {
        List<String> names = List.of("A", "B", "C", "D", "E", "F");
        List<String> startIndexes = new CopyOnWriteArrayList<>();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String start = request.getRequestUrl().queryParameter("start_index");
                startIndexes.add(String.valueOf(start));
                int from = start == null ? 0 : Integer.parseInt(start);
                StringBuilder items = new StringBuilder();
                for (int i = from; i < Math.min(from + 2, names.size()); i++) {
                    if (items.length() > 0) {
                        items.append(", ");
                    }
                    items.append("{\"name\": \"").append(names.get(i)).append("\"}");
                }
                return json("{\"total_results\": 6, \"items_per_page\": 3, \"items\": [" + items + "]}");
            }
        });
        server.start();
        BoardsProperties properties = CompaniesHouseFixtures.properties(server);
        properties.getCompaniesHouse().setItemsPerPage(3);

        JsonNode officers = service(properties).query("/company/04547069/officers").orElseThrow();

        assertThat(names(officers)).containsExactly("A", "B", "C", "D", "E", "F");
        assertThat(officers.get("items_per_query_list").toString()).isEqualTo("[2,2,2]");
        assertThat(startIndexes).containsExactly("null", "2", "4");
    }

    @Test
    void failedPagesAreSkippedAndTheRestMerged(CapturedOutput output) throws Exception {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                String start = request.getRequestUrl().queryParameter("start_index");
                if (start == null) {
                    return json("{\"total_results\": 7, \"items_per_page\": 2, "
                        + "\"items\": [{\"name\": \"A\"}, {\"name\": \"B\"}]}");
                }
                return switch (start) {
                    case "2" -> new MockResponse().setResponseCode(404);
                    case "4" -> json("{\"items\": {\"name\": \"E\"}}");
                    default -> json("{\"items\": [{\"name\": \"G\"}]}");
                };
            }
        });
        server.start();
        BoardsProperties properties = CompaniesHouseFixtures.properties(server);
        properties.getCompaniesHouse().setItemsPerPage(2);

        JsonNode officers = service(properties).query("/company/04547069/officers").orElseThrow();

        assertThat(names(officers)).containsExactly("A", "B", "G");
        assertThat(officers.get("items_per_query_list").toString()).isEqualTo("[2,1]");
        assertThat(server.getRequestCount()).isEqualTo(4);
        assertThat(output.getOut())
            .contains("Could not extend dict of pagination records for /company/04547069/officers at 2 of 4 queries.")
            .contains("Could not extend dict of pagination records for /company/04547069/officers at 3 of 4 queries.");
    }

    @Test
    void emptyPageEndsTheListing() throws Exception {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if (request.getRequestUrl().queryParameter("start_index") == null) {
                    return json("{\"total_results\": 10, \"items_per_page\": 2, "
                        + "\"items\": [{\"name\": \"A\"}, {\"name\": \"B\"}]}");
                }
                return json("{\"items\": []}");
            }
        });
        server.start();
        BoardsProperties properties = CompaniesHouseFixtures.properties(server);
        properties.getCompaniesHouse().setItemsPerPage(2);

        JsonNode officers = service(properties).query("/company/04547069/officers").orElseThrow();

        assertThat(officers.get("items").size()).isEqualTo(2);
        assertThat(officers.get("items_per_query_list").toString()).isEqualTo("[2]");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void unreachableRegistryIsAConnectionError() throws Exception {
        server.start();
        BoardsProperties properties = CompaniesHouseFixtures.properties(server);
        server.shutdown();
        CompaniesHouseQueryService service = service(properties);

        assertThatThrownBy(() -> service.query("/company/04547069"))
            .isInstanceOf(RegistryConnectionException.class)
            .hasMessageContaining("/company/04547069");
    }

    private static List<String> names(JsonNode listing) {
        List<String> names = new ArrayList<>();
        listing.get("items").forEach(item -> names.add(item.get("name").asText()));
        return names;
    }

    private static MockResponse json(String body) {
        return new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }
}
