package com.ukboards.network.charities;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ukboards.config.BoardsProperties;
import com.ukboards.network.http.RegistryConnectionException;
import com.ukboards.network.model.CharityId;
import com.ukboards.network.model.CharityRecord;
import com.ukboards.network.model.TrusteeRecord;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Charity Commission {@code SearchCharitiesV1} SOAP 1.1 client. Every request body carries the
 * {@code APIKey} element; responses are read into Jackson trees keyed by element local name.
 */
@Service
public class CharityCommissionSoapClient implements CharityRegistry {
    public static final String GET_CHARITY = "GetCharityByRegisteredCharityNumber";
    public static final String GET_TRUSTEES = "GetCharityTrustees";
    public static final String GET_BY_NAME = "GetCharitiesByName";

    private static final Logger log = LoggerFactory.getLogger(CharityCommissionSoapClient.class);
    private static final String SOAP_ENVELOPE_NS = "http://schemas.xmlsoap.org/soap/envelope/";
    // Elements whose children repeat and are read as arrays.
    private static final Set<String> LIST_ELEMENTS = Set.of(
        "RelatedCharities",
        "GetCharityTrusteesResult",
        "GetCharitiesByNameResult"
    );

    private final BoardsProperties.CharityCommission properties;
    private final HttpClient client;

    public CharityCommissionSoapClient(
        BoardsProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties.getCharityCommission();
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(this.properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public Optional<CharityRecord> charity(CharityId charityNumber) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("registeredCharityNumber", charityNumber.value());
        return call(GET_CHARITY, args, charityNumber.value())
            .filter(JsonNode::isObject)
            .map(json -> CharityRecord.fromJson(charityNumber, json));
    }

    @Override
    public List<TrusteeRecord> trustees(CharityId charityNumber, int subsidiaryNumber) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("registeredCharityNumber", charityNumber.value());
        args.put("subsidiaryNumber", subsidiaryNumber);
        List<TrusteeRecord> trustees = new ArrayList<>();
        call(GET_TRUSTEES, args, charityNumber.value()).ifPresent(result -> {
            for (JsonNode trustee : result) {
                if (trustee.isObject()) {
                    trustees.add(TrusteeRecord.fromJson(trustee));
                }
            }
        });
        return trustees;
    }

    @Override
    public List<CharityRecord> charitiesByName(String name) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("strSearch", name);
        List<CharityRecord> charities = new ArrayList<>();
        call(GET_BY_NAME, args, name).ifPresent(result -> {
            for (JsonNode charity : result) {
                if (charity.isObject()) {
                    charities.add(CharityRecord.fromJson(CharityId.of(""), charity));
                }
            }
        });
        return charities;
    }

    /**
     * Posts one operation and returns its {@code <operation>Result} element, or empty on a SOAP
     * fault or a nil result.
     */
    Optional<JsonNode> call(String operation, Map<String, Object> args, String label) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(properties.getUrl()))
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("Content-Type", "text/xml; charset=utf-8")
            .header("SOAPAction", "\"" + properties.getNamespace() + operation + "\"")
            .POST(HttpRequest.BodyPublishers.ofString(envelope(operation, args), StandardCharsets.UTF_8))
            .build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RegistryConnectionException(
                "Could not reach the Charity Commission for " + operation + " " + label, e
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryConnectionException("Interrupted querying " + operation + " " + label, e);
        } catch (IllegalArgumentException e) {
            throw new RegistryConnectionException("Invalid Charity Commission url " + properties.getUrl(), e);
        }

        Document xml = Jsoup.parse(response.body() == null ? "" : response.body(), "", Parser.xmlParser());
        Element fault = firstByLocalName(xml, "Fault");
        if (fault != null) {
            Element reason = firstByLocalName(fault, "faultstring");
            log.error("Fault error pulling for {}", label);
            log.debug("{} fault: {}", operation, reason == null ? fault.text() : reason.text());
            return Optional.empty();
        }
        if (response.statusCode() / 100 != 2) {
            throw new RegistryConnectionException(
                "Status code " + response.statusCode() + " from Charity Commission " + operation + " " + label
            );
        }
        Element result = firstByLocalName(xml, operation + "Result");
        if (result == null || isNil(result)) {
            return Optional.empty();
        }
        return Optional.of(toJson(result));
    }

    String envelope(String operation, Map<String, Object> args) {
        StringBuilder body = new StringBuilder()
            .append("<?xml version=\"1.0\" encoding=\"utf-8\"?>")
            .append("<soap:Envelope xmlns:soap=\"").append(SOAP_ENVELOPE_NS).append("\"")
            .append(" xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\"")
            .append(" xmlns:xsd=\"http://www.w3.org/2001/XMLSchema\">")
            .append("<soap:Body>")
            .append('<').append(operation).append(" xmlns=\"").append(properties.getNamespace()).append("\">");
        appendElement(body, "APIKey", properties.getApiKey());
        for (Map.Entry<String, Object> arg : args.entrySet()) {
            appendElement(body, arg.getKey(), arg.getValue());
        }
        return body.append("</").append(operation).append('>')
            .append("</soap:Body>")
            .append("</soap:Envelope>")
            .toString();
    }

    private void appendElement(StringBuilder body, String name, Object value) {
        body.append('<').append(name).append('>')
            .append(Entities.escape(String.valueOf(value)))
            .append("</").append(name).append('>');
    }

    /**
     * Leaves become text nodes with their whitespace intact, repeating containers become arrays and
     * everything else an object keyed by child local name.
     */
    static JsonNode toJson(Element element) {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        if (isNil(element)) {
            return factory.nullNode();
        }
        if (LIST_ELEMENTS.contains(localName(element))) {
            ArrayNode items = factory.arrayNode();
            for (Element child : element.children()) {
                items.add(toJson(child));
            }
            return items;
        }
        if (element.children().isEmpty()) {
            return factory.textNode(element.wholeText());
        }
        ObjectNode object = factory.objectNode();
        for (Element child : element.children()) {
            String key = localName(child);
            JsonNode value = toJson(child);
            JsonNode existing = object.get(key);
            if (existing == null) {
                object.set(key, value);
            } else if (existing.isArray()) {
                ((ArrayNode) existing).add(value);
            } else {
                ArrayNode repeated = factory.arrayNode();
                repeated.add(existing);
                repeated.add(value);
                object.set(key, repeated);
            }
        }
        return object;
    }

    private static Element firstByLocalName(Element root, String name) {
        for (Element element : root.getAllElements()) {
            if (name.equals(localName(element))) {
                return element;
            }
        }
        return null;
    }

    private static String localName(Element element) {
        String tag = element.tagName();
        int colon = tag.indexOf(':');
        return colon < 0 ? tag : tag.substring(colon + 1);
    }

    private static boolean isNil(Element element) {
        return "true".equalsIgnoreCase(element.attr("xsi:nil"));
    }
}
