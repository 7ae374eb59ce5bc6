package com.ukboards.network.charities;

import com.fasterxml.jackson.databind.JsonNode;
import com.ukboards.config.BoardsProperties;
import com.ukboards.network.http.RegistryConnectionException;
import com.ukboards.network.model.CharityId;
import com.ukboards.network.model.CharityRecord;
import com.ukboards.network.model.TrusteeRecord;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(OutputCaptureExtension.class)
class CharityCommissionSoapClientTest {
    private static final String ENVELOPE_START = """
        <?xml version="1.0" encoding="utf-8"?>
        <soap:Envelope xmlns:soap="http://schemas.xmlsoap.org/soap/envelope/"
                       xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance">
          <soap:Body>
        """;
    private static final String ENVELOPE_END = """
          </soap:Body>
        </soap:Envelope>
        """;

    private static final String CHARITY_RESPONSE = ENVELOPE_START + """
            <GetCharityByRegisteredCharityNumberResponse xmlns="http://www.charitycommission.gov.uk/">
              <GetCharityByRegisteredCharityNumberResult>
                <RegisteredCharityNumber>1089464</RegisteredCharityNumber>
                <SubsidiaryNumber>1</SubsidiaryNumber>
                <CharityName>NORTHERN LIGHTS ARTS TRUST      </CharityName>
                <RegistrationHistory>
                  <RegistrationDate>2001-11-12</RegistrationDate>
                </RegistrationHistory>
                <WorkingNames xsi:nil="true" />
              </GetCharityByRegisteredCharityNumberResult>
            </GetCharityByRegisteredCharityNumberResponse>
        """ + ENVELOPE_END;

    private static final String TRUSTEES_RESPONSE = ENVELOPE_START + """
            <GetCharityTrusteesResponse xmlns="http://www.charitycommission.gov.uk/">
              <GetCharityTrusteesResult>
                <Trustee>
                  <TrusteeNumber>3028123</TrusteeNumber>
                  <TrusteeName>MS JANE HOLLOWAY</TrusteeName>
                  <RelatedCharitiesCount>2</RelatedCharitiesCount>
                  <RelatedCharities>
                    <Charity>
                      <CharityNumber>1089464</CharityNumber>
                      <CharityName>NORTHERN LIGHTS ARTS TRUST</CharityName>
                    </Charity>
                    <Charity>
                      <CharityNumber>0502201</CharityNumber>
                      <CharityName>RIVERSIDE YOUTH THEATRE</CharityName>
                    </Charity>
                  </RelatedCharities>
                </Trustee>
                <Trustee>
                  <TrusteeNumber>3028124</TrusteeNumber>
                  <TrusteeName>NORTHERN LIGHTS TRUSTEE LIMITED</TrusteeName>
                  <RelatedCharitiesCount>0</RelatedCharitiesCount>
                  <RelatedCharities />
                </Trustee>
              </GetCharityTrusteesResult>
            </GetCharityTrusteesResponse>
        """ + ENVELOPE_END;

    private static final String NIL_RESPONSE = ENVELOPE_START + """
            <GetCharityByRegisteredCharityNumberResponse xmlns="http://www.charitycommission.gov.uk/">
              <GetCharityByRegisteredCharityNumberResult xsi:nil="true" />
            </GetCharityByRegisteredCharityNumberResponse>
        """ + ENVELOPE_END;

    private static final String FAULT_RESPONSE = ENVELOPE_START + """
            <soap:Fault>
              <faultcode>soap:Server</faultcode>
              <faultstring>Server was unable to process request. Invalid API key</faultstring>
            </soap:Fault>
        """ + ENVELOPE_END;

    private MockWebServer server;
    private ExecutorService executor;
    private CharityCommissionSoapClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        BoardsProperties properties = new BoardsProperties();
        properties.getCharityCommission().setUrl(server.url("/SearchCharitiesV1.asmx").toString());
        properties.getCharityCommission().setApiKey("a-charity-key");
        properties.getCharityCommission().setRequestTimeoutSeconds(5);
        client = new CharityCommissionSoapClient(properties, executor);
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

    private void enqueueXml(int status, String body) {
        server.enqueue(new MockResponse()
            .setResponseCode(status)
            .setHeader("Content-Type", "text/xml; charset=utf-8")
            .setBody(body));
    }

    @Test
    void charityRecordIsReadFromResultElement() throws Exception {
        enqueueXml(200, CHARITY_RESPONSE);

        CharityRecord charity = client.charity(CharityId.of("1089464")).orElseThrow();

        assertThat(charity.id()).isEqualTo(CharityId.of("1089464"));
        assertThat(charity.name()).isEqualTo("NORTHERN LIGHTS ARTS TRUST");
        assertThat(charity.subsidiaryNumber()).isEqualTo(1);
        assertThat(charity.raw().get("CharityName").asText()).isEqualTo("NORTHERN LIGHTS ARTS TRUST      ");
        assertThat(charity.raw().path("RegistrationHistory").path("RegistrationDate").asText()).isEqualTo("2001-11-12");
        assertThat(charity.raw().get("WorkingNames").isNull()).isTrue();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("SOAPAction"))
            .isEqualTo("\"http://www.charitycommission.gov.uk/GetCharityByRegisteredCharityNumber\"");
        assertThat(request.getHeader("Content-Type")).startsWith("text/xml");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("<APIKey>a-charity-key</APIKey><registeredCharityNumber>1089464</registeredCharityNumber>");
    }

    @Test
    void trusteesAndTheirRelatedCharitiesAreLists() throws Exception {
        enqueueXml(200, TRUSTEES_RESPONSE);

        List<TrusteeRecord> trustees = client.trustees(CharityId.of("1089464"), 0);

        assertThat(trustees).extracting(TrusteeRecord::trusteeNumber).containsExactly("3028123", "3028124");
        TrusteeRecord first = trustees.get(0);
        assertThat(first.name()).isEqualTo("MS JANE HOLLOWAY");
        assertThat(first.relatedCharitiesCount()).isEqualTo(2);
        assertThat(first.relatedCharities().get(1).number()).isEqualTo(CharityId.of("502201"));
        assertThat(first.relatedCharities().get(1).name()).isEqualTo("RIVERSIDE YOUTH THEATRE");
        assertThat(trustees.get(1).relatedCharities()).isEmpty();

        String body = server.takeRequest().getBody().readUtf8();
        assertThat(body).contains("<subsidiaryNumber>0</subsidiaryNumber>");
    }

    @Test
    void nilResultIsEmpty() {
        enqueueXml(200, NIL_RESPONSE);

        assertThat(client.charity(CharityId.of("1"))).isEmpty();
    }

    @Test
    void faultIsLoggedAndEmpty(CapturedOutput output) {
        enqueueXml(500, FAULT_RESPONSE);

        Optional<CharityRecord> charity = client.charity(CharityId.of("1089464"));

        assertThat(charity).isEmpty();
        assertThat(output.getOut()).contains("Fault error pulling for 1089464");
    }

    @Test
    void errorStatusWithoutFaultIsAConnectionError() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("Service Unavailable"));

        assertThatThrownBy(() -> client.trustees(CharityId.of("1089464"), 0))
            .isInstanceOf(RegistryConnectionException.class)
            .hasMessageContaining("503");
    }

    @Test
    void searchTermsAreEscaped() throws Exception {
        enqueueXml(200, ENVELOPE_START + """
                <GetCharitiesByNameResponse xmlns="http://www.charitycommission.gov.uk/">
                  <GetCharitiesByNameResult>
                    <CharityList>
                      <RegisteredCharityNumber>1089464</RegisteredCharityNumber>
                      <CharityName>SMITH &amp; SONS MEMORIAL FUND</CharityName>
                    </CharityList>
                  </GetCharitiesByNameResult>
                </GetCharitiesByNameResponse>
            """ + ENVELOPE_END);

        List<CharityRecord> charities = client.charitiesByName("Smith & Sons");

        assertThat(charities).hasSize(1);
        assertThat(charities.get(0).id()).isEqualTo(CharityId.of("1089464"));
        assertThat(charities.get(0).name()).isEqualTo("SMITH & SONS MEMORIAL FUND");
        assertThat(server.takeRequest().getBody().readUtf8()).contains("<strSearch>Smith &amp; Sons</strSearch>");
    }

    @Test
    void repeatedChildElementsBecomeArrays() {
        Document xml = Jsoup.parse(
            "<Result><Name>first</Name><Name>second</Name><Single> padded </Single></Result>",
            "",
            Parser.xmlParser()
        );

        JsonNode json = CharityCommissionSoapClient.toJson(xml.children().first());

        assertThat(json.get("Name").isArray()).isTrue();
        assertThat(json.get("Name").get(1).asText()).isEqualTo("second");
        assertThat(json.get("Single").asText()).isEqualTo(" padded ");
    }
}
