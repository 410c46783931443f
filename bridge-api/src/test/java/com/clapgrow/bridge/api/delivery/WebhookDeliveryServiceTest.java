package com.clapgrow.bridge.api.delivery;

import com.clapgrow.bridge.api.config.DeliveryProperties;
import com.clapgrow.bridge.api.service.BridgeMetrics;
import com.clapgrow.bridge.common.crypto.CredentialVault;
import com.clapgrow.bridge.common.crypto.HmacSigner;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import com.github.tomakehurst.wiremock.verification.LoggedRequest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.exactly;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebhookDeliveryServiceTest {

    private static final String TENANT = "tenant-1";
    private static final String SECRET = "tenant-signing-secret";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private DeadLetterPublisher deadLetterPublisher;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CredentialVault credentialVault = CredentialVault.fromConfiguredKey("0123456789abcdef0123456789abcdef");
    private final List<Duration> sleeps = new ArrayList<>();

    private WireMockServer wireMock;
    private DeliveryProperties deliveryProperties;
    private WebhookDeliveryService deliveryService;
    private String url;

    @BeforeEach
    void setUp() {
        wireMock = new WireMockServer(wireMockConfig().dynamicPort());
        wireMock.start();
        url = "http://localhost:" + wireMock.port() + "/hook";

        deliveryProperties = new DeliveryProperties();
        deliveryProperties.getRetry().setBaseDelay(Duration.ofMillis(100));

        BridgeMetrics metrics = new BridgeMetrics(new SimpleMeterRegistry());
        metrics.init();
        BackoffSleeper recordingSleeper = sleeps::add;
        deliveryService = new WebhookDeliveryService(WebClient.builder().build(), objectMapper, credentialVault,
            deliveryProperties, deadLetterPublisher, recordingSleeper, metrics, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        wireMock.stop();
    }

    private static Map<String, Object> eventPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jsonData", "{\"event\":\"Message\",\"data\":{\"id\":\"MSG1\",\"text\":\"hello world\"}}");
        payload.put("instanceName", "acme");
        return payload;
    }

    private void givenWebhookStatus(int status, String body) {
        wireMock.stubFor(post(urlEqualTo("/hook")).willReturn(aResponse().withStatus(status).withBody(body)));
    }

    @Test
    void testDeliver_AlwaysFailing_RetriesWithBackoffThenDeadLetters() {
        givenWebhookStatus(500, "boom");
        byte[] sealedKey = credentialVault.encrypt(SECRET);

        deliveryService.deliver(url, eventPayload(), TENANT, sealedKey);

        wireMock.verify(exactly(3), postRequestedFor(urlEqualTo("/hook")));
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);

        ArgumentCaptor<DeadLetterRecord> record = ArgumentCaptor.forClass(DeadLetterRecord.class);
        verify(deadLetterPublisher).publish(record.capture());
        assertEquals(url, record.getValue().getUrl());
        assertEquals(TENANT, record.getValue().getUserId());
        assertEquals("unexpected status code: 500. Body: boom", record.getValue().getErrorMessage());
        assertEquals(HexFormat.of().formatHex(sealedKey), record.getValue().getEncryptedHmacKey());
        assertEquals(NOW, record.getValue().getAttemptTime());
        assertEquals("Message", record.getValue().getPayload().get("event"));
        assertNull(record.getValue().getFilePath());
    }

    @Test
    void testDeliver_RecoversOnSecondAttempt_NoDeadLetter() {
        wireMock.stubFor(post(urlEqualTo("/hook")).inScenario("flaky")
            .whenScenarioStateIs(Scenario.STARTED)
            .willReturn(aResponse().withStatus(503))
            .willSetStateTo("recovered"));
        wireMock.stubFor(post(urlEqualTo("/hook")).inScenario("flaky")
            .whenScenarioStateIs("recovered")
            .willReturn(aResponse().withStatus(200)));

        deliveryService.deliver(url, eventPayload(), TENANT, null);

        wireMock.verify(exactly(2), postRequestedFor(urlEqualTo("/hook")));
        assertEquals(List.of(Duration.ofMillis(100)), sleeps);
        verifyNoInteractions(deadLetterPublisher);
    }

    @Test
    void testDeliver_JsonMode_UnwrapsJsonDataAndSignsExactBody() throws Exception {
        givenWebhookStatus(200, "ok");

        deliveryService.deliver(url, eventPayload(), TENANT, credentialVault.encrypt(SECRET));

        LoggedRequest request = wireMock.findAll(postRequestedFor(urlEqualTo("/hook"))).get(0);
        byte[] body = request.getBody();
        assertEquals(HmacSigner.sign(body, SECRET), request.getHeader(HmacSigner.SIGNATURE_HEADER));
        assertTrue(request.getHeader("Content-Type").startsWith("application/json"));

        JsonNode json = objectMapper.readTree(body);
        assertEquals("Message", json.get("event").asText());
        assertEquals("hello world", json.get("data").get("text").asText());
        assertEquals("acme", json.get("instanceName").asText());
        assertEquals(TENANT, json.get("userID").asText());
        assertFalse(json.has("jsonData"));
        verifyNoInteractions(deadLetterPublisher);
    }

    @Test
    void testDeliver_NoKey_SendsUnsigned() {
        givenWebhookStatus(204, "");

        deliveryService.deliver(url, eventPayload(), TENANT, null);

        LoggedRequest request = wireMock.findAll(postRequestedFor(urlEqualTo("/hook"))).get(0);
        assertFalse(request.containsHeader(HmacSigner.SIGNATURE_HEADER));
    }

    @Test
    void testDeliver_FormMode_SortsAndEncodesFields() {
        deliveryProperties.setMode(DeliveryMode.FORM);
        givenWebhookStatus(200, "ok");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", "hello world");
        payload.put("id", "MSG1");

        deliveryService.deliver(url, payload, TENANT, credentialVault.encrypt(SECRET));

        LoggedRequest request = wireMock.findAll(postRequestedFor(urlEqualTo("/hook"))).get(0);
        String body = new String(request.getBody(), StandardCharsets.UTF_8);
        assertEquals("id=MSG1&text=hello+world&userID=tenant-1", body);
        assertTrue(request.getHeader("Content-Type").startsWith("application/x-www-form-urlencoded"));
        assertEquals(HmacSigner.sign(request.getBody(), SECRET), request.getHeader(HmacSigner.SIGNATURE_HEADER));
    }

    @Test
    void testDeliver_RetryDisabled_SingleAttempt() {
        deliveryProperties.getRetry().setEnabled(false);
        givenWebhookStatus(500, "boom");

        deliveryService.deliver(url, eventPayload(), TENANT, null);

        wireMock.verify(exactly(1), postRequestedFor(urlEqualTo("/hook")));
        assertTrue(sleeps.isEmpty());
        verify(deadLetterPublisher).publish(any(DeadLetterRecord.class));
    }

    @Test
    void testDeliver_RedirectIsNotFollowed() {
        wireMock.stubFor(post(urlEqualTo("/hook"))
            .willReturn(aResponse().withStatus(302).withHeader("Location", "/elsewhere")));

        deliveryService.deliver(url, eventPayload(), TENANT, null);

        wireMock.verify(exactly(3), postRequestedFor(urlEqualTo("/hook")));
        wireMock.verify(exactly(0), postRequestedFor(urlEqualTo("/elsewhere")));
        verify(deadLetterPublisher).publish(any(DeadLetterRecord.class));
    }

    @Test
    void testDeliver_ConnectionReset_CountsAsFailedAttempt() {
        wireMock.stubFor(post(urlEqualTo("/hook"))
            .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

        deliveryService.deliver(url, eventPayload(), TENANT, null);

        assertEquals(2, sleeps.size());
        verify(deadLetterPublisher).publish(any(DeadLetterRecord.class));
    }

    @Test
    void testDeliver_UnreadableKey_DeadLettersWithoutSending() {
        byte[] garbage = new byte[40];

        deliveryService.deliver(url, eventPayload(), TENANT, garbage);

        assertTrue(wireMock.getAllServeEvents().isEmpty());
        ArgumentCaptor<DeadLetterRecord> record = ArgumentCaptor.forClass(DeadLetterRecord.class);
        verify(deadLetterPublisher).publish(record.capture());
        assertTrue(record.getValue().getErrorMessage().startsWith("failed to decrypt hmac key"));
    }

    @Test
    void testDeliverFile_MissingFile_ReturnsFalseAndDeadLetters() {
        boolean delivered = deliveryService.deliverFile(url, Map.of("event", "Media"), TENANT,
            "/nonexistent/media.jpg", null);

        assertFalse(delivered);
        assertTrue(wireMock.getAllServeEvents().isEmpty());
        ArgumentCaptor<DeadLetterRecord> record = ArgumentCaptor.forClass(DeadLetterRecord.class);
        verify(deadLetterPublisher).publish(record.capture());
        assertEquals("/nonexistent/media.jpg", record.getValue().getFilePath());
    }

    @Test
    void testDeliverFile_SendsMultipartSignedOverFields(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("photo.jpg");
        Files.write(file, new byte[]{1, 2, 3});
        givenWebhookStatus(200, "ok");

        boolean delivered = deliveryService.deliverFile(url, Map.of("event", "Media"), TENANT,
            file.toString(), credentialVault.encrypt(SECRET));

        assertTrue(delivered);
        LoggedRequest request = wireMock.findAll(postRequestedFor(urlEqualTo("/hook"))).get(0);
        assertTrue(request.getHeader("Content-Type").startsWith("multipart/form-data"));

        Map<String, Object> fields = new TreeMap<>();
        fields.put("event", "Media");
        fields.put("file", file.toString());
        fields.put("userID", TENANT);
        String expected = HmacSigner.sign(objectMapper.writeValueAsBytes(fields), SECRET);
        assertEquals(expected, request.getHeader(HmacSigner.SIGNATURE_HEADER));
        wireMock.verify(postRequestedFor(urlEqualTo("/hook")).withRequestBody(containing("photo.jpg")));
        verifyNoInteractions(deadLetterPublisher);
    }

    @Test
    void testFormEncode_EscapesReservedCharacters() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("b", "x&y=z");
        body.put("a", null);

        assertEquals("a=&b=x%26y%3Dz", WebhookDeliveryService.formEncode(body));
    }
}
