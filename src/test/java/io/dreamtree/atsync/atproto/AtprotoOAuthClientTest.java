package io.dreamtree.atsync.atproto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.dreamtree.atsync.atproto.dto.AtprotoDtos;
import io.dreamtree.atsync.support.AtprotoTestSupport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

class AtprotoOAuthClientTest {
  private static final String VERIFIER = "dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk";

  private MockWebServer server;
  private String pdsUrl;
  private SimpleMeterRegistry registry;
  private AtprotoOAuthClient client;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    pdsUrl = server.url("/").toString();

    AtprotoProperties properties = AtprotoTestSupport.properties();
    properties.setRequestTimeoutMs(2000);
    registry = new SimpleMeterRegistry();
    client =
        new AtprotoOAuthClient(
            WebClient.builder().build(),
            properties,
            AtprotoTestSupport.metrics(properties, registry));
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void authorizeUrlCarriesPkceAndClientParameters() {
    String url = client.buildAuthorizeUrl("https://pds.example/", "state-123", "challenge-abc");

    assertTrue(url.startsWith("https://pds.example/oauth/authorize?"));
    MultiValueMap<String, String> params =
        UriComponentsBuilder.fromUriString(url).build().getQueryParams();
    assertEquals("code", params.getFirst("response_type"));
    assertEquals(
        "https://app.example.test/api/atproto/client-metadata.json", params.getFirst("client_id"));
    assertEquals("https://app.example.test/api/atproto/callback", params.getFirst("redirect_uri"));
    assertEquals("atproto%20transition:generic", params.getFirst("scope"));
    assertEquals("state-123", params.getFirst("state"));
    assertEquals("challenge-abc", params.getFirst("code_challenge"));
    assertEquals("S256", params.getFirst("code_challenge_method"));
  }

  @Test
  void exchangePostsFormAndReturnsTokens() throws Exception {
    server.enqueue(
        new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody(
                "{\"access_token\":\"at-1\",\"refresh_token\":\"rt-1\",\"token_type\":\"DPoP\",\"sub\":\"did:plc:alice\"}"));

    AtprotoOAuthClient.TokenSet tokens = client.exchangeCode(pdsUrl, "auth-code", VERIFIER);

    assertEquals("at-1", tokens.accessToken());
    assertEquals("rt-1", tokens.refreshToken());
    assertEquals("did:plc:alice", tokens.subject());

    RecordedRequest request = server.takeRequest();
    assertEquals("POST", request.getMethod());
    assertEquals("/oauth/token", request.getPath());
    assertTrue(request.getHeader("Content-Type").startsWith("application/x-www-form-urlencoded"));
    String form = request.getBody().readUtf8();
    assertTrue(form.contains("grant_type=authorization_code"));
    assertTrue(form.contains("code=auth-code"));
    assertTrue(form.contains("code_verifier=" + VERIFIER));
    assertTrue(form.contains("client_id=https%3A%2F%2Fapp.example.test%2Fapi%2Fatproto%2Fclient-metadata.json"));
  }

  @Test
  void refreshTokenIsOptional() {
    server.enqueue(
        new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"access_token\":\"at-1\"}"));

    AtprotoOAuthClient.TokenSet tokens = client.exchangeCode(pdsUrl, "auth-code", VERIFIER);

    assertNull(tokens.refreshToken());
    assertNull(tokens.subject());
  }

  @Test
  void rejectedCodeIsTokenExchangeFailure() {
    server.enqueue(
        new MockResponse()
            .setResponseCode(400)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"error\":\"invalid_grant\"}"));

    AtprotoException e =
        assertThrows(
            AtprotoException.class, () -> client.exchangeCode(pdsUrl, "used-code", VERIFIER));
    assertEquals(AtprotoErrorCode.TOKEN_EXCHANGE_FAILED, e.getCode());
    assertEquals(502, e.getHttpStatus());
  }

  @Test
  void responseWithoutAccessTokenIsTokenExchangeFailure() {
    server.enqueue(
        new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"token_type\":\"DPoP\"}"));

    AtprotoException e =
        assertThrows(
            AtprotoException.class, () -> client.exchangeCode(pdsUrl, "auth-code", VERIFIER));
    assertEquals(AtprotoErrorCode.TOKEN_EXCHANGE_FAILED, e.getCode());
  }

  @Test
  void unreachableTokenEndpointIsUpstreamUnavailable() throws IOException {
    MockWebServer gone = new MockWebServer();
    gone.start();
    String deadUrl = gone.url("/").toString();
    gone.shutdown();

    AtprotoException e =
        assertThrows(
            AtprotoException.class, () -> client.exchangeCode(deadUrl, "auth-code", VERIFIER));
    assertEquals(AtprotoErrorCode.UPSTREAM_UNAVAILABLE, e.getCode());
    assertEquals(503, e.getHttpStatus());
    assertEquals(1.0, registry.counter("atproto.upstream.unavailable", "endpoint", "token").count());
  }

  @Test
  void clientMetadataDescribesPublicWebClient() {
    AtprotoDtos.ClientMetadata metadata = client.clientMetadata();

    assertEquals("https://app.example.test/api/atproto/client-metadata.json", metadata.clientId());
    assertEquals(List.of("https://app.example.test/api/atproto/callback"), metadata.redirectUris());
    assertEquals(List.of("authorization_code", "refresh_token"), metadata.grantTypes());
    assertEquals(List.of("code"), metadata.responseTypes());
    assertEquals("atproto transition:generic", metadata.scope());
    assertEquals("none", metadata.tokenEndpointAuthMethod());
    assertTrue(metadata.dpopBoundAccessTokens());
    assertEquals("web", metadata.applicationType());
    assertEquals("https://app.example.test/acorn.png", metadata.logoUri());
  }
}
