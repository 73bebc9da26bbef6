package io.dreamtree.atsync.atproto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dreamtree.atsync.atproto.model.PdsResolution;
import io.dreamtree.atsync.support.AtprotoTestSupport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

class PdsResolverTest {
  private static final String PLC_DID = "did:plc:ewvi7nxzyoun6zhxrhs64oiz";

  private final ConcurrentHashMap<String, MockResponse> routes = new ConcurrentHashMap<>();
  private MockWebServer server;
  private SimpleMeterRegistry registry;
  private PdsResolver resolver;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.setDispatcher(
        new Dispatcher() {
          @Override
          public MockResponse dispatch(RecordedRequest request) {
            MockResponse response = routes.get(request.getPath());
            return response != null ? response : new MockResponse().setResponseCode(404);
          }
        });
    server.start();

    String origin = AtprotoUtils.trimTrailingSlash(server.url("/").toString());
    AtprotoProperties properties = AtprotoTestSupport.properties();
    properties.getResolver().setHandleWellKnownTemplate(origin + "/{handle}/.well-known/atproto-did");
    properties.getResolver().setDidWebTemplate(origin + "/web/{host}/did.json");
    properties.getResolver().setPlcDirectoryUrl(origin + "/plc");
    properties.getResolver().setTimeoutMs(500);

    registry = new SimpleMeterRegistry();
    resolver =
        new PdsResolver(
            WebClient.builder().build(),
            properties,
            AtprotoTestSupport.metrics(properties, registry));
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void defaultSuffixHandlesResolveWithoutNetwork() {
    PdsResolution resolution = resolver.resolveDetailed("@Alice.bsky.social");
    assertTrue(resolution.isResolved());
    assertEquals("https://bsky.social", resolution.url());
    assertEquals(0, server.getRequestCount());
  }

  @Test
  void resolvesPlcDidThroughDirectory() {
    routes.put("/alice.example.com/.well-known/atproto-did", text(PLC_DID + "\n"));
    routes.put("/plc/" + PLC_DID, json(didDocument(PLC_DID, "https://pds.alice.example.com/")));

    PdsResolution resolution = resolver.resolveDetailed("alice.example.com");

    assertTrue(resolution.isResolved());
    assertEquals("https://pds.alice.example.com", resolution.url());
    assertEquals(PLC_DID, resolution.did());
    assertEquals(2, server.getRequestCount());
  }

  @Test
  void resolvesDidWebThroughWellKnownDocument() {
    routes.put("/bob.example.org/.well-known/atproto-did", text("did:web:bob.example.org"));
    routes.put(
        "/web/bob.example.org/did.json",
        json(didDocument("did:web:bob.example.org", "https://pds.example.org")));

    assertEquals("https://pds.example.org", resolver.resolve("bob.example.org"));
  }

  @Test
  void missingWellKnownFallsBackToDefault() {
    PdsResolution resolution = resolver.resolveDetailed("carol.example.net");

    assertFalse(resolution.isResolved());
    assertEquals("https://bsky.social", resolution.url());
    assertNull(resolution.did());
    assertEquals(1.0, registry.counter("atproto.resolver.fallback", "reason", "error").count());
  }

  @Test
  void nonDidWellKnownBodyFallsBack() {
    routes.put("/dave.example.com/.well-known/atproto-did", text("<html>hello</html>"));

    PdsResolution resolution = resolver.resolveDetailed("dave.example.com");

    assertFalse(resolution.isResolved());
    assertEquals(1.0, registry.counter("atproto.resolver.fallback", "reason", "no_did").count());
  }

  @Test
  void documentWithoutPdsServiceFallsBack() {
    routes.put("/erin.example.com/.well-known/atproto-did", text(PLC_DID));
    routes.put(
        "/plc/" + PLC_DID,
        json("{\"id\":\"" + PLC_DID + "\",\"service\":[{\"id\":\"#bsky_fg\",\"type\":\"BskyFeedGenerator\",\"serviceEndpoint\":\"https://feed.example\"}]}"));

    PdsResolution resolution = resolver.resolveDetailed("erin.example.com");

    assertFalse(resolution.isResolved());
    assertEquals("https://bsky.social", resolution.url());
  }

  @Test
  void slowServerFallsBackWithinTimeout() {
    routes.put(
        "/slow.example.com/.well-known/atproto-did",
        text(PLC_DID).setBodyDelay(3, TimeUnit.SECONDS));

    long started = System.nanoTime();
    String url = resolver.resolve("slow.example.com");
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

    assertEquals("https://bsky.social", url);
    assertTrue(elapsedMs < 2500, "resolution took " + elapsedMs + "ms");
  }

  @Test
  void syntacticallyInvalidHandleNeverLeavesTheProcess() {
    PdsResolution resolution = resolver.resolveDetailed("not a handle");

    assertFalse(resolution.isResolved());
    assertEquals(0, server.getRequestCount());
  }

  @Test
  void pdsEndpointMatchesServiceIdWhenTypeIsMissing() throws Exception {
    JsonNode document =
        new ObjectMapper()
            .readTree(
                "{\"service\":[{\"id\":\"did:plc:x#atproto_pds\",\"serviceEndpoint\":\"https://pds.x\"}]}");
    assertEquals("https://pds.x", PdsResolver.pdsEndpointFrom(document));
  }

  private static String didDocument(String did, String endpoint) {
    return "{\"id\":\""
        + did
        + "\",\"alsoKnownAs\":[\"at://alice.example.com\"],\"service\":[{\"id\":\"#atproto_pds\","
        + "\"type\":\"AtprotoPersonalDataServer\",\"serviceEndpoint\":\""
        + endpoint
        + "\"}]}";
  }

  private static MockResponse text(String body) {
    return new MockResponse().setHeader("Content-Type", "text/plain").setBody(body);
  }

  private static MockResponse json(String body) {
    return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
  }
}
