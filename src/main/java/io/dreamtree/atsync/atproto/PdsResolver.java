package io.dreamtree.atsync.atproto;

import com.fasterxml.jackson.databind.JsonNode;
import io.dreamtree.atsync.atproto.model.PdsResolution;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Maps a handle to the base URL of its Personal Data Server.
 *
 * <p>Resolution is best effort: handles on the default network short-circuit without a network
 * call, other handles go through {@code /.well-known/atproto-did} and the DID document, and any
 * failure along the way degrades to the default network.
 */
@Service
public class PdsResolver {
  private static final Logger log = LoggerFactory.getLogger(PdsResolver.class);
  private static final String PDS_SERVICE_TYPE = "AtprotoPersonalDataServer";
  private static final String PDS_SERVICE_ID = "#atproto_pds";
  private static final String DID_PLC = "did:plc:";
  private static final String DID_WEB = "did:web:";

  private final WebClient webClient;
  private final AtprotoProperties properties;
  private final AtprotoMetrics metrics;

  public PdsResolver(WebClient webClient, AtprotoProperties properties, AtprotoMetrics metrics) {
    this.webClient = webClient;
    this.properties = properties;
    this.metrics = metrics;
  }

  public String resolve(String handle) {
    return resolveDetailed(handle).url();
  }

  public PdsResolution resolveDetailed(String handle) {
    AtprotoProperties.Resolver cfg = properties.getResolver();
    String defaultUrl = AtprotoUtils.trimTrailingSlash(cfg.getDefaultPdsUrl());
    String normalized = AtprotoUtils.normalizeHandle(handle);

    String suffix = cfg.getDefaultHandleSuffix() == null ? "" : cfg.getDefaultHandleSuffix().trim();
    if (!suffix.isEmpty() && normalized.endsWith(suffix.toLowerCase(Locale.ROOT))) {
      return PdsResolution.resolved(defaultUrl, null);
    }
    if (!AtprotoUtils.isValidHandle(normalized)) {
      return fallback(defaultUrl, normalized, "invalid_handle");
    }

    try {
      String did = fetchHandleDid(normalized);
      if (did == null) {
        return fallback(defaultUrl, normalized, "no_did");
      }
      String endpoint = fetchPdsEndpoint(did);
      if (endpoint == null) {
        return fallback(defaultUrl, normalized, "no_pds_service");
      }
      log.debug("resolved handle={} did={} pds={}", normalized, did, endpoint);
      return PdsResolution.resolved(AtprotoUtils.trimTrailingSlash(endpoint), did);
    } catch (Exception e) {
      log.info("pds resolution failed for handle={}: {}", normalized, e.toString());
      return fallback(defaultUrl, normalized, "error");
    }
  }

  private PdsResolution fallback(String defaultUrl, String handle, String reason) {
    log.debug("falling back to default pds for handle={} reason={}", handle, reason);
    metrics.resolverFallback(reason);
    return PdsResolution.fallback(defaultUrl);
  }

  private String fetchHandleDid(String handle) {
    String url = properties.getResolver().getHandleWellKnownTemplate().replace("{handle}", handle);
    String body =
        webClient
            .get()
            .uri(URI.create(url))
            .accept(MediaType.TEXT_PLAIN, MediaType.ALL)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout())
            .block();
    if (body == null) return null;
    String did = body.trim();
    return did.startsWith("did:") ? did : null;
  }

  private String fetchPdsEndpoint(String did) {
    String documentUrl = didDocumentUrl(did);
    if (documentUrl == null) return null;
    JsonNode document =
        webClient
            .get()
            .uri(URI.create(documentUrl))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout())
            .block();
    return pdsEndpointFrom(document);
  }

  String didDocumentUrl(String did) {
    AtprotoProperties.Resolver cfg = properties.getResolver();
    if (did.startsWith(DID_PLC)) {
      return AtprotoUtils.trimTrailingSlash(cfg.getPlcDirectoryUrl()) + "/" + did;
    }
    if (did.startsWith(DID_WEB)) {
      String host = did.substring(DID_WEB.length());
      // did:web with a port or path is percent/colon encoded; only bare hosts are supported
      if (host.isBlank() || host.contains(":") || host.contains("%")) return null;
      return cfg.getDidWebTemplate().replace("{host}", host.toLowerCase(Locale.ROOT));
    }
    return null;
  }

  static String pdsEndpointFrom(JsonNode document) {
    if (document == null) return null;
    for (JsonNode service : document.path("service")) {
      String type = service.path("type").asText("");
      String id = service.path("id").asText("");
      if (!PDS_SERVICE_TYPE.equals(type) && !id.endsWith(PDS_SERVICE_ID)) continue;
      String endpoint = service.path("serviceEndpoint").asText("");
      if (endpoint.startsWith("https://") || endpoint.startsWith("http://")) {
        return endpoint;
      }
    }
    return null;
  }

  private Duration timeout() {
    return Duration.ofMillis(Math.max(100, properties.getResolver().getTimeoutMs()));
  }
}
