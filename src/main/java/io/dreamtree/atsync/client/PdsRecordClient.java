package io.dreamtree.atsync.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dreamtree.atsync.atproto.AtprotoProperties;
import io.dreamtree.atsync.atproto.AtprotoUtils;
import io.dreamtree.atsync.atproto.model.Connection;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

/** XRPC record calls against the PDS of a connected user. */
@Component
public class PdsRecordClient {
  static final String GET_RECORD = "com.atproto.repo.getRecord";
  static final String CREATE_RECORD = "com.atproto.repo.createRecord";
  static final String PUT_RECORD = "com.atproto.repo.putRecord";
  private static final String RECORD_NOT_FOUND = "RecordNotFound";

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final AtprotoProperties properties;

  public PdsRecordClient(
      WebClient webClient, ObjectMapper objectMapper, AtprotoProperties properties) {
    this.webClient = webClient;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  public boolean recordExists(Connection connection, String collection, String rkey) {
    URI uri =
        UriComponentsBuilder.fromUriString(xrpcUrl(connection, GET_RECORD))
            .queryParam("repo", connection.did())
            .queryParam("collection", collection)
            .queryParam("rkey", rkey)
            .build()
            .encode()
            .toUri();
    Boolean exists;
    try {
      exists =
          webClient
              .get()
              .uri(uri)
              .headers(h -> h.setBearerAuth(connection.accessToken()))
              .exchangeToMono(
                  resp -> {
                    int status = resp.statusCode().value();
                    if (resp.statusCode().is2xxSuccessful()) {
                      return resp.releaseBody().thenReturn(Boolean.TRUE);
                    }
                    return resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(
                            body -> {
                              String error = xrpcError(body);
                              if (status == 404 || (status == 400 && RECORD_NOT_FOUND.equals(error))) {
                                return Mono.just(Boolean.FALSE);
                              }
                              return Mono.<Boolean>error(
                                  new PdsRequestException(
                                      GET_RECORD, status, error, GET_RECORD + " failed", null));
                            });
                  })
              .timeout(timeout())
              .block();
    } catch (PdsRequestException e) {
      throw e;
    } catch (Exception e) {
      throw new PdsRequestException(GET_RECORD, 0, null, GET_RECORD + " unavailable", e);
    }
    return Boolean.TRUE.equals(exists);
  }

  /** Returns the {@code at://} uri of the new record. */
  public String createRecord(
      Connection connection, String collection, String rkey, Map<String, Object> record) {
    return write(CREATE_RECORD, connection, collection, rkey, record);
  }

  public String putRecord(
      Connection connection, String collection, String rkey, Map<String, Object> record) {
    return write(PUT_RECORD, connection, collection, rkey, record);
  }

  private String write(
      String method,
      Connection connection,
      String collection,
      String rkey,
      Map<String, Object> record) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("repo", connection.did());
    body.put("collection", collection);
    body.put("rkey", rkey);
    body.put("record", record);

    JsonNode response;
    try {
      response =
          webClient
              .post()
              .uri(URI.create(xrpcUrl(connection, method)))
              .headers(h -> h.setBearerAuth(connection.accessToken()))
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(body)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(timeout())
              .block();
    } catch (WebClientResponseException e) {
      throw new PdsRequestException(
          method,
          e.getStatusCode().value(),
          xrpcError(e.getResponseBodyAsString()),
          method + " failed",
          e);
    } catch (Exception e) {
      throw new PdsRequestException(method, 0, null, method + " unavailable", e);
    }
    return response == null ? null : response.path("uri").asText(null);
  }

  private String xrpcError(String body) {
    if (body == null || body.isBlank()) return null;
    try {
      String error = objectMapper.readTree(body).path("error").asText("");
      return error.isBlank() ? null : error;
    } catch (JsonProcessingException e) {
      return null;
    }
  }

  private static String xrpcUrl(Connection connection, String method) {
    return AtprotoUtils.trimTrailingSlash(connection.pdsUrl()) + "/xrpc/" + method;
  }

  private Duration timeout() {
    return Duration.ofMillis(Math.max(100, properties.getSync().getTimeoutMs()));
  }
}
