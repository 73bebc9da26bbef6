package io.dreamtree.atsync.atproto;

import com.fasterxml.jackson.databind.JsonNode;
import io.dreamtree.atsync.atproto.dto.AtprotoDtos;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

/** Authorization-code + PKCE client against a PDS authorization server. */
@Service
public class AtprotoOAuthClient {
  private static final Logger log = LoggerFactory.getLogger(AtprotoOAuthClient.class);
  private static final String AUTHORIZE_PATH = "/oauth/authorize";
  private static final String TOKEN_PATH = "/oauth/token";

  private final WebClient webClient;
  private final AtprotoProperties properties;
  private final AtprotoMetrics metrics;

  public AtprotoOAuthClient(
      WebClient webClient, AtprotoProperties properties, AtprotoMetrics metrics) {
    this.webClient = webClient;
    this.properties = properties;
    this.metrics = metrics;
  }

  public record TokenSet(String accessToken, String refreshToken, String subject) {}

  public String buildAuthorizeUrl(String pdsUrl, String state, String codeChallenge) {
    return UriComponentsBuilder.fromUriString(AtprotoUtils.trimTrailingSlash(pdsUrl) + AUTHORIZE_PATH)
        .queryParam("response_type", "code")
        .queryParam("client_id", properties.clientId())
        .queryParam("redirect_uri", properties.redirectUri())
        .queryParam("scope", properties.getScope())
        .queryParam("state", state)
        .queryParam("code_challenge", codeChallenge)
        .queryParam("code_challenge_method", PkceGenerator.CHALLENGE_METHOD)
        .build()
        .encode(StandardCharsets.UTF_8)
        .toUriString();
  }

  public TokenSet exchangeCode(String pdsUrl, String code, String codeVerifier) {
    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("grant_type", "authorization_code");
    form.add("code", code);
    form.add("redirect_uri", properties.redirectUri());
    form.add("client_id", properties.clientId());
    form.add("code_verifier", codeVerifier);

    JsonNode response;
    try {
      response =
          webClient
              .post()
              .uri(AtprotoUtils.trimTrailingSlash(pdsUrl) + TOKEN_PATH)
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(BodyInserters.fromFormData(form))
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(Duration.ofMillis(Math.max(100, properties.getRequestTimeoutMs())))
              .block();
    } catch (WebClientResponseException e) {
      log.info("token endpoint rejected code pds={} status={}", pdsUrl, e.getStatusCode().value());
      throw new AtprotoException(
          AtprotoErrorCode.TOKEN_EXCHANGE_FAILED, "token exchange rejected", 502, e);
    } catch (Exception e) {
      metrics.upstreamUnavailable("token");
      throw new AtprotoException(
          AtprotoErrorCode.UPSTREAM_UNAVAILABLE, "token endpoint unavailable", 503, e);
    }
    if (response == null) {
      throw new AtprotoException(
          AtprotoErrorCode.TOKEN_EXCHANGE_FAILED, "empty token response", 502);
    }
    String accessToken = response.path("access_token").asText("");
    if (accessToken.isBlank()) {
      throw new AtprotoException(
          AtprotoErrorCode.TOKEN_EXCHANGE_FAILED, "token response missing access_token", 502);
    }
    String refreshToken = response.path("refresh_token").asText("");
    String subject = response.path("sub").asText("");
    return new TokenSet(
        accessToken,
        refreshToken.isBlank() ? null : refreshToken,
        subject.isBlank() ? null : subject);
  }

  public AtprotoDtos.ClientMetadata clientMetadata() {
    return new AtprotoDtos.ClientMetadata(
        properties.clientId(),
        properties.getClientName(),
        AtprotoUtils.trimTrailingSlash(properties.getBaseUrl()),
        properties.publicUrl(properties.getLogoPath()),
        properties.publicUrl(properties.getTosPath()),
        properties.publicUrl(properties.getPolicyPath()),
        List.of(properties.redirectUri()),
        List.of("authorization_code", "refresh_token"),
        List.of("code"),
        properties.getScope(),
        "none",
        true,
        "web");
  }
}
