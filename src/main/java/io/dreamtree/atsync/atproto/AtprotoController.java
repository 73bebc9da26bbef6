package io.dreamtree.atsync.atproto;

import io.dreamtree.atsync.atproto.dto.AtprotoDtos;
import io.dreamtree.atsync.atproto.model.ConnectionStatus;
import io.dreamtree.atsync.model.SyncResult;
import io.dreamtree.atsync.service.SkillSyncService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@Validated
@RequestMapping("/api/atproto")
public class AtprotoController {
  private static final Logger log = LoggerFactory.getLogger(AtprotoController.class);

  private final AtprotoProperties properties;
  private final AppSessionVerifier sessionVerifier;
  private final OAuthConnectService connectService;
  private final OAuthCallbackService callbackService;
  private final AtprotoOAuthClient oauthClient;
  private final SessionStore sessionStore;
  private final SkillSyncService syncService;
  private final AtprotoMetrics metrics;

  public AtprotoController(
      AtprotoProperties properties,
      AppSessionVerifier sessionVerifier,
      OAuthConnectService connectService,
      OAuthCallbackService callbackService,
      AtprotoOAuthClient oauthClient,
      SessionStore sessionStore,
      SkillSyncService syncService,
      AtprotoMetrics metrics) {
    this.properties = properties;
    this.sessionVerifier = sessionVerifier;
    this.connectService = connectService;
    this.callbackService = callbackService;
    this.oauthClient = oauthClient;
    this.sessionStore = sessionStore;
    this.syncService = syncService;
    this.metrics = metrics;
  }

  @GetMapping(path = "/client-metadata.json", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<AtprotoDtos.ClientMetadata> clientMetadata() {
    return Mono.fromCallable(oauthClient::clientMetadata);
  }

  @PostMapping(path = "/connect", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<AtprotoDtos.ConnectResponse> connect(
      @RequestHeader(value = "Authorization", required = false) String authorizationHeader,
      @Valid @RequestBody AtprotoDtos.ConnectRequest request) {
    return Mono.fromCallable(
            () -> connectService.initiate(requireUser(authorizationHeader), request.handle()))
        .subscribeOn(Schedulers.boundedElastic());
  }

  /** Always answers with a redirect back to the profile page, never with an error body. */
  @GetMapping(path = "/callback")
  public Mono<ResponseEntity<Void>> callback(
      @RequestParam(value = "code", required = false) String code,
      @RequestParam(value = "state", required = false) String state,
      @RequestParam(value = "error", required = false) String error,
      @RequestParam(value = "error_description", required = false) String errorDescription) {
    return Mono.fromCallable(
            () -> {
              String location;
              try {
                callbackService.complete(code, state, error, errorDescription);
                location = profileRedirect("atp", "connected");
              } catch (AtprotoException e) {
                log.info("atproto callback failed code={}: {}", e.getCode(), e.getMessage());
                location = profileRedirect("atp_error", e.redirectReason());
              } catch (Exception e) {
                log.error("atproto callback crashed", e);
                location = profileRedirect("atp_error", "unknown");
              }
              return ResponseEntity.status(HttpStatus.FOUND)
                  .header(HttpHeaders.LOCATION, location)
                  .<Void>build();
            })
        .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping(path = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<ConnectionStatus> status(
      @RequestHeader(value = "Authorization", required = false) String authorizationHeader) {
    return Mono.fromCallable(() -> sessionStore.status(requireUser(authorizationHeader)))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping(path = "/disconnect", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<AtprotoDtos.DisconnectResponse> disconnect(
      @RequestHeader(value = "Authorization", required = false) String authorizationHeader) {
    return Mono.fromCallable(
            () -> {
              String userId = requireUser(authorizationHeader);
              sessionStore.delete(userId);
              metrics.disconnected();
              log.info("atproto disconnected userId={}", userId);
              return new AtprotoDtos.DisconnectResponse(true);
            })
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping(path = "/sync/skills", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<SyncResult> syncSkills(
      @RequestHeader(value = "Authorization", required = false) String authorizationHeader) {
    return Mono.fromCallable(() -> syncService.syncAll(requireUser(authorizationHeader)))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping(path = "/sync/settings", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<ConnectionStatus> syncSettings(
      @RequestHeader(value = "Authorization", required = false) String authorizationHeader,
      @Valid @RequestBody AtprotoDtos.SyncSettingsRequest request) {
    return Mono.fromCallable(
            () -> {
              String userId = requireUser(authorizationHeader);
              ConnectionStatus status = sessionStore.setSyncEnabled(userId, request.enabled());
              if (!status.connected()) {
                throw new AtprotoException(
                    AtprotoErrorCode.NOT_CONNECTED, "not connected to AT Protocol", 400);
              }
              log.info("atproto sync enabled={} userId={}", request.enabled(), userId);
              return status;
            })
        .subscribeOn(Schedulers.boundedElastic());
  }

  private String requireUser(String authorizationHeader) {
    if (!properties.isEnabled()) {
      throw new AtprotoException(
          AtprotoErrorCode.FEATURE_DISABLED, "atproto integration is disabled", 403);
    }
    return sessionVerifier.requireUserId(authorizationHeader);
  }

  // The value is a template variable so reserved characters such as '+' are escaped too.
  private String profileRedirect(String param, String value) {
    return UriComponentsBuilder.fromUriString(properties.profileUrl())
        .queryParam(param, "{value}")
        .encode()
        .buildAndExpand(value)
        .toUriString();
  }
}
