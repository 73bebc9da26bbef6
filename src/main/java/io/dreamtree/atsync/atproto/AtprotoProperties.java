package io.dreamtree.atsync.atproto;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.atproto")
public class AtprotoProperties {
  public static final String CLIENT_METADATA_PATH = "/api/atproto/client-metadata.json";
  public static final String CALLBACK_PATH = "/api/atproto/callback";

  private boolean enabled = true;
  private boolean metricsEnabled = true;
  private String baseUrl = "https://dreamtree.org";
  private String clientName = "DreamTree Career Workbook";
  private String logoPath = "/acorn.png";
  private String tosPath = "/terms";
  private String policyPath = "/privacy";
  private String profilePath = "/profile";
  private String scope = "atproto transition:generic";
  private long stateTtlSeconds = 600;
  private long requestTimeoutMs = 10_000;
  private String sessionEncryptionKey = "";

  private Resolver resolver = new Resolver();
  private Sync sync = new Sync();
  private AppJwt appJwt = new AppJwt();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isMetricsEnabled() {
    return metricsEnabled;
  }

  public void setMetricsEnabled(boolean metricsEnabled) {
    this.metricsEnabled = metricsEnabled;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getClientName() {
    return clientName;
  }

  public void setClientName(String clientName) {
    this.clientName = clientName;
  }

  public String getLogoPath() {
    return logoPath;
  }

  public void setLogoPath(String logoPath) {
    this.logoPath = logoPath;
  }

  public String getTosPath() {
    return tosPath;
  }

  public void setTosPath(String tosPath) {
    this.tosPath = tosPath;
  }

  public String getPolicyPath() {
    return policyPath;
  }

  public void setPolicyPath(String policyPath) {
    this.policyPath = policyPath;
  }

  public String getProfilePath() {
    return profilePath;
  }

  public void setProfilePath(String profilePath) {
    this.profilePath = profilePath;
  }

  public String getScope() {
    return scope;
  }

  public void setScope(String scope) {
    this.scope = scope;
  }

  public long getStateTtlSeconds() {
    return stateTtlSeconds;
  }

  public void setStateTtlSeconds(long stateTtlSeconds) {
    this.stateTtlSeconds = stateTtlSeconds;
  }

  public long getRequestTimeoutMs() {
    return requestTimeoutMs;
  }

  public void setRequestTimeoutMs(long requestTimeoutMs) {
    this.requestTimeoutMs = requestTimeoutMs;
  }

  public String getSessionEncryptionKey() {
    return sessionEncryptionKey;
  }

  public void setSessionEncryptionKey(String sessionEncryptionKey) {
    this.sessionEncryptionKey = sessionEncryptionKey;
  }

  public Resolver getResolver() {
    return resolver;
  }

  public void setResolver(Resolver resolver) {
    this.resolver = resolver;
  }

  public Sync getSync() {
    return sync;
  }

  public void setSync(Sync sync) {
    this.sync = sync;
  }

  public AppJwt getAppJwt() {
    return appJwt;
  }

  public void setAppJwt(AppJwt appJwt) {
    this.appJwt = appJwt;
  }

  /** The client id of an AT Protocol OAuth client is the URL of its metadata document. */
  public String clientId() {
    return publicUrl(CLIENT_METADATA_PATH);
  }

  public String redirectUri() {
    return publicUrl(CALLBACK_PATH);
  }

  public String profileUrl() {
    return publicUrl(profilePath);
  }

  public String publicUrl(String path) {
    String base = AtprotoUtils.trimTrailingSlash(baseUrl);
    if (path == null || path.isBlank()) return base;
    return path.startsWith("/") ? base + path : base + "/" + path;
  }

  public static class Resolver {
    private String defaultPdsUrl = "https://bsky.social";
    private String defaultHandleSuffix = ".bsky.social";
    private String handleWellKnownTemplate = "https://{handle}/.well-known/atproto-did";
    private String didWebTemplate = "https://{host}/.well-known/did.json";
    private String plcDirectoryUrl = "https://plc.directory";
    private long timeoutMs = 3_000;

    public String getDefaultPdsUrl() {
      return defaultPdsUrl;
    }

    public void setDefaultPdsUrl(String defaultPdsUrl) {
      this.defaultPdsUrl = defaultPdsUrl;
    }

    public String getDefaultHandleSuffix() {
      return defaultHandleSuffix;
    }

    public void setDefaultHandleSuffix(String defaultHandleSuffix) {
      this.defaultHandleSuffix = defaultHandleSuffix;
    }

    public String getHandleWellKnownTemplate() {
      return handleWellKnownTemplate;
    }

    public void setHandleWellKnownTemplate(String handleWellKnownTemplate) {
      this.handleWellKnownTemplate = handleWellKnownTemplate;
    }

    public String getDidWebTemplate() {
      return didWebTemplate;
    }

    public void setDidWebTemplate(String didWebTemplate) {
      this.didWebTemplate = didWebTemplate;
    }

    public String getPlcDirectoryUrl() {
      return plcDirectoryUrl;
    }

    public void setPlcDirectoryUrl(String plcDirectoryUrl) {
      this.plcDirectoryUrl = plcDirectoryUrl;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }
  }

  public static class Sync {
    private String collection = "com.dreamtree.skill";
    private long timeoutMs = 10_000;

    public String getCollection() {
      return collection;
    }

    public void setCollection(String collection) {
      this.collection = collection;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }
  }

  public static class AppJwt {
    private String issuer = "dreamtree";
    private String audience = "dreamtree-app";
    private String secret = "replace-me-dev-secret-at-least-32-bytes";

    public String getIssuer() {
      return issuer;
    }

    public void setIssuer(String issuer) {
      this.issuer = issuer;
    }

    public String getAudience() {
      return audience;
    }

    public void setAudience(String audience) {
      this.audience = audience;
    }

    public String getSecret() {
      return secret;
    }

    public void setSecret(String secret) {
      this.secret = secret;
    }
  }
}
