package io.dreamtree.atsync.config;

import io.dreamtree.atsync.atproto.AtprotoProperties;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

@Configuration
public class AppConfig {

  @Bean
  public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
    return new StringRedisTemplate(cf);
  }

  @Bean
  public WebClient webClient() {
    // DID documents and XRPC responses are small; keep the buffer bounded.
    ExchangeStrategies strategies =
        ExchangeStrategies.builder()
            .codecs(c -> c.defaultCodecs().maxInMemorySize(512 * 1024))
            .build();

    return WebClient.builder()
        .exchangeStrategies(strategies)
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .defaultHeader(HttpHeaders.USER_AGENT, "dreamtree-atproto-sync")
        .build();
  }

  /**
   * The profile page calls connect, status, disconnect and sync from the workbook's own origin.
   * The OAuth redirect and the metadata fetch are top-level or server-side and need no CORS.
   */
  @Bean
  public CorsWebFilter corsWebFilter(
      AtprotoProperties properties, @Value("${app.cors.extra-origins:}") String extraOrigins) {
    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration(
        "/api/atproto/**", workbookCors(properties.getBaseUrl(), extraOrigins));
    return new CorsWebFilter(source);
  }

  static CorsConfiguration workbookCors(String baseUrl, String extraOrigins) {
    CorsConfiguration config = new CorsConfiguration();
    config.addAllowedOrigin(originOf(baseUrl));
    if (extraOrigins != null && !extraOrigins.isBlank()) {
      Arrays.stream(extraOrigins.split(","))
          .map(String::trim)
          .filter(s -> !s.isEmpty())
          .map(AppConfig::originOf)
          .forEach(config::addAllowedOrigin);
    }
    // Bearer app tokens, no cookies.
    config.setAllowCredentials(false);
    config.setAllowedMethods(List.of(HttpMethod.GET.name(), HttpMethod.POST.name()));
    config.setAllowedHeaders(List.of(HttpHeaders.AUTHORIZATION, HttpHeaders.CONTENT_TYPE));
    config.setMaxAge(Duration.ofMinutes(30));
    return config;
  }

  private static String originOf(String url) {
    return UriComponentsBuilder.fromUriString(url)
        .replacePath(null)
        .replaceQuery(null)
        .fragment(null)
        .build()
        .toUriString();
  }
}
