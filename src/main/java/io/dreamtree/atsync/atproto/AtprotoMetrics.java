package io.dreamtree.atsync.atproto;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class AtprotoMetrics {
  private final MeterRegistry meterRegistry;
  private final AtprotoProperties properties;

  public AtprotoMetrics(MeterRegistry meterRegistry, AtprotoProperties properties) {
    this.meterRegistry = meterRegistry;
    this.properties = properties;
  }

  public void connectInitiated() {
    if (!properties.isMetricsEnabled()) return;
    meterRegistry.counter("atproto.connect.initiated").increment();
  }

  public void resolverFallback(String reason) {
    if (!properties.isMetricsEnabled()) return;
    meterRegistry.counter("atproto.resolver.fallback", "reason", reason).increment();
  }

  public void callbackSuccess() {
    if (!properties.isMetricsEnabled()) return;
    meterRegistry.counter("atproto.callback.success").increment();
  }

  public void callbackFailure(AtprotoErrorCode code) {
    if (!properties.isMetricsEnabled()) return;
    meterRegistry.counter("atproto.callback.failure", "reason", code.redirectReason()).increment();
  }

  public void upstreamUnavailable(String endpoint) {
    if (!properties.isMetricsEnabled()) return;
    meterRegistry.counter("atproto.upstream.unavailable", "endpoint", endpoint).increment();
  }

  public void disconnected() {
    if (!properties.isMetricsEnabled()) return;
    meterRegistry.counter("atproto.disconnect").increment();
  }

  public void syncRecord(String outcome) {
    if (!properties.isMetricsEnabled()) return;
    meterRegistry.counter("atproto.sync.record", "outcome", outcome).increment();
  }
}
