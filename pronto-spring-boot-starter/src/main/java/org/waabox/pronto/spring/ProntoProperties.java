package org.waabox.pronto.spring;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties mapped from the {@code pronto.*} prefix.
 *
 * <p>Supported keys:
 * <ul>
 *   <li>{@code pronto.namespace} - namespace of the corpus built from the
 *       {@code pronto.http.*} settings, {@code emissions} by default.</li>
 *   <li>{@code pronto.default-pollutants} and
 *       {@code pronto.default-categories} - the default selection, by
 *       name.</li>
 *   <li>{@code pronto.include-activity} - adds activity data to the
 *       default selection.</li>
 *   <li>{@code pronto.preload} - loads the default selection of every
 *       corpus on startup.</li>
 *   <li>{@code pronto.failure-cooldown} - minimum time between two failure
 *       reports of the same source.</li>
 *   <li>{@code pronto.retry.max-attempts} and {@code pronto.retry.backoff}
 *       - the retry policy of every source call.</li>
 *   <li>{@code pronto.http.base-url}, {@code pronto.http.api-key} and
 *       {@code pronto.http.timeout} - the remote data service. Without a
 *       base URL no corpus is auto-registered.</li>
 *   <li>{@code pronto.snapshot.directory} - where pre-baked snapshots are
 *       read from.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "pronto")
public class ProntoProperties {

  /** The namespace of the auto-registered corpus. */
  private String namespace = "emissions";

  /** The default pollutant names. */
  private List<String> defaultPollutants = new ArrayList<>();

  /** The default category names. */
  private List<String> defaultCategories = new ArrayList<>();

  /** Whether the default selection includes activity data. */
  private boolean includeActivity;

  /** Whether default selections load on startup. */
  private boolean preload;

  /** The failure report cooldown. */
  private Duration failureCooldown = Duration.ofSeconds(60);

  /** The retry settings. */
  private final Retry retry = new Retry();

  /** The remote data service settings. */
  private final Http http = new Http();

  /** The snapshot settings. */
  private final Snapshot snapshot = new Snapshot();

  public String getNamespace() {
    return namespace;
  }

  public void setNamespace(final String namespace) {
    this.namespace = namespace;
  }

  public List<String> getDefaultPollutants() {
    return defaultPollutants;
  }

  public void setDefaultPollutants(final List<String> defaultPollutants) {
    this.defaultPollutants = defaultPollutants;
  }

  public List<String> getDefaultCategories() {
    return defaultCategories;
  }

  public void setDefaultCategories(final List<String> defaultCategories) {
    this.defaultCategories = defaultCategories;
  }

  public boolean isIncludeActivity() {
    return includeActivity;
  }

  public void setIncludeActivity(final boolean includeActivity) {
    this.includeActivity = includeActivity;
  }

  public boolean isPreload() {
    return preload;
  }

  public void setPreload(final boolean preload) {
    this.preload = preload;
  }

  public Duration getFailureCooldown() {
    return failureCooldown;
  }

  public void setFailureCooldown(final Duration failureCooldown) {
    this.failureCooldown = failureCooldown;
  }

  public Retry getRetry() {
    return retry;
  }

  public Http getHttp() {
    return http;
  }

  public Snapshot getSnapshot() {
    return snapshot;
  }

  /** Retry settings, {@code pronto.retry.*}. */
  public static class Retry {

    /** Attempts per source call, including the first. */
    private int maxAttempts = 3;

    /** Pause between attempts. */
    private Duration backoff = Duration.ofMillis(500);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(final int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getBackoff() {
      return backoff;
    }

    public void setBackoff(final Duration backoff) {
      this.backoff = backoff;
    }
  }

  /** Remote data service settings, {@code pronto.http.*}. */
  public static class Http {

    /** The base URL, null disables the auto-registered corpus. */
    private String baseUrl;

    /** The API key, may be null. */
    private String apiKey;

    /** The request timeout. */
    private Duration timeout = Duration.ofSeconds(30);

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(final String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getApiKey() {
      return apiKey;
    }

    public void setApiKey(final String apiKey) {
      this.apiKey = apiKey;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(final Duration timeout) {
      this.timeout = timeout;
    }
  }

  /** Snapshot settings, {@code pronto.snapshot.*}. */
  public static class Snapshot {

    /** The snapshot directory, null when no snapshot is served. */
    private String directory;

    public String getDirectory() {
      return directory;
    }

    public void setDirectory(final String directory) {
      this.directory = directory;
    }
  }
}
