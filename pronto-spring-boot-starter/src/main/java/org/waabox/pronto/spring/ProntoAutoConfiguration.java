package org.waabox.pronto.spring;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.pronto.Corpus;
import org.waabox.pronto.DatasetQuery;
import org.waabox.pronto.Pronto;
import org.waabox.pronto.RetryPolicy;
import org.waabox.pronto.cache.CacheStore;
import org.waabox.pronto.cache.InMemoryCacheStore;
import org.waabox.pronto.snapshot.SnapshotStoreSource;
import org.waabox.pronto.snapshot.fs.FileSystemSnapshotStore;
import org.waabox.pronto.source.http.HttpDataService;
import org.waabox.pronto.source.http.HttpDataServiceConfig;
import org.waabox.pronto.telemetry.LoggingTelemetrySink;
import org.waabox.pronto.telemetry.TelemetrySink;

/**
 * Spring Boot auto-configuration for Pronto.
 *
 * <p>Creates a singleton {@link Pronto} on a {@link CacheStore} bean. An
 * application that defines its own {@code CacheStore} shares it with every
 * consumer of that bean; otherwise an {@link InMemoryCacheStore} is used.
 * Optional {@link TelemetrySink} and {@link RetryPolicy} beans override
 * the defaults built from {@link ProntoProperties}.
 *
 * <p>When {@code pronto.http.base-url} is set, a corpus reading the remote
 * service, and the snapshot directory if configured, is registered under
 * {@code pronto.namespace}. Every {@link CorpusRegistrar} bean is invoked
 * afterwards.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(ProntoProperties.class)
public class ProntoAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ProntoAutoConfiguration.class);

  /**
   * Creates the default cache store.
   *
   * @return an in-memory cache store, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public CacheStore prontoCacheStore() {
    return new InMemoryCacheStore();
  }

  /**
   * Creates the singleton {@link Pronto} bean.
   *
   * @param properties          the configuration properties, never null
   * @param cacheStore          the cache store, never null
   * @param telemetryProvider   provider for an optional TelemetrySink bean
   * @param retryPolicyProvider provider for an optional RetryPolicy bean
   * @param corpusRegistrars    the corpus registrars, may be empty
   *
   * @return the configured instance, never null
   */
  @Bean
  public Pronto pronto(
      final ProntoProperties properties,
      final CacheStore cacheStore,
      final ObjectProvider<TelemetrySink> telemetryProvider,
      final ObjectProvider<RetryPolicy> retryPolicyProvider,
      final List<CorpusRegistrar> corpusRegistrars) {

    requireAtMostOne(telemetryProvider, TelemetrySink.class);

    final Pronto.Builder builder = Pronto.builder()
        .cacheStore(cacheStore)
        .failureCooldown(properties.getFailureCooldown());

    final TelemetrySink telemetry = telemetryProvider.getIfAvailable(
        LoggingTelemetrySink::new);
    builder.telemetry(telemetry);
    log.info("Pronto using TelemetrySink: {}",
        telemetry.getClass().getSimpleName());

    final RetryPolicy retryPolicy = retryPolicyProvider.getIfAvailable(
        () -> RetryPolicy.of(properties.getRetry().getMaxAttempts(),
            properties.getRetry().getBackoff()));
    builder.retryPolicy(retryPolicy);

    final Pronto pronto = builder.build();

    final String baseUrl = properties.getHttp().getBaseUrl();
    if (baseUrl != null && !baseUrl.isBlank()) {
      pronto.register(httpCorpus(properties));
    }

    for (final CorpusRegistrar registrar : corpusRegistrars) {
      registrar.register(pronto);
      log.debug("Invoked CorpusRegistrar: {}",
          registrar.getClass().getSimpleName());
    }

    log.info("Pronto created with {} corpus/corpora, {} attempts per source",
        pronto.corpora().size(), retryPolicy.maxAttempts());
    return pronto;
  }

  /**
   * Creates the {@link SmartLifecycle} that preloads default selections on
   * start, when enabled, and stops Pronto on shutdown.
   *
   * @param pronto     the instance to manage, never null
   * @param properties the configuration properties, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle prontoLifecycle(final Pronto pronto,
      final ProntoProperties properties) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        if (properties.isPreload()) {
          preload(pronto);
        }
        running = true;
      }

      @Override
      public void stop() {
        log.info("Stopping Pronto...");
        pronto.stop();
        running = false;
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }

  private static void preload(final Pronto pronto) {
    for (final Corpus corpus : pronto.corpora()) {
      if (corpus.defaultSelection().isEmpty()) {
        continue;
      }
      final String namespace = corpus.namespace();
      log.info("Preloading default selection of '{}'", namespace);
      pronto.loadDefault(namespace).whenComplete((entry, error) -> {
        if (error != null) {
          log.warn("Preload of '{}' failed: {}", namespace,
              error.getMessage());
        }
      });
    }
  }

  private static Corpus httpCorpus(final ProntoProperties properties) {
    final ProntoProperties.Http http = properties.getHttp();
    final HttpDataService service = new HttpDataService(
        HttpDataServiceConfig.builder()
            .baseUrl(http.getBaseUrl())
            .apiKey(http.getApiKey())
            .timeout(http.getTimeout())
            .build());

    final String namespace = properties.getNamespace();
    final Corpus.Builder corpus = Corpus.named(namespace)
        .scoped(service)
        .full(service);

    final String directory = properties.getSnapshot().getDirectory();
    if (directory != null && !directory.isBlank()) {
      corpus.snapshot(new SnapshotStoreSource(
          new FileSystemSnapshotStore(Path.of(directory)), namespace));
    }

    if (!properties.getDefaultPollutants().isEmpty()
        && !properties.getDefaultCategories().isEmpty()) {
      corpus.defaultSelection(DatasetQuery.builder()
          .pollutantNames(properties.getDefaultPollutants())
          .categoryNames(properties.getDefaultCategories())
          .includeActivity(properties.isIncludeActivity())
          .build());
    }

    log.info("Registering corpus '{}' on {} (snapshot directory: {})",
        namespace, http.getBaseUrl(), directory);
    return corpus.build();
  }

  /**
   * Checks that at most one bean of the given type is present.
   *
   * @param provider the object provider to check, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "Pronto requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}
