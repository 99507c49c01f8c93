package org.waabox.pronto.spring;

import org.waabox.pronto.Pronto;

/**
 * A callback for registering {@link org.waabox.pronto.Corpus} instances
 * with the {@link Pronto} bean during auto-configuration.
 *
 * <p>Every {@code CorpusRegistrar} bean is invoked while the Pronto bean is
 * created:
 * <pre>{@code
 * @Bean
 * CorpusRegistrar emissionsRegistrar(final RemoteDataService service) {
 *   return pronto -> pronto.register(Corpus.named("emissions")
 *       .service(service)
 *       .defaultSelection(DatasetQuery.builder()
 *           .pollutantNames("PM2.5")
 *           .categoryNames("All")
 *           .build())
 *       .build());
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface CorpusRegistrar {

  /**
   * Registers one or more corpora.
   *
   * @param pronto the instance to register corpora with, never null
   */
  void register(Pronto pronto);
}
