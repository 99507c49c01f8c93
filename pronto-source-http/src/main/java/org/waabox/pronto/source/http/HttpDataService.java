package org.waabox.pronto.source.http;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.pronto.DatasetQuery;
import org.waabox.pronto.InvalidQueryException;
import org.waabox.pronto.TransientFetchException;
import org.waabox.pronto.data.Category;
import org.waabox.pronto.data.Dataset;
import org.waabox.pronto.data.Pollutant;
import org.waabox.pronto.data.TimeseriesRow;
import org.waabox.pronto.snapshot.DatasetCodec;
import org.waabox.pronto.source.FullSource;
import org.waabox.pronto.source.ScopedSource;

/**
 * Reads datasets from a PostgREST endpoint with {@link HttpClient}.
 *
 * <p>{@link #fetchFull()} reads the pollutant, category, time-series and
 * NFR code tables in parallel; a failure of any of them fails the load. {@link #fetchScoped(DatasetQuery)} first resolves the
 * selected pollutants and categories, by identifier when the query has
 * identifiers and by name otherwise, then reads only the rows of the
 * resolved pairs:
 * <pre>{@code
 * GET /rest/v1/NAEI_global_Pollutants?select=*&id=in.(1,2)
 * GET /rest/v1/NAEI_global_t_Group?select=*&group_title=in.("All")
 * GET /rest/v1/NAEI_2023ds_t_Group_Data?select=*
 *     &pollutant_id=in.(1,2)&group_id=in.(7)
 * }</pre>
 *
 * <p>Scoped results are memoized per query key until {@link #invalidate()}.
 * Failures are not memoized.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpDataService implements ScopedSource, FullSource {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      HttpDataService.class);

  /** The REST path prefix of every table. */
  private static final String REST_PATH = "/rest/v1/";

  /** Shared ObjectMapper for tree model parsing. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The configuration, never null. */
  private final HttpDataServiceConfig config;

  /** The HTTP client, never null. */
  private final HttpClient client;

  /** Scoped results by query key. */
  private final Map<String, Dataset> scopedResults =
      new ConcurrentHashMap<>();

  /**
   * Creates a new service with its own HTTP client.
   *
   * @param config the configuration, never null
   */
  public HttpDataService(final HttpDataServiceConfig config) {
    this(config, HttpClient.newBuilder()
        .connectTimeout(Objects.requireNonNull(config,
            "config must not be null").timeout())
        .build());
  }

  /**
   * Creates a new service on a given HTTP client.
   *
   * @param config the configuration, never null
   * @param client the HTTP client, never null
   */
  public HttpDataService(final HttpDataServiceConfig config,
      final HttpClient client) {
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.client = Objects.requireNonNull(client, "client must not be null");
  }

  /**
   * {@inheritDoc}
   *
   * @throws TransientFetchException if any table read fails
   */
  @Override
  public Dataset fetchFull() {
    final long start = System.nanoTime();

    final CompletableFuture<JsonNode> pollutants = readAsync(
        config.pollutantTable(), "");
    final CompletableFuture<JsonNode> categories = readAsync(
        config.categoryTable(), "");
    final CompletableFuture<JsonNode> rows = readAsync(
        config.rowTable(), "");
    final CompletableFuture<JsonNode> nfrCodes = readAsync(
        config.nfrCodeTable(), "");

    final Dataset dataset;
    try {
      dataset = new Dataset(
          DatasetCodec.pollutants(pollutants.join()),
          DatasetCodec.categories(categories.join()),
          DatasetCodec.rows(rows.join()),
          DatasetCodec.nfrCodes(nfrCodes.join()));
    } catch (final CompletionException e) {
      throw unwrap(e);
    }

    log.info("Full dataset fetched: {} pollutants, {} categories, {} rows,"
        + " {} NFR codes in {} ms", dataset.pollutants().size(),
        dataset.categories().size(), dataset.rows().size(),
        dataset.nfrCodes().size(), (System.nanoTime() - start) / 1_000_000L);
    return dataset;
  }

  /**
   * {@inheritDoc}
   *
   * @throws InvalidQueryException   if no pollutant or no category resolves
   * @throws TransientFetchException if a table read fails
   */
  @Override
  public Optional<Dataset> fetchScoped(final DatasetQuery query) {
    Objects.requireNonNull(query, "query must not be null");

    final Dataset cached = scopedResults.get(query.cacheKey());
    if (cached != null) {
      log.debug("Scoped dataset for {} served from memo", query);
      return Optional.of(cached);
    }

    final List<Pollutant> pollutants = DatasetCodec.pollutants(
        query.pollutantIds().isEmpty()
            ? read(config.pollutantTable(),
                inFilter("pollutant", quoted(query.pollutantNames())))
            : read(config.pollutantTable(),
                inFilter("id", query.pollutantIds())));

    final List<Category> categories = DatasetCodec.categories(
        query.categoryIds().isEmpty()
            ? read(config.categoryTable(),
                inFilter("group_title", quoted(query.categoryNames())))
            : read(config.categoryTable(),
                inFilter("id", query.categoryIds())));

    final Set<Integer> pollutantIds = new LinkedHashSet<>(
        query.pollutantIds());
    pollutants.forEach(pollutant -> pollutantIds.add(pollutant.id()));
    final Set<Integer> categoryIds = new LinkedHashSet<>(
        query.categoryIds());
    categories.forEach(category -> categoryIds.add(category.id()));

    if (pollutantIds.isEmpty() || categoryIds.isEmpty()) {
      throw new InvalidQueryException("Query " + query
          + " resolved no pollutant or category identifiers");
    }

    final List<TimeseriesRow> rows = DatasetCodec.rows(read(
        config.rowTable(), inFilter("pollutant_id", pollutantIds)
            + inFilter("group_id", categoryIds)));

    final Dataset dataset = new Dataset(pollutants, categories, rows);
    scopedResults.put(query.cacheKey(), dataset);

    log.info("Scoped dataset for {} fetched: {} rows", query,
        rows.size());
    return Optional.of(dataset);
  }

  /** Drops every memoized scoped result. */
  @Override
  public void invalidate() {
    scopedResults.clear();
  }

  /**
   * Reads a table, blocking the calling thread.
   *
   * @param table   the table, never null
   * @param filters the encoded filter query string, may be empty
   *
   * @return the JSON array of records, never null
   */
  private JsonNode read(final String table, final String filters) {
    final HttpResponse<byte[]> response;
    try {
      response = client.send(request(table, filters),
          HttpResponse.BodyHandlers.ofByteArray());
    } catch (final IOException e) {
      throw new TransientFetchException("Failed to read table " + table, e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientFetchException(
          "Interrupted while reading table " + table, e);
    }
    return parse(table, response);
  }

  private CompletableFuture<JsonNode> readAsync(final String table,
      final String filters) {
    return client.sendAsync(request(table, filters),
            HttpResponse.BodyHandlers.ofByteArray())
        .thenApply(response -> parse(table, response));
  }

  private HttpRequest request(final String table, final String filters) {
    final HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(config.baseUrl() + REST_PATH + table + "?select=*"
            + filters))
        .timeout(config.timeout())
        .header("Accept", "application/json")
        .GET();
    if (config.apiKey() != null && !config.apiKey().isBlank()) {
      builder.header("apikey", config.apiKey());
      builder.header("Authorization", "Bearer " + config.apiKey());
    }
    return builder.build();
  }

  private static JsonNode parse(final String table,
      final HttpResponse<byte[]> response) {
    final int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new TransientFetchException("Table " + table
          + " responded with status " + status);
    }
    final JsonNode body;
    try {
      body = MAPPER.readTree(response.body());
    } catch (final IOException e) {
      throw new TransientFetchException(
          "Table " + table + " returned malformed JSON", e);
    }
    if (body == null || !body.isArray()) {
      throw new TransientFetchException(
          "Table " + table + " did not return a JSON array");
    }
    return body;
  }

  private static String inFilter(final String column,
      final Collection<?> values) {
    final String list = values.stream()
        .map(String::valueOf)
        .collect(Collectors.joining(","));
    return "&" + column + "=" + URLEncoder.encode("in.(" + list + ")",
        StandardCharsets.UTF_8);
  }

  private static List<String> quoted(final Collection<String> names) {
    return names.stream()
        .map(name -> "\"" + name.replace("\"", "\\\"") + "\"")
        .collect(Collectors.toList());
  }

  private static RuntimeException unwrap(final CompletionException e) {
    final Throwable cause = e.getCause();
    if (cause instanceof RuntimeException runtime) {
      return runtime;
    }
    return new TransientFetchException("Full dataset fetch failed", cause);
  }
}
