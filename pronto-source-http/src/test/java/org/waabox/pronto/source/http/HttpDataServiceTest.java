package org.waabox.pronto.source.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.waabox.pronto.DatasetQuery;
import org.waabox.pronto.InvalidQueryException;
import org.waabox.pronto.TransientFetchException;
import org.waabox.pronto.data.Dataset;
import org.waabox.pronto.data.NfrCode;

/**
 * Tests for {@link HttpDataService} against a local HTTP server that
 * answers like a PostgREST endpoint.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HttpDataServiceTest {

  private static final String POLLUTANTS = "[{\"id\":1,\"pollutant\":\"PM2.5\","
      + "\"emission_unit\":\"kt\"},{\"id\":2,\"pollutant\":\"NOx\"}]";

  private static final String GROUPS = "[{\"id\":7,\"group_title\":\"All\"}]";

  private static final String ROWS = "[{\"id\":100,\"pollutant_id\":1,"
      + "\"group_id\":7,\"f2020\":1.5,\"f2021\":null}]";

  private static final String NFR_CODES = "[{\"id\":1,\"nfr_code\":\"1A3bi\","
      + "\"description\":\"Road transport: passenger cars\"}]";

  private HttpServer server;

  private HttpDataService service;

  /** Query strings received per table, in arrival order. */
  private final Map<String, List<String>> queries = new ConcurrentHashMap<>();

  /** Bodies served per table. */
  private final Map<String, String> bodies = new ConcurrentHashMap<>();

  /** Status served per table, 200 when absent. */
  private final Map<String, Integer> statuses = new ConcurrentHashMap<>();

  /** Values of the apikey header received. */
  private final List<String> apiKeys = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() throws IOException {
    bodies.put(HttpDataServiceConfig.DEFAULT_POLLUTANT_TABLE, POLLUTANTS);
    bodies.put(HttpDataServiceConfig.DEFAULT_CATEGORY_TABLE, GROUPS);
    bodies.put(HttpDataServiceConfig.DEFAULT_ROW_TABLE, ROWS);
    bodies.put(HttpDataServiceConfig.DEFAULT_NFR_CODE_TABLE, NFR_CODES);

    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/rest/v1/", this::handle);
    server.start();

    service = new HttpDataService(HttpDataServiceConfig.builder()
        .baseUrl("http://localhost:" + server.getAddress().getPort() + "/")
        .apiKey("secret")
        .timeout(Duration.ofSeconds(5))
        .build());
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  private void handle(final HttpExchange exchange) throws IOException {
    final String path = exchange.getRequestURI().getPath();
    final String table = path.substring(path.lastIndexOf('/') + 1);
    queries.computeIfAbsent(table, t -> new CopyOnWriteArrayList<>())
        .add(exchange.getRequestURI().getQuery());
    apiKeys.add(exchange.getRequestHeaders().getFirst("apikey"));

    final byte[] body = bodies.getOrDefault(table, "[]")
        .getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(statuses.getOrDefault(table, 200),
        body.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(body);
    }
  }

  private int requestCount() {
    return queries.values().stream().mapToInt(List::size).sum();
  }

  @Test
  void whenFetchingFull_givenFourTables_shouldBuildDataset() {
    final Dataset dataset = service.fetchFull();

    assertEquals(2, dataset.pollutants().size());
    assertEquals(1, dataset.categories().size());
    assertEquals(1, dataset.rows().size());
    assertEquals(7, dataset.rows().get(0).categoryId());
    assertEquals(Double.valueOf(1.5),
        dataset.rows().get(0).values().get(2020));
    assertTrue(dataset.rows().get(0).values().containsKey(2021));
    assertEquals(List.of(new NfrCode("1A3bi",
        "Road transport: passenger cars")), dataset.nfrCodes());

    assertEquals("select=*", queries.get(
        HttpDataServiceConfig.DEFAULT_ROW_TABLE).get(0));
    assertEquals("select=*", queries.get(
        HttpDataServiceConfig.DEFAULT_NFR_CODE_TABLE).get(0));
    assertEquals(4, apiKeys.size());
    assertTrue(apiKeys.stream().allMatch("secret"::equals));
  }

  @Test
  void whenFetchingScoped_givenIds_shouldFilterByIds() {
    final DatasetQuery query = DatasetQuery.builder()
        .pollutantIds(1, 2)
        .categoryIds(7)
        .build();

    final Dataset dataset = service.fetchScoped(query).orElseThrow();

    assertEquals(1, dataset.rows().size());
    assertEquals("select=*&id=in.(1,2)", queries.get(
        HttpDataServiceConfig.DEFAULT_POLLUTANT_TABLE).get(0));
    assertEquals("select=*&id=in.(7)", queries.get(
        HttpDataServiceConfig.DEFAULT_CATEGORY_TABLE).get(0));
    assertEquals("select=*&pollutant_id=in.(1,2)&group_id=in.(7)",
        queries.get(HttpDataServiceConfig.DEFAULT_ROW_TABLE).get(0));
  }

  @Test
  void whenFetchingScoped_givenNames_shouldFilterByQuotedNames() {
    final DatasetQuery query = DatasetQuery.builder()
        .pollutantNames("PM2.5")
        .categoryNames("All")
        .build();

    service.fetchScoped(query);

    assertEquals("select=*&pollutant=in.(\"PM2.5\")", queries.get(
        HttpDataServiceConfig.DEFAULT_POLLUTANT_TABLE).get(0));
    assertEquals("select=*&group_title=in.(\"All\")", queries.get(
        HttpDataServiceConfig.DEFAULT_CATEGORY_TABLE).get(0));
    assertEquals("select=*&pollutant_id=in.(1,2)&group_id=in.(7)",
        queries.get(HttpDataServiceConfig.DEFAULT_ROW_TABLE).get(0));
  }

  @Test
  void whenFetchingScoped_givenSameQueryTwice_shouldServeFromMemo() {
    final DatasetQuery query = DatasetQuery.builder()
        .pollutantIds(1)
        .categoryIds(7)
        .build();

    service.fetchScoped(query);
    assertEquals(3, requestCount());

    service.fetchScoped(query);
    assertEquals(3, requestCount());

    service.invalidate();
    service.fetchScoped(query);
    assertEquals(6, requestCount());
  }

  @Test
  void whenFetchingScoped_givenUnknownNames_shouldThrowInvalidQuery() {
    bodies.put(HttpDataServiceConfig.DEFAULT_POLLUTANT_TABLE, "[]");

    final DatasetQuery query = DatasetQuery.builder()
        .pollutantNames("Unobtainium")
        .categoryNames("All")
        .build();

    assertThrows(InvalidQueryException.class,
        () -> service.fetchScoped(query));
    assertFalse(queries.containsKey(
        HttpDataServiceConfig.DEFAULT_ROW_TABLE));
  }

  @Test
  void whenFetchingScoped_givenServerError_shouldNotMemoizeFailure() {
    statuses.put(HttpDataServiceConfig.DEFAULT_ROW_TABLE, 503);

    final DatasetQuery query = DatasetQuery.builder()
        .pollutantIds(1)
        .categoryIds(7)
        .build();

    assertThrows(TransientFetchException.class,
        () -> service.fetchScoped(query));

    statuses.clear();
    final Dataset dataset = service.fetchScoped(query).orElseThrow();
    assertEquals(1, dataset.rows().size());
  }

  @Test
  void whenFetchingFull_givenOneTableFailing_shouldThrowTransient() {
    statuses.put(HttpDataServiceConfig.DEFAULT_CATEGORY_TABLE, 500);

    assertThrows(TransientFetchException.class, () -> service.fetchFull());
  }

  @Test
  void whenFetchingFull_givenNfrCodeTableFailing_shouldThrowTransient() {
    statuses.put(HttpDataServiceConfig.DEFAULT_NFR_CODE_TABLE, 503);

    assertThrows(TransientFetchException.class, () -> service.fetchFull());
  }

  @Test
  void whenFetchingFull_givenCustomNfrCodeTable_shouldReadIt() {
    bodies.put("nfr_v2", NFR_CODES);
    final HttpDataService custom = new HttpDataService(
        HttpDataServiceConfig.builder()
            .baseUrl("http://localhost:" + server.getAddress().getPort())
            .nfrCodeTable("nfr_v2")
            .build());

    assertEquals(1, custom.fetchFull().nfrCodes().size());
    assertEquals(1, queries.get("nfr_v2").size());
    assertFalse(queries.containsKey(
        HttpDataServiceConfig.DEFAULT_NFR_CODE_TABLE));
  }

  @Test
  void whenFetchingFull_givenNonArrayBody_shouldThrowTransient() {
    bodies.put(HttpDataServiceConfig.DEFAULT_ROW_TABLE, "{\"message\":1}");

    assertThrows(TransientFetchException.class, () -> service.fetchFull());
  }

  @Test
  void whenBuildingConfig_givenBlankBaseUrl_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> HttpDataServiceConfig.builder().baseUrl(" ").build());
  }
}
