package org.waabox.pronto.snapshot;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.pronto.data.Category;
import org.waabox.pronto.data.Dataset;
import org.waabox.pronto.data.NfrCode;
import org.waabox.pronto.data.Pollutant;
import org.waabox.pronto.data.TimeseriesRow;

/**
 * Reads and writes datasets as JSON.
 *
 * <p>The written document looks like:
 * <pre>{@code
 * {
 *   "generatedAt": "2025-01-01T00:00:00Z",
 *   "data": {
 *     "pollutants": [{"id": 1, "pollutant": "PM2.5", "emission_unit": "kt"}],
 *     "categories": [{"id": 7, "category_title": "All",
 *                     "has_activity_data": false}],
 *     "rows": [{"id": 3, "pollutant_id": 1, "category_id": 7,
 *               "f2020": 1.5, "f2021": null}],
 *     "nfrCodes": [{"nfr_code": "1A3bi",
 *                   "description": "Road transport: passenger cars"}]
 *   }
 * }
 * }</pre>
 *
 * <p>Reading is lenient so the same parsers work for snapshots and for the
 * rows of the remote tables: {@code groups} is accepted for
 * {@code categories}, {@code timeseries} for {@code rows},
 * {@code group_title}, {@code group_name} or {@code title} for the category
 * title, {@code name} for the pollutant name and {@code group_id} for the
 * category identifier. Yearly values are the {@code fYYYY} columns.
 * Documents without NFR codes decode with an empty list.
 *
 * <p>Uses Jackson's tree model, no data binding.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DatasetCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Matches the yearly value columns, {@code f1970} to {@code f2023}. */
  private static final Pattern YEAR_COLUMN = Pattern.compile("^f(\\d{4})$");

  /** Private constructor to prevent instantiation. */
  private DatasetCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Encodes a dataset.
   *
   * @param dataset     the dataset, never null
   * @param generatedAt the generation time written to the document, never
   *                    null
   *
   * @return the UTF-8 JSON bytes, never null
   */
  public static byte[] encode(final Dataset dataset,
      final Instant generatedAt) {
    Objects.requireNonNull(dataset, "dataset must not be null");
    Objects.requireNonNull(generatedAt, "generatedAt must not be null");

    final ObjectNode root = MAPPER.createObjectNode();
    root.put("generatedAt", generatedAt.toString());
    final ObjectNode data = root.putObject("data");

    final ArrayNode pollutants = data.putArray("pollutants");
    for (final Pollutant pollutant : dataset.pollutants()) {
      final ObjectNode node = pollutants.addObject();
      node.put("id", pollutant.id());
      node.put("pollutant", pollutant.name());
      pollutant.unit().ifPresent(unit -> node.put("emission_unit", unit));
    }

    final ArrayNode categories = data.putArray("categories");
    for (final Category category : dataset.categories()) {
      final ObjectNode node = categories.addObject();
      node.put("id", category.id());
      node.put("category_title", category.title());
      node.put("has_activity_data", category.hasActivityData());
    }

    final ArrayNode rows = data.putArray("rows");
    for (final TimeseriesRow row : dataset.rows()) {
      final ObjectNode node = rows.addObject();
      node.put("id", row.id());
      node.put("pollutant_id", row.pollutantId());
      node.put("category_id", row.categoryId());
      for (final Map.Entry<Integer, Double> value : row.values().entrySet()) {
        final String column = "f" + value.getKey();
        if (value.getValue() == null) {
          node.putNull(column);
        } else {
          node.put(column, value.getValue());
        }
      }
    }

    final ArrayNode nfrCodes = data.putArray("nfrCodes");
    for (final NfrCode nfrCode : dataset.nfrCodes()) {
      final ObjectNode node = nfrCodes.addObject();
      node.put("nfr_code", nfrCode.code());
      nfrCode.describe().ifPresent(text -> node.put("description", text));
    }

    try {
      return MAPPER.writeValueAsBytes(root);
    } catch (final IOException e) {
      throw new IllegalStateException("Failed to encode dataset", e);
    }
  }

  /**
   * Decodes a dataset.
   *
   * @param json the UTF-8 JSON bytes, never null
   *
   * @return the dataset, never null
   *
   * @throws IllegalArgumentException if the document is malformed
   */
  public static Dataset decode(final byte[] json) {
    Objects.requireNonNull(json, "json must not be null");
    final JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (final IOException e) {
      throw new IllegalArgumentException("Malformed dataset document", e);
    }
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException(
          "Dataset document must be a JSON object");
    }
    final JsonNode data = root.has("data") ? root.get("data") : root;

    return new Dataset(
        pollutants(firstArray(data, "pollutants")),
        categories(firstArray(data, "categories", "groups")),
        rows(firstArray(data, "rows", "timeseries")),
        nfrCodes(firstArray(data, "nfrCodes", "nfr_codes")));
  }

  /**
   * Reads the generation time of a document.
   *
   * @param json the UTF-8 JSON bytes, never null
   *
   * @return the generation time, or null if absent or unparseable
   */
  public static Instant generatedAt(final byte[] json) {
    Objects.requireNonNull(json, "json must not be null");
    try {
      final JsonNode value = MAPPER.readTree(json).get("generatedAt");
      return value == null || value.isNull()
          ? null : Instant.parse(value.asText());
    } catch (final IOException | RuntimeException e) {
      return null;
    }
  }

  /**
   * Parses pollutant records.
   *
   * @param nodes a JSON array of pollutant objects, may be null
   *
   * @return the pollutants, never null
   */
  public static List<Pollutant> pollutants(final JsonNode nodes) {
    final List<Pollutant> result = new ArrayList<>();
    for (final JsonNode node : elements(nodes)) {
      final String name = firstText(node, "pollutant", "name");
      if (name == null) {
        continue;
      }
      result.add(new Pollutant(requireField(node, "id").asInt(), name,
          firstText(node, "emission_unit", "emission unit", "Emission Unit")));
    }
    return result;
  }

  /**
   * Parses category records.
   *
   * @param nodes a JSON array of category objects, may be null
   *
   * @return the categories, never null
   */
  public static List<Category> categories(final JsonNode nodes) {
    final List<Category> result = new ArrayList<>();
    for (final JsonNode node : elements(nodes)) {
      final String title = firstText(node, "category_title", "group_title",
          "group_name", "title");
      if (title == null) {
        continue;
      }
      result.add(new Category(requireField(node, "id").asInt(), title,
          node.path("has_activity_data").asBoolean(false)));
    }
    return result;
  }

  /**
   * Parses time-series rows.
   *
   * @param nodes a JSON array of row objects, may be null
   *
   * @return the rows, never null
   *
   * @throws IllegalArgumentException if a row lacks its pollutant or
   *                                  category identifier
   */
  public static List<TimeseriesRow> rows(final JsonNode nodes) {
    final List<TimeseriesRow> result = new ArrayList<>();
    for (final JsonNode node : elements(nodes)) {
      final int pollutantId = firstField(node, "pollutant_id").asInt();
      final int categoryId = firstField(node, "category_id", "group_id")
          .asInt();
      result.add(new TimeseriesRow(node.path("id").asLong(0), pollutantId,
          categoryId, yearlyValues(node)));
    }
    return result;
  }

  /**
   * Parses NFR code records, skipping those without a code.
   *
   * @param nodes a JSON array of NFR code objects, may be null
   *
   * @return the NFR codes, never null
   */
  public static List<NfrCode> nfrCodes(final JsonNode nodes) {
    final List<NfrCode> result = new ArrayList<>();
    for (final JsonNode node : elements(nodes)) {
      final String code = firstText(node, "nfr_code", "code");
      if (code == null || "NULL".equals(code)) {
        continue;
      }
      result.add(new NfrCode(code, firstText(node, "description")));
    }
    return result;
  }

  private static SortedMap<Integer, Double> yearlyValues(
      final JsonNode node) {
    final SortedMap<Integer, Double> values = new TreeMap<>();
    final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      final Matcher matcher = YEAR_COLUMN.matcher(field.getKey());
      if (matcher.matches()) {
        values.put(Integer.parseInt(matcher.group(1)),
            numberOrNull(field.getValue()));
      }
    }
    return values;
  }

  private static Double numberOrNull(final JsonNode value) {
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isNumber()) {
      return value.asDouble();
    }
    final String text = value.asText().trim();
    if (text.isEmpty()) {
      return null;
    }
    try {
      return Double.valueOf(text);
    } catch (final NumberFormatException e) {
      return null;
    }
  }

  private static JsonNode firstArray(final JsonNode node,
      final String... names) {
    for (final String name : names) {
      final JsonNode value = node.get(name);
      if (value != null && value.isArray()) {
        return value;
      }
    }
    return null;
  }

  private static String firstText(final JsonNode node,
      final String... names) {
    for (final String name : names) {
      final JsonNode value = node.get(name);
      if (value != null && !value.isNull() && !value.asText().isBlank()) {
        return value.asText().trim();
      }
    }
    return null;
  }

  private static JsonNode firstField(final JsonNode node,
      final String... names) {
    for (final String name : names) {
      final JsonNode value = node.get(name);
      if (value != null && !value.isNull()) {
        return value;
      }
    }
    throw new IllegalArgumentException(
        "Missing field: " + String.join(" or ", names) + " in JSON: " + node);
  }

  private static JsonNode requireField(final JsonNode node,
      final String field) {
    return firstField(node, field);
  }

  private static Iterable<JsonNode> elements(final JsonNode nodes) {
    if (nodes == null || !nodes.isArray()) {
      return List.of();
    }
    return nodes;
  }
}
