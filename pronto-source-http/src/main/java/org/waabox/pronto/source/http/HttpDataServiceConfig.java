package org.waabox.pronto.source.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of the {@link HttpDataService}.
 *
 * <p>The service speaks to a PostgREST endpoint: each table is read at
 * {@code {baseUrl}/rest/v1/{table}}. Only the base URL is required; table
 * names default to the emissions inventory tables.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpDataServiceConfig {

  /** The default pollutant table. */
  public static final String DEFAULT_POLLUTANT_TABLE =
      "NAEI_global_Pollutants";

  /** The default category table. */
  public static final String DEFAULT_CATEGORY_TABLE = "NAEI_global_t_Group";

  /** The default time-series table. */
  public static final String DEFAULT_ROW_TABLE = "NAEI_2023ds_t_Group_Data";

  /** The default NFR code table. */
  public static final String DEFAULT_NFR_CODE_TABLE = "NAEI_global_t_NFRCode";

  /** The default request timeout. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  /** The base URL without trailing slash, never null. */
  private final String baseUrl;

  /** The API key, may be null. */
  private final String apiKey;

  /** The pollutant table, never null. */
  private final String pollutantTable;

  /** The category table, never null. */
  private final String categoryTable;

  /** The time-series table, never null. */
  private final String rowTable;

  /** The NFR code table, never null. */
  private final String nfrCodeTable;

  /** The request timeout, never null. */
  private final Duration timeout;

  private HttpDataServiceConfig(final Builder builder) {
    Objects.requireNonNull(builder.baseUrl, "baseUrl must not be null");
    if (builder.baseUrl.isBlank()) {
      throw new IllegalArgumentException("baseUrl must not be blank");
    }
    if (builder.timeout.isNegative() || builder.timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    String url = builder.baseUrl.trim();
    while (url.endsWith("/")) {
      url = url.substring(0, url.length() - 1);
    }
    this.baseUrl = url;
    this.apiKey = builder.apiKey;
    this.pollutantTable = builder.pollutantTable;
    this.categoryTable = builder.categoryTable;
    this.rowTable = builder.rowTable;
    this.nfrCodeTable = builder.nfrCodeTable;
    this.timeout = builder.timeout;
  }

  /** @return the base URL without trailing slash, never null */
  public String baseUrl() {
    return baseUrl;
  }

  /** @return the API key, null when requests go unauthenticated */
  public String apiKey() {
    return apiKey;
  }

  /** @return the pollutant table, never null */
  public String pollutantTable() {
    return pollutantTable;
  }

  /** @return the category table, never null */
  public String categoryTable() {
    return categoryTable;
  }

  /** @return the time-series table, never null */
  public String rowTable() {
    return rowTable;
  }

  /** @return the NFR code table, never null */
  public String nfrCodeTable() {
    return nfrCodeTable;
  }

  /** @return the request timeout, never null */
  public Duration timeout() {
    return timeout;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link HttpDataServiceConfig}. */
  public static final class Builder {

    private String baseUrl;
    private String apiKey;
    private String pollutantTable = DEFAULT_POLLUTANT_TABLE;
    private String categoryTable = DEFAULT_CATEGORY_TABLE;
    private String rowTable = DEFAULT_ROW_TABLE;
    private String nfrCodeTable = DEFAULT_NFR_CODE_TABLE;
    private Duration timeout = DEFAULT_TIMEOUT;

    private Builder() {
    }

    /**
     * Sets the base URL, for instance {@code https://xyz.supabase.co}.
     *
     * @param theBaseUrl the base URL, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder baseUrl(final String theBaseUrl) {
      baseUrl = theBaseUrl;
      return this;
    }

    /**
     * Sets the API key sent as {@code apikey} and bearer token.
     *
     * @param theApiKey the API key, may be null
     *
     * @return this builder for chaining, never null
     */
    public Builder apiKey(final String theApiKey) {
      apiKey = theApiKey;
      return this;
    }

    /**
     * Sets the pollutant table.
     *
     * @param theTable the table name, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder pollutantTable(final String theTable) {
      pollutantTable = Objects.requireNonNull(theTable,
          "pollutantTable must not be null");
      return this;
    }

    /**
     * Sets the category table.
     *
     * @param theTable the table name, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder categoryTable(final String theTable) {
      categoryTable = Objects.requireNonNull(theTable,
          "categoryTable must not be null");
      return this;
    }

    /**
     * Sets the time-series table.
     *
     * @param theTable the table name, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder rowTable(final String theTable) {
      rowTable = Objects.requireNonNull(theTable,
          "rowTable must not be null");
      return this;
    }

    /**
     * Sets the NFR code table.
     *
     * @param theTable the table name, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder nfrCodeTable(final String theTable) {
      nfrCodeTable = Objects.requireNonNull(theTable,
          "nfrCodeTable must not be null");
      return this;
    }

    /**
     * Sets the request timeout.
     *
     * @param theTimeout the timeout, must be positive
     *
     * @return this builder for chaining, never null
     */
    public Builder timeout(final Duration theTimeout) {
      timeout = Objects.requireNonNull(theTimeout,
          "timeout must not be null");
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration, never null
     *
     * @throws IllegalArgumentException if the base URL is blank or the
     *                                  timeout is not positive
     */
    public HttpDataServiceConfig build() {
      return new HttpDataServiceConfig(this);
    }
  }
}
