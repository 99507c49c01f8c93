package org.waabox.pronto.data;

import java.util.Objects;
import java.util.Optional;

/**
 * An NFR (Nomenclature For Reporting) code and its description.
 *
 * @param code        the NFR code (e.g. "1A3bi"), never null
 * @param description the human readable description, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record NfrCode(String code, String description) {

  /** Validates the required fields. */
  public NfrCode {
    Objects.requireNonNull(code, "code must not be null");
  }

  /**
   * Returns the description, if known.
   *
   * @return the description, never null
   */
  public Optional<String> describe() {
    return Optional.ofNullable(description);
  }
}
