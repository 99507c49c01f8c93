package org.waabox.pronto.data;

import java.util.Objects;
import java.util.Optional;

/**
 * A pollutant reference record.
 *
 * @param id           the pollutant identifier
 * @param name         the pollutant display name, never null
 * @param emissionUnit the emission unit (e.g. "kilotonnes"), may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Pollutant(int id, String name, String emissionUnit) {

  /** Validates the required fields. */
  public Pollutant {
    Objects.requireNonNull(name, "name must not be null");
  }

  /**
   * Creates a pollutant without an emission unit.
   *
   * @param id   the pollutant identifier
   * @param name the pollutant name, never null
   *
   * @return the pollutant, never null
   */
  public static Pollutant of(final int id, final String name) {
    return new Pollutant(id, name, null);
  }

  /**
   * Returns the emission unit, if known.
   *
   * @return the unit, never null
   */
  public Optional<String> unit() {
    return Optional.ofNullable(emissionUnit);
  }
}
