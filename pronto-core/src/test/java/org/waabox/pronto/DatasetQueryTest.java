package org.waabox.pronto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link DatasetQuery}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DatasetQueryTest {

  @Test
  void whenBuilding_givenMessyNames_shouldTrimDedupeAndSort() {
    final DatasetQuery query = DatasetQuery.builder()
        .pollutantNames(" PM2.5 ", "pm2.5", "", "NOx")
        .pollutantNames(List.of("  "))
        .categoryIds(3, 1, 3)
        .build();

    assertEquals(List.of("NOx", "PM2.5"),
        List.copyOf(query.pollutantNames()));
    assertEquals(List.of(1, 3), List.copyOf(query.categoryIds()));
  }

  @Test
  void whenComparing_givenSameSelectionInDifferentOrderAndCase_shouldBeEqual() {
    final DatasetQuery a = DatasetQuery.builder()
        .pollutantNames("PM2.5", "NOx")
        .categoryNames("All", "Transport")
        .build();
    final DatasetQuery b = DatasetQuery.builder()
        .pollutantNames("nox", "pm2.5")
        .categoryNames("transport", "ALL")
        .build();

    assertEquals(a.cacheKey(), b.cacheKey());
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
  }

  @Test
  void whenComparing_givenDifferentActivityFlag_shouldDiffer() {
    final DatasetQuery plain = DatasetQuery.builder()
        .pollutantIds(1).categoryIds(2).build();
    final DatasetQuery activity = DatasetQuery.builder()
        .pollutantIds(1).categoryIds(2).includeActivity(true).build();

    assertNotEquals(plain, activity);
  }

  @Test
  void whenBuilding_givenActivity_shouldAddActivityPollutant() {
    final DatasetQuery query = DatasetQuery.builder()
        .pollutantNames("PM2.5")
        .categoryIds(1)
        .includeActivity(true)
        .build();

    assertTrue(query.pollutantNames()
        .contains(DatasetQuery.DEFAULT_ACTIVITY_POLLUTANT));
    assertTrue(query.includeActivity());
  }

  @Test
  void whenValidating_givenNoPollutant_shouldThrow() {
    final DatasetQuery query = DatasetQuery.builder().categoryIds(1).build();

    assertFalse(query.isValid());
    final InvalidQueryException error = assertThrows(
        InvalidQueryException.class, query::requireValid);
    assertTrue(error.getMessage().contains("pollutant"));
  }

  @Test
  void whenValidating_givenNoCategory_shouldThrow() {
    final DatasetQuery query = DatasetQuery.builder().pollutantIds(1).build();

    final InvalidQueryException error = assertThrows(
        InvalidQueryException.class, query::requireValid);
    assertTrue(error.getMessage().contains("category"));
  }

  @Test
  void whenFillingDefaults_givenOnlyPollutants_shouldTakeDefaultCategories() {
    final DatasetQuery defaults = DatasetQuery.builder()
        .pollutantNames("PM2.5")
        .categoryNames("All")
        .build();
    final DatasetQuery query = DatasetQuery.builder()
        .pollutantNames("NOx")
        .build();

    final DatasetQuery filled = query.withDefaults(defaults);

    assertEquals(List.of("NOx"), List.copyOf(filled.pollutantNames()));
    assertEquals(List.of("All"), List.copyOf(filled.categoryNames()));
    assertTrue(filled.isValid());
  }

  @Test
  void whenFillingDefaults_givenEmptyQuery_shouldEqualDefaults() {
    final DatasetQuery defaults = DatasetQuery.builder()
        .pollutantNames("PM2.5")
        .categoryNames("All")
        .includeActivity(true)
        .build();

    assertEquals(defaults, DatasetQuery.builder().build()
        .withDefaults(defaults));
  }

  @Test
  void whenFillingDefaults_givenValidQuery_shouldReturnSameInstance() {
    final DatasetQuery query = DatasetQuery.builder()
        .pollutantIds(1).categoryIds(2).build();

    assertSame(query, query.withDefaults(DatasetQuery.builder()
        .pollutantIds(9).categoryIds(9).build()));
  }
}
