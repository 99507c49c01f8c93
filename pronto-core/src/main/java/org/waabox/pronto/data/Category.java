package org.waabox.pronto.data;

import java.util.Objects;

/**
 * A category (emission source group) reference record.
 *
 * @param id              the category identifier
 * @param title           the category title, never null
 * @param hasActivityData whether activity data rows exist for the category
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Category(int id, String title, boolean hasActivityData) {

  /** Validates the required fields. */
  public Category {
    Objects.requireNonNull(title, "title must not be null");
  }

  /**
   * Creates a category without activity data.
   *
   * @param id    the category identifier
   * @param title the category title, never null
   *
   * @return the category, never null
   */
  public static Category of(final int id, final String title) {
    return new Category(id, title, false);
  }
}
