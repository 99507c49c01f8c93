package org.waabox.pronto.cache;

import java.util.Optional;

import org.waabox.pronto.CacheEntry;

/**
 * The single source of truth for the dataset currently believed correct for
 * each namespace.
 *
 * <p>Implementations must honor the overwrite rule:
 * <ul>
 *   <li>a partial entry may be written when the namespace holds nothing or
 *       a partial entry;</li>
 *   <li>a full entry always replaces a partial entry;</li>
 *   <li>a partial entry never replaces a full entry. The write is ignored,
 *       it is not an error.</li>
 * </ul>
 *
 * <p>Writes to a namespace must be atomic: a reader observes either the
 * previous entry or the new one.
 *
 * <p>A store may be shared by several {@link org.waabox.pronto.Pronto}
 * instances. Deciding which store to share is a configuration concern.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CacheStore {

  /**
   * Returns the current entry of a namespace.
   *
   * @param namespace the namespace, never null
   *
   * @return the entry, or empty if nothing has been stored
   */
  Optional<CacheEntry> get(String namespace);

  /**
   * Stores an entry, subject to the overwrite rule.
   *
   * @param namespace the namespace, never null
   * @param entry     the entry to store, never null
   *
   * @return true if the entry was written, false if it was ignored
   */
  boolean put(String namespace, CacheEntry entry);

  /**
   * Whether the namespace has been hydrated with the full dataset.
   *
   * @param namespace the namespace, never null
   *
   * @return true if hydrated
   */
  boolean isHydrated(String namespace);

  /**
   * Marks the namespace as hydrated.
   *
   * @param namespace the namespace, never null
   *
   * @return true only for the call that moved the namespace from not
   *         hydrated to hydrated
   */
  boolean markHydrated(String namespace);

  /**
   * Removes the entry and the hydration flag of a namespace.
   *
   * @param namespace the namespace, never null
   */
  void clear(String namespace);
}
