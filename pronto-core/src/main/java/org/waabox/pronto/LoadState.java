package org.waabox.pronto;

/**
 * The loading state of a namespace.
 *
 * <p>The usual path is {@code EMPTY -> RACING -> PARTIALLY_SERVED ->
 * HYDRATING -> HYDRATED}. A namespace goes straight from {@code RACING} to
 * {@code HYDRATED} when the full source wins the initial race, and falls back
 * to {@code EMPTY} when no source produced usable data.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum LoadState {

  /** Nothing cached and nothing in flight. */
  EMPTY,

  /** A race between source tiers is in flight. */
  RACING,

  /** Partial data is cached, no full load is running. */
  PARTIALLY_SERVED,

  /** Partial data is cached and a full load is running. */
  HYDRATING,

  /** The full dataset is cached. */
  HYDRATED
}
