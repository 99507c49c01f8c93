package org.waabox.pronto.cache;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.pronto.CacheEntry;

/**
 * A process-local {@link CacheStore} backed by a concurrent map.
 *
 * <p>Each namespace owns a small state holder; reads and writes of a
 * namespace synchronize on that holder, so namespaces never contend with
 * each other.
 *
 * <p>When two full entries compete, the most recently fetched one wins: a
 * full entry fetched strictly before the stored full entry is ignored.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryCacheStore implements CacheStore {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(InMemoryCacheStore.class);

  /** The per-namespace state, created on first access. */
  private final Map<String, NamespaceState> namespaces =
      new ConcurrentHashMap<>();

  /** {@inheritDoc} */
  @Override
  public Optional<CacheEntry> get(final String namespace) {
    final NamespaceState state = namespaces.get(requireNamespace(namespace));
    if (state == null) {
      return Optional.empty();
    }
    synchronized (state) {
      return Optional.ofNullable(state.entry);
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean put(final String namespace, final CacheEntry entry) {
    Objects.requireNonNull(entry, "entry must not be null");
    final NamespaceState state = stateOf(namespace);
    synchronized (state) {
      final CacheEntry current = state.entry;
      if (current != null && current.isFull()) {
        if (!entry.isFull()) {
          log.debug("Namespace '{}': ignoring partial {} entry, full data "
              + "already cached", namespace, entry.source().label());
          return false;
        }
        if (entry.fetchedAt().isBefore(current.fetchedAt())) {
          log.debug("Namespace '{}': ignoring full entry fetched at {}, "
              + "cached one is newer", namespace, entry.fetchedAt());
          return false;
        }
      }
      state.entry = entry;
      return true;
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean isHydrated(final String namespace) {
    final NamespaceState state = namespaces.get(requireNamespace(namespace));
    if (state == null) {
      return false;
    }
    synchronized (state) {
      return state.hydrated;
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean markHydrated(final String namespace) {
    final NamespaceState state = stateOf(namespace);
    synchronized (state) {
      if (state.hydrated) {
        return false;
      }
      state.hydrated = true;
      return true;
    }
  }

  /** {@inheritDoc} */
  @Override
  public void clear(final String namespace) {
    final NamespaceState state = namespaces.get(requireNamespace(namespace));
    if (state == null) {
      return;
    }
    synchronized (state) {
      state.entry = null;
      state.hydrated = false;
    }
    log.info("Namespace '{}': cache cleared", namespace);
  }

  private NamespaceState stateOf(final String namespace) {
    return namespaces.computeIfAbsent(requireNamespace(namespace),
        key -> new NamespaceState());
  }

  private static String requireNamespace(final String namespace) {
    return Objects.requireNonNull(namespace, "namespace must not be null");
  }

  /** The mutable state of one namespace, guarded by its own monitor. */
  private static final class NamespaceState {

    /** The current entry, null when nothing is cached. */
    private CacheEntry entry;

    /** Whether the namespace reached the full dataset. */
    private boolean hydrated;
  }
}
