package liveevents;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide ambient context merged into the attributes of every posted event.
 *
 * <p>The stored map is replaced atomically on every change, so {@link #current()} hands
 * out an immutable snapshot that concurrent {@code set}/{@code clear} calls never tear.
 * Changes are visible to events posted afterwards; events already queued keep the
 * context they were built with.
 */
public final class ContextStore {
  private final AtomicReference<Map<String, Object>> context =
      new AtomicReference<>(Collections.emptyMap());

  /**
   * Merges {@code partial} into the stored context, replacing entries with the same key.
   *
   * @param partial entries to add; must not contain {@code null} keys
   */
  public void set(Map<String, ?> partial) {
    Objects.requireNonNull(partial, "partial");
    // containsKey(null) throws on Map.of and TreeMap
    for (String key : partial.keySet()) {
      if (key == null) {
        throw new IllegalArgumentException("context cannot contain null keys");
      }
    }
    if (partial.isEmpty()) {
      return;
    }
    context.updateAndGet(existing -> {
      Map<String, Object> merged = new LinkedHashMap<>(existing);
      merged.putAll(partial);
      return Collections.unmodifiableMap(merged);
    });
  }

  /** Resets the stored context to empty. */
  public void clear() {
    context.set(Collections.emptyMap());
  }

  /**
   * Returns an immutable snapshot of the stored context.
   *
   * @return current context, never {@code null}
   */
  public Map<String, Object> current() {
    return context.get();
  }

  /**
   * Returns the stored context overlaid with {@code extra}; {@code extra} wins on key
   * collision.
   *
   * @param extra call-site context; may be {@code null}
   * @return a new mutable map
   */
  public Map<String, Object> mergedWith(Map<String, ?> extra) {
    Map<String, Object> merged = new LinkedHashMap<>(context.get());
    if (extra != null) {
      merged.putAll(extra);
    }
    return merged;
  }
}
