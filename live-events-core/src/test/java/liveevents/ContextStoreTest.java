package liveevents;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ContextStoreTest {

  private final ContextStore store = new ContextStore();

  @Test
  void startsEmpty() {
    assertTrue(store.current().isEmpty());
  }

  @Test
  void setOverwritesSameKeysAndKeepsOthers() {
    store.set(Map.of("user_id", 1, "login", "a"));
    store.set(Map.of("user_id", 2, "user_agent", "ua"));

    assertEquals(Map.of("user_id", 2, "login", "a", "user_agent", "ua"), store.current());
  }

  @Test
  void clearEmptiesTheStore() {
    store.set(Map.of("user_id", 1));
    store.clear();

    assertTrue(store.current().isEmpty());
  }

  @Test
  void snapshotIsUnaffectedByLaterChanges() {
    store.set(Map.of("user_id", 1));
    Map<String, Object> snapshot = store.current();

    store.set(Map.of("user_id", 2));
    store.clear();

    assertEquals(Map.of("user_id", 1), snapshot);
  }

  @Test
  void snapshotIsReadOnly() {
    store.set(Map.of("user_id", 1));

    assertThrows(UnsupportedOperationException.class, () -> store.current().put("x", 1));
  }

  @Test
  void mergedWithLetsExtraWin() {
    store.set(Map.of("user_id", 1, "login", "a"));

    Map<String, Object> merged = store.mergedWith(Map.of("user_id", 9));

    assertEquals(Map.of("user_id", 9, "login", "a"), merged);
    assertEquals(1, store.current().get("user_id"));
  }

  @Test
  void mergedWithNullReturnsCopyOfContext() {
    store.set(Map.of("user_id", 1));

    assertEquals(Map.of("user_id", 1), store.mergedWith(null));
  }

  @Test
  void setRejectsNullKeys() {
    Map<String, Object> bad = new HashMap<>();
    bad.put(null, 1);

    assertThrows(IllegalArgumentException.class, () -> store.set(bad));
    assertThrows(NullPointerException.class, () -> store.set(null));
  }

  @Test
  void setAcceptsMapsThatRejectNullLookups() {
    store.set(Map.of("user_id", 1));
    store.set(new TreeMap<>(Map.of("login", "a")));
    store.set(Map.of());

    assertEquals(Map.of("user_id", 1, "login", "a"), store.current());
  }

  @Test
  void concurrentSetsAreAllApplied() throws Exception {
    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Throwable> errors = new CopyOnWriteArrayList<>();
    for (int i = 0; i < threads; i++) {
      String key = "k" + i;
      pool.submit(() -> {
        try {
          start.await();
          for (int n = 0; n < 100; n++) {
            store.set(Map.of(key, n));
            store.current().size();
          }
        } catch (Throwable t) {
          errors.add(t);
        }
      });
    }
    start.countDown();
    pool.shutdown();
    assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

    assertTrue(errors.isEmpty(), errors.toString());
    assertEquals(threads, store.current().size());
    for (int i = 0; i < threads; i++) {
      assertEquals(99, store.current().get("k" + i));
    }
  }
}
