package com.example.authguard.store;

import com.example.authguard.exception.StoreUnavailableException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Client for the shared TTL-keyed store behind every defense component.
 *
 * <p>Each single operation is atomic on its own key. Nothing here is atomic across keys or across
 * calls: {@link #batch(Consumer)} is a pipeline, not a transaction.
 *
 * <p>Every method throws {@link StoreUnavailableException} when the store cannot be reached. A
 * missing key is never reported that way.
 */
public interface CounterStore {

  Increment increment(String key);

  boolean expire(String key, Duration ttl);

  Optional<String> get(String key);

  void set(String key, String value, Duration ttl);

  /**
   * Remaining time to live of a key. Empty when the key does not exist or carries no expiry.
   */
  Optional<Duration> ttl(String key);

  long delete(String... keys);

  long setAdd(String key, String member);

  long setRemove(String key, String member);

  Set<String> setMembers(String key);

  long setSize(String key);

  /**
   * Pipelines the queued operations and returns their results in queue order.
   * See {@link CounterBatch} for result types.
   */
  List<Object> batch(Consumer<CounterBatch> operations);

  /**
   * Cursor-based key scan, bounded by {@code limit}.
   */
  List<String> scan(String pattern, int limit);

  /**
   * Applies {@code ttl} only when the increment created the key.
   *
   * <p>Not atomic with the increment. If the process dies between the two calls the key survives
   * without expiry until cleaned up by hand or by the store's own eviction policy.
   */
  default boolean expireIfFirst(Increment increment, Duration ttl) {
    if (!increment.firstWrite()) {
      return false;
    }
    return expire(increment.key(), ttl);
  }

  default Increment incrementWithExpiry(String key, Duration ttl) {
    Increment increment = increment(key);
    expireIfFirst(increment, ttl);
    return increment;
  }
}
