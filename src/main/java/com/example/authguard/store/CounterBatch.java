package com.example.authguard.store;

import java.time.Duration;

/**
 * Operations queued inside a {@link CounterStore#batch} call.
 *
 * <p>Result types, in queue order:
 * <ul>
 *   <li>{@code increment} - {@code Long} post-increment value</li>
 *   <li>{@code expire} - {@code Boolean}</li>
 *   <li>{@code get} - {@code String}, or {@code null} when the key is missing</li>
 *   <li>{@code ttl} - {@code Long} milliseconds; {@code -2} missing key, {@code -1} no expiry</li>
 *   <li>{@code delete} - {@code Long} number of keys removed</li>
 *   <li>{@code set} - {@code Boolean}</li>
 *   <li>{@code setAdd} / {@code setRemove} - {@code Long}</li>
 * </ul>
 */
public interface CounterBatch {

  long TTL_MISSING_KEY = -2L;
  long TTL_NO_EXPIRY = -1L;

  void increment(String key);

  void expire(String key, Duration ttl);

  void get(String key);

  void ttl(String key);

  void delete(String key);

  void set(String key, String value, Duration ttl);

  void setAdd(String key, String member);

  void setRemove(String key, String member);
}
