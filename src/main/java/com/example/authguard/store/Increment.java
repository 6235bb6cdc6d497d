package com.example.authguard.store;

/**
 * Result of an atomic increment.
 *
 * <p>{@code firstWrite} is true when this increment created the key (post-increment count of 1).
 * A TTL for such a key has to be applied by a separate call, so there is a window in which the key
 * exists without expiry. See {@link CounterStore#expireIfFirst(Increment, java.time.Duration)}.
 */
public record Increment(String key, long count, boolean firstWrite) {

  public static Increment of(String key, long count) {
    return new Increment(key, count, count == 1);
  }
}
