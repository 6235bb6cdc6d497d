package com.example.authguard.adapter.redis.client;

import com.example.authguard.exception.StoreUnavailableException;
import com.example.authguard.store.CounterBatch;
import com.example.authguard.store.CounterStore;
import com.example.authguard.store.Increment;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * {@link CounterStore} over a string {@link RedisTemplate}.
 * Spring's {@link DataAccessException} hierarchy is translated to {@link StoreUnavailableException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisCounterStore implements CounterStore {

  private static final int SCAN_BATCH_SIZE = 500;

  private final RedisTemplate<String, String> redisTemplate;

  @Override
  public Increment increment(String key) {
    Long count = execute("INCR", () -> redisTemplate.opsForValue().increment(key));
    if (count == null) {
      throw new StoreUnavailableException("INCR returned no value for key " + key);
    }
    return Increment.of(key, count);
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    return Boolean.TRUE.equals(
        execute("PEXPIRE", () -> redisTemplate.expire(key, ttl.toMillis(), TimeUnit.MILLISECONDS)));
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(execute("GET", () -> redisTemplate.opsForValue().get(key)));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    execute("SET", () -> {
      redisTemplate.opsForValue().set(key, value, ttl);
      return null;
    });
  }

  @Override
  public Optional<Duration> ttl(String key) {
    Long millis = execute("PTTL", () -> redisTemplate.getExpire(key, TimeUnit.MILLISECONDS));
    if (millis == null || millis < 0) {
      return Optional.empty();
    }
    return Optional.of(Duration.ofMillis(millis));
  }

  @Override
  public long delete(String... keys) {
    if (keys.length == 0) {
      return 0;
    }
    Long removed = execute("DEL", () -> redisTemplate.delete(Arrays.asList(keys)));
    return removed != null ? removed : 0;
  }

  @Override
  public long setAdd(String key, String member) {
    Long added = execute("SADD", () -> redisTemplate.opsForSet().add(key, member));
    return added != null ? added : 0;
  }

  @Override
  public long setRemove(String key, String member) {
    Long removed = execute("SREM", () -> redisTemplate.opsForSet().remove(key, member));
    return removed != null ? removed : 0;
  }

  @Override
  public Set<String> setMembers(String key) {
    Set<String> members = execute("SMEMBERS", () -> redisTemplate.opsForSet().members(key));
    return members != null ? members : Collections.emptySet();
  }

  @Override
  public long setSize(String key) {
    Long size = execute("SCARD", () -> redisTemplate.opsForSet().size(key));
    return size != null ? size : 0;
  }

  @Override
  public List<Object> batch(Consumer<CounterBatch> operations) {
    return execute("PIPELINE", () -> redisTemplate.executePipelined(new SessionCallback<Object>() {
      @Override
      public Object execute(@NonNull RedisOperations redisOperations) {
        @SuppressWarnings("unchecked")
        RedisOperations<String, String> redisOps = (RedisOperations<String, String>) redisOperations;
        operations.accept(new PipelinedBatch(redisOps));
        return null;
      }
    }));
  }

  @Override
  public List<String> scan(String pattern, int limit) {
    return execute("SCAN", () -> {
      List<String> keys = new ArrayList<>();
      ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH_SIZE).build();
      try (Cursor<String> cursor = redisTemplate.scan(options)) {
        while (cursor.hasNext() && keys.size() < limit) {
          keys.add(cursor.next());
        }
      }
      return keys;
    });
  }

  private <T> T execute(String command, Supplier<T> call) {
    try {
      return call.get();
    } catch (DataAccessException e) {
      log.debug("Redis {} failed: {}", command, e.getMessage());
      throw new StoreUnavailableException("Redis " + command + " failed", e);
    }
  }

  /**
   * Queues commands on the pipelined connection. Return values of the template calls are null
   * while pipelining; the real results come back from executePipelined.
   */
  @RequiredArgsConstructor
  private static final class PipelinedBatch implements CounterBatch {

    private final RedisOperations<String, String> ops;

    @Override
    public void increment(String key) {
      ops.opsForValue().increment(key);
    }

    @Override
    public void expire(String key, Duration ttl) {
      ops.expire(key, ttl.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void get(String key) {
      ops.opsForValue().get(key);
    }

    @Override
    public void ttl(String key) {
      ops.getExpire(key, TimeUnit.MILLISECONDS);
    }

    @Override
    public void delete(String key) {
      ops.delete(key);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
      ops.opsForValue().set(key, value, ttl);
    }

    @Override
    public void setAdd(String key, String member) {
      ops.opsForSet().add(key, member);
    }

    @Override
    public void setRemove(String key, String member) {
      ops.opsForSet().remove(key, member);
    }
  }
}
