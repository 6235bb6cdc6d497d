package com.example.authguard.config;

import com.example.authguard.properties.ApplicationProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.SslOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.cluster.ClusterClientOptions;
import io.lettuce.core.cluster.ClusterTopologyRefreshOptions;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisNode;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis connection for the shared counter store, standalone or cluster, pooled through
 * commons-pool2.
 *
 * <p>Commands are rejected while disconnected and time out after {@code app.redis.timeout}, so
 * an outage surfaces to the defense components at once instead of queueing behind them.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@RequiredArgsConstructor
public class RedisConfig {

  private static final String CLUSTER_MODE = "cluster";
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);
  private static final Duration TOPOLOGY_REFRESH_PERIOD = Duration.ofMinutes(1);

  private final ApplicationProperties properties;

  @Bean(destroyMethod = "shutdown")
  public ClientResources lettuceClientResources() {
    int threads = Runtime.getRuntime().availableProcessors();
    return DefaultClientResources.builder()
        .ioThreadPoolSize(threads)
        .computationThreadPoolSize(threads)
        .build();
  }

  @Bean
  public GenericObjectPoolConfig<StatefulConnection<?, ?>> redisPoolConfig() {
    ApplicationProperties.RedisProperties.PoolProperties pool = properties.redis().pool();

    GenericObjectPoolConfig<StatefulConnection<?, ?>> config = new GenericObjectPoolConfig<>();
    config.setMaxTotal(pool.maxActive());
    config.setMaxIdle(pool.maxIdle());
    config.setMinIdle(pool.minIdle());
    config.setMaxWait(pool.maxWait());
    // idle connections are checked by the evictor, not on every borrow
    config.setTestOnBorrow(false);
    config.setTestWhileIdle(true);
    config.setTimeBetweenEvictionRuns(pool.timeBetweenEvictionRuns());
    return config;
  }

  @Bean
  public RedisConnectionFactory redisConnectionFactory(
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redis = properties.redis();
    boolean cluster = CLUSTER_MODE.equalsIgnoreCase(redis.mode());
    log.info("Connecting counter store to Redis in {} mode (ssl={})", redis.mode(), redis.ssl().enabled());

    LettuceClientConfiguration.LettuceClientConfigurationBuilder client =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .clientResources(clientResources)
            .commandTimeout(redis.timeout())
            .shutdownTimeout(SHUTDOWN_TIMEOUT)
            .clientOptions(cluster ? clusterClientOptions(redis) : standaloneClientOptions(redis));
    if (redis.ssl().enabled()) {
      client.useSsl();
    }

    LettuceConnectionFactory factory = cluster
        ? new LettuceConnectionFactory(clusterConfiguration(redis), client.build())
        : new LettuceConnectionFactory(standaloneConfiguration(redis), client.build());
    factory.setShareNativeConnection(true);
    return factory;
  }

  /**
   * Keys, values and set members are plain strings; session records are JSON text.
   */
  @Bean
  @Primary
  public RedisTemplate<String, String> redisTemplate(RedisConnectionFactory connectionFactory) {
    StringRedisSerializer serializer = StringRedisSerializer.UTF_8;

    RedisTemplate<String, String> template = new RedisTemplate<>();
    template.setConnectionFactory(connectionFactory);
    template.setKeySerializer(serializer);
    template.setValueSerializer(serializer);
    template.setEnableTransactionSupport(false);
    template.afterPropertiesSet();
    return template;
  }

  private RedisStandaloneConfiguration standaloneConfiguration(ApplicationProperties.RedisProperties redis) {
    RedisStandaloneConfiguration config = new RedisStandaloneConfiguration(redis.host(), redis.port());
    if (hasText(redis.password())) {
      config.setPassword(redis.password());
    }
    return config;
  }

  private RedisClusterConfiguration clusterConfiguration(ApplicationProperties.RedisProperties redis) {
    RedisClusterConfiguration config = new RedisClusterConfiguration();
    parseNodes(redis.cluster().nodes()).forEach(config::addClusterNode);
    config.setMaxRedirects(redis.cluster().maxRedirects());
    if (hasText(redis.password())) {
      config.setPassword(redis.password());
    }
    return config;
  }

  /**
   * Parses {@code host:port,host:port}.
   */
  static List<RedisNode> parseNodes(String nodes) {
    return Arrays.stream(nodes.split(","))
        .map(String::trim)
        .filter(node -> !node.isEmpty())
        .map(node -> {
          int separator = node.lastIndexOf(':');
          if (separator <= 0) {
            throw new IllegalArgumentException("Redis cluster node must be host:port but was: " + node);
          }
          return new RedisNode(node.substring(0, separator), Integer.parseInt(node.substring(separator + 1)));
        })
        .toList();
  }

  private ClientOptions standaloneClientOptions(ApplicationProperties.RedisProperties redis) {
    ClientOptions.Builder builder = ClientOptions.builder();
    applyCommonOptions(builder, redis);
    return builder.build();
  }

  private ClusterClientOptions clusterClientOptions(ApplicationProperties.RedisProperties redis) {
    ClusterClientOptions.Builder builder = ClusterClientOptions.builder()
        .topologyRefreshOptions(ClusterTopologyRefreshOptions.builder()
            .enablePeriodicRefresh(TOPOLOGY_REFRESH_PERIOD)
            .enableAllAdaptiveRefreshTriggers()
            .closeStaleConnections(true)
            .build())
        .maxRedirects(redis.cluster().maxRedirects());
    applyCommonOptions(builder, redis);
    return builder.build();
  }

  private void applyCommonOptions(ClientOptions.Builder builder, ApplicationProperties.RedisProperties redis) {
    builder
        .socketOptions(SocketOptions.builder()
            .connectTimeout(redis.timeout())
            .keepAlive(true)
            .tcpNoDelay(true)
            .build())
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .autoReconnect(true)
        .timeoutOptions(TimeoutOptions.enabled(redis.timeout()));
    if (redis.ssl().enabled()) {
      builder.sslOptions(SslOptions.builder().jdkSslProvider().build());
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
