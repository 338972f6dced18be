package com.vapeshop.shop.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis connection for the key-value store.
 *
 * Either {@code spring.data.redis.url} (hosting platforms expose it as REDIS_URL)
 * or the individual host/port/password/database properties are used.
 *
 * @author Vape Shop Team
 */
@Configuration
public class RedisConfig {

    private static final Logger logger = LoggerFactory.getLogger(RedisConfig.class);

    @Value("${spring.data.redis.url:}")
    private String redisUrl;

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private Integer redisPort;

    @Value("${spring.data.redis.password:}")
    private String redisPassword;

    @Value("${spring.data.redis.database:0}")
    private Integer redisDatabase;

    @Value("${spring.data.redis.timeout:2000}")
    private Integer redisTimeout;

    @Value("${spring.data.redis.lettuce.pool.max-active:16}")
    private Integer maxActive;

    @Value("${spring.data.redis.lettuce.pool.max-idle:8}")
    private Integer maxIdle;

    @Value("${spring.data.redis.lettuce.pool.min-idle:1}")
    private Integer minIdle;

    @Value("${spring.data.redis.lettuce.pool.max-wait:2000}")
    private Long maxWait;

    /**
     * Pooled Lettuce connection factory shared by all repositories.
     *
     * @return RedisConnectionFactory
     */
    @Bean
    public RedisConnectionFactory redisConnectionFactory() {
        RedisStandaloneConfiguration redisConfig = standaloneConfiguration();

        GenericObjectPoolConfig<?> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(maxActive);
        poolConfig.setMaxIdle(maxIdle);
        poolConfig.setMinIdle(minIdle);
        poolConfig.setMaxWait(Duration.ofMillis(maxWait));
        poolConfig.setTestWhileIdle(true);

        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(Duration.ofMillis(redisTimeout))
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .build();

        LettucePoolingClientConfiguration.LettucePoolingClientConfigurationBuilder builder =
                LettucePoolingClientConfiguration.builder()
                        .poolConfig(poolConfig);
        builder.clientOptions(clientOptions)
                .commandTimeout(Duration.ofMillis(redisTimeout));

        // rediss:// URLs from managed hosts require TLS
        boolean ssl = hasUrl() && RedisURI.create(redisUrl).isSsl();
        if (ssl) {
            builder.useSsl();
        }
        LettucePoolingClientConfiguration lettuceConfig = builder.build();

        logger.info("Connecting to Redis at {}:{} (database {}, ssl {})",
                redisConfig.getHostName(), redisConfig.getPort(), redisConfig.getDatabase(), ssl);
        return new LettuceConnectionFactory(redisConfig, lettuceConfig);
    }

    /**
     * All records are string hashes and counters, so plain string serialization is enough.
     *
     * @param connectionFactory Redis connection factory
     * @return StringRedisTemplate
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    private RedisStandaloneConfiguration standaloneConfiguration() {
        RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration();
        if (hasUrl()) {
            RedisURI uri = RedisURI.create(redisUrl);
            redisConfig.setHostName(uri.getHost());
            redisConfig.setPort(uri.getPort());
            redisConfig.setDatabase(uri.getDatabase());
            if (uri.getPassword() != null && uri.getPassword().length > 0) {
                redisConfig.setPassword(new String(uri.getPassword()));
            }
            if (uri.getUsername() != null) {
                redisConfig.setUsername(uri.getUsername());
            }
            return redisConfig;
        }

        redisConfig.setHostName(redisHost);
        redisConfig.setPort(redisPort);
        redisConfig.setDatabase(redisDatabase);
        if (redisPassword != null && !redisPassword.isEmpty()) {
            redisConfig.setPassword(redisPassword);
        }
        return redisConfig;
    }

    private boolean hasUrl() {
        return redisUrl != null && !redisUrl.isBlank();
    }
}
