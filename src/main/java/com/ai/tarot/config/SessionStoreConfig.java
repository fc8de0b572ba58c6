package com.ai.tarot.config;

import com.ai.tarot.exception.StorageUnavailableException;
import com.ai.tarot.repository.InMemorySessionStore;
import com.ai.tarot.repository.RedisSessionStore;
import com.ai.tarot.repository.SessionCodec;
import com.ai.tarot.repository.SessionStore;
import io.lettuce.core.RedisURI;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Chooses the session backend from {@code REDIS_URL}. Blank means in-memory; a Redis that
 * does not answer a PING at startup also means in-memory, with a warning.
 */
@Configuration
public class SessionStoreConfig implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SessionStoreConfig.class);

    @Value("${app.session.redis-url:}")
    private String redisUrl = "";

    @Value("${app.session.ttl:24h}")
    private Duration ttl = Duration.ofHours(24);

    @Value("${app.session.redis-timeout:2s}")
    private Duration redisTimeout = Duration.ofSeconds(2);

    private LettuceConnectionFactory connectionFactory;

    @Bean
    public SessionStore sessionStore(SessionCodec codec, Clock clock) {
        if (StringUtils.isBlank(redisUrl)) {
            log.info("REDIS_URL not set, sessions kept in memory (ttl={})", ttl);
            return new InMemorySessionStore(codec, clock, ttl);
        }
        try {
            StringRedisTemplate template = connect(redisUrl.trim());
            log.info("Sessions stored in Redis at {}:{} (ttl={})",
                    connectionFactory.getHostName(), connectionFactory.getPort(), ttl);
            return new RedisSessionStore(template, codec, ttl);
        } catch (StorageUnavailableException e) {
            log.warn("Redis unavailable, falling back to in-memory sessions: {}", e.getMessage());
            destroy();
            return new InMemorySessionStore(codec, clock, ttl);
        }
    }

    private StringRedisTemplate connect(String url) {
        try {
            RedisURI uri = RedisURI.create(url);
            RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
            standalone.setDatabase(uri.getDatabase());
            if (uri.getUsername() != null) {
                standalone.setUsername(uri.getUsername());
            }
            if (uri.getPassword() != null) {
                standalone.setPassword(RedisPassword.of(uri.getPassword()));
            }
            LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder()
                    .commandTimeout(redisTimeout);
            if (uri.isSsl()) {
                client.useSsl();
            }
            connectionFactory = new LettuceConnectionFactory(standalone, client.build());
            connectionFactory.afterPropertiesSet();
            connectionFactory.start();
            try (RedisConnection connection = connectionFactory.getConnection()) {
                connection.ping();
            }
            return new StringRedisTemplate(connectionFactory);
        } catch (RuntimeException e) {
            throw new StorageUnavailableException("Cannot reach Redis: " + e.getMessage(), e);
        }
    }

    @Override
    public void destroy() {
        if (connectionFactory != null) {
            connectionFactory.destroy();
            connectionFactory = null;
        }
    }
}
