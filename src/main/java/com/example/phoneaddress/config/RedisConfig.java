package com.example.phoneaddress.config;

import io.lettuce.core.RedisURI;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@EnableConfigurationProperties(PhoneAddressProperties.class)
public class RedisConfig {

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(PhoneAddressProperties properties) {
        RedisURI uri = RedisURI.create(properties.redisUrl());
        LettuceConnectionFactory factory =
                new LettuceConnectionFactory(standaloneConfiguration(uri), clientConfiguration(uri));
        // Opens the shared connection in afterPropertiesSet, so an unreachable store fails the boot.
        factory.setEagerInitialization(properties.redisEagerConnect());
        return factory;
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    static RedisStandaloneConfiguration standaloneConfiguration(RedisURI uri) {
        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
        config.setDatabase(uri.getDatabase());
        if (uri.getUsername() != null) {
            config.setUsername(uri.getUsername());
        }
        if (uri.getPassword() != null && uri.getPassword().length > 0) {
            config.setPassword(uri.getPassword());
        }
        return config;
    }

    static LettuceClientConfiguration clientConfiguration(RedisURI uri) {
        LettuceClientConfiguration.LettuceClientConfigurationBuilder builder = LettuceClientConfiguration.builder()
                .commandTimeout(uri.getTimeout());
        if (uri.isSsl()) {
            builder.useSsl();
        }
        return builder.build();
    }
}
