package com.example.phoneaddress.access;

import com.example.phoneaddress.config.PhoneAddressProperties;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
public class RedisPhoneAddressAccess implements PhoneAddressAccess {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    @Autowired
    public RedisPhoneAddressAccess(StringRedisTemplate redisTemplate, PhoneAddressProperties properties) {
        this(redisTemplate, properties.keyPrefix());
    }

    public RedisPhoneAddressAccess(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public Optional<String> findAddress(String phone) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key(phone)));
    }

    @Override
    public void save(String phone, String address) {
        redisTemplate.opsForValue().set(key(phone), address);
    }

    @Override
    public boolean saveIfAbsent(String phone, String address) {
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key(phone), address));
    }

    @Override
    public boolean exists(String phone) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(key(phone)));
    }

    @Override
    public boolean delete(String phone) {
        return Boolean.TRUE.equals(redisTemplate.delete(key(phone)));
    }

    @Override
    public boolean ping() {
        String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
        return "PONG".equalsIgnoreCase(pong);
    }

    String key(String phone) {
        return keyPrefix + phone;
    }
}
