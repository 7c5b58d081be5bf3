package com.example.phoneaddress.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Startup configuration bound from application.yml (app.*). The YAML maps the
 * REDIS_URL, API_V1_PREFIX and PROJECT_NAME environment variables onto these fields;
 * the defaults below apply when a property is missing altogether.
 *
 * @param projectName        display name used in the generated API docs and the health payload
 * @param apiV1Prefix        path prefix under which the record routes are mounted
 * @param redisUrl           Redis connection URL, e.g. {@code redis://localhost:6379/0}
 * @param keyPrefix          namespace prepended to every phone key in the store
 * @param normalizePhoneKeys when true, store keys use the digits-only form of the phone number
 * @param redisEagerConnect  when true, the Redis connection is opened during startup
 */
@ConfigurationProperties(prefix = "app")
public record PhoneAddressProperties(
        @DefaultValue("Phone Address Service") String projectName,
        @DefaultValue("/api/v1") String apiV1Prefix,
        @DefaultValue("redis://localhost:6379/0") String redisUrl,
        @DefaultValue("phone_address:") String keyPrefix,
        @DefaultValue("false") boolean normalizePhoneKeys,
        @DefaultValue("true") boolean redisEagerConnect
) {
}
