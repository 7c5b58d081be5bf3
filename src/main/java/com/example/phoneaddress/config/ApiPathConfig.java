package com.example.phoneaddress.config;

import com.example.phoneaddress.http.PhoneAddressController;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.method.HandlerTypePredicate;
import org.springframework.web.servlet.config.annotation.PathMatchConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Mounts the controllers of the http package under {@code app.api-v1-prefix}. The health
 * endpoint and the OpenAPI docs stay at the root.
 */
@Configuration
@EnableConfigurationProperties(PhoneAddressProperties.class)
public class ApiPathConfig implements WebMvcConfigurer {

    private final PhoneAddressProperties properties;

    public ApiPathConfig(PhoneAddressProperties properties) {
        this.properties = properties;
    }

    @Override
    public void configurePathMatch(PathMatchConfigurer configurer) {
        String prefix = properties.apiV1Prefix();
        if (!StringUtils.hasText(prefix) || "/".equals(prefix)) {
            return;
        }
        configurer.addPathPrefix(prefix, HandlerTypePredicate.forBasePackageClass(PhoneAddressController.class));
    }
}
