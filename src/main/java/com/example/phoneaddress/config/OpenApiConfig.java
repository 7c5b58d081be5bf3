package com.example.phoneaddress.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    private static final String DESCRIPTION = """
            Service for storing and managing "phone - address" pairs.

            Redis is used as the key-value storage. Typical uses:

            * Quick access to delivery addresses by phone number
            * Caching frequently requested user addresses
            * Temporary storage for phone-address bindings
            """;

    @Bean
    public OpenAPI phoneAddressOpenApi(PhoneAddressProperties properties) {
        return new OpenAPI().info(new Info()
                .title(properties.projectName())
                .description(DESCRIPTION)
                .version("1.0.0")
                .contact(new Contact().name(properties.projectName())));
    }
}
