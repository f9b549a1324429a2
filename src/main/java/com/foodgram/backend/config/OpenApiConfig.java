package com.foodgram.backend.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeIn;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger UI sends the token as {@code Authorization: Token <jwt>}; paste the whole header value.
 */
@Configuration
@OpenAPIDefinition(info = @Info(title = "Foodgram API", version = "v1",
        description = "Recipes, favorites, shopping cart and subscriptions"))
@SecurityScheme(name = "token", type = SecuritySchemeType.APIKEY, in = SecuritySchemeIn.HEADER,
        paramName = "Authorization")
public class OpenApiConfig {
}
