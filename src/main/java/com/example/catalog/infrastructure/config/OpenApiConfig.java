package com.example.catalog.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI catalogOrderServiceOpenAPI(@Value("${server.port:9091}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Catalog Order Service API")
                        .description("""
                                Product catalog and order management with transactional stock reservation.

                                ## Order lifecycle

                                - **Create**: stock for every line is checked and reserved as one unit
                                - **Cancel**: all reserved stock is restored, the order becomes `CANCELLED`
                                - **Partial return**: quantities go back to stock, earlier lines of a product are consumed first

                                ## Error mapping

                                `INVALID_INPUT`, `NOT_ENOUGH_STOCK` → 400 · `NOT_FOUND` → 404 · `INVALID_STATE` → 409
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Catalog Service Team")
                                .email("catalog-service@example.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server().url("http://localhost:" + port).description("Local Development")
                ));
    }
}
