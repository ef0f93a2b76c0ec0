package com.cred.freestyle.stockcount.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI document for the stock count endpoints, served at /v3/api-docs.
 *
 * @author Stock Count Team
 */
@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Stock Count Service",
                version = "1.0.0",
                description = "Start in-progress stock counts and report RFID tag reads against them"),
        servers = @Server(url = "http://localhost:8080", description = "Local Development"))
public class OpenApiConfig {
}
