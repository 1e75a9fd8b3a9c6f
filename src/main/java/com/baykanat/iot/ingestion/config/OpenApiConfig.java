package com.baykanat.iot.ingestion.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/** OpenAPI / Swagger UI bean tanımı. */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI telemetryIngestionOpenApi(AppProperties appProperties) {
        return new OpenAPI()
                .info(new Info()
                        .title(appProperties.getName())
                        .description("""
                                Telemetry ingestion for IoT devices. Devices publish over MQTT \
                                (devices/{device_id}/telemetry), other producers POST to /ingest. \
                                Records are queued in a bounded buffer and written to PostgreSQL \
                                in batches; a full buffer answers 503 so callers can back off.\
                                """)
                        .version(appProperties.getVersion())
                        .contact(new Contact()
                                .name("Burak Aykanat")
                                .email("burak.aykanat12@gmail.com")))
                .servers(List.of(
                        new Server().url("http://localhost:8000").description("Local Development")
                ));
    }
}
