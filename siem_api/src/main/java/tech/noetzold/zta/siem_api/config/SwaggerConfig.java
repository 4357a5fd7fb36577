package tech.noetzold.zta.siem_api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SIEM API")
                        .version("1.0.0")
                        .description("Durable security alert store and per-session alert aggregation")
                        .contact(new Contact()
                                .name("Noetzold Tech")
                                .email("contato@noetzold.tech")
                                .url("https://noetzold.tech")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8002")
                                .description("Development")))
                .tags(List.of(
                        new Tag().name("Alerts").description("Alert ingestion and listing"),
                        new Tag().name("Aggregation").description("Windowed alert counts")));
    }
}
