package com.autosem.digital.process.optimizer.infrastructure.config;

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
 * Configuración de Swagger/OpenAPI para documentar los endpoints del optimizador
 */
@Configuration
public class SwaggerConfig {

    @Value("${spring.application.name}")
    private String applicationName;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Optimizer Process API Documentation")
                        .description(
                                "API del motor de optimización de campañas (" + applicationName + ")." +
                                        "\n\n**Características principales:**" +
                                        "\n- Evaluación de reglas por campaña y límites globales de gasto" +
                                        "\n- Pruebas A/B con prueba z de dos proporciones" +
                                        "\n- Configuración de la cuenta y registro de auditoría" +
                                        "\n- Métricas de rendimiento de las llamadas a plataformas"
                        )
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Equipo de Optimización")
                                .email("optimizer-team@autosem.com"))
                        .license(new License()
                                .name("Propietario"))
                )
                .servers(List.of(
                        new Server()
                                .url("/")
                                .description("Servidor actual")
                ));
    }
}
