package com.blockflow.blockflow_engine.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

@Configuration
@RequiredArgsConstructor
public class CorsConfig {

    private final EngineProperties properties;

    @Bean
    public CorsFilter corsFilter() {
        return new CorsFilter(corsConfigurationSource());
    }

    UrlBasedCorsConfigurationSource corsConfigurationSource() {
        EngineProperties.Cors cors = properties.getCors();

        CorsConfiguration config = new CorsConfiguration();
        cors.getAllowedOrigins().stream()
                .filter(origin -> origin != null && !origin.isBlank())
                .forEach(config::addAllowedOriginPattern);
        cors.getAllowedMethods().forEach(config::addAllowedMethod);
        config.addAllowedHeader("*");
        config.setAllowCredentials(cors.isAllowCredentials());

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration(cors.getPathPattern(), config);
        return source;
    }
}
