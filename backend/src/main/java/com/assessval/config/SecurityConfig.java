package com.assessval.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

/**
 * HTTP security for the valuation service.
 * <p>
 * Callers are authenticated upstream, so every {@code /api/**} route is open and
 * carries the acting user id in its payload for the lineage ledger. Anything
 * outside the API needs basic credentials unless {@code security.auth.enabled}
 * is off, as it is for local work and tests.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    static final String API_ROUTES = "/api/**";

    @Value("${security.auth.enabled:true}")
    private boolean authEnabled;

    @Value("${cors.allowed-origins:http://localhost:5173,http://localhost:3000}")
    private String allowedOrigins;

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration assessorUi = new CorsConfiguration();
        assessorUi.setAllowedOrigins(parseOrigins(allowedOrigins));
        assessorUi.setAllowedMethods(List.of(
            HttpMethod.GET.name(), HttpMethod.POST.name(), HttpMethod.PATCH.name(),
            HttpMethod.DELETE.name(), HttpMethod.OPTIONS.name()));
        assessorUi.setAllowedHeaders(List.of("*"));
        assessorUi.setAllowCredentials(true);
        assessorUi.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration(API_ROUTES, assessorUi);
        return source;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
            .cors(cors -> cors.configurationSource(corsConfigurationSource()))
            .csrf(csrf -> csrf.disable())
            // local H2 console is framed from the same origin
            .headers(headers -> headers.frameOptions(frame -> frame.sameOrigin()));

        if (authEnabled) {
            http
                .authorizeHttpRequests(auth -> auth
                    .requestMatchers(API_ROUTES).permitAll()
                    .anyRequest().authenticated())
                .httpBasic(Customizer.withDefaults());
        } else {
            http.authorizeHttpRequests(auth -> auth.anyRequest().permitAll());
        }
        return http.build();
    }

    /**
     * Split the comma-separated origin list, ignoring blanks.
     */
    static List<String> parseOrigins(String configured) {
        if (configured == null) {
            return List.of();
        }
        return Arrays.stream(configured.split(","))
            .map(String::trim)
            .filter(origin -> !origin.isEmpty())
            .toList();
    }
}
