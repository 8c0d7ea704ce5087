package com.example.sessionstore.configuration;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.AuthenticationProvider;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.Http403ForbiddenEntryPoint;
import org.springframework.security.web.authentication.www.BasicAuthenticationFilter;

import java.util.Map;

/**
 * HTTP security. Off by default; with {@code security.enabled=true} every endpoint but
 * health and API docs requires form or basic authentication against the
 * {@link AuthenticationProvider} beans found in the context.
 */
@Configuration
public class SecurityConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(SecurityConfiguration.class);

    static final String[] PUBLIC_PATHS = {
            "/health",
            "/actuator/health",
            "/swagger-resources/**",
            "/swagger-ui/**",
            "/v3/api-docs/**"
    };

    private final ApplicationContext context;

    @Value("${security.enabled:false}")
    private boolean securityEnabled;

    public SecurityConfiguration(ApplicationContext context) {
        this.context = context;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http.csrf(AbstractHttpConfigurer::disable);

        if (!securityEnabled) {
            http.authorizeHttpRequests(auth -> auth.anyRequest().permitAll());
            return http.build();
        }

        Map<String, AuthenticationProvider> providers = context.getBeansOfType(AuthenticationProvider.class);
        providers.forEach((name, provider) -> {
            http.authenticationProvider(provider);
            logger.info("Authentication provider '{}' added.", name);
        });

        http.authorizeHttpRequests(auth -> auth
                        .requestMatchers(PUBLIC_PATHS).permitAll()
                        .anyRequest().authenticated())
                .formLogin(form -> form
                        .successHandler((req, res, authentication) ->
                                logger.info("Login attempt. User: {}, State: SUCCESSFUL", authentication.getName()))
                        .failureHandler((req, res, exception) -> {
                            logger.info("Login attempt. User: {}, State: FAILED", exception.getMessage());
                            res.sendError(HttpStatus.FORBIDDEN.value());
                        }))
                .httpBasic(basic -> basic.authenticationEntryPoint(new Http403ForbiddenEntryPoint()))
                .addFilterBefore((req, res, chain) -> {
                    chain.doFilter(req instanceof HttpServletRequest
                            ? new HeaderFallbackRequest((HttpServletRequest) req) : req, res);
                }, BasicAuthenticationFilter.class)
                .exceptionHandling(ex -> ex.authenticationEntryPoint(new Http403ForbiddenEntryPoint()));

        return http.build();
    }

    /**
     * Some API clients send {@code authorization} in lower case. Falls back to the
     * lower-case name when a header is not found as given.
     */
    static class HeaderFallbackRequest extends HttpServletRequestWrapper {

        HeaderFallbackRequest(HttpServletRequest request) {
            super(request);
        }

        @Override
        public String getHeader(String name) {
            String value = super.getHeader(name);
            return value != null ? value : super.getHeader(name.toLowerCase());
        }
    }
}
