package io.b2mash.realtime.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;

/**
 * Single stateless chain. Health is public, the internal API needs the cluster key, everything
 * else is denied.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final ApiKeyAuthFilter apiKeyAuthFilter;
  private final RequestLoggingFilter requestLoggingFilter;

  public SecurityConfig(
      ApiKeyAuthFilter apiKeyAuthFilter, RequestLoggingFilter requestLoggingFilter) {
    this.apiKeyAuthFilter = apiKeyAuthFilter;
    this.requestLoggingFilter = requestLoggingFilter;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health/**", "/actuator/health")
                    .permitAll()
                    .requestMatchers("/internal/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .addFilterBefore(apiKeyAuthFilter, AnonymousAuthenticationFilter.class)
        .addFilterAfter(requestLoggingFilter, ApiKeyAuthFilter.class);

    return http.build();
  }
}
