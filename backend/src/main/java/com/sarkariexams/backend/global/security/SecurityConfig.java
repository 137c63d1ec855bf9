package com.sarkariexams.backend.global.security;

import java.util.Arrays;

import com.sarkariexams.backend.modules.auth.domain.AdminPermissions;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Value("${app.cors.allowed-origins:http://localhost:5173,http://localhost:3000}")
    private String allowedOrigins;

    private final SessionCookieAuthenticationFilter sessionCookieAuthenticationFilter;
    private final CsrfGuardFilter csrfGuardFilter;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;
    private final RestAccessDeniedHandler accessDeniedHandler;

    public SecurityConfig(
            SessionCookieAuthenticationFilter sessionCookieAuthenticationFilter,
            CsrfGuardFilter csrfGuardFilter,
            RestAuthenticationEntryPoint authenticationEntryPoint,
            RestAccessDeniedHandler accessDeniedHandler
    ) {
        this.sessionCookieAuthenticationFilter = sessionCookieAuthenticationFilter;
        this.csrfGuardFilter = csrfGuardFilter;
        this.authenticationEntryPoint = authenticationEntryPoint;
        this.accessDeniedHandler = accessDeniedHandler;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        // Spring's CSRF support is replaced by CsrfGuardFilter, which binds the token to the admin session.
        http
                .csrf(csrf -> csrf.disable())
                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(authz -> authz
                        .requestMatchers(HttpMethod.POST, "/auth/login", "/auth/logout").permitAll()
                        .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                        .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()
                        .requestMatchers("/actuator/**").hasRole("ADMIN")
                        .requestMatchers("/admin/sessions/**", "/admin/sessions").hasAuthority(AdminPermissions.ADMIN_READ)
                        .requestMatchers("/admin/approvals/**", "/admin/approvals").hasAuthority(AdminPermissions.ANNOUNCEMENTS_APPROVE)
                        .requestMatchers("/admin/audit/**", "/admin/audit").hasAuthority(AdminPermissions.AUDIT_READ)
                        .requestMatchers(HttpMethod.PUT, "/admin/policies").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.GET, "/admin/policies").hasAuthority(AdminPermissions.ADMIN_READ)
                        .requestMatchers(HttpMethod.GET, "/admin/announcements/**").hasAuthority(AdminPermissions.ANNOUNCEMENTS_READ)
                        .requestMatchers(HttpMethod.DELETE, "/admin/announcements/**").hasAuthority(AdminPermissions.ANNOUNCEMENTS_DELETE)
                        .requestMatchers("/admin/announcements/*/approve", "/admin/announcements/*/reject")
                        .hasAuthority(AdminPermissions.ANNOUNCEMENTS_APPROVE)
                        .requestMatchers("/admin/announcements/**", "/admin/announcements").hasAuthority(AdminPermissions.ANNOUNCEMENTS_WRITE)
                        .anyRequest().authenticated()
                )
                .exceptionHandling(handler -> handler
                        .authenticationEntryPoint(authenticationEntryPoint)
                        .accessDeniedHandler(accessDeniedHandler)
                )
                .addFilterBefore(sessionCookieAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)
                .addFilterAfter(csrfGuardFilter, SessionCookieAuthenticationFilter.class);
        return http.build();
    }

    @Bean
    public FilterRegistrationBean<SessionCookieAuthenticationFilter> sessionCookieFilterRegistration(
            SessionCookieAuthenticationFilter filter) {
        FilterRegistrationBean<SessionCookieAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<CsrfGuardFilter> csrfGuardFilterRegistration(CsrfGuardFilter filter) {
        FilterRegistrationBean<CsrfGuardFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsConfiguration config = new CorsConfiguration();
        config.setAllowCredentials(true);
        config.setAllowedOrigins(Arrays.asList(allowedOrigins.split(",")));
        config.setAllowedMethods(Arrays.asList("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
        config.setAllowedHeaders(Arrays.asList(
                "Content-Type",
                CsrfGuardFilter.CSRF_HEADER,
                "X-Admin-Step-Up-Token",
                "X-Admin-Approval-Id",
                "X-Admin-Break-Glass-Reason",
                "X-Request-Id"
        ));
        config.setExposedHeaders(Arrays.asList("Location", "Retry-After", "X-Request-Id"));
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return source;
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
