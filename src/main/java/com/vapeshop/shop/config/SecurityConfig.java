package com.vapeshop.shop.config;

import com.vapeshop.shop.security.AdminAllowList;
import com.vapeshop.shop.security.HeaderAuthenticationFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.Http403ForbiddenEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Security configuration.
 *
 * Authentication: the {@code X-User-Id} header, read by {@link HeaderAuthenticationFilter}.
 * Sessions are stateless and CSRF is off since every call carries the header.
 *
 * Authorization:
 * - catalog reads are public
 * - everything else needs a caller; unauthenticated requests get 403
 * - admin endpoints use {@code @PreAuthorize("hasRole('ADMIN')")}
 * - owner checks go through {@link com.vapeshop.shop.security.SecurityUtils}
 *
 * @author Vape Shop Team
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity(prePostEnabled = true)
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, AdminAllowList adminAllowList) throws Exception {
        http
            .csrf(csrf -> csrf.disable())

            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.GET, "/api/products", "/api/products/**").permitAll()
                .anyRequest().authenticated()
            )

            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(new Http403ForbiddenEntryPoint())
            )

            // Not a bean, so it runs only inside this chain
            .addFilterBefore(
                new HeaderAuthenticationFilter(adminAllowList),
                UsernamePasswordAuthenticationFilter.class
            );

        return http.build();
    }
}
