/**
 * Configuration class for Spring Security settings
 *
 * Features:
 * - Every route is public and read-only
 * - Keeps CSRF protection on so rendered pages carry a session-bound anti-forgery token
 * - Sets Referrer-Policy and frame options headers
 */
package net.fiddleserver.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.csrf.CsrfTokenRequestAttributeHandler;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter;

@Configuration
@EnableWebSecurity
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
public class SecurityConfig {

    private final String referrerPolicy;

    public SecurityConfig(@Value("${app.security.headers.referrer-policy:ORIGIN_WHEN_CROSS_ORIGIN}") String referrerPolicy) {
        this.referrerPolicy = referrerPolicy;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        // Plain handler: the token goes into a hidden form field as-is, not BREACH-masked per request
        CsrfTokenRequestAttributeHandler csrfRequestHandler = new CsrfTokenRequestAttributeHandler();
        http
            .securityMatcher("/**")
            .authorizeHttpRequests(authorizeRequests ->
                authorizeRequests
                    .requestMatchers(HttpMethod.GET, "/**").permitAll()
                    .requestMatchers(HttpMethod.HEAD, "/**").permitAll()
                    .anyRequest().denyAll()
            )
            .csrf(csrf -> csrf.csrfTokenRequestHandler(csrfRequestHandler))
            .httpBasic(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .headers(headers -> {
                ReferrerPolicyHeaderWriter.ReferrerPolicy policy =
                    ReferrerPolicyHeaderWriter.ReferrerPolicy.valueOf(referrerPolicy);
                headers.referrerPolicy(referrer -> referrer.policy(policy));
                headers.frameOptions(frame -> frame.sameOrigin());
                // Bundle files are immutable per version and carry their own ETag and Last-Modified
                headers.cacheControl(cache -> cache.disable());
            });
        return http.build();
    }
}
