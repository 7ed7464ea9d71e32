package tech.yump.amethyst.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import tech.yump.amethyst.auth.ApiErrorAuthenticationEntryPoint;
import tech.yump.amethyst.auth.BucketTokenAuthFilter;
import tech.yump.amethyst.auth.BucketTokenService;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
@Slf4j
public class SecurityConfig {

  private final BucketTokenService bucketTokenService;
  private final ObjectMapper objectMapper;

  @Bean
  public BucketTokenAuthFilter bucketTokenAuthFilter() {
    log.debug("Creating BucketTokenAuthFilter.");
    return new BucketTokenAuthFilter(bucketTokenService);
  }

  /**
   * The filter runs inside the security chain only, not a second time as a plain servlet filter.
   */
  @Bean
  public FilterRegistrationBean<BucketTokenAuthFilter> bucketTokenAuthFilterRegistration(BucketTokenAuthFilter filter) {
    FilterRegistrationBean<BucketTokenAuthFilter> registration = new FilterRegistrationBean<>(filter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http, BucketTokenAuthFilter bucketTokenAuthFilter) throws Exception {
    log.info("Configuring Spring Security for bucket token authentication.");
    http
            .csrf(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .exceptionHandling(ex -> ex.authenticationEntryPoint(new ApiErrorAuthenticationEntryPoint(objectMapper)))
            .addFilterBefore(bucketTokenAuthFilter, UsernamePasswordAuthenticationFilter.class)
            .authorizeHttpRequests(authz -> authz
                    .requestMatchers("/", "/error", "/sys/status").permitAll()
                    .requestMatchers("/actuator/health", "/actuator/health/**").permitAll()
                    .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                    .requestMatchers("/v1/auth/**").permitAll()
                    .requestMatchers("/v1/tools/**").permitAll()
                    // Creation and detail requests are gated by the bucket's IP allow-list in the controller.
                    .requestMatchers(HttpMethod.POST, "/v1/buckets", "/v1/buckets/*/*/details").permitAll()
                    .requestMatchers("/v1/buckets", "/v1/buckets/**").authenticated()
                    .requestMatchers("/v1/secrets/**").authenticated()
                    .anyRequest().denyAll()
            );
    return http.build();
  }
}
