package com.infound.creatorportal.springboot.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infound.creatorportal.server.gate.AccessGate;
import jakarta.servlet.DispatcherType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.util.matcher.RequestMatcher;

@Configuration
@EnableWebSecurity
public class CreatorPortalSecurityConfig {

  // AccessTokenFilter must not be a bean: Boot would also register it with the servlet container.
  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http, AccessGate accessGate,
                                                 ObjectMapper objectMapper) throws Exception {
    RequestMatcher allowListed =
        request -> accessGate.isAllowListed(AccessTokenFilter.pathWithinApplication(request));
    http
        .csrf(csrf -> csrf.disable())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .dispatcherTypeMatchers(DispatcherType.ERROR).permitAll()
            .requestMatchers(allowListed).permitAll()
            .anyRequest().authenticated())
        .exceptionHandling(ex -> ex
            .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
        .addFilterBefore(new AccessTokenFilter(accessGate, objectMapper),
            UsernamePasswordAuthenticationFilter.class);
    return http.build();
  }
}
