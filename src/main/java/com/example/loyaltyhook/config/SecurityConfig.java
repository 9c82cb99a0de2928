package com.example.loyaltyhook.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Spring Security 配置
 *
 * 安全规则:
 * 开放：/webhooks/** (Webhook 摄入端点，依靠 HMAC 验签鉴权)
 * 开放：/actuator/health/**
 * 保护：其余端点（含 /actuator/**）需要 ADMIN 角色
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

        @Bean
        public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
                http
                                // 平台回调无法携带 CSRF Token
                                .csrf(csrf -> csrf
                                                .ignoringRequestMatchers("/webhooks/**"))
                                .sessionManagement(session -> session
                                                .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                                .authorizeHttpRequests(auth -> auth
                                                .requestMatchers("/webhooks/**").permitAll()
                                                .requestMatchers("/actuator/health", "/actuator/health/**", "/error")
                                                .permitAll()
                                                .anyRequest().hasRole("ADMIN"))
                                .httpBasic(Customizer.withDefaults());

                return http.build();
        }
}
