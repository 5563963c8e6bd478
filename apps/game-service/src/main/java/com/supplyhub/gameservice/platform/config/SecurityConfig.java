package com.supplyhub.gameservice.platform.config;

import com.supplyhub.gameservice.games.beergame.config.BeerGameProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;

/**
 * 最小化的安全配置（Resource Server）
 * -------------------------------------------------------
 *  - 只开启 JWT 资源服务器能力，issuer-uri 由 application.yml 提供。
 *  - 放行 /actuator/** 与 STOMP 握手端点（握手后在 CONNECT 帧里校验 token）。
 *  - 其余路径要求已认证；管理员角色在控制器中按 realm 角色判断。
 */
@Configuration
public class SecurityConfig {

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http, BeerGameProperties properties) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/actuator/**").permitAll()
                        .requestMatchers(properties.getWsEndpoint(), properties.getWsEndpoint() + "/**").permitAll()
                        .anyRequest().authenticated()
                )
                .oauth2ResourceServer(oauth -> oauth.jwt(Customizer.withDefaults()));
        return http.build();
    }
}
