package com.linlay.assistantgw.config;

import com.linlay.assistantgw.security.ApiJwtAuthWebFilter;
import com.linlay.assistantgw.security.JwtTokenVerifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class SecurityConfiguration {

    @Bean
    public JwtTokenVerifier jwtTokenVerifier(AppAuthProperties properties) {
        return new JwtTokenVerifier(properties);
    }

    @Bean
    public ApiJwtAuthWebFilter apiJwtAuthWebFilter(AppAuthProperties properties, JwtTokenVerifier jwtTokenVerifier) {
        return new ApiJwtAuthWebFilter(properties, jwtTokenVerifier);
    }
}
