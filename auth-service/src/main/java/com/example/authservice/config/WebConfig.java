package com.example.authservice.config;

import com.example.authservice.gate.AuthGates;
import com.example.authservice.web.GateInterceptor;
import com.example.authservice.web.PrincipalContextHelper;
import com.example.authservice.web.RequestIdFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Servlet wiring: request id filter first, gate interceptor in front of every handler.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AuthGates authGates;
    private final ObjectMapper objectMapper;

    public WebConfig(AuthGates authGates, ObjectMapper objectMapper) {
        this.authGates = authGates;
        this.objectMapper = objectMapper;
    }

    @Bean
    public FilterRegistrationBean<RequestIdFilter> requestIdFilter() {
        FilterRegistrationBean<RequestIdFilter> registration = new FilterRegistrationBean<>(new RequestIdFilter());
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 1);
        registration.addUrlPatterns("/*");
        return registration;
    }

    @Bean
    public GateInterceptor gateInterceptor() {
        return new GateInterceptor(authGates, objectMapper);
    }

    @Bean
    public PrincipalContextHelper principalContextHelper() {
        return new PrincipalContextHelper();
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(gateInterceptor());
    }
}
