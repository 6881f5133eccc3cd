package com.platform.planner.observability;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation IDs for requests and plan context in
 * the MDC.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_PLAN_ID = "planId";
    public static final String MDC_MARKET_ID = "marketId";
    
    @Value("${spring.application.name:capacity-planner}")
    private String applicationName;
    
    @PostConstruct
    public void init() {
        log.info("Logging configuration initialized for application: {}", applicationName);
    }
    
    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        static final String MDC_CORRELATION_ID = "correlationId";
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }
                
                MDC.put(MDC_CORRELATION_ID, correlationId);
                response.setHeader(CORRELATION_ID_HEADER, correlationId);
                
                filterChain.doFilter(request, response);
                
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
    }
    
    /**
     * Set plan information in MDC for logging.
     */
    public static void setPlanContext(String planId, String marketId) {
        MDC.put(MDC_PLAN_ID, planId);
        if (marketId != null) {
            MDC.put(MDC_MARKET_ID, marketId);
        }
    }
    
    public static void clearPlanContext() {
        MDC.remove(MDC_PLAN_ID);
        MDC.remove(MDC_MARKET_ID);
    }
}
