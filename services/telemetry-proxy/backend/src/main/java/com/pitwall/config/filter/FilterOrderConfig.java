package com.pitwall.config.filter;

import com.pitwall.filter.TraceIdFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Filter 실행 순서를 명시적으로 고정
 *
 * 로직은 Filter에 두고, 이 클래스는 "순서"만 책임
 */
@Configuration
public class FilterOrderConfig {

    @Bean
    public FilterRegistrationBean<TraceIdFilter> traceIdFilterRegistration() {
        FilterRegistrationBean<TraceIdFilter> registration = new FilterRegistrationBean<>();
        registration.setFilter(new TraceIdFilter());

        // trace_id 가 가장 먼저 생성되어야 이후 모든 로그에 포함된다
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE);

        return registration;
    }
}
