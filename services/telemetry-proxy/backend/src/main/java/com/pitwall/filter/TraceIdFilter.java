package com.pitwall.filter;

import com.pitwall.logging.TraceContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * HTTP 요청 단위 trace_id 생성 및 MDC 전파용 Filter
 */
public class TraceIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        // 외부에서 trace_id를 전달한 경우 재사용, 없으면 새로 생성
        String traceId = request.getHeader(TraceContext.TRACE_ID_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = TraceContext.generate();
        }

        MDC.put(TraceContext.TRACE_ID_KEY, traceId);
        response.setHeader(TraceContext.TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // 서버 쓰레드 재사용으로 인한 trace_id 오염 방지
            MDC.remove(TraceContext.TRACE_ID_KEY);
        }
    }
}
