package com.example.food_search.common.log;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * 요청마다 traceId 를 MDC 에 넣는다. 제공자 호출에도 같은 값이 X-Trace-Id 로 전달된다.
 */
@Component
@Order(1)
public class MdcTraceIdFilter implements Filter {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String HEADER_TRACE_ID = "X-Trace-Id";

    private static final int MAX_TRACE_ID_LENGTH = 64;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        String traceId = resolveTraceId((HttpServletRequest) request);

        MDC.put(TRACE_ID_KEY, traceId);
        ((HttpServletResponse) response).setHeader(HEADER_TRACE_ID, traceId);

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }

    // 헤더 값이 없거나 비정상적으로 길면 새로 만든다
    private String resolveTraceId(HttpServletRequest request) {
        String traceId = request.getHeader(HEADER_TRACE_ID);
        if (traceId == null || traceId.isBlank() || traceId.length() > MAX_TRACE_ID_LENGTH) {
            return UUID.randomUUID().toString().substring(0, 8);
        }
        return traceId.trim();
    }
}
