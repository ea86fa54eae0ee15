package com.pitwall.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * 요청 단위 trace_id 관리
 */
public final class TraceContext {

    public static final String TRACE_ID_KEY = "trace_id";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private TraceContext() {
    }

    public static String current() {
        return MDC.get(TRACE_ID_KEY);
    }

    public static String generate() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
