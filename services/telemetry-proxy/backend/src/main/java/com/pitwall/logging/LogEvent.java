package com.pitwall.logging;

public final class LogEvent {

    private LogEvent() {
        // 인스턴스 생성 방지
    }

    /** 관측 대상 작업 시작 (preload, 캐시 무효화) */
    public static final String OPERATION_START = "OPERATION_START";

    /** 관측 대상 작업 정상 종료 */
    public static final String OPERATION_END = "OPERATION_END";

    /** 비치명적 실패 (circuit open, upstream 장애 등) */
    public static final String OPERATION_FAIL = "OPERATION_FAIL";

    /** 치명적 오류로 인한 작업 실패 */
    public static final String OPERATION_ERROR = "OPERATION_ERROR";

    /** CircuitBreaker fallback 반환 */
    public static final String FALLBACK = "FALLBACK";

    /** CircuitBreaker OPEN 상태로 요청 거부 */
    public static final String CIRCUIT_OPEN = "CIRCUIT_OPEN";

    /** CircuitBreaker 상태 전환 */
    public static final String CIRCUIT_TRANSITION = "CIRCUIT_TRANSITION";

    /** CircuitBreaker 수동 리셋 */
    public static final String CIRCUIT_RESET = "CIRCUIT_RESET";

    /** Upstream 호출 실패 */
    public static final String UPSTREAM_FAILURE = "UPSTREAM_FAILURE";

    /** 캐시 저장소 연결 불가 → always-miss 모드 */
    public static final String CACHE_UNAVAILABLE = "CACHE_UNAVAILABLE";

    /** 캐시 저장소 연결 복구 */
    public static final String CACHE_READY = "CACHE_READY";

    /** 캐시 namespace 전체 삭제 */
    public static final String CACHE_FLUSHED = "CACHE_FLUSHED";

    /** 캐시 payload 역직렬화 실패 */
    public static final String CACHE_CORRUPTED = "CACHE_CORRUPTED";

    /** 세션 preload 중 카테고리 실패 */
    public static final String PRELOAD_CATEGORY_FAILED = "PRELOAD_CATEGORY_FAILED";

    /** 비즈니스 예외(ApiException) 발생 */
    public static final String BUSINESS_EXCEPTION = "BUSINESS_EXCEPTION";

    /** 예상하지 못한 시스템 예외 */
    public static final String UNHANDLED_EXCEPTION = "UNHANDLED_EXCEPTION";

}
