package com.pitwall.logging;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.event.Level;
import org.springframework.stereotype.Component;

import java.util.Arrays;

@Aspect
@Component
@Slf4j
public class LogAspect {

    /**
     * 세션 preload / 캐시 무효화 작업에만 적용 (fetch 단건은 제외)
     */
    @Around(
            "execution(* com.pitwall.service.PreloadOrchestrator.preload(..)) || " +
                    "execution(* com.pitwall.service.ResilientFetchProxy.invalidate*(..))"
    )
    public Object logOperation(ProceedingJoinPoint joinPoint) throws Throwable {

        long start = System.currentTimeMillis();
        String method = joinPoint.getSignature().getName();
        String args = Arrays.toString(joinPoint.getArgs());

        log.info("event={} method={} args={}", LogEvent.OPERATION_START, method, args);

        try {
            Object result = joinPoint.proceed();

            long duration = System.currentTimeMillis() - start;
            log.info("event={} method={} durationMs={}", LogEvent.OPERATION_END, method, duration);

            return result;

        } catch (Exception e) {
            long duration = System.currentTimeMillis() - start;

            Level level = LogLevelPolicy.decideByException(e);

            if (level == Level.WARN) {
                log.warn(
                        "event={} method={} durationMs={} message={}",
                        LogEvent.OPERATION_FAIL,
                        method,
                        duration,
                        e.getMessage()
                );

            } else {
                log.error(
                        "event={} method={} durationMs={} message={}",
                        LogEvent.OPERATION_ERROR,
                        method,
                        duration,
                        e.getMessage(),
                        e
                );
            }
            throw e;
        }
        // trace_id clear 금지 (요청 종료 시 Filter에서 일괄 처리)
    }
}
