package com.pitwall.service;

import com.pitwall.domain.DataCategory;
import com.pitwall.domain.FetchParams;
import com.pitwall.logging.LogEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 세션 replay 데이터 병렬 preload
 *
 * - 카테고리마다 ResilientFetchProxy.fetch 를 동시에 시작하고 모두 끝날 때까지 대기
 * - 한 카테고리의 실패는 빈 리스트 + 실패 기록으로 대체, preload 자체는 실패하지 않는다
 * - timeout 을 넘긴 카테고리도 실패로 기록한다 (진행 중인 fetch 는 끝까지 실행되어 캐시를 채운다)
 */
@Slf4j
public class PreloadOrchestrator {

    private final ResilientFetchProxy fetchProxy;
    private final Executor executor;
    private final List<DataCategory> categories;
    private final Duration timeout;

    public PreloadOrchestrator(ResilientFetchProxy fetchProxy,
                               Executor executor,
                               List<DataCategory> categories,
                               Duration timeout) {
        this.fetchProxy = Objects.requireNonNull(fetchProxy, "fetchProxy must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");

        if (categories == null || categories.isEmpty()) {
            throw new IllegalArgumentException("preload categories must not be empty");
        }
        this.categories = List.copyOf(categories);

        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("preload timeout must be positive");
        }
        this.timeout = timeout;
    }

    public PreloadResult preload(int sessionKey) {
        long start = System.currentTimeMillis();
        FetchParams params = FetchParams.forSession(sessionKey);

        Map<DataCategory, CompletableFuture<Outcome>> futures = new LinkedHashMap<>();
        for (DataCategory category : categories) {
            futures.put(category, start(category, params));
        }

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<DataCategory, List<?>> data = new EnumMap<>(DataCategory.class);
        Set<DataCategory> failed = EnumSet.noneOf(DataCategory.class);

        futures.forEach((category, future) -> {
            Outcome outcome = future.join();
            data.put(category, outcome.records());
            if (outcome.failed()) {
                failed.add(category);
            }
        });

        long elapsedMs = System.currentTimeMillis() - start;

        log.info(
                "Preloaded session={} records={} failed={} durationMs={}",
                sessionKey,
                summarize(data),
                failed,
                elapsedMs
        );

        return new PreloadResult(
                sessionKey,
                Collections.unmodifiableMap(data),
                Collections.unmodifiableSet(failed),
                elapsedMs
        );
    }

    public List<DataCategory> getCategories() {
        return categories;
    }

    private CompletableFuture<Outcome> start(DataCategory category, FetchParams params) {
        CompletableFuture<List<?>> fetch;
        try {
            fetch = CompletableFuture.supplyAsync(() -> fetchProxy.fetch(category, params), executor);
        } catch (RuntimeException e) {
            // executor 포화(RejectedExecutionException) 도 카테고리 실패로 취급
            fetch = CompletableFuture.failedFuture(e);
        }

        return fetch.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).handle((records, error) -> {
            if (error == null) {
                return new Outcome(records, false);
            }

            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            log.warn(
                    "event={} session={} category={} cause={}",
                    LogEvent.PRELOAD_CATEGORY_FAILED,
                    params.getSessionKey(),
                    category,
                    cause.toString()
            );
            return new Outcome(List.of(), true);
        });
    }

    private static String summarize(Map<DataCategory, List<?>> data) {
        return data.entrySet().stream()
                .map(e -> e.getKey().getPath() + "=" + e.getValue().size())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private record Outcome(List<?> records, boolean failed) {
    }
}
