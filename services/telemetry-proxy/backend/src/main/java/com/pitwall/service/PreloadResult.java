package com.pitwall.service;

import com.pitwall.domain.DataCategory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 세션 replay preload 결과
 *
 * @param data             카테고리별 레코드 (실패한 카테고리는 빈 리스트)
 * @param failedCategories 예외로 끝난 카테고리
 */
public record PreloadResult(
        int sessionKey,
        Map<DataCategory, List<?>> data,
        Set<DataCategory> failedCategories,
        long elapsedMs
) {

    public List<?> records(DataCategory category) {
        return data.getOrDefault(category, List.of());
    }

    public boolean complete() {
        return failedCategories.isEmpty();
    }
}
