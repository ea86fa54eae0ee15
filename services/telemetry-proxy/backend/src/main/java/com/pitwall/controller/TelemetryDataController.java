package com.pitwall.controller;

import com.pitwall.domain.DataCategory;
import com.pitwall.domain.FetchParams;
import com.pitwall.dto.DefaultResponse;
import com.pitwall.exception.ApiException;
import com.pitwall.service.ResilientFetchProxy;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 카테고리 단위 원본 레코드 조회 (cache-aside 경유)
 *
 * 예) GET /api/v1/data/laps?session_key=9158&driver_number=1
 */
@RestController
@RequestMapping("/api/v1/data")
@RequiredArgsConstructor
public class TelemetryDataController {

    private final ResilientFetchProxy fetchProxy;

    @GetMapping("/{category}")
    public ResponseEntity<DefaultResponse<List<?>>> fetch(
            @PathVariable String category,
            @RequestParam Map<String, String> query
    ) {
        DataCategory dataCategory = DataCategory.fromPath(category)
                .orElseThrow(() -> new ApiException(
                        "UNKNOWN_CATEGORY",
                        "unknown data category: " + category,
                        HttpStatus.NOT_FOUND
                ));

        List<?> records = fetchProxy.fetch(dataCategory, FetchParams.fromQuery(query));

        return ResponseEntity.ok(DefaultResponse.<List<?>>success(HttpStatus.OK.value(), records));
    }
}
