package com.pitwall.controller;

import com.pitwall.dto.DefaultResponse;
import com.pitwall.dto.InvalidationResponse;
import com.pitwall.service.PreloadOrchestrator;
import com.pitwall.service.PreloadResult;
import com.pitwall.service.ResilientFetchProxy;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
public class SessionReplayController {

    private final PreloadOrchestrator preloadOrchestrator;
    private final ResilientFetchProxy fetchProxy;

    /**
     * replay 시작 전 세션 데이터를 캐시에 적재
     * - 일부 카테고리 실패는 failedCategories 로 보고 (200 유지)
     */
    @PostMapping("/{sessionKey}/preload")
    public ResponseEntity<DefaultResponse<PreloadResult>> preload(@PathVariable int sessionKey) {
        PreloadResult result = preloadOrchestrator.preload(sessionKey);
        return ResponseEntity.ok(DefaultResponse.success(HttpStatus.OK.value(), result));
    }

    @DeleteMapping("/{sessionKey}/cache")
    public ResponseEntity<DefaultResponse<InvalidationResponse>> invalidate(@PathVariable int sessionKey) {
        long deleted = fetchProxy.invalidateSession(sessionKey);
        return ResponseEntity.ok(DefaultResponse.success(
                HttpStatus.OK.value(),
                new InvalidationResponse(sessionKey, deleted)
        ));
    }
}
