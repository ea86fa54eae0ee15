package com.pitwall.controller;

import com.pitwall.dto.DefaultResponse;
import com.pitwall.dto.InvalidationResponse;
import com.pitwall.service.ResilientFetchProxy;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/cache")
@RequiredArgsConstructor
public class CacheAdminController {

    private final ResilientFetchProxy fetchProxy;

    /**
     * 캐시 namespace 전체 삭제
     */
    @DeleteMapping
    public ResponseEntity<DefaultResponse<InvalidationResponse>> flush() {
        long deleted = fetchProxy.invalidateAll();
        return ResponseEntity.ok(DefaultResponse.success(
                HttpStatus.OK.value(),
                new InvalidationResponse(null, deleted)
        ));
    }
}
