package com.pitwall.dto;

public record InvalidationResponse(Integer sessionKey, long deletedKeys) {}
