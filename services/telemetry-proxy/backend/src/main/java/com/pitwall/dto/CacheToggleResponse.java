package com.pitwall.dto;

/**
 * @param message 예: "ON -> OFF"
 */
public record CacheToggleResponse(boolean enabled, String message) {}
