package com.streamraid.engine.api;

public record ApiErrorResponse(String code, String message) {}
