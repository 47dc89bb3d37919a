package com.example.scheduler.api;

public record ApiErrorResponse(String code, String message) {}
