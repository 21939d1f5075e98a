package com.spendmonitor.monitor.application.controller;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ErrorCodes {

    public static final String DEVICE_NOT_FOUND = "DEVICE_NOT_FOUND";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String INVALID_DEVICE_TOKEN = "INVALID_DEVICE_TOKEN";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String RATE_LIMITED = "RATE_LIMITED";
    public static final String BACKEND_UNAVAILABLE = "BACKEND_UNAVAILABLE";
    public static final String BACKEND_REJECTED = "BACKEND_REJECTED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
