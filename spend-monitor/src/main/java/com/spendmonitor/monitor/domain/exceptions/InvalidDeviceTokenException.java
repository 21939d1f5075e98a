package com.spendmonitor.monitor.domain.exceptions;

public class InvalidDeviceTokenException extends ValidationException {

    private InvalidDeviceTokenException(String message) {
        super(message);
    }

    public static InvalidDeviceTokenException of(String token) {
        var length = token == null ? 0 : token.length();
        return new InvalidDeviceTokenException(
                "Device token must be 64 hexadecimal characters, got " + length + " characters");
    }
}
