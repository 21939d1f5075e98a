package com.spendmonitor.monitor.domain.exceptions;

import lombok.Getter;

@Getter
public class PayloadTooLargeException extends ValidationException {

    private final int size;
    private final int limit;

    private PayloadTooLargeException(int size, int limit) {
        super("Push payload is " + size + " bytes, limit is " + limit);
        this.size = size;
        this.limit = limit;
    }

    public static PayloadTooLargeException of(int size, int limit) {
        return new PayloadTooLargeException(size, limit);
    }
}
