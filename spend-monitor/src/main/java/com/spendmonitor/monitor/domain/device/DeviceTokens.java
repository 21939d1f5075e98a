package com.spendmonitor.monitor.domain.device;

import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class DeviceTokens {

    private static final Pattern TOKEN_PATTERN = Pattern.compile("^[0-9a-fA-F]{64}$");

    public static boolean isWellFormed(String token) {
        return token != null && TOKEN_PATTERN.matcher(token).matches();
    }

    /**
     * First eight characters, for log lines.
     */
    public static String preview(String token) {
        if (token == null) {
            return "null";
        }
        return token.length() <= 8 ? token : token.substring(0, 8) + "...";
    }
}
