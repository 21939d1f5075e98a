package com.spendmonitor.common.id;

import java.security.SecureRandom;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Time-ordered identifiers for alerts and pipeline runs.
 *
 * <p>Alert ids keep the {@code spend-alert-<epochMillis>} shape the mobile client
 * parses, followed by a random Crockford Base32 suffix so two payloads built in the
 * same millisecond never share an id. Run ids are 26-char ULID-style strings.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class IdGenerator {

    private static final char[] CROCKFORD = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int TIME_CHARS = 10;
    private static final int RANDOM_CHARS = 16;
    private static final int ALERT_SUFFIX_CHARS = 6;

    public static String alertId(Instant createdAt) {
        return "spend-alert-" + createdAt.toEpochMilli() + "-" + randomChars(ALERT_SUFFIX_CHARS);
    }

    public static String runId() {
        return runId(Instant.now());
    }

    public static String runId(Instant startedAt) {
        var builder = new StringBuilder(TIME_CHARS + RANDOM_CHARS);
        long millis = startedAt.toEpochMilli();
        for (int shift = (TIME_CHARS - 1) * 5; shift >= 0; shift -= 5) {
            builder.append(CROCKFORD[(int) ((millis >>> shift) & 0x1F)]);
        }
        return builder.append(randomChars(RANDOM_CHARS)).toString();
    }

    private static String randomChars(int count) {
        var chars = new char[count];
        for (int i = 0; i < count; i++) {
            chars[i] = CROCKFORD[RANDOM.nextInt(CROCKFORD.length)];
        }
        return new String(chars);
    }
}
