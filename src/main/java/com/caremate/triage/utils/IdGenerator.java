package com.caremate.triage.utils;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.Instant;
import java.util.UUID;

/**
 * Time-ordered ids with a random suffix, e.g. {@code APR-20261019101502-3f9a1c0b7d2e}.
 * No shared counter, so concurrent inserts never contend on id generation.
 */
public final class IdGenerator {

    public static final String APPROVAL_PREFIX = "APR";
    public static final String AUDIT_PREFIX = "LOG";
    public static final String REQUEST_PREFIX = "REQ";
    public static final String NOTIFICATION_PREFIX = "NTF";

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss")
            .withZone(ZoneOffset.UTC);

    private IdGenerator() {
    }

    public static String next(String prefix, Instant at) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return prefix + "-" + STAMP.format(at) + "-" + suffix;
    }
}
