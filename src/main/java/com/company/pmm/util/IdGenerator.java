package com.company.pmm.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Produces ids like {@code SIG-20250101120000-0001}. The trailing sequence is
 * process-wide and strictly increasing, which makes ids unique per prefix.
 */
public class IdGenerator {

    private final String prefix;
    private final DateTimeFormatter formatter;
    private final AtomicLong sequence = new AtomicLong();

    public IdGenerator(String prefix, String datePattern) {
        this.prefix = prefix;
        this.formatter = DateTimeFormatter.ofPattern(datePattern).withZone(ZoneOffset.UTC);
    }

    public String next(Instant now) {
        return String.format("%s-%s-%04d", prefix, formatter.format(now), sequence.incrementAndGet());
    }

    /**
     * Numeric sequence after the last '-', or -1 when the id has no numeric suffix.
     * Ids minted in the same second order by this value, not by their text.
     */
    public static long sequenceOf(String id) {
        String suffix = id.substring(id.lastIndexOf('-') + 1);
        if (suffix.isEmpty() || suffix.length() > 18 || !suffix.chars().allMatch(Character::isDigit)) {
            return -1;
        }
        return Long.parseLong(suffix);
    }
}
