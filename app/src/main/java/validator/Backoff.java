package validator;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.OptionalLong;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

// Exponential backoff with +/-25% jitter, plus Retry-After parsing.
public class Backoff {

    static final double JITTER_FRACTION = 0.25;

    // Server-directed waits beyond this are treated as this
    static final long MAX_RETRY_AFTER_MILLIS = 3_600_000L;

    private static final Pattern LEADING_SECONDS = Pattern.compile("^([+-]?)(\\d+)");

    private final long baseMillis;
    private final long maxMillis;
    private final DoubleSupplier random;

    public Backoff(long baseMillis, long maxMillis) {
        this(baseMillis, maxMillis, () -> ThreadLocalRandom.current().nextDouble());
    }

    // random must yield values in [0, 1)
    public Backoff(long baseMillis, long maxMillis, DoubleSupplier random) {
        if (baseMillis < 0 || maxMillis < baseMillis) {
            throw new IllegalArgumentException("Backoff needs 0 <= base <= max, got " + baseMillis + ".." + maxMillis);
        }
        this.baseMillis = baseMillis;
        this.maxMillis = maxMillis;
        this.random = random;
    }

    // base * 2^(attempt-1), clamped to [base, max]. attempt is 1-based.
    public long delayFor(long attempt) {
        int shift = (int) Math.min(Math.max(attempt - 1, 0L), 30L);
        long raw = baseMillis << shift;
        return Math.min(maxMillis, Math.max(baseMillis, raw));
    }

    public long jitteredDelayFor(long attempt) {
        return jitter(delayFor(attempt));
    }

    long jitter(long millis) {
        double delta = millis * JITTER_FRACTION;
        double offset = (random.getAsDouble() * 2 - 1) * delta;
        return Math.max(0L, Math.round(millis + offset));
    }

    // Retry-After as milliseconds: leading integer seconds or an RFC 1123 date (0 once past).
    // Empty when absent or unreadable. Capped at MAX_RETRY_AFTER_MILLIS.
    public static OptionalLong parseRetryAfterMillis(String headerValue, Instant now) {
        if (headerValue == null) return OptionalLong.empty();
        String value = headerValue.trim();
        if (value.isEmpty()) return OptionalLong.empty();

        // Leading integer, so "120abc" is 120 s and "1.5" is 1 s
        Matcher m = LEADING_SECONDS.matcher(value);
        if (m.find()) {
            if (m.group(1).equals("-")) return OptionalLong.of(0L);
            String digits = m.group(2).replaceFirst("^0+(?=\\d)", "");
            // more digits than the cap can need: no point parsing, and it could overflow
            if (digits.length() > 9) return OptionalLong.of(MAX_RETRY_AFTER_MILLIS);
            return OptionalLong.of(Math.min(MAX_RETRY_AFTER_MILLIS, Long.parseLong(digits) * 1000L));
        }

        try {
            Instant at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            long delta = at.toEpochMilli() - now.toEpochMilli();
            return OptionalLong.of(Math.min(MAX_RETRY_AFTER_MILLIS, Math.max(0L, delta)));
        } catch (DateTimeParseException e) {
            return OptionalLong.empty();
        }
    }
}
