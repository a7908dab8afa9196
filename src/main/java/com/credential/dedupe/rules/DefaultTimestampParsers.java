package com.credential.dedupe.rules;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Built-in timestamp parsers: epoch seconds, epoch milliseconds and the ISO-8601
 * shapes seen in password manager exports. Date-times without an offset are read as UTC.
 */
public final class DefaultTimestampParsers {

    /**
     * Integers with more digits than this are milliseconds. Eleven digits of seconds
     * already reach past the year 5000.
     */
    static final int MAX_EPOCH_SECONDS_DIGITS = 11;

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+");

    private static final TimestampParserChain DEFAULT_CHAIN = new TimestampParserChain(List.of(
            epochSeconds(),
            epochMillis(),
            isoInstant(),
            isoOffsetDateTime(),
            localDateTime("iso-local-date-time", DateTimeFormatter.ISO_LOCAL_DATE_TIME),
            localDateTime("space-separated-date-time", DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss][.SSS]")),
            isoDate()
    ));

    private DefaultTimestampParsers() {
        // Utility class
    }

    /**
     * Returns the shared default chain. Chains are immutable, so sharing is safe.
     */
    public static TimestampParserChain defaultChain() {
        return DEFAULT_CHAIN;
    }

    /**
     * Integer or decimal epoch seconds, e.g. {@code 1700000000} or {@code 1700000000.25}.
     */
    public static TimestampParser epochSeconds() {
        return parser("epoch-seconds", value -> {
            String digits = value.startsWith("-") ? value.substring(1) : value;
            if (INTEGER.matcher(value).matches() && digits.length() <= MAX_EPOCH_SECONDS_DIGITS) {
                return Optional.of(Long.parseLong(value) * 1000L);
            }
            if (DECIMAL.matcher(value).matches()) {
                try {
                    return Optional.of(new BigDecimal(value).movePointRight(3)
                            .setScale(0, RoundingMode.DOWN)
                            .longValueExact());
                } catch (ArithmeticException e) {
                    return Optional.empty();
                }
            }
            return Optional.empty();
        });
    }

    /**
     * Integer epoch milliseconds, e.g. {@code 1700000000000}.
     */
    public static TimestampParser epochMillis() {
        return parser("epoch-millis", value -> {
            if (!INTEGER.matcher(value).matches()) {
                return Optional.empty();
            }
            try {
                return Optional.of(Long.parseLong(value));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        });
    }

    /**
     * {@code 2024-01-31T10:15:30Z} and {@code 2024-01-31T10:15:30.123Z}.
     */
    public static TimestampParser isoInstant() {
        return parser("iso-instant", value -> {
            try {
                return Optional.of(Instant.parse(value).toEpochMilli());
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        });
    }

    /**
     * {@code 2024-01-31T10:15:30+02:00}.
     */
    public static TimestampParser isoOffsetDateTime() {
        return parser("iso-offset-date-time", value -> {
            try {
                return Optional.of(OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                        .toInstant().toEpochMilli());
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        });
    }

    /**
     * Date-time without offset, read as UTC.
     */
    public static TimestampParser localDateTime(String name, DateTimeFormatter formatter) {
        return parser(name, value -> {
            try {
                return Optional.of(LocalDateTime.parse(value, formatter)
                        .toInstant(ZoneOffset.UTC).toEpochMilli());
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        });
    }

    /**
     * {@code 2024-01-31}, read as the start of that day in UTC.
     */
    public static TimestampParser isoDate() {
        return parser("iso-date", value -> {
            try {
                return Optional.of(LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE)
                        .atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli());
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        });
    }

    private static TimestampParser parser(String name, Function<String, Optional<Long>> fn) {
        return new TimestampParser() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public Optional<Long> parse(String value) {
                return fn.apply(value);
            }

            @Override
            public String toString() {
                return "TimestampParser{" + name + '}';
            }
        };
    }
}
