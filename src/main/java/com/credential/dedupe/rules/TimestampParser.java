package com.credential.dedupe.rules;

import java.util.Optional;

/**
 * One attempt at interpreting a provider timestamp string as epoch milliseconds.
 * Parsers are chained by {@link TimestampParserChain}; a parser that does not
 * recognize its input returns an empty result instead of throwing.
 */
public interface TimestampParser {

    /**
     * Name used in debug logging.
     */
    String getName();

    /**
     * Parses the trimmed, non-empty value.
     *
     * @param value the raw value, already trimmed and never empty
     * @return epoch milliseconds, or empty if this parser does not apply
     */
    Optional<Long> parse(String value);
}
