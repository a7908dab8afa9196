package com.credential.dedupe.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of {@link TimestampParser}s. The first parser that returns a value wins;
 * when none applies the timestamp is unknown.
 *
 * <p>An unparsable value is never an error: it is logged at debug level and resolved
 * to "no timestamp", which sorts as the oldest possible time.</p>
 */
public class TimestampParserChain {
    private static final Logger log = LoggerFactory.getLogger(TimestampParserChain.class);

    private final List<TimestampParser> parsers;

    public TimestampParserChain(List<TimestampParser> parsers) {
        this.parsers = List.copyOf(parsers);
    }

    /**
     * Returns a new chain with the parser appended after the existing ones.
     */
    public TimestampParserChain with(TimestampParser parser) {
        List<TimestampParser> extended = new ArrayList<>(parsers);
        extended.add(parser);
        return new TimestampParserChain(extended);
    }

    public List<TimestampParser> getParsers() {
        return parsers;
    }

    /**
     * Parses a timestamp string into epoch milliseconds.
     *
     * @param value the raw value (may be null or blank)
     * @return epoch milliseconds, or empty for absent or unparsable values
     */
    public Optional<Long> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (TimestampParser parser : parsers) {
            Optional<Long> result = parser.parse(trimmed);
            if (result.isPresent()) {
                log.trace("timestamp.parsed parser={}", parser.getName());
                return result;
            }
        }
        log.debug("timestamp.unparsable length={}", trimmed.length());
        return Optional.empty();
    }
}
