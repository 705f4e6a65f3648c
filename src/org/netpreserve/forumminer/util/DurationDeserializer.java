package org.netpreserve.forumminer.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads durations written as plain milliseconds ({@code 1500}), as unit strings ({@code 2s}, {@code 1m30s},
 * {@code 1.5s}, {@code 250ms}) or in ISO-8601 form ({@code PT2S}).
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    private static final Pattern PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|h|m|s)");

    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        return parse(jsonParser.getText());
    }

    public static Duration parse(String text) throws IOException {
        String value = text.strip().toLowerCase(Locale.ROOT);
        if (value.startsWith("pt")) {
            return Duration.parse(value.toUpperCase(Locale.ROOT));
        }
        Matcher matcher = PART.matcher(value);
        Duration total = Duration.ZERO;
        int end = 0;
        while (matcher.find()) {
            if (matcher.start() != end) break;
            BigDecimal amount = new BigDecimal(matcher.group(1));
            long millisPerUnit = switch (matcher.group(2)) {
                case "h" -> 3_600_000L;
                case "m" -> 60_000L;
                case "s" -> 1_000L;
                default -> 1L;
            };
            total = total.plusMillis(amount.multiply(BigDecimal.valueOf(millisPerUnit)).longValue());
            end = matcher.end();
        }
        if (end == 0 || end != value.length()) {
            throw new IOException("Invalid duration format: " + text);
        }
        return total;
    }
}
