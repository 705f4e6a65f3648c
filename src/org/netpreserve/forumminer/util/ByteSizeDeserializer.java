package org.netpreserve.forumminer.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads byte sizes written as plain numbers or with a binary unit suffix ({@code 512K}, {@code 50MB}, {@code 1.5GB}).
 */
public class ByteSizeDeserializer extends JsonDeserializer<Long> {
    private static final Pattern SIZE_PATTERN =
            Pattern.compile("(?i)\\s*(\\d+(?:\\.\\d+)?)\\s*([KMGT]?)(?:I?B)?\\s*");
    private static final String UNITS = "KMGT";

    @Override
    public Long deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return jsonParser.getLongValue();
        return parse(jsonParser.getText());
    }

    public static long parse(String text) throws IOException {
        Matcher matcher = SIZE_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new IOException("Invalid byte size format: " + text);
        }
        double value = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2).toUpperCase(Locale.ROOT);
        int exponent = unit.isEmpty() ? 0 : UNITS.indexOf(unit) + 1;
        return (long) (value * (1L << (10 * exponent)));
    }
}
