package com.example.techpack.application.parser;

import com.example.techpack.domain.model.BaseInformation;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the header facts of a tech pack (buyer, order number, style reference, fit, season and
 * modification date) from {@code label: value} lines.
 */
@Component
public class BaseInformationExtractor {

    private static final int MAX_LINE_LENGTH = 200;
    private static final int MAX_VALUE_LENGTH = 120;

    private enum Field {
        BUYER("buyer\\s*[:\\-]\\s*(.+)"),
        ORDER_NO("(?:order\\s*no\\.?|con\\s*no\\.?|contract\\s*no\\.?)\\s*[:\\-]\\s*(.+)"),
        STYLE_REF("style\\s*ref\\.?\\s*[:\\-]\\s*(.+)"),
        FIT("fit\\s*[:\\-]\\s*(.+)"),
        SEASON("season\\s*[:\\-]\\s*(.+)"),
        MODIFIED("modified\\s*(?:on)?\\s*[:\\-]\\s*(.+)");

        private final Pattern pattern;

        Field(String regex) {
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        }
    }

    /**
     * Scans the lines once. The first field pattern that matches a line consumes it, and each
     * field keeps the first non-empty value it sees.
     *
     * @param lines extracted lines in reading order
     * @return header facts, missing ones as empty strings
     */
    public BaseInformation extract(List<String> lines) {
        Map<Field, String> values = new EnumMap<>(Field.class);
        if (lines != null) {
            for (String rawLine : lines) {
                if (rawLine == null) {
                    continue;
                }
                String line = rawLine.strip();
                if (line.isEmpty() || line.length() > MAX_LINE_LENGTH) {
                    continue;
                }
                for (Field field : Field.values()) {
                    Matcher matcher = field.pattern.matcher(line);
                    if (matcher.find()) {
                        String value = matcher.group(1).strip();
                        if (!value.isEmpty() && !values.containsKey(field)) {
                            values.put(field, truncate(value));
                        }
                        break;
                    }
                }
            }
        }
        return new BaseInformation(
                values.getOrDefault(Field.BUYER, ""),
                values.getOrDefault(Field.ORDER_NO, ""),
                values.getOrDefault(Field.STYLE_REF, ""),
                values.getOrDefault(Field.FIT, ""),
                values.getOrDefault(Field.SEASON, ""),
                values.getOrDefault(Field.MODIFIED, "")
        );
    }

    private static String truncate(String value) {
        return value.length() > MAX_VALUE_LENGTH ? value.substring(0, MAX_VALUE_LENGTH).strip() : value;
    }
}
