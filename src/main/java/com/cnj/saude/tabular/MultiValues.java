package com.cnj.saude.tabular;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing helpers for CNJ cells that pack several values, e.g. {@code {12480, 10028}}.
 */
public final class MultiValues {

    private static final Pattern SEPARATOR = Pattern.compile("\\s*,\\s*");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final int MAX_CODE_DIGITS = 9;

    private MultiValues() {
    }

    /**
     * Splits a cell into its trimmed, non-empty items. Surrounding braces are optional.
     */
    public static List<String> split(String cell) {
        List<String> items = new ArrayList<>();
        if (cell == null) {
            return items;
        }
        String text = cell.strip();
        if (text.startsWith("{") && text.endsWith("}")) {
            text = text.substring(1, text.length() - 1);
        }
        for (String item : SEPARATOR.split(text)) {
            String trimmed = item.strip();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    /**
     * Extracts every run of digits in the cell as an integer code. Runs longer than nine
     * digits are skipped.
     */
    public static List<Integer> codes(String cell) {
        List<Integer> codes = new ArrayList<>();
        if (cell == null) {
            return codes;
        }
        Matcher matcher = DIGITS.matcher(cell);
        while (matcher.find()) {
            String digits = matcher.group();
            if (digits.length() <= MAX_CODE_DIGITS) {
                codes.add(Integer.parseInt(digits));
            }
        }
        return codes;
    }
}
