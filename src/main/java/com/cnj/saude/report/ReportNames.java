package com.cnj.saude.report;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * File-name and PDF-safe forms of report labels.
 */
final class ReportNames {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");
    private static final Pattern NON_PRINTABLE_ASCII = Pattern.compile("[^\\x20-\\x7E]");

    private ReportNames() {
    }

    /**
     * {@code "Polo passivo - Natureza juridica" -> "polo_passivo_natureza_juridica"}
     */
    static String slug(String label) {
        String ascii = stripAccents(label).toLowerCase(Locale.ROOT);
        String slug = NON_SLUG.matcher(ascii).replaceAll("_");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '_') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '_') {
            end--;
        }
        return start == end ? "vazio" : slug.substring(start, end);
    }

    /**
     * Reduces text to what the standard Type 1 fonts can draw.
     */
    static String pdfSafe(String text) {
        if (text == null) {
            return "";
        }
        return NON_PRINTABLE_ASCII.matcher(stripAccents(text)).replaceAll("?");
    }

    private static String stripAccents(String text) {
        return COMBINING_MARKS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD)).replaceAll("");
    }
}
