package com.cnj.saude.analysis;

import com.cnj.saude.config.PipelineConfig;
import com.cnj.saude.tabular.MultiValues;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a legal-nature cell describes a public entity (municipality, state, federal
 * agency and so on) by keyword containment.
 *
 * <p>Each item of a multi-valued cell is upper-cased and stripped of accents before the keywords
 * are searched, so {@code "Município"} matches {@code MUNICIPIO}.
 */
public class PublicEntityMatcher {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private final List<String> keywords;

    public PublicEntityMatcher(PipelineConfig config) {
        this(config.getPublicEntityKeywords());
    }

    public PublicEntityMatcher(List<String> keywords) {
        List<String> normalized = new ArrayList<>(keywords.size());
        for (String keyword : keywords) {
            normalized.add(normalize(keyword));
        }
        this.keywords = List.copyOf(normalized);
    }

    public boolean matches(String legalNatureCell) {
        for (String item : MultiValues.split(legalNatureCell)) {
            String value = normalize(item);
            for (String keyword : keywords) {
                if (value.contains(keyword)) {
                    return true;
                }
            }
        }
        return false;
    }

    static String normalize(String text) {
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("").toUpperCase(Locale.ROOT).strip();
    }
}
