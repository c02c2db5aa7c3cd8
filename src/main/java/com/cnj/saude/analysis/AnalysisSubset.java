package com.cnj.saude.analysis;

/**
 * The two record subsets every frequency analysis is computed for.
 */
public enum AnalysisSubset {

    /** Every health-litigation record. */
    ALL_RECORDS("Geral", "geral"),

    /** Records whose defendant is a public entity. */
    PUBLIC_DEFENDANT("vs Entes Publicos", "entes_publicos");

    private final String label;
    private final String slug;

    AnalysisSubset(String label, String slug) {
        this.label = label;
        this.slug = slug;
    }

    /**
     * @return human-readable label used in report titles
     */
    public String getLabel() {
        return label;
    }

    /**
     * @return file-name fragment used for per-table exports
     */
    public String getSlug() {
        return slug;
    }
}
