package com.smurthy.ai.insights.model;

import java.util.function.Function;

/**
 * Paper fields compared during reconciliation, in display order.
 */
public enum PaperField {

    TITLE("title", "Title", PaperRecord::title),
    JOURNAL("journal", "Journal", PaperRecord::journal),
    AUTHOR("author_name", "Author", PaperRecord::authorName),
    AFFILIATION("affiliation", "Affiliation", PaperRecord::affiliation),
    WEBSITE("website", "Website", PaperRecord::website),
    ADDRESS("address", "Address", PaperRecord::address),
    EMAIL("email", "Email", PaperRecord::email);

    private final String column;
    private final String label;
    private final Function<PaperRecord, String> accessor;

    PaperField(String column, String label, Function<PaperRecord, String> accessor) {
        this.column = column;
        this.label = label;
        this.accessor = accessor;
    }

    public String column() {
        return column;
    }

    public String label() {
        return label;
    }

    public String valueOf(PaperRecord paper) {
        return accessor.apply(paper);
    }
}
