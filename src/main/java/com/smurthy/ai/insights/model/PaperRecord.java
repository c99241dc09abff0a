package com.smurthy.ai.insights.model;

/**
 * A surgeon paper. The same schema is used by the internal (authoritative) and
 * external (reference) collections; {@code id} is only meaningful for internal records.
 */
public record PaperRecord(
        String id,
        String title,
        String journal,
        String authorName,
        String affiliation,
        String website,
        String address,
        String email
) {

    public PaperRecord withoutId() {
        return new PaperRecord(null, title, journal, authorName, affiliation, website, address, email);
    }
}
