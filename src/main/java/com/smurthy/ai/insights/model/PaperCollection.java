package com.smurthy.ai.insights.model;

/**
 * The two parallel paper record sets.
 */
public enum PaperCollection {

    /** Mutable, authoritative records owned by this system. */
    INTERNAL("internal_surgeon_papers"),

    /** Read-only reference records. */
    EXTERNAL("surgeon_papers");

    private final String tableName;

    PaperCollection(String tableName) {
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
