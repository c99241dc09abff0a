package com.smurthy.ai.insights.service.papers;

import com.smurthy.ai.insights.model.PaperField;
import com.smurthy.ai.insights.model.PaperRecord;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Field-level comparison of an internal paper and the external paper with the same title.
 * {@code diffs} holds only the fields that are not identical.
 */
public record RecordComparison(
        String title,
        PaperRecord internal,
        PaperRecord external,
        List<FieldDiff> diffs
) {

    public boolean hasDifferences() {
        return !diffs.isEmpty();
    }

    public Set<PaperField> differingFields() {
        Set<PaperField> fields = EnumSet.noneOf(PaperField.class);
        diffs.forEach(diff -> fields.add(diff.field()));
        return fields;
    }
}
