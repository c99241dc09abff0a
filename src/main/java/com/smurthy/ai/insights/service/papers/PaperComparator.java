package com.smurthy.ai.insights.service.papers;

import com.smurthy.ai.insights.model.PaperField;
import com.smurthy.ai.insights.model.PaperRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares an internal paper with an external one field by field.
 *
 * Values are trimmed before comparison. An empty external value never produces a diff.
 */
public class PaperComparator {

    public RecordComparison compare(PaperRecord internal, PaperRecord external) {
        List<FieldDiff> diffs = new ArrayList<>();
        for (PaperField field : PaperField.values()) {
            FieldDiff diff = compareField(field, field.valueOf(internal), field.valueOf(external));
            if (diff.status() != DiffStatus.IDENTICAL) {
                diffs.add(diff);
            }
        }
        return new RecordComparison(external.title(), internal, external, List.copyOf(diffs));
    }

    FieldDiff compareField(PaperField field, String internalValue, String externalValue) {
        String internal = trim(internalValue);
        String external = trim(externalValue);

        DiffStatus status;
        if (external.isEmpty()) {
            status = DiffStatus.IDENTICAL;
        } else if (internal.isEmpty()) {
            status = DiffStatus.MISSING_INTERNAL;
        } else if (!internal.equals(external)) {
            status = DiffStatus.DIFFERENT;
        } else {
            status = DiffStatus.IDENTICAL;
        }
        return new FieldDiff(field, status, internal, external);
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
