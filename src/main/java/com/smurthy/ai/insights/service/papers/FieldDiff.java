package com.smurthy.ai.insights.service.papers;

import com.smurthy.ai.insights.model.PaperField;

/**
 * One compared field with its trimmed internal and external values.
 */
public record FieldDiff(
        PaperField field,
        DiffStatus status,
        String internalValue,
        String externalValue
) {
}
