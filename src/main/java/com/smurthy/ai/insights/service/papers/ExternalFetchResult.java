package com.smurthy.ai.insights.service.papers;

import com.smurthy.ai.insights.model.PaperRecord;

import java.util.List;

/**
 * Internal and external papers for one author, with a comparison for every external paper
 * whose title also exists internally.
 *
 * @param externalAvailable false when the external set could not be read
 * @param missingFromInternal external papers with no internal paper of the same title
 */
public record ExternalFetchResult(
        String authorName,
        List<PaperRecord> internal,
        List<PaperRecord> external,
        boolean externalAvailable,
        List<RecordComparison> comparisons,
        List<PaperRecord> missingFromInternal
) {

    public boolean hasDifferences() {
        return comparisons.stream().anyMatch(RecordComparison::hasDifferences);
    }
}
