package com.smurthy.ai.insights.service.papers;

import com.smurthy.ai.insights.model.PaperCollection;
import com.smurthy.ai.insights.model.PaperField;
import com.smurthy.ai.insights.model.PaperRecord;
import com.smurthy.ai.insights.repository.PaperRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the internal surgeon papers in sync with the external reference set.
 *
 * Papers are linked across the two sets by exact title within the results of an author search.
 */
public class PaperReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PaperReconciliationService.class);

    private final PaperRepository paperRepository;
    private final PaperComparator comparator;
    private final int searchLimit;

    public PaperReconciliationService(PaperRepository paperRepository, PaperComparator comparator, int searchLimit) {
        this.paperRepository = paperRepository;
        this.comparator = comparator;
        this.searchLimit = searchLimit;
    }

    /**
     * Internal papers whose author matches the given name.
     */
    public List<PaperRecord> searchInternal(String authorName) {
        log.info("Searching internal surgeon papers for author: {}", authorName);
        return paperRepository.findByAuthor(PaperCollection.INTERNAL, authorName, searchLimit);
    }

    /**
     * Reads both sets and compares them. An unreadable external set is reported, not thrown.
     */
    public ExternalFetchResult fetchExternal(String authorName) {
        List<PaperRecord> internal = searchInternal(authorName);

        List<PaperRecord> external;
        try {
            external = paperRepository.findByAuthor(PaperCollection.EXTERNAL, authorName, searchLimit);
        } catch (DataAccessException e) {
            log.error("External paper lookup failed for '{}': {}", authorName, e.getMessage(), e);
            return new ExternalFetchResult(authorName, internal, List.of(), false, List.of(), List.of());
        }
        log.info("Found {} internal and {} external papers for '{}'", internal.size(), external.size(), authorName);

        if (internal.isEmpty() || external.isEmpty()) {
            return new ExternalFetchResult(authorName, internal, external, true, List.of(), List.of());
        }

        Map<String, PaperRecord> internalByTitle = byTitle(internal);
        List<RecordComparison> comparisons = new ArrayList<>();
        List<PaperRecord> missing = new ArrayList<>();
        for (PaperRecord externalPaper : external) {
            PaperRecord internalPaper = internalByTitle.get(externalPaper.title());
            if (internalPaper == null) {
                missing.add(externalPaper);
            } else {
                comparisons.add(comparator.compare(internalPaper, externalPaper));
            }
        }
        return new ExternalFetchResult(authorName, internal, external, true, comparisons, missing);
    }

    /**
     * Merges external papers into the internal set. When the author has no internal papers,
     * every external paper is inserted; otherwise only differing fields of title-matched
     * papers are overwritten, and only with non-empty external values.
     */
    public InternalUpdateResult updateInternal(String authorName) {
        List<PaperRecord> internal = searchInternal(authorName);
        List<PaperRecord> external = paperRepository.findByAuthor(PaperCollection.EXTERNAL, authorName, searchLimit);

        if (external.isEmpty()) {
            log.info("No external papers to merge for '{}'", authorName);
            return new InternalUpdateResult(authorName, InternalUpdateResult.Action.NOTHING_EXTERNAL, 0);
        }

        if (internal.isEmpty()) {
            int inserted = 0;
            for (PaperRecord paper : external) {
                if (paperRepository.insertInternal(paper.withoutId())) {
                    inserted++;
                }
            }
            log.info("Inserted {} internal papers for '{}'", inserted, authorName);
            return new InternalUpdateResult(authorName, InternalUpdateResult.Action.INSERTED, inserted);
        }

        Map<String, PaperRecord> internalByTitle = byTitle(internal);
        int updated = 0;
        for (PaperRecord externalPaper : external) {
            PaperRecord internalPaper = internalByTitle.get(externalPaper.title());
            if (internalPaper == null) {
                continue;
            }
            RecordComparison comparison = comparator.compare(internalPaper, externalPaper);
            if (!comparison.hasDifferences()) {
                continue;
            }

            Map<PaperField, String> changes = new EnumMap<>(PaperField.class);
            for (FieldDiff diff : comparison.diffs()) {
                if (!diff.externalValue().isEmpty()) {
                    changes.put(diff.field(), diff.externalValue());
                }
            }
            if (!changes.isEmpty() && paperRepository.updateInternal(internalPaper.id(), changes)) {
                log.debug("Updated fields {} of internal paper '{}'", changes.keySet(), internalPaper.title());
                updated++;
            }
        }
        log.info("Updated {} internal papers for '{}'", updated, authorName);
        return new InternalUpdateResult(authorName, InternalUpdateResult.Action.UPDATED, updated);
    }

    // first paper wins when an author has duplicate titles
    private static Map<String, PaperRecord> byTitle(List<PaperRecord> papers) {
        Map<String, PaperRecord> byTitle = new LinkedHashMap<>();
        papers.forEach(paper -> byTitle.putIfAbsent(paper.title(), paper));
        return byTitle;
    }
}
