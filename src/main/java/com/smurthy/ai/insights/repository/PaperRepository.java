package com.smurthy.ai.insights.repository;

import com.smurthy.ai.insights.model.PaperCollection;
import com.smurthy.ai.insights.model.PaperField;
import com.smurthy.ai.insights.model.PaperRecord;

import java.util.List;
import java.util.Map;

/**
 * Access to the internal and external surgeon paper collections.
 */
public interface PaperRepository {

    /**
     * Papers whose author name contains {@code authorName}, ignoring case.
     */
    List<PaperRecord> findByAuthor(PaperCollection collection, String authorName, int limit);

    /**
     * Overwrites the given fields of one internal paper, leaving all others untouched.
     *
     * @return true if a row was updated
     */
    boolean updateInternal(String id, Map<PaperField, String> fields);

    /**
     * Adds a paper to the internal collection under a newly generated id.
     *
     * @return true if the row was inserted
     */
    boolean insertInternal(PaperRecord paper);
}
