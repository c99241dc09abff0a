package com.smurthy.ai.insights.service.address;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the registry row that best matches a searched organization name.
 *
 * Scoring: exact name 100, containment in either direction 50, otherwise 10 per shared word.
 * A matching state adds 25. The highest positive score wins; ties keep the earliest row.
 */
public class RegistryCandidateScorer {

    private static final Logger log = LoggerFactory.getLogger(RegistryCandidateScorer.class);

    static final int EXACT_MATCH = 100;
    static final int PARTIAL_MATCH = 50;
    static final int PER_SHARED_WORD = 10;
    static final int STATE_BONUS = 25;

    public int score(RegistryCandidate candidate, String searchName, String expectedState) {
        String candidateName = candidate.organizationName() == null ? "" : candidate.organizationName().toLowerCase(Locale.ROOT);
        String search = searchName.toLowerCase(Locale.ROOT);

        int score;
        if (candidateName.equals(search)) {
            score = EXACT_MATCH;
        } else if (candidateName.contains(search) || search.contains(candidateName)) {
            score = PARTIAL_MATCH;
        } else {
            Set<String> shared = words(search);
            shared.retainAll(words(candidateName));
            score = shared.size() * PER_SHARED_WORD;
        }

        if (expectedState != null && candidate.state() != null
                && candidate.state().equalsIgnoreCase(expectedState)) {
            score += STATE_BONUS;
        }
        return score;
    }

    public Optional<RegistryCandidate> bestMatch(List<RegistryCandidate> candidates, String searchName, String expectedState) {
        RegistryCandidate best = null;
        int bestScore = 0;
        for (RegistryCandidate candidate : candidates) {
            int score = score(candidate, searchName, expectedState);
            log.debug("Registry candidate '{}' ({}) scored {}", candidate.organizationName(), candidate.state(), score);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    private static Set<String> words(String text) {
        Set<String> words = new HashSet<>(Arrays.asList(text.trim().split("\\s+")));
        words.remove("");
        return words;
    }
}
