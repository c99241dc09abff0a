package com.smurthy.ai.insights.chat.handlers;

import com.smurthy.ai.insights.chat.ActionToken;
import com.smurthy.ai.insights.chat.ChatReply;
import com.smurthy.ai.insights.chat.IntentHandler;
import com.smurthy.ai.insights.chat.MatchResult;
import com.smurthy.ai.insights.chat.TextParams;
import com.smurthy.ai.insights.model.PaperRecord;
import com.smurthy.ai.insights.service.papers.DiffStatus;
import com.smurthy.ai.insights.service.papers.ExternalFetchResult;
import com.smurthy.ai.insights.service.papers.FieldDiff;
import com.smurthy.ai.insights.service.papers.InternalUpdateResult;
import com.smurthy.ai.insights.service.papers.PaperReconciliationService;
import com.smurthy.ai.insights.service.papers.RecordComparison;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Surgeon paper search and reconciliation with the external reference set.
 *
 * The flow is search, then fetch external data, then update internal data. Each step is a
 * separate message; the follow-up steps are offered to the user as action tokens.
 *
 * Examples:
 * - "Find papers by Kahraman E"
 * - "Fetch external data for Kahraman E"
 * - "Update internal data for Kahraman E"
 */
public class PaperReconciliationHandler implements IntentHandler {

    private static final Logger log = LoggerFactory.getLogger(PaperReconciliationHandler.class);

    public static final String ACTION = "action";
    public static final String AUTHOR_NAME = "author_name";

    private static final Pattern FETCH_EXTERNAL =
            Pattern.compile("fetch\\s+external\\s+data\\s+for\\s+(.+?)(?:\\?|$)", Pattern.CASE_INSENSITIVE);

    private static final Pattern UPDATE_INTERNAL =
            Pattern.compile("update\\s+internal\\s+data\\s+for\\s+(.+?)(?:\\?|$)", Pattern.CASE_INSENSITIVE);

    private static final Pattern SEARCH = Pattern.compile(
            "(?:find|search|show|get|list|what).*(?:papers?|publications?).*(?:by|for|from|author)\\s+(.+?)(?:\\?|$)"
                    + "|(?:papers?|publications?).*(?:by|from)\\s+(.+?)(?:\\?|$)"
                    + "|(?:author|surgeon)\\s+(.+?).*(?:papers?|publications?)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern NOISE_WORDS =
            Pattern.compile("\\b(?:publish|published|write|wrote|author)\\b", Pattern.CASE_INSENSITIVE);

    private final PaperReconciliationService reconciliationService;

    public PaperReconciliationHandler(PaperReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    @Override
    public String getIntentName() {
        return "PaperReconciliation";
    }

    @Override
    public Optional<MatchResult> matches(String message) {
        Optional<ActionToken> token = ActionToken.find(message);
        if (token.isPresent() && token.get().kind() != ActionToken.Kind.LOOKUP_ADDRESS) {
            PaperAction action = token.get().kind() == ActionToken.Kind.FETCH_EXTERNAL
                    ? PaperAction.FETCH_EXTERNAL
                    : PaperAction.UPDATE_INTERNAL;
            return result(action, token.get().parameter().strip());
        }

        Matcher fetch = FETCH_EXTERNAL.matcher(message);
        if (fetch.find()) {
            return result(PaperAction.FETCH_EXTERNAL, TextParams.cleanName(fetch.group(1)));
        }

        Matcher update = UPDATE_INTERNAL.matcher(message);
        if (update.find()) {
            return result(PaperAction.UPDATE_INTERNAL, TextParams.cleanName(update.group(1)));
        }

        Matcher search = SEARCH.matcher(message);
        if (search.find()) {
            String raw = search.group(1) != null ? search.group(1)
                    : search.group(2) != null ? search.group(2)
                    : search.group(3);
            String name = NOISE_WORDS.matcher(TextParams.cleanName(raw)).replaceAll("")
                    .replaceAll("\\s{2,}", " ")
                    .strip();
            return result(PaperAction.SEARCH, name);
        }
        return Optional.empty();
    }

    private static Optional<MatchResult> result(PaperAction action, String authorName) {
        return Optional.of(MatchResult.builder()
                .put(ACTION, action)
                .put(AUTHOR_NAME, authorName)
                .build());
    }

    @Override
    public ChatReply handle(MatchResult params) {
        String authorName = params.getString(AUTHOR_NAME).strip();
        if (authorName.isEmpty()) {
            return ChatReply.text("Please specify an author name to search for surgeon papers.");
        }

        PaperAction action = params.getEnum(ACTION, PaperAction.class);
        log.info("Paper action {} for author: {}", action, authorName);
        return switch (action) {
            case SEARCH -> search(authorName);
            case FETCH_EXTERNAL -> fetchExternal(authorName);
            case UPDATE_INTERNAL -> updateInternal(authorName);
        };
    }

    private ChatReply search(String authorName) {
        List<PaperRecord> papers = reconciliationService.searchInternal(authorName);
        String fetchLink = ActionToken.fetchExternal(authorName).toMarkdown("Fetch external data");

        if (papers.isEmpty()) {
            return ChatReply.text(String.format(
                    "I couldn't find any surgeon papers for author **%s** in our internal database. "
                            + "%s to check the external reference set.", authorName, fetchLink));
        }

        List<String> lines = new ArrayList<>();
        lines.add(String.format("**Surgeon Papers by %s** (%d found):\n", authorName, papers.size()));
        appendPapers(lines, papers, authorName);
        return ChatReply.messages(String.join("\n", lines), fetchLink);
    }

    private ChatReply fetchExternal(String authorName) {
        ExternalFetchResult result = reconciliationService.fetchExternal(authorName);

        if (!result.externalAvailable()) {
            List<String> lines = new ArrayList<>();
            lines.add(String.format("External data for **%s** is currently unavailable.", authorName));
            if (!result.internal().isEmpty()) {
                lines.add(String.format("\n**Internal papers** (%d):\n", result.internal().size()));
                appendPapers(lines, result.internal(), authorName);
            }
            return ChatReply.text(String.join("\n", lines));
        }

        if (result.external().isEmpty()) {
            return ChatReply.text(String.format("No external papers were found for author **%s**.", authorName));
        }

        String updateLink = ActionToken.updateInternal(authorName).toMarkdown("Update internal data");

        if (result.internal().isEmpty()) {
            List<String> lines = new ArrayList<>();
            lines.add(String.format("**External Papers by %s** (%d found, none in internal data):\n",
                    authorName, result.external().size()));
            appendPapers(lines, result.external(), authorName);
            lines.add(updateLink + " to add them to the internal database.");
            return ChatReply.text(String.join("\n", lines));
        }

        List<String> lines = new ArrayList<>();
        lines.add(String.format("**Internal vs External Papers for %s**\n", authorName));
        for (RecordComparison comparison : result.comparisons()) {
            lines.add(String.format("**%s**", comparison.title()));
            if (!comparison.hasDifferences()) {
                lines.add("   - No differences");
            }
            for (FieldDiff diff : comparison.diffs()) {
                lines.add(formatDiff(diff));
            }
            lines.add("");
        }
        for (PaperRecord missing : result.missingFromInternal()) {
            lines.add(String.format("**%s**", missing.title()));
            lines.add("   - Missing from internal data");
            lines.add("");
        }

        if (result.hasDifferences()) {
            return ChatReply.messages(String.join("\n", lines).strip(), updateLink);
        }
        lines.add("Internal data is up to date with the external reference set.");
        return ChatReply.text(String.join("\n", lines));
    }

    private ChatReply updateInternal(String authorName) {
        InternalUpdateResult result = reconciliationService.updateInternal(authorName);
        return ChatReply.text(switch (result.action()) {
            case NOTHING_EXTERNAL -> String.format(
                    "No external papers were found for author **%s**, nothing to update.", authorName);
            case INSERTED -> String.format(
                    "Added %d paper(s) by **%s** to the internal database.", result.count(), authorName);
            case UPDATED -> String.format(
                    "Updated %d internal paper(s) by **%s** with external data.", result.count(), authorName);
        });
    }

    private static String formatDiff(FieldDiff diff) {
        if (diff.status() == DiffStatus.MISSING_INTERNAL) {
            return String.format("   - **%s:** missing internally, external has \"%s\"",
                    diff.field().label(), diff.externalValue());
        }
        return String.format("   - **%s:** internal \"%s\", external \"%s\"",
                diff.field().label(), diff.internalValue(), diff.externalValue());
    }

    private static void appendPapers(List<String> lines, List<PaperRecord> papers, String authorName) {
        for (int i = 0; i < papers.size(); i++) {
            PaperRecord paper = papers.get(i);
            lines.add(String.format("%d. **%s**", i + 1, orDefault(paper.title(), "Unknown Title")));
            lines.add("   - **Author:** " + orDefault(paper.authorName(), authorName));
            lines.add("   - **Journal:** " + orDefault(paper.journal(), "Unknown Journal"));
            lines.add("   - **Affiliation:** " + orDefault(paper.affiliation(), "Unknown Affiliation"));
            if (paper.website() != null && !paper.website().isBlank()) {
                lines.add(String.format("   - **Link:** [Affiliation Website](%s)", paper.website()));
            }
            lines.add("");
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
