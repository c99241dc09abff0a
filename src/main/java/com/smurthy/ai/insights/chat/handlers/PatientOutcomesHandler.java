package com.smurthy.ai.insights.chat.handlers;

import com.smurthy.ai.insights.chat.ChatReply;
import com.smurthy.ai.insights.chat.IntentHandler;
import com.smurthy.ai.insights.chat.MatchResult;
import com.smurthy.ai.insights.model.PatientStats;
import com.smurthy.ai.insights.repository.PatientRepository;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Clinical outcome counts (toxicity, 12-month events, retreatment).
 *
 * Registered before {@link PatientStatsHandler}, whose pattern also accepts
 * "toxicity rate by patient age".
 */
public class PatientOutcomesHandler implements IntentHandler {

    private static final Pattern PATTERN = Pattern.compile(
            "(?:toxicity|retreatment|event|outcome).*(?:patient|rate|count)"
                    + "|(?:how many|what percent).*(?:toxicity|retreatment|event)",
            Pattern.CASE_INSENSITIVE);

    private final PatientRepository patientRepository;

    public PatientOutcomesHandler(PatientRepository patientRepository) {
        this.patientRepository = patientRepository;
    }

    @Override
    public String getIntentName() {
        return "PatientOutcomes";
    }

    @Override
    public Optional<MatchResult> matches(String message) {
        return PATTERN.matcher(message).find() ? Optional.of(MatchResult.empty()) : Optional.empty();
    }

    @Override
    public ChatReply handle(MatchResult params) {
        return patientRepository.loadStats()
                .map(PatientOutcomesHandler::format)
                .map(ChatReply::text)
                .orElseGet(() -> ChatReply.text("No patient data available."));
    }

    private static String format(PatientStats stats) {
        return String.join("\n",
                String.format(Locale.US, "**Patient Outcome Statistics** (%,d total patients)\n", stats.totalPatients()),
                "**Clinical Outcomes:**",
                String.format(Locale.US, "- **30-Day Toxicity Events:** %,d patients (%d%%)",
                        stats.toxicityCount(), stats.percentOf(stats.toxicityCount())),
                "  - ICU/inpatient readmission with CRS/ICANS within 30 days",
                String.format(Locale.US, "- **12-Month Events:** %,d patients (%d%%)",
                        stats.event12MonthCount(), stats.percentOf(stats.event12MonthCount())),
                "  - Death or escalation to new MM treatment within 12 months",
                String.format(Locale.US, "- **18-Month Retreatment:** %,d patients (%d%%)",
                        stats.retreatment18MonthCount(), stats.percentOf(stats.retreatment18MonthCount())),
                "  - Received new high-cost MM treatment within 18 months");
    }
}
