package com.smurthy.ai.insights.chat.handlers;

import com.smurthy.ai.insights.chat.ChatReply;
import com.smurthy.ai.insights.chat.IntentHandler;
import com.smurthy.ai.insights.chat.MatchResult;
import com.smurthy.ai.insights.model.PatientStats;
import com.smurthy.ai.insights.repository.PatientRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Cohort demographics: age, gender, payer, region and age distribution.
 */
public class PatientStatsHandler implements IntentHandler {

    private static final Pattern PATTERN = Pattern.compile(
            "(?:patient|cohort|demographic).*(?:stat|age|payer|distribution|info)"
                    + "|(?:average|avg).*(?:age|patient)"
                    + "|payer.*distribution",
            Pattern.CASE_INSENSITIVE);

    private static final List<String> AGE_RANGES = List.of("50-59", "60-69", "70-79", "80+");

    private final PatientRepository patientRepository;

    public PatientStatsHandler(PatientRepository patientRepository) {
        this.patientRepository = patientRepository;
    }

    @Override
    public String getIntentName() {
        return "PatientStats";
    }

    @Override
    public Optional<MatchResult> matches(String message) {
        return PATTERN.matcher(message).find() ? Optional.of(MatchResult.empty()) : Optional.empty();
    }

    @Override
    public ChatReply handle(MatchResult params) {
        return patientRepository.loadStats()
                .map(PatientStatsHandler::format)
                .map(ChatReply::text)
                .orElseGet(() -> ChatReply.text("No patient data available."));
    }

    private static String format(PatientStats stats) {
        List<String> lines = new ArrayList<>();
        lines.add(String.format(Locale.US, "**Patient Cohort Statistics** (%,d total patients)\n", stats.totalPatients()));
        lines.add("**Demographics:**");
        lines.add(String.format("- Average age: %d years", stats.averageAge()));
        lines.add(String.format("- Gender: %d%% Male, %d%% Female", stats.malePercent(), stats.femalePercent()));
        lines.add(String.format(Locale.US, "- Average prior treatment lines: %.1f\n", stats.averagePriorLines()));

        appendDistribution(lines, "**Payer Distribution:**", stats, stats.payerDistribution());
        appendDistribution(lines, "**Regional Distribution:**", stats, stats.regionDistribution());

        if (!stats.ageBuckets().isEmpty()) {
            lines.add("**Age Distribution:**");
            for (String range : AGE_RANGES) {
                long count = stats.ageBuckets().getOrDefault(range, 0L);
                lines.add(formatCount(range, count, stats));
            }
        }
        return String.join("\n", lines).strip();
    }

    // largest first
    private static void appendDistribution(List<String> lines, String heading, PatientStats stats,
                                           Map<String, Long> distribution) {
        if (distribution.isEmpty()) {
            return;
        }
        lines.add(heading);
        distribution.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .forEach(entry -> lines.add(formatCount(entry.getKey(), entry.getValue(), stats)));
        lines.add("");
    }

    private static String formatCount(String label, long count, PatientStats stats) {
        double percent = stats.totalPatients() > 0 ? Math.round(count * 1000.0 / stats.totalPatients()) / 10.0 : 0;
        return String.format(Locale.US, "- %s: %,d patients (%.1f%%)", label, count, percent);
    }
}
