package com.smurthy.ai.insights.chat.handlers;

import java.util.List;
import java.util.Locale;

/**
 * Contract templates that can be named in a simulation request, in resolution priority order.
 */
public enum SimulatedTemplate {

    SURVIVAL_12M("survival-12m", List.of("12-month", "survival")),
    TOXICITY_30D("toxicity-30d", List.of("toxicity")),
    RETREATMENT_18M("retreatment-18m", List.of("retreatment"));

    static final SimulatedTemplate DEFAULT = SURVIVAL_12M;

    private final String templateId;
    private final List<String> keywords;

    SimulatedTemplate(String templateId, List<String> keywords) {
        this.templateId = templateId;
        this.keywords = keywords;
    }

    public String templateId() {
        return templateId;
    }

    /**
     * The first template, in declaration order, with a keyword in the message; {@link #DEFAULT} otherwise.
     */
    static SimulatedTemplate resolve(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        for (SimulatedTemplate template : values()) {
            if (template.keywords.stream().anyMatch(lower::contains)) {
                return template;
            }
        }
        return DEFAULT;
    }
}
