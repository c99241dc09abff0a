package com.smurthy.ai.insights.chat.handlers;

import com.smurthy.ai.insights.chat.ActionToken;
import com.smurthy.ai.insights.chat.ChatReply;
import com.smurthy.ai.insights.chat.IntentHandler;
import com.smurthy.ai.insights.chat.MatchResult;
import com.smurthy.ai.insights.chat.TextParams;
import com.smurthy.ai.insights.model.OrganizationRecord;
import com.smurthy.ai.insights.service.address.AddressLookupOutcome;
import com.smurthy.ai.insights.service.address.AddressResolutionService;
import com.smurthy.ai.insights.service.address.AddressSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Organization address lookup.
 *
 * Examples:
 * - "What is the address of Tyrone Hospital?"
 * - "Where is Tyrone Hospital located?"
 * - "Find address for Tyrone Hospital"
 */
public class HcoAddressHandler implements IntentHandler {

    public static final String HCO_NAME = "hco_name";

    private static final Pattern PATTERN = Pattern.compile(
            "(?:what\\s+is\\s+the\\s+)?(?:address|location)(?:\\s+of|\\s+for)?\\s+(.+?)(?:\\?|$)"
                    + "|(?:where\\s+is)\\s+(.+?)\\s+(?:located|address)(?:\\?|$)"
                    + "|(?:find|get|show)\\s+(?:the\\s+)?address\\s+(?:of|for)\\s+(.+?)(?:\\?|$)",
            Pattern.CASE_INSENSITIVE);

    private final AddressResolutionService addressResolutionService;

    public HcoAddressHandler(AddressResolutionService addressResolutionService) {
        this.addressResolutionService = addressResolutionService;
    }

    @Override
    public String getIntentName() {
        return "HcoAddress";
    }

    @Override
    public Optional<MatchResult> matches(String message) {
        Optional<ActionToken> token = ActionToken.find(message);
        if (token.isPresent() && token.get().kind() == ActionToken.Kind.LOOKUP_ADDRESS) {
            return Optional.of(MatchResult.of(HCO_NAME, token.get().parameter().strip()));
        }

        Matcher matcher = PATTERN.matcher(message);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String raw = matcher.group(1) != null ? matcher.group(1)
                : matcher.group(2) != null ? matcher.group(2)
                : matcher.group(3);
        String name = TextParams.cleanName(raw);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(MatchResult.of(HCO_NAME, name));
    }

    @Override
    public ChatReply handle(MatchResult params) {
        String name = params.getString(HCO_NAME).strip();
        if (name.isEmpty()) {
            return ChatReply.text("Please specify an HCO name to look up the address.");
        }

        AddressLookupOutcome outcome = addressResolutionService.resolve(name);
        if (!outcome.organizationFound()) {
            return ChatReply.text(String.format(
                    "I couldn't find an HCO named **%s** in our database. "
                            + "Please check the name and try again, or ask me to show you the top HCOs.", name));
        }
        return ChatReply.text(format(outcome));
    }

    private static String format(AddressLookupOutcome outcome) {
        OrganizationRecord hco = outcome.organization();

        if (!outcome.hasAddress()) {
            String text = String.format("I couldn't find address information for **%s**. "
                    + "The address may not be publicly available or the HCO name might need verification.", hco.name());
            if (outcome.websiteUrl() != null) {
                text += "\n\n**Website:** " + outcome.websiteUrl();
            }
            return text;
        }

        List<String> lines = new ArrayList<>();
        lines.add(String.format("**Address for %s:**\n", hco.name()));
        if (hasText(hco.address())) {
            lines.add(hco.address());
        }

        List<String> location = new ArrayList<>();
        for (String part : new String[]{hco.city(), hco.state(), hco.zipCode()}) {
            if (hasText(part)) {
                location.add(part);
            }
        }
        if (!location.isEmpty()) {
            lines.add(String.join(", ", location));
        }

        if (outcome.websiteUrl() != null) {
            lines.add("\n**Website:** " + outcome.websiteUrl());
        }
        lines.add("\n" + sourceNote(outcome));
        return String.join("\n", lines);
    }

    private static String sourceNote(AddressLookupOutcome outcome) {
        AddressSource source = outcome.source();
        return switch (source) {
            case PROVIDER -> "*Address found via " + outcome.providerName() + " and cached for future queries.*";
            case STALE_CACHE -> "*Address retrieved from database; it could not be refreshed and may be out of date.*";
            default -> "*Address retrieved from database.*";
        };
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
