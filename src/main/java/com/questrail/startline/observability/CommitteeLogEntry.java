package com.questrail.startline.observability;

import java.util.List;
import java.util.Objects;

/**
 * Committee boat log wording for one {@link StartEvent}: what is written down,
 * which flags are displayed and how many sound signals accompany it.
 *
 * @param category     {@code signal}, {@code timing} or {@code schedule}
 * @param title        one-line headline
 * @param description  free text; the officer's reason when one was given
 * @param flags        flags displayed with the signal, in hoisting order
 * @param soundSignals number of sound signals made
 */
public record CommitteeLogEntry(
    String category,
    String title,
    String description,
    List<String> flags,
    int soundSignals
) {
    public static final String KEY_FLEET_NAME = "fleetName";
    public static final String KEY_CLASS_FLAG = "classFlag";
    public static final String KEY_RACE_NUMBER = "raceNumber";
    public static final String KEY_REASON = "reason";
    public static final String KEY_BOATS = "boats";

    public CommitteeLogEntry {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(title, "title");
        flags = List.copyOf(flags);
    }

    /**
     * Describes an event using the fleet details the scheduler attaches to it.
     */
    public static CommitteeLogEntry describe(StartEvent event) {
        Objects.requireNonNull(event, "event");

        String fleet = event.detail(KEY_FLEET_NAME).orElse("");
        String race = event.detail(KEY_RACE_NUMBER).orElse("");
        String defaultDescription = fleet.isEmpty()
                ? event.eventType().wireName()
                : "Race " + race + " - " + fleet;
        String description = event.detail(KEY_REASON).orElse(defaultDescription);

        return switch (event.eventType()) {
            case WARNING_SIGNALED -> new CommitteeLogEntry("signal", "Warning Signal: " + fleet, description,
                    List.of(event.detail(KEY_CLASS_FLAG).orElse("Class")), 1);
            case PREPARATORY_SIGNALED -> new CommitteeLogEntry("signal", "Preparatory Signal: " + fleet, description,
                    List.of("P"), 1);
            case ONE_MINUTE_SIGNALED -> new CommitteeLogEntry("signal", "One Minute: " + fleet, description,
                    List.of(), 1);
            case START_SIGNALED -> new CommitteeLogEntry("timing", "Race Start: " + fleet, description,
                    List.of(), 1);
            case GENERAL_RECALL -> new CommitteeLogEntry("signal", "General Recall: " + fleet, description,
                    List.of("First Substitute"), 2);
            case INDIVIDUAL_RECALL -> new CommitteeLogEntry("signal", "Individual Recall: " + fleet,
                    "Individual recall for boats: " + event.detail(KEY_BOATS).orElse(""),
                    List.of("X"), 1);
            case POSTPONED -> new CommitteeLogEntry("signal", "Postponed: " + fleet, description,
                    List.of("AP"), 2);
            case RESUMED -> new CommitteeLogEntry("signal", "Postponement Lowered: " + fleet, description,
                    List.of(), 1);
            case ABANDONED -> new CommitteeLogEntry("signal", "Abandoned: " + fleet, description,
                    List.of("N"), 3);
            default -> new CommitteeLogEntry("schedule", titleCase(event.eventType()), description,
                    List.of(), 0);
        };
    }

    private static String titleCase(StartEventType type) {
        String[] words = type.name().toLowerCase().split("_");
        StringBuilder sb = new StringBuilder();
        for (String w : words) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(w.charAt(0))).append(w.substring(1));
        }
        return sb.toString();
    }
}
