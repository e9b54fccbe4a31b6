/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.textarchive.archive.grammar;

import dev.mars.textarchive.archive.EntityType;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Verbs of a prayer's activity section and the rows each one projects to.
 * <p>
 * Every activity becomes an {@code ACTIVITY_LOG} row. Known verbs additionally become a
 * mark ({@code prayed}) or an attribute ({@code answered}, {@code testimony},
 * {@code archived}, {@code restored}, {@code flagged}). Verbs not listed here are kept as
 * activity log rows only.
 */
public enum PrayerActivity {

    PRAYED("prayed", "prayed this prayer"),
    ANSWERED("answered", "marked this prayer as answered"),
    TESTIMONY("testimony", "added testimony"),
    ARCHIVED("archived", "archived this prayer"),
    RESTORED("restored", "restored this prayer"),
    FLAGGED("flagged", "flagged this prayer");

    /** A row to be created for one activity line. */
    public record Projection(EntityType type, String action, Map<String, String> fields) {
    }

    private final String verb;
    private final String phrase;

    PrayerActivity(String verb, String phrase) {
        this.verb = verb;
        this.phrase = phrase;
    }

    public String verb() {
        return verb;
    }

    public static Optional<PrayerActivity> ofVerb(String verb) {
        for (PrayerActivity a : values()) {
            if (a.verb.equals(verb)) {
                return Optional.of(a);
            }
        }
        return Optional.empty();
    }

    /**
     * Text following the actor in an activity line.
     */
    public static String phrase(String verb, String detail) {
        Optional<PrayerActivity> known = ofVerb(verb);
        String base = known.map(a -> a.phrase).orElse(verb);
        if (known.isPresent() && known.get() != TESTIMONY) {
            return base;
        }
        return detail == null || detail.isEmpty() ? base : base + ": " + detail;
    }

    /**
     * Splits the text following the actor back into verb and detail.
     *
     * @return {@code [verb, detail]}; detail may be null
     */
    public static String[] parsePhrase(String text) {
        for (PrayerActivity a : values()) {
            if (a == TESTIMONY) {
                if (text.equals(a.phrase)) {
                    return new String[]{a.verb, null};
                }
                if (text.startsWith(a.phrase + ":")) {
                    return new String[]{a.verb, text.substring(a.phrase.length() + 1).trim()};
                }
            } else if (text.equals(a.phrase)) {
                return new String[]{a.verb, null};
            }
        }
        int colon = text.indexOf(": ");
        if (colon > 0) {
            return new String[]{text.substring(0, colon), text.substring(colon + 2)};
        }
        return new String[]{text, null};
    }

    /**
     * Rows for one activity, in creation order.
     */
    public static List<Projection> project(String verb, String detail, LocalDate date) {
        List<Projection> rows = new ArrayList<>(3);
        Map<String, String> log = new HashMap<>();
        log.put("detail", detail);
        rows.add(new Projection(EntityType.ACTIVITY_LOG, verb, log));

        Optional<PrayerActivity> known = ofVerb(verb);
        if (known.isEmpty()) {
            return rows;
        }
        switch (known.get()) {
            case PRAYED -> rows.add(new Projection(EntityType.INTERACTION_MARK, "prayed", Map.of()));
            case ANSWERED -> {
                rows.add(attribute("answered", "true"));
                rows.add(attribute("answer_date", date.toString()));
            }
            case TESTIMONY -> rows.add(attribute("answer_testimony", detail == null ? "" : detail));
            case ARCHIVED -> rows.add(attribute("archived", "true"));
            case RESTORED -> rows.add(attribute("archived", "false"));
            case FLAGGED -> rows.add(attribute("flagged", "true"));
        }
        return rows;
    }

    private static Projection attribute(String name, String value) {
        return new Projection(EntityType.INTERACTION_ATTRIBUTE, name, Map.of("attribute_value", value));
    }
}
