package com.casefile.common.normalizer;

import com.casefile.common.model.LocationCluster;
import com.casefile.common.model.SignalBundle;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Pure adapter: turns raw provider payloads into one canonical {@link SignalBundle}.
 *
 * <p>No external calls. No Spring dependency. Never throws.
 *
 * <h3>Accepted dialects</h3>
 * <pre>
 * native   : totalPhotos, photosWithLocation, dayOfWeekCounts {"Sun".."Sat"},
 *             hourOfDayCounts, topLocations, totalEvents, meetingMinutesPerWeekday
 * canonical: total_photos, photos_with_location, day_of_week_counts {"1".."7"},
 *             hour_of_day_counts, top_locations, total_events, meeting_minutes_per_day
 * </pre>
 *
 * <p>Day names map Sun=1 … Sat=7. Keys outside 1..7 (days) or 0..23 (hours), unknown day
 * names and non-numeric or negative values are dropped. An unavailable source contributes
 * nothing, whatever its payload holds.
 */
public final class DataNormalizer {

    private static final Map<String, Integer> DAY_NUMBERS = Map.of(
        "sun", 1, "mon", 2, "tue", 3, "wed", 4, "thu", 5, "fri", 6, "sat", 7);

    private DataNormalizer() {}

    public static SignalBundle normalize(JsonNode rawPhoto, JsonNode rawCalendar,
                                         boolean photoAvailable, boolean calendarAvailable) {
        JsonNode photo    = photoAvailable && isObject(rawPhoto) ? rawPhoto : null;
        JsonNode calendar = calendarAvailable && isObject(rawCalendar) ? rawCalendar : null;

        int totalPhotos = 0;
        int photosWithLocation = 0;
        SortedMap<Integer, Integer> photoDays  = Collections.emptySortedMap();
        SortedMap<Integer, Integer> photoHours = Collections.emptySortedMap();
        List<LocationCluster> locations  = List.of();
        if (photo != null) {
            totalPhotos        = count(field(photo, "totalPhotos", "total_photos"));
            photosWithLocation = count(field(photo, "photosWithLocation", "photos_with_location"));
            photoDays          = dayHistogram(field(photo, "dayOfWeekCounts", "day_of_week_counts"));
            photoHours         = hourHistogram(field(photo, "hourOfDayCounts", "hour_of_day_counts"));
            locations          = locations(field(photo, "topLocations", "top_locations"));
        }

        int totalEvents = 0;
        SortedMap<Integer, Integer> calendarDays   = Collections.emptySortedMap();
        SortedMap<Integer, Integer> meetingMinutes = Collections.emptySortedMap();
        if (calendar != null) {
            totalEvents    = count(field(calendar, "totalEvents", "total_events"));
            calendarDays   = dayHistogram(field(calendar, "dayOfWeekCounts", "day_of_week_counts"));
            meetingMinutes = dayHistogram(field(calendar, "meetingMinutesPerWeekday", "meeting_minutes_per_day"));
        }

        return new SignalBundle(
            totalPhotos, totalEvents,
            photoDays, photoHours, calendarDays, meetingMinutes,
            locations, photosWithLocation,
            photoAvailable, calendarAvailable);
    }

    /** Canonical day number for a provider key ("Sun", "sunday", "1"), or -1 if unknown. */
    public static int dayNumber(String key) {
        if (key == null) return -1;
        String trimmed = key.trim().toLowerCase(Locale.ROOT);
        if (trimmed.length() >= 3) {
            Integer byName = DAY_NUMBERS.get(trimmed.substring(0, 3));
            if (byName != null) return byName;
        }
        int numeric = parseInt(trimmed);
        return numeric >= 1 && numeric <= 7 ? numeric : -1;
    }

    // ── field readers ─────────────────────────────────────────────────────────

    private static JsonNode field(JsonNode node, String nativeName, String canonicalName) {
        JsonNode value = node.get(nativeName);
        if (value == null || value.isNull()) {
            value = node.get(canonicalName);
        }
        return value;
    }

    private static SortedMap<Integer, Integer> dayHistogram(JsonNode node) {
        SortedMap<Integer, Integer> result = new TreeMap<>();
        if (!isObject(node)) return result;
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            int day   = dayNumber(entry.getKey());
            int value = count(entry.getValue());
            if (day > 0 && isCount(entry.getValue())) {
                result.merge(day, value, Integer::sum);
            }
        }
        return result;
    }

    private static SortedMap<Integer, Integer> hourHistogram(JsonNode node) {
        SortedMap<Integer, Integer> result = new TreeMap<>();
        if (!isObject(node)) return result;
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            int hour = parseInt(entry.getKey().trim());
            if (hour >= 0 && hour <= 23 && isCount(entry.getValue())) {
                result.merge(hour, count(entry.getValue()), Integer::sum);
            }
        }
        return result;
    }

    private static List<LocationCluster> locations(JsonNode node) {
        List<LocationCluster> result = new ArrayList<>();
        if (node == null || !node.isArray()) return result;
        for (JsonNode item : node) {
            if (!isObject(item) || !isCount(item.get("count"))) continue;
            result.add(new LocationCluster(
                count(item.get("count")),
                coordinate(item, "lat", "latitude"),
                coordinate(item, "lon", "longitude")));
        }
        return result;
    }

    private static Double coordinate(JsonNode item, String shortName, String longName) {
        JsonNode value = field(item, shortName, longName);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }

    // ── scalar helpers ────────────────────────────────────────────────────────

    private static boolean isObject(JsonNode node) {
        return node != null && node.isObject();
    }

    private static boolean isCount(JsonNode node) {
        return node != null && node.isNumber() && node.asDouble() >= 0;
    }

    private static int count(JsonNode node) {
        return isCount(node) ? (int) Math.min(Integer.MAX_VALUE, node.asLong()) : 0;
    }

    private static int parseInt(String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
