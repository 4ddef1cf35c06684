package com.casefile.common.synthetic;

import com.casefile.common.model.SignalBundle;
import com.casefile.common.normalizer.DataNormalizer;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.TreeMap;

/**
 * Fixed demo dataset used when the user opts into demo mode.
 *
 * <p>Payloads are emitted in the canonical snake_case dialect and go through
 * {@link DataNormalizer} like any real provider response. The profile is a weekend-heavy
 * evening photographer with a mid-week meeting load, so the rule engine produces well over
 * three candidates.
 */
public final class SyntheticSignals {

    public static final int TOTAL_PHOTOS         = 247;
    public static final int PHOTOS_WITH_LOCATION = 189;
    public static final int TOTAL_EVENTS         = 86;

    private static final Map<Integer, Integer> PHOTO_DAYS = histogram(
        1, 52, 2, 18, 3, 14, 4, 12, 5, 16, 6, 35, 7, 100);

    private static final Map<Integer, Integer> PHOTO_HOURS = histogram(
        0, 12, 1, 4, 6, 3, 7, 5, 8, 8, 9, 14, 10, 38, 11, 22, 12, 15, 13, 10,
        14, 8, 15, 12, 16, 18, 17, 25, 18, 42, 19, 20, 20, 8, 21, 6, 22, 3, 23, 2);

    private static final Map<Integer, Integer> CALENDAR_DAYS = histogram(
        1, 4, 2, 12, 3, 22, 4, 20, 5, 14, 6, 10, 7, 4);

    private static final Map<Integer, Integer> MEETING_MINUTES = histogram(
        1, 30, 2, 180, 3, 320, 4, 290, 5, 210, 6, 140, 7, 20);

    private static final double[][] LOCATIONS = {
        {72, 37.7749, -122.4194},
        {28, 37.8044, -122.2712},
        {15, 37.3382, -121.8863},
    };

    private SyntheticSignals() {}

    public static ObjectNode photoPayload() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode node = f.objectNode();
        node.put("total_photos", TOTAL_PHOTOS);
        node.put("photos_with_location", PHOTOS_WITH_LOCATION);
        node.set("day_of_week_counts", toNode(PHOTO_DAYS));
        node.set("hour_of_day_counts", toNode(PHOTO_HOURS));
        ArrayNode locations = node.putArray("top_locations");
        for (double[] cluster : LOCATIONS) {
            locations.addObject()
                .put("count", (int) cluster[0])
                .put("lat", cluster[1])
                .put("lon", cluster[2]);
        }
        return node;
    }

    public static ObjectNode calendarPayload() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("total_events", TOTAL_EVENTS);
        node.set("day_of_week_counts", toNode(CALENDAR_DAYS));
        node.set("meeting_minutes_per_day", toNode(MEETING_MINUTES));
        return node;
    }

    /** The dataset already normalized, both sources available. */
    public static SignalBundle bundle() {
        return DataNormalizer.normalize(photoPayload(), calendarPayload(), true, true);
    }

    private static ObjectNode toNode(Map<Integer, Integer> histogram) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        histogram.forEach((k, v) -> node.put(String.valueOf(k), v));
        return node;
    }

    private static Map<Integer, Integer> histogram(int... keyValues) {
        Map<Integer, Integer> map = new TreeMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
