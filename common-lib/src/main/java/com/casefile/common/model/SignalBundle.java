package com.casefile.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Canonical, immutable view of the photo and calendar signals for one pipeline run.
 *
 * <p>Day-of-week keys run 1 (Sunday) to 7 (Saturday); hour keys run 0 to 23. All maps are
 * sorted copies so that iteration order, and therefore every derived insight, is stable.
 * When a source is unavailable its maps are empty and its total is zero.
 */
public record SignalBundle(
    @JsonProperty("totalPhotos")             int totalPhotos,
    @JsonProperty("totalEvents")             int totalEvents,
    @JsonProperty("photoDayOfWeek")          SortedMap<Integer, Integer> photoDayOfWeek,
    @JsonProperty("photoHourOfDay")          SortedMap<Integer, Integer> photoHourOfDay,
    @JsonProperty("calendarDayOfWeek")       SortedMap<Integer, Integer> calendarDayOfWeek,
    @JsonProperty("meetingMinutesByDay")     SortedMap<Integer, Integer> meetingMinutesByDay,
    @JsonProperty("topLocations")            List<LocationCluster> topLocations,
    @JsonProperty("photosWithLocation")      int photosWithLocation,
    @JsonProperty("photoSourceAvailable")    boolean photoSourceAvailable,
    @JsonProperty("calendarSourceAvailable") boolean calendarSourceAvailable
) {
    public SignalBundle {
        photoDayOfWeek      = freeze(photoDayOfWeek);
        photoHourOfDay      = freeze(photoHourOfDay);
        calendarDayOfWeek   = freeze(calendarDayOfWeek);
        meetingMinutesByDay = freeze(meetingMinutesByDay);
        topLocations        = topLocations == null ? List.of() : List.copyOf(topLocations);
    }

    /** Bundle with no data at all, keeping the given availability flags. */
    public static SignalBundle empty(boolean photoSourceAvailable, boolean calendarSourceAvailable) {
        return new SignalBundle(0, 0, null, null, null, null, null, 0,
            photoSourceAvailable, calendarSourceAvailable);
    }

    public boolean hasAnyData() {
        return totalPhotos > 0 || totalEvents > 0;
    }

    private static SortedMap<Integer, Integer> freeze(Map<Integer, Integer> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptySortedMap();
        }
        return Collections.unmodifiableSortedMap(new TreeMap<>(source));
    }
}
