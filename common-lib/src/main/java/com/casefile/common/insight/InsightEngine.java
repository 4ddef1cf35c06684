package com.casefile.common.insight;

import com.casefile.common.model.InsightCandidate;
import com.casefile.common.model.InsightType;
import com.casefile.common.model.LocationCluster;
import com.casefile.common.model.SignalBundle;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static com.casefile.common.insight.SignalFormat.compact;
import static com.casefile.common.insight.SignalFormat.dayName;
import static com.casefile.common.insight.SignalFormat.hour;
import static com.casefile.common.insight.SignalFormat.oneDecimal;
import static com.casefile.common.insight.SignalFormat.percent;

/**
 * Pure rule engine: derives ranked {@link InsightCandidate}s from a {@link SignalBundle}.
 *
 * <p>No external calls. No Spring dependency. No randomness, no clock: the same bundle
 * always yields the same list. The generator never computes facts; everything a report
 * may claim originates here.
 *
 * <h3>Rules (evaluated in order, each appends at most one candidate)</h3>
 * <pre>
 * 1 peak hours         : two busiest hours, needs ≥2 nonzero hour buckets
 * 2 weekend vs weekday : weekend per-day average &gt; 1.5 × weekday per-day average
 * 3 heaviest meetings  : day with the largest meeting-minute sum (&gt; 0)
 * 4 light-meeting shots: lightest meeting day is also the busiest photo day
 * 5 night owl / early  : &gt;20% of photos at night (20-5), else &gt;20% in the morning (5-8)
 * 6 home base          : largest location cluster &gt;30% of geotagged photos
 * 7 busy-day overlap   : &gt;50% of active days have &gt;3 photos and &gt;3 events
 * 8 secret photo day   : busiest photo day has ≥2× the photos of the runner-up
 * </pre>
 *
 * <p>Photo rules need the photo source, calendar rules the calendar source, cross rules
 * both. Ties between equal counts resolve to the lowest day or hour. Candidates backed by
 * fewer than {@value #MIN_CONFIDENT_COUNT} data points are flagged low-confidence.
 *
 * <p>The returned list always holds at least {@value #MIN_CANDIDATES} candidates.
 */
public final class InsightEngine {

    static final int MIN_CONFIDENT_COUNT = 3;
    static final int MIN_CANDIDATES      = 2;

    private static final double WEEKEND_FACTOR       = 1.5;
    private static final double TIME_OF_DAY_SHARE    = 0.20;
    private static final double HOME_BASE_SHARE      = 0.30;
    private static final double BUSY_DAY_SHARE       = 0.50;
    private static final int    ACTIVE_DAY_THRESHOLD = 3;
    private static final double SURPRISE_RATIO       = 2.0;
    private static final double WEEKS_PER_MONTH      = 4.3;

    private InsightEngine() {}

    public static List<InsightCandidate> computeInsights(SignalBundle bundle) {
        List<InsightCandidate> insights = new ArrayList<>();
        boolean photos   = bundle.photoSourceAvailable();
        boolean calendar = bundle.calendarSourceAvailable();

        if (photos)             peakHours(bundle, insights);
        if (photos)             weekendPhotographer(bundle, insights);
        if (calendar)           heaviestMeetingDay(bundle, insights);
        if (photos && calendar) lightMeetingPhotoDay(bundle, insights);
        if (photos)             nightOwlOrEarlyBird(bundle, insights);
        if (photos)             homeBase(bundle, insights);
        if (photos && calendar) busyDayOverlap(bundle, insights);
        if (photos)             secretPhotoDay(bundle, insights);

        sourceNote(bundle, insights);
        ensureMinimum(bundle, insights);
        return List.copyOf(insights);
    }

    // ── rule 1 ────────────────────────────────────────────────────────────────

    private static void peakHours(SignalBundle b, List<InsightCandidate> out) {
        List<Map.Entry<Integer, Integer>> nonZero = byCountDescending(b.photoHourOfDay()).stream()
            .filter(e -> e.getValue() > 0)
            .toList();
        if (nonZero.size() < 2) return;

        Map.Entry<Integer, Integer> first  = nonZero.get(0);
        Map.Entry<Integer, Integer> second = nonZero.get(1);
        out.add(InsightCandidate.of(
            InsightType.PHOTO_PATTERN,
            "Peak photography at " + hour(first.getKey()) + " and " + hour(second.getKey()),
            "Based on " + b.totalPhotos() + " photos in the scan window, you take the most photos at "
                + hour(first.getKey()) + " (" + first.getValue() + " photos) and "
                + hour(second.getKey()) + " (" + second.getValue() + " photos).",
            nonZero.size() < MIN_CONFIDENT_COUNT));
    }

    // ── rule 2 ────────────────────────────────────────────────────────────────

    private static void weekendPhotographer(SignalBundle b, List<InsightCandidate> out) {
        SortedMap<Integer, Integer> days = b.photoDayOfWeek();
        if (days.isEmpty()) return;

        long weekendTotal = (long) days.getOrDefault(7, 0) + days.getOrDefault(1, 0);
        long weekdayTotal = 0;
        for (int d = 2; d <= 6; d++) {
            weekdayTotal += days.getOrDefault(d, 0);
        }
        double weekendAvg = weekendTotal / 2.0;
        double weekdayAvg = weekdayTotal / 5.0;
        if (!(weekdayAvg > 0 && weekendAvg > weekdayAvg * WEEKEND_FACTOR)) return;

        out.add(InsightCandidate.of(
            InsightType.PHOTO_PATTERN,
            "Weekend photographer",
            "Based on " + b.totalPhotos() + " photos in the scan window, you take "
                + oneDecimal(weekendAvg / weekdayAvg) + "x more photos on weekends ("
                + weekendTotal + " weekend photos, " + compact(weekendAvg) + " per weekend day vs "
                + compact(weekdayAvg) + " per weekday).",
            b.totalPhotos() < MIN_CONFIDENT_COUNT));
    }

    // ── rule 3 ────────────────────────────────────────────────────────────────

    private static void heaviestMeetingDay(SignalBundle b, List<InsightCandidate> out) {
        List<Map.Entry<Integer, Integer>> sorted = byCountDescending(b.meetingMinutesByDay());
        if (sorted.isEmpty() || sorted.get(0).getValue() <= 0) return;

        Map.Entry<Integer, Integer> top = sorted.get(0);
        String day = dayName(top.getKey());
        out.add(InsightCandidate.of(
            InsightType.CALENDAR_PATTERN,
            day + " is your heaviest meeting day",
            "Based on " + b.totalEvents() + " events in the scan window, " + day + " has "
                + top.getValue() + " total meeting minutes ("
                + Math.round(top.getValue() / WEEKS_PER_MONTH) + " min/week average).",
            b.totalEvents() < MIN_CONFIDENT_COUNT));
    }

    // ── rule 4 ────────────────────────────────────────────────────────────────

    private static void lightMeetingPhotoDay(SignalBundle b, List<InsightCandidate> out) {
        if (b.meetingMinutesByDay().isEmpty() || b.photoDayOfWeek().isEmpty()) return;

        Map.Entry<Integer, Integer> lightest = b.meetingMinutesByDay().entrySet().stream()
            .min(Comparator.comparingInt((Map.Entry<Integer, Integer> e) -> e.getValue())
                .thenComparingInt(Map.Entry::getKey))
            .orElseThrow();
        Map.Entry<Integer, Integer> busiest = byCountDescending(b.photoDayOfWeek()).get(0);
        if (!lightest.getKey().equals(busiest.getKey())) return;

        out.add(InsightCandidate.of(
            InsightType.CROSS_PATTERN,
            "You shoot more on your lightest meeting days",
            dayName(lightest.getKey()) + " has the fewest meetings (" + lightest.getValue()
                + " min total) and the most photos (" + busiest.getValue() + " photos).",
            b.totalPhotos() < MIN_CONFIDENT_COUNT && b.totalEvents() < MIN_CONFIDENT_COUNT));
    }

    // ── rule 5 ────────────────────────────────────────────────────────────────

    private static void nightOwlOrEarlyBird(SignalBundle b, List<InsightCandidate> out) {
        int total = b.totalPhotos();
        if (b.photoHourOfDay().isEmpty() || total <= 0) return;

        int night = 0;
        int morning = 0;
        for (Map.Entry<Integer, Integer> e : b.photoHourOfDay().entrySet()) {
            int h = e.getKey();
            if (h >= 20 || h <= 5) night += e.getValue();
            if (h >= 5 && h <= 8)  morning += e.getValue();
        }

        double nightShare   = (double) night / total;
        double morningShare = (double) morning / total;
        if (nightShare > TIME_OF_DAY_SHARE) {
            out.add(InsightCandidate.of(
                InsightType.PHOTO_PATTERN,
                "Night owl photographer",
                percent(nightShare) + "% of your " + total + " photos (" + night
                    + " photos) were taken between 8 PM and 5 AM.",
                night < MIN_CONFIDENT_COUNT));
        } else if (morningShare > TIME_OF_DAY_SHARE) {
            out.add(InsightCandidate.of(
                InsightType.PHOTO_PATTERN,
                "Early bird photographer",
                percent(morningShare) + "% of your " + total + " photos (" + morning
                    + " photos) were taken between 5 AM and 8 AM.",
                morning < MIN_CONFIDENT_COUNT));
        }
    }

    // ── rule 6 ────────────────────────────────────────────────────────────────

    private static void homeBase(SignalBundle b, List<InsightCandidate> out) {
        int located = b.photosWithLocation();
        if (located <= 0 || b.topLocations().isEmpty()) return;

        int top = b.topLocations().stream().mapToInt(LocationCluster::count).max().orElse(0);
        double share = (double) top / located;
        if (share <= HOME_BASE_SHARE) return;

        out.add(InsightCandidate.of(
            InsightType.PHOTO_PATTERN,
            "You have a photography home base",
            percent(share) + "% of your " + located + " geotagged photos (" + top
                + " photos) cluster at one location.",
            top < MIN_CONFIDENT_COUNT));
    }

    // ── rule 7 ────────────────────────────────────────────────────────────────

    private static void busyDayOverlap(SignalBundle b, List<InsightCandidate> out) {
        if (b.photoDayOfWeek().isEmpty() || b.calendarDayOfWeek().isEmpty()) return;

        int active = 0;
        int both = 0;
        for (int day = 1; day <= 7; day++) {
            int photos = b.photoDayOfWeek().getOrDefault(day, 0);
            int events = b.calendarDayOfWeek().getOrDefault(day, 0);
            if (photos > ACTIVE_DAY_THRESHOLD || events > ACTIVE_DAY_THRESHOLD) active++;
            if (photos > ACTIVE_DAY_THRESHOLD && events > ACTIVE_DAY_THRESHOLD) both++;
        }
        if (active == 0 || (double) both / active <= BUSY_DAY_SHARE) return;

        out.add(InsightCandidate.of(
            InsightType.CROSS_PATTERN,
            "Busy days equal photo days",
            both + " of " + active + " active days have both more than three events and more than"
                + " three photos -- your busiest days are also your most photogenic.",
            both < MIN_CONFIDENT_COUNT));
    }

    // ── rule 8 ────────────────────────────────────────────────────────────────

    private static void secretPhotoDay(SignalBundle b, List<InsightCandidate> out) {
        List<Map.Entry<Integer, Integer>> sorted = byCountDescending(b.photoDayOfWeek());
        if (sorted.size() < 2 || sorted.get(0).getValue() <= 0) return;

        Map.Entry<Integer, Integer> top    = sorted.get(0);
        Map.Entry<Integer, Integer> second = sorted.get(1);
        if (second.getValue() <= 0) return;
        double ratio = (double) top.getValue() / second.getValue();
        if (ratio < SURPRISE_RATIO) return;

        out.add(InsightCandidate.of(
            InsightType.SURPRISING,
            dayName(top.getKey()) + ": your secret photo day",
            dayName(top.getKey()) + " has " + top.getValue() + " photos -- " + oneDecimal(ratio)
                + "x more than " + dayName(second.getKey()) + " (" + second.getValue() + " photos).",
            top.getValue() < MIN_CONFIDENT_COUNT));
    }

    // ── partial data and minimum guarantee ────────────────────────────────────

    private static void sourceNote(SignalBundle b, List<InsightCandidate> out) {
        if (!b.photoSourceAvailable() && b.calendarSourceAvailable()) {
            out.add(InsightCandidate.of(
                InsightType.CALENDAR_PATTERN,
                "Calendar-only analysis",
                "Photo library was unavailable. Analysis based on " + b.totalEvents()
                    + " calendar events only.",
                true));
        } else if (b.photoSourceAvailable() && !b.calendarSourceAvailable()) {
            out.add(InsightCandidate.of(
                InsightType.PHOTO_PATTERN,
                "Photo-only analysis",
                "Calendar was unavailable. Analysis based on " + b.totalPhotos() + " photos only.",
                true));
        }
    }

    private static void ensureMinimum(SignalBundle b, List<InsightCandidate> out) {
        if (out.size() >= MIN_CANDIDATES) return;

        if (b.photoSourceAvailable() && b.totalPhotos() > 0) {
            out.add(InsightCandidate.of(
                InsightType.PHOTO_PATTERN,
                "Active photographer",
                "You have taken " + b.totalPhotos() + " photos in the scan window.",
                b.totalPhotos() < MIN_CONFIDENT_COUNT));
        }
        if (b.calendarSourceAvailable() && b.totalEvents() > 0) {
            out.add(InsightCandidate.of(
                InsightType.CALENDAR_PATTERN,
                "Organized scheduler",
                "You have " + b.totalEvents() + " calendar events in the scan window.",
                b.totalEvents() < MIN_CONFIDENT_COUNT));
        }
        if (out.size() < MIN_CANDIDATES) {
            out.add(InsightCandidate.of(
                InsightType.PHOTO_PATTERN,
                "Data explorer",
                "Limited data available (" + coverage(b) + ") -- enable demo mode for a richer experience.",
                true));
        }
        if (out.size() < MIN_CANDIDATES) {
            out.add(InsightCandidate.of(
                InsightType.CALENDAR_PATTERN,
                "Quiet trail",
                "The scan found too little activity to profile (" + coverage(b) + ").",
                true));
        }
    }

    /** Totals of the readable sources only, so no claim is made about a missing one. */
    private static String coverage(SignalBundle b) {
        List<String> parts = new ArrayList<>();
        if (b.photoSourceAvailable())    parts.add(b.totalPhotos() + " photos");
        if (b.calendarSourceAvailable()) parts.add(b.totalEvents() + " events");
        if (parts.isEmpty()) {
            return "no readable sources (0 photos, 0 events)";
        }
        return String.join(", ", parts);
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    /** Entries by descending count; equal counts keep ascending key order. */
    private static List<Map.Entry<Integer, Integer>> byCountDescending(SortedMap<Integer, Integer> histogram) {
        List<Map.Entry<Integer, Integer>> entries = new ArrayList<>(histogram.entrySet());
        entries.sort(Map.Entry.<Integer, Integer>comparingByValue().reversed());
        return entries;
    }
}
