package com.casefile.common.narration;

import com.casefile.common.exception.UngroundedNarrationException;
import com.casefile.common.model.Deduction;
import com.casefile.common.model.DetectiveReport;
import com.casefile.common.model.InsightCandidate;
import com.casefile.common.model.InsightType;
import com.casefile.common.model.NarrationDraft;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Anti-fabrication gate between the generator and the report.
 *
 * <p>The draft's structure is trusted, its content is not. Each proposed deduction is
 * checked against the insight candidates the draft was prompted with:
 *
 * <h3>Per deduction (first {@value DetectiveReport#DEDUCTION_COUNT} only, in order)</h3>
 * <ol>
 *   <li>Category gate: claims about a data category are dropped when no
 *       candidate backs that category.</li>
 *   <li>Numeric gate: kept verbatim if its evidence shares a numeral with any candidate's
 *       evidence.</li>
 *   <li>Repair: otherwise replaced by the raw candidate at the same output position
 *       (or the next unused one).</li>
 * </ol>
 *
 * <p>The list is then padded positionally: the candidate at the next output position if
 * unused, else the next unused one, wrapping to the lowest unused. If the
 * required count still cannot be reached an {@link UngroundedNarrationException} is thrown
 * and the caller falls back to {@link FallbackReportBuilder}.
 *
 * <p>Positional repair means a substituted candidate keeps the slot of the deduction it
 * replaced, next to generator-styled neighbours. That pairing is kept as is.
 *
 * <p>Stateless and thread-safe.
 */
public final class NarrationValidator {

    public static final String DEFAULT_PRIVACY_STATEMENT =
        "Every byte of this analysis happened on your device. No data was uploaded, "
            + "no servers were contacted.";

    private static final List<String> LOCATION_TERMS = List.of("location", "places", "geotag");
    private static final List<String> PHOTO_TERMS    = List.of("photo");
    private static final List<String> CALENDAR_TERMS = List.of("meeting", "calendar", "event");

    private NarrationValidator() {}

    public static DetectiveReport validate(NarrationDraft draft, List<InsightCandidate> insights) {
        return review(draft, insights).report();
    }

    /**
     * Same as {@link #validate} but also returns the repairs applied, for logging.
     *
     * @throws UngroundedNarrationException if fewer than three grounded deductions can be assembled
     */
    public static ValidationResult review(NarrationDraft draft, List<InsightCandidate> insights) {
        List<InsightCandidate> candidates = insights == null ? List.of() : insights;
        NarrationDraft safeDraft = draft == null ? NarrationDraft.fromJson(null) : draft;

        Set<String> legitimate = NumeralExtractor.legitimateNumbers(candidates);
        Categories categories  = Categories.of(candidates);

        List<Deduction> accepted = new ArrayList<>();
        boolean[] used = new boolean[candidates.size()];
        List<String> repairs = new ArrayList<>();

        List<Deduction> proposed = safeDraft.deductions();
        int considered = Math.min(proposed.size(), DetectiveReport.DEDUCTION_COUNT);
        for (int i = 0; i < considered; i++) {
            Deduction d = proposed.get(i);
            String rejectedCategory = categories.unsupportedCategoryIn(d);
            if (rejectedCategory != null) {
                repairs.add("rejected deduction " + (i + 1) + ": unsupported " + rejectedCategory + " claim");
                continue;
            }
            if (NumeralExtractor.isGrounded(d.evidence(), legitimate)) {
                accepted.add(new Deduction(
                    d.finding().isBlank() ? "Finding" : d.finding(),
                    d.evidence()));
                continue;
            }
            int slot = substituteIndex(accepted.size(), used);
            if (slot >= 0) {
                used[slot] = true;
                accepted.add(Deduction.fromInsight(candidates.get(slot)));
                repairs.add("replaced deduction " + (i + 1) + ": numbers " + NumeralExtractor.extract(d.evidence())
                    + " not traceable, substituted candidate " + (slot + 1));
            } else {
                repairs.add("dropped deduction " + (i + 1) + ": numbers not traceable and no candidate left");
            }
        }

        while (accepted.size() < DetectiveReport.DEDUCTION_COUNT) {
            int slot = substituteIndex(accepted.size(), used);
            if (slot < 0) break;
            used[slot] = true;
            accepted.add(Deduction.fromInsight(candidates.get(slot)));
            repairs.add("padded with candidate " + (slot + 1));
        }

        if (accepted.size() < DetectiveReport.DEDUCTION_COUNT) {
            throw new UngroundedNarrationException(accepted.size(), DetectiveReport.DEDUCTION_COUNT);
        }
        List<Deduction> deductions = List.copyOf(accepted.subList(0, DetectiveReport.DEDUCTION_COUNT));

        String surprisingFact = safeDraft.surprisingFact();
        if (surprisingFact.isBlank() || !numeralsAllLegitimate(surprisingFact, legitimate)) {
            if (!surprisingFact.isBlank()) {
                repairs.add("replaced surprising fact: numbers " + NumeralExtractor.extract(surprisingFact)
                    + " not traceable");
            }
            surprisingFact = FallbackReportBuilder.surprisingFact(candidates);
        }

        DetectiveReport report = new DetectiveReport(
            safeDraft.headline().isBlank() ? FallbackReportBuilder.dramaticHeadline(candidates) : safeDraft.headline(),
            deductions,
            surprisingFact,
            safeDraft.privacyStatement().isBlank() ? DEFAULT_PRIVACY_STATEMENT : safeDraft.privacyStatement());
        return new ValidationResult(report, List.copyOf(repairs));
    }

    /** Candidate at the current output position if unused, else the next unused one. */
    private static int substituteIndex(int position, boolean[] used) {
        for (int i = position; i < used.length; i++) {
            if (!used[i]) return i;
        }
        for (int i = 0; i < Math.min(position, used.length); i++) {
            if (!used[i]) return i;
        }
        return -1;
    }

    private static boolean numeralsAllLegitimate(String text, Set<String> legitimate) {
        return legitimate.containsAll(NumeralExtractor.extract(text));
    }

    /**
     * The draft plus the repairs the validator made to it, in the order they were applied.
     */
    public record ValidationResult(DetectiveReport report, List<String> repairs) {
        public boolean repaired() {
            return !repairs.isEmpty();
        }
    }

    // ── category availability ─────────────────────────────────────────────────

    private record Categories(boolean hasPhoto, boolean hasCalendar, boolean hasLocation) {

        static Categories of(List<InsightCandidate> insights) {
            boolean photo = insights.stream()
                .anyMatch(i -> i.type() == InsightType.PHOTO_PATTERN && !i.lowConfidence());
            boolean calendar = insights.stream()
                .anyMatch(i -> i.type() == InsightType.CALENDAR_PATTERN && !i.lowConfidence());
            boolean location = insights.stream()
                .map(i -> i.evidence().toLowerCase(Locale.ROOT))
                .anyMatch(e -> e.contains("location") || e.contains("geotag"));
            return new Categories(photo, calendar, location);
        }

        /** Name of the first unsupported category the deduction mentions, or null. */
        String unsupportedCategoryIn(Deduction d) {
            String text = (d.finding() + " " + d.evidence()).toLowerCase(Locale.ROOT);
            if (!hasLocation && mentions(text, LOCATION_TERMS)) return "location";
            if (!hasPhoto && mentions(text, PHOTO_TERMS))       return "photo";
            if (!hasCalendar && mentions(text, CALENDAR_TERMS)) return "calendar";
            return null;
        }

        private static boolean mentions(String text, List<String> terms) {
            return terms.stream().anyMatch(text::contains);
        }
    }
}
