package com.casefile.common.narration;

import com.casefile.common.exception.UngroundedNarrationException;
import com.casefile.common.insight.InsightEngine;
import com.casefile.common.model.Deduction;
import com.casefile.common.model.DetectiveReport;
import com.casefile.common.model.InsightCandidate;
import com.casefile.common.model.InsightType;
import com.casefile.common.model.NarrationDraft;
import com.casefile.common.synthetic.SyntheticSignals;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies grounding, category honesty and report shape of {@link NarrationValidator}.
 */
class NarrationValidatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final InsightCandidate WEEKEND = InsightCandidate.of(InsightType.PHOTO_PATTERN,
        "Weekend photographer",
        "Based on 230 photos in the scan window, you take 9.0x more photos on weekends "
            + "(180 weekend photos, 90 per weekend day vs 10 per weekday).", false);
    private static final InsightCandidate TUESDAY = InsightCandidate.of(InsightType.CALENDAR_PATTERN,
        "Tuesday is your heaviest meeting day",
        "Based on 40 events in the scan window, Tuesday has 320 total meeting minutes (74 min/week average).",
        false);
    private static final InsightCandidate SECRET = InsightCandidate.of(InsightType.SURPRISING,
        "Saturday: your secret photo day",
        "Saturday has 100 photos -- 2.0x more than Sunday (50 photos).", false);

    private static final List<InsightCandidate> NO_LOCATION = List.of(WEEKEND, TUESDAY, SECRET);

    private static final Deduction GROUNDED_WEEKEND =
        new Deduction("The weekend alter ego", "Ninety photos a day, 90 to be exact, every weekend.");
    private static final Deduction GROUNDED_TUESDAY =
        new Deduction("Tuesday disappears", "320 minutes of meetings swallow every Tuesday.");
    private static final Deduction GROUNDED_SECRET =
        new Deduction("Saturday is sacred", "Saturday alone holds 100 shots.");

    private static NarrationDraft draft(Deduction... deductions) {
        return new NarrationDraft("Case File: The Test Subject", List.of(deductions),
            "Saturday has 100 photos.", "Nothing left the device.");
    }

    // ── grounding ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("numeric grounding")
    class Grounding {

        @Test
        @DisplayName("fully grounded draft passes through verbatim")
        void groundedDraftKept() {
            NarrationValidator.ValidationResult result = NarrationValidator.review(
                draft(GROUNDED_WEEKEND, GROUNDED_TUESDAY, GROUNDED_SECRET), NO_LOCATION);

            assertEquals(List.of(GROUNDED_WEEKEND, GROUNDED_TUESDAY, GROUNDED_SECRET), result.report().deductions());
            assertEquals("Case File: The Test Subject", result.report().headline());
            assertEquals("Saturday has 100 photos.", result.report().surprisingFact());
            assertEquals("Nothing left the device.", result.report().privacyStatement());
            assertFalse(result.repaired());
        }

        @Test
        @DisplayName("untraceable \"57\" is replaced by the candidate at the same position")
        void untraceableNumberReplacedPositionally() {
            Deduction fabricated = new Deduction("Selfie addict", "You took 57 selfies last month.");

            DetectiveReport report = NarrationValidator.validate(
                draft(GROUNDED_WEEKEND, fabricated, GROUNDED_SECRET), NO_LOCATION);

            assertEquals(GROUNDED_WEEKEND, report.deductions().get(0));
            assertEquals(Deduction.fromInsight(TUESDAY), report.deductions().get(1));
            assertEquals(GROUNDED_SECRET, report.deductions().get(2));
        }

        @Test
        @DisplayName("no candidate at the current position → first unused candidate substitutes")
        void positionBeyondCandidatesWrapsToFirstUnused() {
            Deduction bad = new Deduction("Bad", "999 of something");

            DetectiveReport report = NarrationValidator.validate(
                draft(GROUNDED_WEEKEND, GROUNDED_TUESDAY, bad), List.of(WEEKEND, TUESDAY));

            assertEquals(GROUNDED_WEEKEND, report.deductions().get(0));
            assertEquals(GROUNDED_TUESDAY, report.deductions().get(1));
            assertEquals(Deduction.fromInsight(WEEKEND), report.deductions().get(2));
        }

        @Test
        @DisplayName("fabricated Paris location claim is replaced by a raw candidate")
        void parisClaimReplaced() {
            Deduction paris = new Deduction("A Parisian at heart", "82% of your photos are from Paris");

            DetectiveReport report = NarrationValidator.validate(
                draft(paris, GROUNDED_TUESDAY, GROUNDED_SECRET), NO_LOCATION);

            assertEquals(3, report.deductions().size());
            assertTrue(report.deductions().stream().noneMatch(d -> d.evidence().contains("Paris")));
            assertEquals(Deduction.fromInsight(WEEKEND), report.deductions().get(0));
        }

        @Test
        @DisplayName("every validated deduction intersects the legitimate numbers")
        void everyDeductionGrounded() {
            List<InsightCandidate> insights = InsightEngine.computeInsights(SyntheticSignals.bundle());
            Set<String> legitimate = NumeralExtractor.legitimateNumbers(insights);
            NarrationDraft wild = draft(
                new Deduction("A", "31 things"), new Deduction("B", "no numbers at all"),
                new Deduction("C", "exactly 247 photos"));

            DetectiveReport report = NarrationValidator.validate(wild, insights);

            report.deductions().forEach(d ->
                assertTrue(NumeralExtractor.isGrounded(d.evidence(), legitimate), d.evidence()));
        }

        @Test
        @DisplayName("surprising fact with an untraceable number falls back to the best candidate")
        void surprisingFactWithFabricatedNumber() {
            NarrationDraft d = new NarrationDraft("H", List.of(GROUNDED_WEEKEND, GROUNDED_TUESDAY, GROUNDED_SECRET),
                "You visited 14 countries.", "P");

            NarrationValidator.ValidationResult result = NarrationValidator.review(d, NO_LOCATION);

            assertEquals("What the subject doesn't realize: " + SECRET.evidence(), result.report().surprisingFact());
            assertTrue(result.repaired());
        }
    }

    // ── category honesty ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("category honesty")
    class CategoryHonesty {

        @Test
        @DisplayName("location wording is rejected when no candidate mentions a location; padding stays positional")
        void locationRejectedWithoutLocationCandidate() {
            Deduction places = new Deduction("Your favourite places", "You return there 90 times.");

            DetectiveReport report = NarrationValidator.validate(
                draft(places, GROUNDED_TUESDAY, GROUNDED_SECRET), NO_LOCATION);

            assertFalse(report.deductions().contains(places));
            assertEquals(List.of(GROUNDED_TUESDAY, GROUNDED_SECRET, Deduction.fromInsight(SECRET)),
                report.deductions());
        }

        @Test
        @DisplayName("location wording is allowed once a geotag candidate exists")
        void locationAllowedWithLocationCandidate() {
            InsightCandidate home = InsightCandidate.of(InsightType.PHOTO_PATTERN, "You have a photography home base",
                "38% of your 189 geotagged photos (72 photos) cluster at one location.", false);
            Deduction places = new Deduction("One location rules them all", "72 photos from a single spot.");

            DetectiveReport report = NarrationValidator.validate(
                draft(places, GROUNDED_TUESDAY, GROUNDED_SECRET), List.of(home, TUESDAY, SECRET));

            assertEquals(places, report.deductions().get(0));
        }

        @Test
        @DisplayName("photo claims are rejected when only calendar data backs the candidates")
        void photoClaimRejectedWithoutPhotoSource() {
            InsightCandidate note = InsightCandidate.of(InsightType.CALENDAR_PATTERN, "Calendar-only analysis",
                "Photo library was unavailable. Analysis based on 40 calendar events only.", true);
            InsightCandidate busiest = InsightCandidate.of(InsightType.CALENDAR_PATTERN, "Wednesday is packed",
                "Wednesday has 12 events.", false);
            Deduction photoClaim = new Deduction("Shutterbug", "You took 320 photos on Tuesdays.");

            DetectiveReport report = NarrationValidator.validate(
                draft(photoClaim), List.of(TUESDAY, note, busiest));

            assertFalse(report.deductions().contains(photoClaim));
            assertEquals(List.of(Deduction.fromInsight(TUESDAY), Deduction.fromInsight(note),
                Deduction.fromInsight(busiest)), report.deductions());
        }

        @Test
        @DisplayName("meeting claims are rejected when no high-confidence calendar candidate exists")
        void meetingClaimRejectedWithoutCalendar() {
            InsightCandidate peak = InsightCandidate.of(InsightType.PHOTO_PATTERN, "Peak photography at 6 PM and 10 AM",
                "Based on 247 photos in the scan window, you take the most photos at 6 PM (42 photos) "
                    + "and 10 AM (38 photos).", false);
            Deduction meetings = new Deduction("Meeting marathon", "247 meetings and counting.");

            DetectiveReport report = NarrationValidator.validate(
                draft(meetings, GROUNDED_WEEKEND), List.of(WEEKEND, peak, SECRET));

            assertFalse(report.deductions().contains(meetings));
        }
    }

    // ── report shape ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("report shape")
    class ReportShape {

        @Test
        @DisplayName("zero proposals → padded from candidates in order")
        void zeroProposals() {
            DetectiveReport report = NarrationValidator.validate(draft(), NO_LOCATION);
            assertEquals(List.of(Deduction.fromInsight(WEEKEND), Deduction.fromInsight(TUESDAY),
                Deduction.fromInsight(SECRET)), report.deductions());
        }

        @Test
        @DisplayName("one proposal → kept and padded to three")
        void oneProposal() {
            DetectiveReport report = NarrationValidator.validate(draft(GROUNDED_SECRET), NO_LOCATION);

            assertEquals(DetectiveReport.DEDUCTION_COUNT, report.deductions().size());
            assertEquals(GROUNDED_SECRET, report.deductions().get(0));
        }

        @Test
        @DisplayName("narration of the first candidate only → padded with the next candidates, no repeat")
        void paddingContinuesAfterNarratedCandidates() {
            NarrationValidator.ValidationResult result =
                NarrationValidator.review(draft(GROUNDED_WEEKEND), NO_LOCATION);

            assertEquals(List.of(GROUNDED_WEEKEND, Deduction.fromInsight(TUESDAY), Deduction.fromInsight(SECRET)),
                result.report().deductions());
            assertEquals(List.of("padded with candidate 2", "padded with candidate 3"), result.repairs());
        }

        @Test
        @DisplayName("two narrated candidates → padded with the third")
        void paddingAfterTwoNarrated() {
            DetectiveReport report = NarrationValidator.validate(
                draft(GROUNDED_WEEKEND, GROUNDED_TUESDAY), NO_LOCATION);

            assertEquals(List.of(GROUNDED_WEEKEND, GROUNDED_TUESDAY, Deduction.fromInsight(SECRET)),
                report.deductions());
        }

        @Test
        @DisplayName("five proposals → only the first three are considered")
        void fiveProposals() {
            Deduction extra = new Deduction("Extra", "Another 90 to consider.");
            DetectiveReport report = NarrationValidator.validate(
                draft(GROUNDED_WEEKEND, GROUNDED_TUESDAY, GROUNDED_SECRET, extra, extra), NO_LOCATION);

            assertEquals(List.of(GROUNDED_WEEKEND, GROUNDED_TUESDAY, GROUNDED_SECRET), report.deductions());
        }

        @Test
        @DisplayName("malformed JSON draft → three raw candidates and default texts")
        void malformedDraft() throws Exception {
            NarrationDraft malformed = NarrationDraft.fromJson(MAPPER.readTree("""
                {"headline": 42, "deductions": ["oops", 7, null, {"finding": {}}]}
                """));

            DetectiveReport report = NarrationValidator.validate(malformed, NO_LOCATION);

            assertEquals(3, report.deductions().size());
            assertEquals(Deduction.fromInsight(WEEKEND), report.deductions().get(0));
            assertEquals(NarrationValidator.DEFAULT_PRIVACY_STATEMENT, report.privacyStatement());
            assertFalse(report.headline().isBlank());
        }

        @Test
        @DisplayName("null draft behaves like an empty one")
        void nullDraft() {
            DetectiveReport report = NarrationValidator.validate(null, NO_LOCATION);
            assertEquals(3, report.deductions().size());
            assertEquals(FallbackReportBuilder.dramaticHeadline(NO_LOCATION), report.headline());
        }

        @Test
        @DisplayName("fewer than three candidates and no grounded proposals → UngroundedNarrationException")
        void cannotReachThree() {
            List<InsightCandidate> two = new ArrayList<>(List.of(WEEKEND, TUESDAY));

            UngroundedNarrationException ex = assertThrows(UngroundedNarrationException.class,
                () -> NarrationValidator.validate(draft(new Deduction("X", "no numbers")), two));
            assertEquals(2, ex.getGroundedCount());
            assertEquals("validation", ex.getStage());
        }
    }
}
