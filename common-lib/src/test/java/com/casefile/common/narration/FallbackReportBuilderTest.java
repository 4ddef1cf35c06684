package com.casefile.common.narration;

import com.casefile.common.insight.InsightEngine;
import com.casefile.common.model.Deduction;
import com.casefile.common.model.DetectiveReport;
import com.casefile.common.model.InsightCandidate;
import com.casefile.common.model.InsightType;
import com.casefile.common.model.SignalBundle;
import com.casefile.common.synthetic.SyntheticSignals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FallbackReportBuilderTest {

    private static final InsightCandidate NIGHT_OWL = InsightCandidate.of(InsightType.PHOTO_PATTERN,
        "Night owl photographer", "25% of your 100 photos (25 photos) were taken between 8 PM and 5 AM.", false);

    @Nested
    @DisplayName("demo dataset")
    class DemoDataset {

        private final List<InsightCandidate> insights = InsightEngine.computeInsights(SyntheticSignals.bundle());

        @Test
        @DisplayName("weekend and home-base candidates → The Weekend Regular")
        void headline() {
            assertEquals("Case File: The Weekend Regular", FallbackReportBuilder.build(insights).headline());
        }

        @Test
        @DisplayName("exactly three grounded deductions with dramatised findings")
        void groundedDeductions() {
            DetectiveReport report = FallbackReportBuilder.build(insights);
            Set<String> legitimate = NumeralExtractor.legitimateNumbers(insights);

            assertEquals(DetectiveReport.DEDUCTION_COUNT, report.deductions().size());
            assertEquals("Surveillance patterns reveal preferred operating hours", report.deductions().get(0).finding());
            assertEquals(insights.get(0).evidence(), report.deductions().get(0).evidence());
            report.deductions().forEach(d ->
                assertTrue(NumeralExtractor.isGrounded(d.evidence(), legitimate), d.evidence()));
        }

        @Test
        @DisplayName("no surprising candidate → cross pattern feeds the surprising fact")
        void surprisingFactFromCrossPattern() {
            String fact = FallbackReportBuilder.build(insights).surprisingFact();
            assertTrue(fact.startsWith("What the subject doesn't realize: Saturday has the fewest meetings"), fact);
        }

        @Test
        @DisplayName("privacy statement is the constant one")
        void privacyStatement() {
            assertEquals(FallbackReportBuilder.PRIVACY_STATEMENT, FallbackReportBuilder.build(insights).privacyStatement());
        }
    }

    @Nested
    @DisplayName("sparse input")
    class SparseInput {

        @Test
        @DisplayName("one candidate → the trail goes cold, re-citing its evidence")
        void singleCandidatePadded() {
            DetectiveReport report = FallbackReportBuilder.build(List.of(NIGHT_OWL));

            assertEquals(3, report.deductions().size());
            assertEquals("The subject operates under cover of darkness", report.deductions().get(0).finding());
            assertEquals(new Deduction(FallbackReportBuilder.COLD_TRAIL_FINDING, NIGHT_OWL.evidence()),
                report.deductions().get(1));
            assertEquals(report.deductions().get(1), report.deductions().get(2));
            assertEquals("Case File: The Midnight Operator", report.headline());
        }

        @Test
        @DisplayName("empty and null input never throw and still yield three deductions")
        void emptyInput() {
            for (List<InsightCandidate> input : Arrays.asList(List.<InsightCandidate>of(), null)) {
                DetectiveReport report = assertDoesNotThrow(() -> FallbackReportBuilder.build(input));
                assertEquals(3, report.deductions().size());
                assertEquals(FallbackReportBuilder.COLD_TRAIL_EVIDENCE, report.deductions().get(0).evidence());
                assertEquals(FallbackReportBuilder.DEFAULT_SURPRISE, report.surprisingFact());
                assertEquals("Case File: Subject Under Surveillance", report.headline());
            }
        }

        @Test
        @DisplayName("low-confidence candidates are used only after high-confidence ones")
        void highConfidenceFirst() {
            InsightCandidate weak = InsightCandidate.of(InsightType.CALENDAR_PATTERN, "Organized scheduler",
                "You have 2 calendar events in the scan window.", true);

            DetectiveReport report = FallbackReportBuilder.build(List.of(weak, NIGHT_OWL));

            assertEquals(NIGHT_OWL.evidence(), report.deductions().get(0).evidence());
            assertEquals(weak.evidence(), report.deductions().get(1).evidence());
        }

        @Test
        @DisplayName("both sources empty → placeholders still produce a grounded report")
        void placeholderInsights() {
            List<InsightCandidate> insights = InsightEngine.computeInsights(SignalBundle.empty(true, true));
            Set<String> legitimate = NumeralExtractor.legitimateNumbers(insights);

            DetectiveReport report = FallbackReportBuilder.build(insights);

            report.deductions().forEach(d ->
                assertTrue(NumeralExtractor.isGrounded(d.evidence(), legitimate), d.evidence()));
        }
    }
}
