package com.casefile.common.narration;

import com.casefile.common.model.Deduction;
import com.casefile.common.model.DetectiveReport;
import com.casefile.common.model.InsightCandidate;
import com.casefile.common.model.InsightType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds a complete {@link DetectiveReport} straight from insight candidates, with no
 * generator involved. Used on timeout, generator failure, or an ungroundable draft.
 *
 * <p>Every deduction's evidence is copied from a candidate, so the grounding invariant
 * holds by construction. When fewer than three candidates exist, the remaining slots
 * re-cite candidate evidence under a "trail goes cold" finding instead of inventing text.
 *
 * <p>Stateless; never throws.
 */
public final class FallbackReportBuilder {

    public static final String PRIVACY_STATEMENT =
        "Every byte of this dossier was compiled on-device. No dead drops, no server contacts, "
            + "no third parties. Your secrets stayed yours.";

    static final String COLD_TRAIL_FINDING  = "The trail goes cold here";
    static final String COLD_TRAIL_EVIDENCE = "Further surveillance required to complete the dossier.";
    static final String DEFAULT_SURPRISE    = "The subject remains unpredictable.";

    private FallbackReportBuilder() {}

    public static DetectiveReport build(List<InsightCandidate> insights) {
        List<InsightCandidate> source = insights == null ? List.of() : insights;
        return new DetectiveReport(
            dramaticHeadline(source),
            deductions(source),
            surprisingFact(source),
            PRIVACY_STATEMENT);
    }

    // ── deductions ────────────────────────────────────────────────────────────

    private static List<Deduction> deductions(List<InsightCandidate> insights) {
        List<InsightCandidate> chosen = new ArrayList<>();
        for (InsightCandidate i : insights) {
            if (chosen.size() == DetectiveReport.DEDUCTION_COUNT) break;
            if (!i.lowConfidence()) chosen.add(i);
        }
        for (InsightCandidate i : insights) {
            if (chosen.size() == DetectiveReport.DEDUCTION_COUNT) break;
            boolean duplicate = chosen.stream().anyMatch(c -> c.evidence().equals(i.evidence()));
            if (!duplicate) chosen.add(i);
        }

        List<Deduction> deductions = new ArrayList<>();
        for (InsightCandidate i : chosen) {
            deductions.add(new Deduction(dramaticFinding(i), i.evidence()));
        }
        int cursor = 0;
        while (deductions.size() < DetectiveReport.DEDUCTION_COUNT) {
            String evidence = chosen.isEmpty()
                ? COLD_TRAIL_EVIDENCE
                : chosen.get(cursor++ % chosen.size()).evidence();
            deductions.add(new Deduction(COLD_TRAIL_FINDING, evidence));
        }
        return deductions;
    }

    // ── keyword rules ─────────────────────────────────────────────────────────

    public static String dramaticHeadline(List<InsightCandidate> insights) {
        boolean nightOwl     = anyHeadline(insights, "night owl");
        boolean earlyBird    = anyHeadline(insights, "early bird");
        boolean weekend      = anyHeadline(insights, "weekend");
        boolean homeBase     = anyHeadline(insights, "home base");
        boolean heavyMeeting = anyHeadline(insights, "heaviest meeting");
        boolean cross        = insights.stream().anyMatch(i -> i.type() == InsightType.CROSS_PATTERN);

        if (nightOwl)             return "Case File: The Midnight Operator";
        if (earlyBird)            return "Case File: The Dawn Patrol";
        if (weekend && homeBase)  return "Case File: The Weekend Regular";
        if (weekend)              return "Case File: The Saturday Suspect";
        if (homeBase)             return "Case File: The Creature of Habit";
        if (cross)                return "Case File: The Double Life";
        if (heavyMeeting)         return "Case File: The Corporate Ghost";
        return "Case File: Subject Under Surveillance";
    }

    public static String dramaticFinding(InsightCandidate insight) {
        String h = insight.headline().toLowerCase(Locale.ROOT);
        if (h.contains("night owl"))                  return "The subject operates under cover of darkness";
        if (h.contains("early bird"))                 return "Subject rises before the city wakes";
        if (h.contains("peak photography"))           return "Surveillance patterns reveal preferred operating hours";
        if (h.contains("weekend photographer"))       return "The subject leads a double life on weekends";
        if (h.contains("home base"))                  return "A single location keeps pulling them back";
        if (h.contains("heaviest meeting"))           return "One day a week, they vanish into back-to-back meetings";
        if (h.contains("lightest meeting"))           return "When the calendar clears, the camera comes out";
        if (h.contains("busy days equal photo days")) return "The busier the day, the more evidence they leave behind";
        if (h.contains("secret photo day"))           return "One day stands out in the surveillance logs";
        if (h.contains("only analysis"))              return "Limited intel available -- partial dossier compiled";
        return "A pattern emerges from the digital trail";
    }

    /**
     * Surprising fact from the best candidate: {@code surprising}, then
     * {@code cross_pattern}, then the first high-confidence one, then any.
     */
    public static String surprisingFact(List<InsightCandidate> insights) {
        return bestSurprise(insights)
            .map(i -> "What the subject doesn't realize: " + i.evidence())
            .orElse(DEFAULT_SURPRISE);
    }

    static Optional<InsightCandidate> bestSurprise(List<InsightCandidate> insights) {
        return firstOfType(insights, InsightType.SURPRISING)
            .or(() -> firstOfType(insights, InsightType.CROSS_PATTERN))
            .or(() -> insights.stream().filter(i -> !i.lowConfidence()).findFirst())
            .or(() -> insights.stream().findFirst());
    }

    private static Optional<InsightCandidate> firstOfType(List<InsightCandidate> insights, InsightType type) {
        return insights.stream().filter(i -> i.type() == type).findFirst();
    }

    private static boolean anyHeadline(List<InsightCandidate> insights, String keyword) {
        return insights.stream()
            .anyMatch(i -> i.headline().toLowerCase(Locale.ROOT).contains(keyword));
    }
}
