package co.fanki.webready.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static co.fanki.webready.analysis.domain.AnalysisFixtures.broken;
import static co.fanki.webready.analysis.domain.AnalysisFixtures.file;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link WebReadinessScorer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class WebReadinessScorerTest {

    private final WebReadinessScorer scorer = new WebReadinessScorer(
            AnalysisThresholds.STANDARD);

    @Test
    void whenScoring_givenLogicFile_shouldCountAllLines() {
        final FileAnalysis logic = file("calc.py", 10, 4, 0.0,
                FileClassification.LOGIC, List.of(), List.of());

        assertEquals(100.0, scorer.webReadyPercentage(List.of(logic)));
        assertEquals(100.0, scorer.fileReadiness(logic));
        assertTrue(scorer.isReusable(logic));
    }

    @Test
    void whenScoring_givenMixedFile_shouldCountOnlyPureLines() {
        final FileAnalysis mixed = file("app.py", 7, 2, 71.4,
                FileClassification.MIXED, List.of(), List.of());

        assertEquals(28.6, scorer.webReadyPercentage(List.of(mixed)));
        assertFalse(scorer.isReusable(mixed));
    }

    @Test
    void whenScoring_givenUiAndLogicFiles_shouldWeightByLines() {
        final FileAnalysis ui = file("view.py", 30, 0, 100.0,
                FileClassification.UI, List.of(), List.of());
        final FileAnalysis logic = file("calc.py", 10, 10, 0.0,
                FileClassification.LOGIC, List.of(), List.of());

        assertEquals(25.0, scorer.webReadyPercentage(List.of(ui, logic)));
    }

    @Test
    void whenScoring_givenFailedFile_shouldLeaveItOut() {
        final FileAnalysis logic = file("calc.py", 10, 10, 0.0,
                FileClassification.LOGIC, List.of(), List.of());

        assertEquals(100.0, scorer.webReadyPercentage(
                List.of(logic, broken("bad.py", 50))));
        assertEquals(0.0, scorer.fileReadiness(broken("bad.py", 50)));
    }

    @Test
    void whenScoring_givenNoCode_shouldReturnZero() {
        assertEquals(0.0, scorer.webReadyPercentage(List.of()));
        assertEquals(0.0, scorer.webReadyPercentage(List.of(file("empty.py", 0,
                0, 0.0, FileClassification.MIXED, List.of(), List.of()))));
    }

    @Test
    void whenScoring_givenThirds_shouldRoundHalfUpToOneDecimal() {
        final FileAnalysis mixed = file("app.py", 3, 2, 33.3,
                FileClassification.MIXED, List.of(), List.of());

        assertEquals(66.7, scorer.webReadyPercentage(List.of(mixed)));
    }

    @Test
    void whenBucketing_givenBoundaries_shouldBeInclusive() {
        assertEquals(Complexity.LOW, scorer.complexity(80.0));
        assertEquals(Complexity.MEDIUM, scorer.complexity(79.9));
        assertEquals(Complexity.MEDIUM, scorer.complexity(50.0));
        assertEquals(Complexity.HIGH, scorer.complexity(49.9));
        assertEquals(Complexity.HIGH, scorer.complexity(0.0));
    }

    @Test
    void whenBucketing_givenOutOfRange_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> scorer.complexity(-1.0));
    }

}
