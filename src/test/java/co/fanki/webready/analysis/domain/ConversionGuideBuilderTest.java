package co.fanki.webready.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static co.fanki.webready.analysis.domain.AnalysisFixtures.broken;
import static co.fanki.webready.analysis.domain.AnalysisFixtures.file;
import static co.fanki.webready.analysis.domain.AnalysisFixtures.pure;
import static co.fanki.webready.analysis.domain.AnalysisFixtures.ui;
import static co.fanki.webready.analysis.domain.AnalysisFixtures.uiClass;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ConversionGuideBuilder}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ConversionGuideBuilderTest {

    private final ConversionGuideBuilder builder = new ConversionGuideBuilder(
            AnalysisThresholds.STANDARD,
            new WebReadinessScorer(AnalysisThresholds.STANDARD));

    @Test
    void whenBuilding_givenLogicOnlyProject_shouldRecommendReuse() {
        final FileAnalysis logic = file("calc.py", 8, 8, 0.0,
                FileClassification.LOGIC, List.of(pure("calc.py", "add", 1, 3),
                        pure("calc.py", "mul", 5, 8)), List.of());

        final WebConversionGuide guide = builder.build(List.of(logic),
                List.of(), 100.0);

        assertEquals(List.of("calc.py"), guide.reusableModules());
        assertTrue(guide.uiComponentsToReplace().isEmpty());
        assertEquals(Complexity.LOW, guide.estimatedComplexity());
        assertEquals(ConversionGuideBuilder.RECOMMENDED_APPROACH,
                guide.recommendedApproach());
        assertEquals(List.of("2 pure functions in 1 files are web-ready and"
                + " can be reused as-is"), guide.recommendations());
        assertEquals("Project has 1 web-ready files and 0 files requiring UI"
                + " conversion; 100.0% of the code is web-ready",
                guide.summary());
    }

    @Test
    void whenBuilding_givenMixedFileWithPureAndUiFunctions_shouldAdviseSplit() {
        final FileAnalysis mixed = file("app.py", 7, 2, 71.4,
                FileClassification.MIXED, List.of(
                        ui("app.py", "f1", 4, 7, "QLabel", "setText", "show",
                                "QApplication"),
                        pure("app.py", "f2", 9, 10)), List.of());

        final WebConversionGuide guide = builder.build(List.of(mixed),
                List.of(), 28.6);

        assertEquals(List.of(
                "1 mixed files need refactoring to separate UI from logic",
                "Split app.py: 1 pure functions can move to a logic module,"
                        + " 1 UI-bound functions stay in the view layer"),
                guide.recommendations());
        assertEquals(Complexity.HIGH, guide.estimatedComplexity());
        assertTrue(guide.reusableModules().isEmpty());
    }

    @Test
    void whenBuilding_givenRefactoringsAndFailures_shouldCountThem() {
        final RefactoringSuggestion suggestion = new RefactoringSuggestion(
                "view.py", "refresh", 1, 5, "Minimal UI usage: show",
                Effort.MEDIUM, false, List.of("show"));
        final FileAnalysis view = file("view.py", 5, 0, 100.0,
                FileClassification.UI, List.of(), List.of());

        final WebConversionGuide guide = builder.build(
                List.of(view, broken("bad.py", 3)), List.of(suggestion), 0.0);

        assertEquals(List.of("view.py"), guide.uiComponentsToReplace());
        assertEquals(List.of(
                "1 functions become reusable after removing a few UI calls or"
                        + " shared state accesses",
                "1 files could not be analyzed and were left out of the"
                        + " results"),
                guide.recommendations());
    }

    @Test
    void whenBuilding_givenLargeUiClass_shouldAdviseBreakingItDown() {
        final ClassInfo window = uiClass("win.py", "MainWindow",
                "QtWidgets.QMainWindow", 1, 250);
        final FileAnalysis view = file("win.py", 250, 0, 100.0,
                FileClassification.UI, List.of(), List.of(window));

        final WebConversionGuide guide = builder.build(List.of(view),
                List.of(), 0.0);

        assertEquals(List.of(
                "Large UI class MainWindow in win.py (250 LOC): break it down"
                        + " into smaller components and extract its business"
                        + " logic",
                "Main UI framework: QMainWindow - plan an equivalent web"
                        + " frontend component model"),
                guide.recommendations());
    }

    @Test
    void whenFindingMainBase_givenTie_shouldPickAlphabeticallyFirst() {
        final FileAnalysis view = file("v.py", 10, 0, 100.0,
                FileClassification.UI, List.of(), List.of(
                        uiClass("v.py", "B", "QWidget", 1, 4),
                        uiClass("v.py", "A", "QDialog", 5, 10)));

        assertEquals("QDialog",
                ConversionGuideBuilder.mainUiBaseClass(List.of(view)));
    }

    @Test
    void whenFindingMainBase_givenNoUiClass_shouldReturnNull() {
        assertNull(ConversionGuideBuilder.mainUiBaseClass(List.of()));
    }

}
