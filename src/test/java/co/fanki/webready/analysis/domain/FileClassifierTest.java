package co.fanki.webready.analysis.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link FileClassifier}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class FileClassifierTest {

    private final FileClassifier classifier = new FileClassifier(
            AnalysisThresholds.STANDARD);

    @Test
    void whenComputingPercentage_givenExactFraction_shouldStayExact() {
        assertEquals(80.0, classifier.uiPercentage(4, 5));
        assertEquals(20.0, classifier.uiPercentage(1, 5));
        assertEquals(0.0, classifier.uiPercentage(0, 0));
    }

    @Test
    void whenComputingPercentage_givenUiLinesAboveTotal_shouldCapAt100() {
        assertEquals(100.0, classifier.uiPercentage(12, 10));
    }

    @Test
    void whenClassifying_givenExactly80_shouldBeUi() {
        assertEquals(FileClassification.UI, classifier.classify(80.0, true, 10));
    }

    @Test
    void whenClassifying_givenJustBelow80_shouldBeMixed() {
        assertEquals(FileClassification.MIXED,
                classifier.classify(79.9, true, 10));
    }

    @Test
    void whenClassifying_givenExactly20WithPureFunction_shouldBeLogic() {
        assertEquals(FileClassification.LOGIC,
                classifier.classify(20.0, true, 10));
    }

    @Test
    void whenClassifying_givenLowUiWithoutPureFunction_shouldBeMixed() {
        assertEquals(FileClassification.MIXED,
                classifier.classify(0.0, false, 10));
    }

    @Test
    void whenClassifying_givenJustAbove20_shouldBeMixed() {
        assertEquals(FileClassification.MIXED,
                classifier.classify(20.1, true, 10));
    }

    @Test
    void whenClassifying_givenEmptyFile_shouldBeMixed() {
        assertEquals(FileClassification.MIXED, classifier.classify(0.0, true, 0));
    }

    @Test
    void whenClassifying_givenPercentageOutOfRange_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> classifier.classify(101.0, true, 10));
    }

}
