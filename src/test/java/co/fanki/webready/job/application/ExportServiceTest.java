package co.fanki.webready.job.application;

import co.fanki.webready.analysis.domain.AnalysisOrchestrator;
import co.fanki.webready.analysis.domain.AnalysisRequest;
import co.fanki.webready.analysis.domain.AnalysisThresholds;
import co.fanki.webready.analysis.domain.ProjectAnalysisResult;
import co.fanki.webready.analysis.domain.SourceFile;
import co.fanki.webready.analysis.domain.ToolkitRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ExportService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ExportServiceTest {

    private static final List<SourceFile> SOURCES = List.of(
            SourceFile.ofText("logic/calc.py", String.join("\n",
                    "import math",
                    "from PyQt5.QtWidgets import QLabel",
                    "",
                    "def hypot(a, b):",
                    "    squares = a * a + b * b",
                    "    return math.sqrt(squares)",
                    "",
                    "def outer(x):",
                    "    def inner(y):",
                    "        return y + 1",
                    "    return inner(x)",
                    "")),
            SourceFile.ofText("ui/window.py", String.join("\n",
                    "import tkinter as tk",
                    "",
                    "class Window(tk.Frame):",
                    "    def build(self):",
                    "        self.pack()",
                    "",
                    "    def scale(self, value, factor):",
                    "        result = value * factor",
                    "        return round(result, 2)",
                    "")),
            SourceFile.ofText("broken, \"odd\".py", "def oops(:\n"));

    private final ExportService exportService = new ExportService(
            new ObjectMapper());

    private final ProjectAnalysisResult result = new AnalysisOrchestrator(
            ToolkitRegistry.standard(), AnalysisThresholds.STANDARD, 1)
            .analyze(new AnalysisRequest("my project", SOURCES));

    @Test
    void whenExportingJson_givenResult_shouldWriteWholeResult()
            throws IOException {
        final JsonNode json = new ObjectMapper().readTree(
                exportService.exportJson(result));

        assertEquals("my project", json.get("projectName").asText());
        assertEquals(3, json.get("totalFiles").asInt());
        assertEquals(3, json.get("files").size());
        assertTrue(json.get("summary").has("webReadyPercentage"));
        assertTrue(json.get("webConversionGuide").has("recommendations"));
        assertFalse(json.get("files").get(0).has("analyzed"));
    }

    @Test
    void whenExportingCsv_givenResult_shouldWriteBomHeaderAndRows() {
        final String csv = new String(exportService.exportCsv(result),
                StandardCharsets.UTF_8);

        assertTrue(csv.startsWith("\uFEFF"));
        final String[] rows = csv.substring(1).split("\r\n");
        assertEquals(4, rows.length);
        assertEquals("File Path,Lines of Code,UI Percentage (%),Pure Functions,"
                + "Classification,Web Ready", rows[0]);
        assertEquals("\"broken, \"\"odd\"\".py\",1,0.0,0,Unavailable,No",
                rows[1]);
        assertTrue(rows[2].startsWith("logic/calc.py,9,"));
        assertTrue(rows[2].endsWith(",3,Logic,Yes"));
        assertTrue(rows[3].startsWith("ui/window.py,7,"));
        assertTrue(rows[3].endsWith(",1,UI,No"));
    }

    @Test
    void whenExportingZip_givenResult_shouldWritePureFunctionFiles()
            throws IOException {
        final Map<String, String> entries = unzip(
                exportService.exportPureFunctionsZip(result, SOURCES));

        assertEquals(List.of("my_project/calc_pure.py",
                "my_project/window_pure.py", "my_project/README.md"),
                List.copyOf(entries.keySet()));

        final String calc = entries.get("my_project/calc_pure.py");
        assertTrue(calc.contains("Pure functions extracted from: logic/calc.py"));
        assertTrue(calc.contains("# Original imports\nimport math\n"));
        assertFalse(calc.contains("PyQt5"));
        assertTrue(calc.contains("# Function: hypot\n"
                + "# Original location: lines 4-6\n"
                + "# Dependencies: math.sqrt\n"
                + "def hypot(a, b):\n"));
        assertTrue(calc.contains("# Function: outer\n"));
        assertFalse(calc.contains("# Function: inner"));

        final String window = entries.get("my_project/window_pure.py");
        assertTrue(window.contains("def scale(self, value, factor):\n"
                + "    result = value * factor\n"));
        assertFalse(window.contains("import tkinter"));

        final String readme = entries.get("my_project/README.md");
        assertTrue(readme.contains("- **Total Pure Functions**: 3\n"));
        assertTrue(readme.contains("- `calc_pure.py`: 2 functions\n"));
        assertTrue(readme.contains("- `window_pure.py`: 1 functions\n"));
    }

    @Test
    void whenExportingZip_givenSameStemTwice_shouldSuffixSecondFile()
            throws IOException {
        final List<SourceFile> sources = List.of(
                SourceFile.ofText("a/util.py",
                        "def one(x):\n    y = x\n    return y\n"),
                SourceFile.ofText("b/util.py",
                        "def two(x):\n    y = x\n    return y\n"));
        final ProjectAnalysisResult twins = new AnalysisOrchestrator(
                ToolkitRegistry.standard(), AnalysisThresholds.STANDARD, 1)
                .analyze(new AnalysisRequest("...", sources));

        final Map<String, String> entries = unzip(
                exportService.exportPureFunctionsZip(twins, sources));

        assertEquals(List.of("extracted_functions/util_pure.py",
                "extracted_functions/util_pure_2.py",
                "extracted_functions/README.md"),
                List.copyOf(entries.keySet()));
    }

    private static Map<String, String> unzip(final byte[] zip)
            throws IOException {
        final Map<String, String> entries = new LinkedHashMap<>();
        try (ZipInputStream in = new ZipInputStream(
                new ByteArrayInputStream(zip), StandardCharsets.UTF_8)) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                entries.put(entry.getName(), new String(in.readAllBytes(),
                        StandardCharsets.UTF_8));
            }
        }
        return entries;
    }

}
