package co.fanki.webready.job.application;

import co.fanki.webready.analysis.domain.FileAnalysis;
import co.fanki.webready.analysis.domain.FileClassification;
import co.fanki.webready.analysis.domain.FunctionInfo;
import co.fanki.webready.analysis.domain.Import;
import co.fanki.webready.analysis.domain.ProjectAnalysisResult;
import co.fanki.webready.analysis.domain.SourceFile;
import co.fanki.webready.analysis.domain.WebConversionGuide;
import co.fanki.webready.shared.DomainException;
import co.fanki.webready.shared.Preconditions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Exports a project result as JSON, CSV or a ZIP of its pure functions.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ExportService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ExportService.class);

    /** Header row of the CSV export. */
    static final List<String> CSV_HEADER = List.of("File Path",
            "Lines of Code", "UI Percentage (%)", "Pure Functions",
            "Classification", "Web Ready");

    private static final String UTF8_BOM = "\uFEFF";

    private final ObjectMapper objectMapper;

    /**
     * Creates a new ExportService.
     *
     * @param theObjectMapper the JSON mapper
     */
    public ExportService(final ObjectMapper theObjectMapper) {
        this.objectMapper = theObjectMapper;
    }

    /**
     * Exports the whole result as indented JSON.
     *
     * @param result the project result, never null
     * @return the UTF-8 JSON document
     */
    public byte[] exportJson(final ProjectAnalysisResult result) {
        Preconditions.requireNonNull(result, "Result is required");
        try {
            final byte[] json = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsBytes(result);
            LOG.info("Exported {} as JSON ({} bytes)", result.projectName(),
                    json.length);
            return json;
        } catch (final JsonProcessingException e) {
            throw new DomainException("Failed to export JSON: "
                    + e.getMessage(), "EXPORT_FAILED", e);
        }
    }

    /**
     * Exports one summary row per file as CSV.
     *
     * <p>The document starts with a UTF-8 byte order mark so spreadsheet
     * tools pick the right encoding. Rows follow the file order of the
     * result.</p>
     *
     * @param result the project result, never null
     * @return the UTF-8 CSV document
     */
    public byte[] exportCsv(final ProjectAnalysisResult result) {
        Preconditions.requireNonNull(result, "Result is required");
        final StringBuilder csv = new StringBuilder(UTF8_BOM);
        row(csv, CSV_HEADER);
        for (final FileAnalysis file : result.files()) {
            final int pure = pureFunctions(file).size();
            row(csv, List.of(
                    file.path(),
                    String.valueOf(file.loc()),
                    String.format(Locale.ROOT, "%.1f", file.uiPercentage()),
                    String.valueOf(pure),
                    label(file.classification()),
                    webReady(file.classification(), pure)));
        }
        final byte[] bytes = csv.toString().getBytes(StandardCharsets.UTF_8);
        LOG.info("Exported {} as CSV ({} bytes)", result.projectName(),
                bytes.length);
        return bytes;
    }

    /**
     * Exports the pure functions of the project as a ZIP archive.
     *
     * <p>The archive holds, under a folder named after the project, one
     * {@code <stem>_pure.py} per file with pure functions and a
     * {@code README.md} summary. Each Python file carries the non-UI
     * imports of its source and the source text of its outermost pure
     * functions.</p>
     *
     * @param result the project result, never null
     * @param sources the analyzed sources, to copy the function code from
     * @return the ZIP archive
     */
    public byte[] exportPureFunctionsZip(final ProjectAnalysisResult result,
            final List<SourceFile> sources) {
        Preconditions.requireNonNull(result, "Result is required");
        Preconditions.requireNonNull(sources, "Sources are required");

        final Map<String, SourceFile> byPath = new HashMap<>();
        for (final SourceFile source : sources) {
            byPath.put(source.path(), source);
        }

        final String folder = folderName(result.projectName());
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final Map<String, Integer> extracted = new LinkedHashMap<>();
        final Set<String> usedNames = new HashSet<>();
        int total = 0;

        try (ZipOutputStream zip = new ZipOutputStream(bytes,
                StandardCharsets.UTF_8)) {
            for (final FileAnalysis file : result.files()) {
                final List<FunctionInfo> pure = outermost(pureFunctions(file));
                final SourceFile source = byPath.get(file.path());
                if (pure.isEmpty() || source == null) {
                    continue;
                }
                final String name = uniqueName(source.stem() + "_pure",
                        usedNames);
                write(zip, folder + "/" + name,
                        pureFunctionFile(file, pure, source.text()));
                extracted.put(name, pure.size());
                total += pure.size();
            }
            write(zip, folder + "/README.md", readme(result, total,
                    extracted));
        } catch (final IOException e) {
            throw new DomainException("Failed to export ZIP: "
                    + e.getMessage(), "EXPORT_FAILED", e);
        }

        LOG.info("Exported {} pure functions of {} as ZIP ({} bytes)", total,
                result.projectName(), bytes.size());
        return bytes.toByteArray();
    }

    private static void write(final ZipOutputStream zip, final String name,
            final String content) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content.getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
    }

    private static String pureFunctionFile(final FileAnalysis file,
            final List<FunctionInfo> functions, final String text) {
        final String[] lines = text.split("\r\n|\r|\n", -1);
        final StringBuilder out = new StringBuilder();
        out.append("\"\"\"\n")
                .append("Pure functions extracted from: ").append(file.path())
                .append("\n\nThese functions have no UI dependencies and can be"
                        + " reused in a web backend.\n")
                .append("\"\"\"\n\n");

        final Set<String> imports = new LinkedHashSet<>();
        for (final Import anImport : file.imports()) {
            if (!anImport.ui()) {
                imports.add(importLine(anImport));
            }
        }
        if (!imports.isEmpty()) {
            out.append("# Original imports\n");
            imports.forEach(line -> out.append(line).append('\n'));
            out.append('\n');
        }

        for (final FunctionInfo function : functions) {
            out.append("\n# Function: ").append(function.name()).append('\n')
                    .append("# Original location: lines ")
                    .append(function.lineRange()).append('\n');
            if (!function.dependencies().isEmpty()) {
                out.append("# Dependencies: ")
                        .append(String.join(", ", function.dependencies()))
                        .append('\n');
            }
            final List<String> body = new ArrayList<>();
            for (int line = function.startLine();
                    line <= function.endLine() && line <= lines.length;
                    line++) {
                body.add(lines[line - 1]);
            }
            dedent(body).forEach(line -> out.append(line).append('\n'));
        }
        return out.toString();
    }

    private static String importLine(final Import anImport) {
        if (anImport.fromImport()) {
            return "from " + anImport.module() + " import "
                    + String.join(", ", anImport.names());
        }
        final String bound = anImport.names().isEmpty()
                ? anImport.rootModule() : anImport.names().get(0);
        if (bound.equals(anImport.rootModule())) {
            return "import " + anImport.module();
        }
        return "import " + anImport.module() + " as " + bound;
    }

    /** Strips the indentation shared by all non-blank lines. */
    private static List<String> dedent(final List<String> lines) {
        int common = Integer.MAX_VALUE;
        for (final String line : lines) {
            if (!line.isBlank()) {
                int indent = 0;
                while (indent < line.length()
                        && Character.isWhitespace(line.charAt(indent))) {
                    indent++;
                }
                common = Math.min(common, indent);
            }
        }
        if (common == Integer.MAX_VALUE || common == 0) {
            return lines;
        }
        final List<String> result = new ArrayList<>();
        for (final String line : lines) {
            result.add(line.isBlank() ? "" : line.substring(common));
        }
        return result;
    }

    private static String readme(final ProjectAnalysisResult result,
            final int total, final Map<String, Integer> extracted) {
        final WebConversionGuide guide = result.webConversionGuide();
        final StringBuilder out = new StringBuilder();
        out.append("# Extracted Pure Functions\n\n")
                .append("## Summary\n\n")
                .append("- **Total Pure Functions**: ").append(total)
                .append('\n')
                .append("- **Source Files**: ").append(extracted.size())
                .append('\n')
                .append("- **Web Readiness**: ")
                .append(String.format(Locale.ROOT, "%.1f%%",
                        result.summary().webReadyPercentage()))
                .append("\n\n## Extracted Files\n\n");
        extracted.forEach((name, count) -> out.append("- `").append(name)
                .append("`: ").append(count).append(" functions\n"));

        out.append("\n## Usage Recommendations\n\n")
                .append("These functions have no UI dependencies and can be"
                        + " reused by a web backend as they are:\n\n")
                .append("1. **Copy to Backend**: place these files in the"
                        + " backend logic layer\n")
                .append("2. **Call from Endpoints**: use them from the API"
                        + " handlers\n")
                .append("3. **Test Independently**: pure functions are easy to"
                        + " unit test\n")
                .append("\n## Web Conversion Guide\n\n")
                .append("**Summary**: ").append(guide.summary()).append("\n\n")
                .append("**Recommended Approach**: ")
                .append(guide.recommendedApproach()).append("\n\n")
                .append("**Estimated Complexity**: ")
                .append(guide.estimatedComplexity()).append("\n\n");
        if (!guide.recommendations().isEmpty()) {
            out.append("**Recommendations**:\n");
            guide.recommendations().forEach(recommendation -> out.append("- ")
                    .append(recommendation).append('\n'));
        }
        out.append("\n---\n\n")
                .append("Total LOC: ").append(result.summary().totalLoc())
                .append('\n')
                .append("UI Files: ").append(result.summary().uiFiles())
                .append('\n')
                .append("Logic Files: ").append(result.summary().logicFiles())
                .append('\n')
                .append("Mixed Files: ").append(result.summary().mixedFiles())
                .append('\n');
        return out.toString();
    }

    private static List<FunctionInfo> pureFunctions(final FileAnalysis file) {
        return file.allFunctions().stream().filter(FunctionInfo::pure)
                .toList();
    }

    /** Drops pure functions nested in another pure function of the list. */
    private static List<FunctionInfo> outermost(
            final List<FunctionInfo> functions) {
        final List<FunctionInfo> result = new ArrayList<>();
        int coveredUntil = 0;
        for (final FunctionInfo function : functions) {
            if (function.startLine() > coveredUntil) {
                result.add(function);
                coveredUntil = function.endLine();
            }
        }
        return result;
    }

    private static String label(final FileClassification classification) {
        return switch (classification) {
            case UI -> "UI";
            case LOGIC -> "Logic";
            case MIXED -> "Mixed";
            case UNAVAILABLE -> "Unavailable";
        };
    }

    private static String webReady(final FileClassification classification,
            final int pureFunctions) {
        return switch (classification) {
            case LOGIC -> pureFunctions > 0 ? "Yes" : "No";
            case MIXED -> pureFunctions > 0 ? "Partial" : "No";
            default -> "No";
        };
    }

    private static void row(final StringBuilder csv,
            final List<String> values) {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                csv.append(',');
            }
            csv.append(quote(values.get(i)));
        }
        csv.append("\r\n");
    }

    private static String quote(final String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0
                && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    private static String uniqueName(final String base,
            final Set<String> used) {
        String name = base + ".py";
        int suffix = 2;
        while (!used.add(name)) {
            name = base + "_" + suffix++ + ".py";
        }
        return name;
    }

    private static String folderName(final String projectName) {
        final String cleaned = projectName == null ? ""
                : projectName.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.isBlank() || cleaned.startsWith(".")
                ? "extracted_functions" : cleaned;
    }

}
