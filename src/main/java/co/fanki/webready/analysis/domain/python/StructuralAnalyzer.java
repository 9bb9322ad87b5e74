package co.fanki.webready.analysis.domain.python;

import co.fanki.webready.analysis.domain.AnalysisThresholds;
import co.fanki.webready.analysis.domain.ClassInfo;
import co.fanki.webready.analysis.domain.FileAnalysis;
import co.fanki.webready.analysis.domain.FileClassification;
import co.fanki.webready.analysis.domain.FileClassifier;
import co.fanki.webready.analysis.domain.FileError;
import co.fanki.webready.analysis.domain.FunctionInfo;
import co.fanki.webready.analysis.domain.Import;
import co.fanki.webready.analysis.domain.PurityClassifier;
import co.fanki.webready.analysis.domain.SourceDecodingException;
import co.fanki.webready.analysis.domain.SourceFile;
import co.fanki.webready.analysis.domain.SourceParseException;
import co.fanki.webready.analysis.domain.ToolkitRegistry;
import co.fanki.webready.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts the structure of one Python file and classifies it.
 *
 * <p>The analysis runs in four steps:</p>
 * <ol>
 *   <li><b>Lines:</b> code lines are counted, skipping blank and
 *       comment-only lines.</li>
 *   <li><b>Parse:</b> the text is parsed with the tree-sitter Python
 *       grammar. A decoding or
 *       syntax error ends the analysis of this file with an error-marked
 *       {@link FileAnalysis}; it is never thrown to the caller.</li>
 *   <li><b>Imports:</b> every import statement, at any depth, is recorded
 *       and matched against the {@link ToolkitRegistry}. The names those
 *       imports bind become the file's UI names.</li>
 *   <li><b>Definitions:</b> functions, methods, nested functions and
 *       classes are extracted with their usage facts, then the UI and pure
 *       line counts feed the {@link FileClassifier}.</li>
 * </ol>
 *
 * <p>Stateless and thread safe: files can be analyzed in parallel with a
 * shared instance.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class StructuralAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            StructuralAnalyzer.class);

    private final ToolkitRegistry registry;

    private final FileClassifier classifier;

    private final AnalysisThresholds thresholds;

    /**
     * Creates a structural analyzer.
     *
     * @param theRegistry the toolkit registry, never null
     * @param theThresholds the decision table, never null
     */
    public StructuralAnalyzer(final ToolkitRegistry theRegistry,
            final AnalysisThresholds theThresholds) {
        this.registry = Preconditions.requireNonNull(theRegistry,
                "Toolkit registry is required");
        this.thresholds = Preconditions.requireNonNull(theThresholds,
                "Thresholds are required");
        this.classifier = new FileClassifier(theThresholds);
    }

    /**
     * Analyzes one file.
     *
     * @param source the source file, never null
     * @return the file analysis; error-marked when the file could not be
     *     decoded or parsed
     */
    public FileAnalysis analyze(final SourceFile source) {
        Preconditions.requireNonNull(source, "Source file is required");
        final String path = source.path();

        final String text;
        try {
            text = source.text();
        } catch (final SourceDecodingException e) {
            LOG.warn("Skipping {}: {}", path, e.getMessage());
            return FileAnalysis.failed(path, 0, FileError.of(e));
        }

        final BitSet codeLines = codeLines(text);
        final int loc = codeLines.cardinality();

        final SyntaxTree tree;
        try {
            tree = SyntaxTree.parse(text);
        } catch (final SourceParseException e) {
            LOG.warn("Syntax error in {}: {}", path, e.getMessage());
            return FileAnalysis.failed(path, loc, FileError.of(e));
        }

        final List<Import> imports = new ArrayList<>();
        final Set<String> uiNames = new HashSet<>();
        final boolean uiStarImport = imports(tree, tree.root(), imports,
                uiNames);
        final List<String> toolkits = List.copyOf(
                registry.detectToolkits(imports));

        final FileInspection inspection = new FileInspection(tree, path,
                codeLines, registry, uiNames, uiStarImport,
                !toolkits.isEmpty(), thresholds.maxDependencies());
        inspection.inspect();

        final FileAnalysis shell = new FileAnalysis(path, imports,
                inspection.classes(), inspection.functions(), loc, 0, 0, 0,
                0.0, FileClassification.MIXED, toolkits, null);

        final BitSet uiLines = new BitSet();
        final BitSet pureLines = new BitSet();
        int uiCalls = 0;
        for (final ClassInfo classInfo : shell.classes()) {
            if (classInfo.uiClass()) {
                uiLines.set(classInfo.startLine(), classInfo.endLine() + 1);
            }
        }
        for (final FunctionInfo function : shell.allFunctions()) {
            if (PurityClassifier.isUiBound(function)) {
                uiLines.set(function.startLine(), function.endLine() + 1);
            }
            if (function.pure()) {
                pureLines.set(function.startLine(), function.endLine() + 1);
            }
        }
        for (final FunctionInfo function : shell.functions()) {
            uiCalls += function.uiCallCount();
        }
        for (final ClassInfo classInfo : shell.classes()) {
            for (final FunctionInfo method : classInfo.methods()) {
                uiCalls += method.uiCallCount();
            }
        }
        uiLines.and(codeLines);
        pureLines.and(codeLines);

        final int uiLoc = uiLines.cardinality();
        final double uiPercentage = classifier.uiPercentage(uiLoc, loc);
        final FileClassification classification = classifier.classify(
                uiPercentage, shell.hasPureFunctions(), loc);

        LOG.debug("Analyzed {}: {} LOC, {} classes, {} functions, {}% UI,"
                + " {}", path, loc, shell.classes().size(),
                shell.allFunctions().size(), uiPercentage, classification);

        return new FileAnalysis(path, imports, shell.classes(),
                shell.functions(), loc, uiLoc, pureLines.cardinality(),
                uiCalls, uiPercentage, classification, toolkits, null);
    }

    /**
     * Marks the lines holding code: not blank and not only a comment.
     *
     * @param text the source text
     * @return the code lines, indexed from 1
     */
    static BitSet codeLines(final String text) {
        final BitSet result = new BitSet();
        final String[] lines = text.split("\r\n|\r|\n", -1);
        for (int i = 0; i < lines.length; i++) {
            final String trimmed = lines[i].strip();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                result.set(i + 1);
            }
        }
        return result;
    }

    /**
     * Collects the imports of a node and everything nested in it.
     *
     * @return true if a star import pulls a toolkit module in
     */
    private boolean imports(final SyntaxTree tree, final TSNode node,
            final List<Import> imports, final Set<String> uiNames) {
        final String type = node.getType();
        if ("import_statement".equals(type)) {
            plainImport(tree, node, imports, uiNames);
            return false;
        }
        if ("import_from_statement".equals(type)
                || "future_import_statement".equals(type)) {
            return fromImport(tree, node, imports, uiNames);
        }
        boolean star = false;
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            star = imports(tree, node.getNamedChild(i), imports, uiNames)
                    || star;
        }
        return star;
    }

    private void plainImport(final SyntaxTree tree, final TSNode statement,
            final List<Import> imports, final Set<String> uiNames) {
        final ScopeBindings bindings = new ScopeBindings(tree);
        for (final TSNode name : SyntaxTree.fields(statement, "name")) {
            final TSNode dotted = "aliased_import".equals(name.getType())
                    ? SyntaxTree.field(name, "name") : name;
            final String module = tree.dotted(dotted);
            final List<String> names = List.of(bindings.boundName(name,
                    false));
            final boolean ui = registry.isUiImport(module, names, false);
            imports.add(new Import(module, names, SyntaxTree.line(statement),
                    false, ui));
            if (ui) {
                uiNames.addAll(names);
            }
        }
    }

    private boolean fromImport(final SyntaxTree tree, final TSNode statement,
            final List<Import> imports, final Set<String> uiNames) {
        final TSNode moduleName = SyntaxTree.field(statement, "module_name");
        final String module = moduleName == null ? "__future__"
                : relativeModule(tree, moduleName);

        final List<String> names = new ArrayList<>();
        final List<String> bound = new ArrayList<>();
        boolean wildcard = false;
        for (final TSNode child : SyntaxTree.namedChildren(statement)) {
            if ("wildcard_import".equals(child.getType())) {
                names.add("*");
                wildcard = true;
            }
        }
        final ScopeBindings bindings = new ScopeBindings(tree);
        for (final TSNode name : SyntaxTree.fields(statement, "name")) {
            final TSNode imported = "aliased_import".equals(name.getType())
                    ? SyntaxTree.field(name, "name") : name;
            names.add(tree.dotted(imported));
            bound.add(bindings.boundName(name, true));
        }

        final boolean ui = registry.isUiImport(module, names, true);
        imports.add(new Import(module, names, SyntaxTree.line(statement),
                true, ui));
        if (ui) {
            uiNames.addAll(bound);
        }
        return ui && wildcard;
    }

    /** Returns the module of a from-import, e.g. "..views" or "os.path". */
    private static String relativeModule(final SyntaxTree tree,
            final TSNode moduleName) {
        if (!"relative_import".equals(moduleName.getType())) {
            return tree.dotted(moduleName);
        }
        final StringBuilder module = new StringBuilder();
        for (final TSNode part : SyntaxTree.namedChildren(moduleName)) {
            if ("import_prefix".equals(part.getType())) {
                module.append(tree.text(part));
            } else {
                module.append(tree.dotted(part));
            }
        }
        return module.toString();
    }

}
