package co.fanki.webready.analysis.domain;

import co.fanki.webready.analysis.domain.python.StructuralAnalyzer;
import co.fanki.webready.shared.DomainException;
import co.fanki.webready.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Drives one analysis run from source files to a project result.
 *
 * <p>Each run goes through {@code PENDING -> RUNNING -> COMPLETED} or ends
 * in {@code FAILED}, see {@link AnalysisStateMachine}. Progress is reported
 * through the {@link ProgressListener} given to the run:</p>
 * <ul>
 *   <li>10% when the run starts</li>
 *   <li>10% to 90% while files are analyzed, proportional to the files
 *       done</li>
 *   <li>90% before aggregation</li>
 *   <li>100% and {@code completed} with the result</li>
 * </ul>
 *
 * <p>A file that cannot be decoded or parsed is kept in the result with an
 * error marker and the run still completes. Only an empty input, a
 * cancellation or an unexpected failure makes the run fail.</p>
 *
 * <p>The orchestrator keeps no state between runs; concurrent runs share
 * nothing but the immutable toolkit registry and thresholds.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class AnalysisOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisOrchestrator.class);

    private static final int START_PERCENT = 10;

    private static final int FILES_PERCENT = 80;

    private static final int AGGREGATION_PERCENT = 90;

    private final StructuralAnalyzer structuralAnalyzer;

    private final SuggestionGenerator suggestionGenerator;

    private final WebReadinessScorer scorer;

    private final ConversionGuideBuilder guideBuilder;

    private final int parallelism;

    /**
     * Creates an orchestrator.
     *
     * @param registry the toolkit registry, never null
     * @param thresholds the decision table, never null
     * @param theParallelism how many files are analyzed at once, at least 1
     */
    public AnalysisOrchestrator(final ToolkitRegistry registry,
            final AnalysisThresholds thresholds, final int theParallelism) {
        Preconditions.require(theParallelism >= 1,
                "Parallelism must be at least 1");
        this.structuralAnalyzer = new StructuralAnalyzer(registry, thresholds);
        this.suggestionGenerator = new SuggestionGenerator(thresholds);
        this.scorer = new WebReadinessScorer(thresholds);
        this.guideBuilder = new ConversionGuideBuilder(thresholds, scorer);
        this.parallelism = theParallelism;
    }

    /**
     * Analyzes a project without progress reporting or cancellation.
     *
     * @param request the project to analyze, never null
     * @return the project result
     * @throws EmptyInputException if the request has no files
     */
    public ProjectAnalysisResult analyze(final AnalysisRequest request) {
        return analyze(request, ProgressListener.NONE,
                CancellationToken.create());
    }

    /**
     * Analyzes a project.
     *
     * @param request the project to analyze, never null
     * @param listener receives the progress checkpoints, may be null
     * @param cancellation checked before each file, never null
     * @return the project result
     * @throws EmptyInputException if the request has no files
     * @throws AnalysisCancelledException if the run was cancelled; carries
     *     the files analyzed so far
     * @throws DomainException with code {@code ANALYSIS_FAILED} on any
     *     unexpected failure
     */
    public ProjectAnalysisResult analyze(final AnalysisRequest request,
            final ProgressListener listener,
            final CancellationToken cancellation) {
        Preconditions.requireNonNull(request, "Analysis request is required");
        Preconditions.requireNonNull(cancellation,
                "Cancellation token is required");

        final ProgressTracker progress = new ProgressTracker(listener);
        AnalysisStatus status = AnalysisStatus.PENDING;

        if (request.isEmpty()) {
            AnalysisStateMachine.transition(status, AnalysisStatus.FAILED);
            LOG.warn("Rejecting analysis of {}: no source files",
                    request.projectName());
            final EmptyInputException error = new EmptyInputException(
                    request.projectName());
            progress.failed(error.getMessage());
            throw error;
        }

        status = AnalysisStateMachine.transition(status,
                AnalysisStatus.RUNNING);
        final List<SourceFile> sources = new ArrayList<>(request.files());
        sources.sort(Comparator.comparing(SourceFile::path));

        LOG.info("Starting analysis of {} with {} files",
                request.projectName(), sources.size());
        progress.running(START_PERCENT, "Analyzing " + sources.size()
                + " files");

        try {
            final List<FileAnalysis> files = analyzeFiles(sources, progress,
                    cancellation);
            if (files.size() < sources.size()) {
                throw new AnalysisCancelledException("Analysis of "
                        + request.projectName() + " cancelled after "
                        + files.size() + " of " + sources.size() + " files",
                        aggregate(request.projectName(), files));
            }

            progress.running(AGGREGATION_PERCENT, "Saving results");
            final ProjectAnalysisResult result = aggregate(
                    request.projectName(), files);

            status = AnalysisStateMachine.transition(status,
                    AnalysisStatus.COMPLETED);
            LOG.info("Analysis of {} {}: {} files, {} LOC, {}% web-ready",
                    request.projectName(), status.token(), result.totalFiles(),
                    result.summary().totalLoc(),
                    result.summary().webReadyPercentage());
            progress.completed("Analysis completed");
            return result;

        } catch (final AnalysisCancelledException e) {
            AnalysisStateMachine.transition(status, AnalysisStatus.FAILED);
            LOG.info(e.getMessage());
            progress.failed("Analysis cancelled");
            throw e;

        } catch (final DomainException e) {
            AnalysisStateMachine.transition(status, AnalysisStatus.FAILED);
            LOG.error("Analysis of {} failed: {}", request.projectName(),
                    e.getMessage(), e);
            progress.failed(e.getMessage());
            throw e;

        } catch (final RuntimeException e) {
            AnalysisStateMachine.transition(status, AnalysisStatus.FAILED);
            LOG.error("Analysis of {} failed", request.projectName(), e);
            progress.failed("Analysis failed: " + e.getMessage());
            throw new DomainException("Analysis failed: " + e.getMessage(),
                    "ANALYSIS_FAILED", e);
        }
    }

    /**
     * Analyzes the files in path order.
     *
     * @return the results of the files analyzed before a cancellation, all
     *     of them when not cancelled
     */
    private List<FileAnalysis> analyzeFiles(final List<SourceFile> sources,
            final ProgressTracker progress,
            final CancellationToken cancellation) {
        if (parallelism == 1 || sources.size() == 1) {
            final List<FileAnalysis> files = new ArrayList<>();
            for (final SourceFile source : sources) {
                if (cancellation.isCancelled()) {
                    break;
                }
                files.add(structuralAnalyzer.analyze(source));
                fileDone(source, files.size(), sources.size(), progress);
            }
            return files;
        }

        final ExecutorService workers = Executors.newFixedThreadPool(
                Math.min(parallelism, sources.size()));
        try {
            final List<Future<FileAnalysis>> futures = new ArrayList<>();
            for (final SourceFile source : sources) {
                futures.add(workers.submit(() -> cancellation.isCancelled()
                        ? null : structuralAnalyzer.analyze(source)));
            }
            final List<FileAnalysis> files = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                final FileAnalysis file = futures.get(i).get();
                if (file != null) {
                    files.add(file);
                    fileDone(sources.get(i), files.size(), sources.size(),
                            progress);
                }
            }
            return files;

        } catch (final ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new DomainException("File analysis failed: "
                    + e.getCause().getMessage(), "ANALYSIS_FAILED",
                    e.getCause());

        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DomainException("Analysis interrupted",
                    "ANALYSIS_INTERRUPTED", e);

        } finally {
            workers.shutdownNow();
        }
    }

    private void fileDone(final SourceFile source, final int done,
            final int total, final ProgressTracker progress) {
        LOG.debug("Analyzed {} ({}/{})", source.path(), done, total);
        progress.running(START_PERCENT + FILES_PERCENT * done / total,
                "Analyzed " + source.path());
    }

    /**
     * Builds the project result from the file results.
     *
     * @param projectName the project name
     * @param analyses the file results, in any order
     * @return the project result, files ordered by path
     */
    ProjectAnalysisResult aggregate(final String projectName,
            final List<FileAnalysis> analyses) {
        final List<FileAnalysis> files = analyses.stream()
                .sorted(Comparator.comparing(FileAnalysis::path))
                .toList();

        final List<ExtractionSuggestion> extractions =
                suggestionGenerator.extractionSuggestions(files);
        final List<RefactoringSuggestion> refactorings =
                suggestionGenerator.refactoringSuggestions(files);
        final double webReady = scorer.webReadyPercentage(files);

        return new ProjectAnalysisResult(projectName, files.size(), files,
                summary(files, webReady), extractions, refactorings,
                guideBuilder.build(files, refactorings, webReady));
    }

    private static ProjectSummary summary(final List<FileAnalysis> files,
            final double webReady) {
        int totalLoc = 0;
        int ui = 0;
        int logic = 0;
        int mixed = 0;
        int failed = 0;
        int classes = 0;
        int functions = 0;
        int pure = 0;
        final Set<String> toolkits = new TreeSet<>();

        for (final FileAnalysis file : files) {
            if (!file.isAnalyzed()) {
                failed++;
                continue;
            }
            totalLoc += file.loc();
            switch (file.classification()) {
                case UI -> ui++;
                case LOGIC -> logic++;
                default -> mixed++;
            }
            classes += file.classes().size();
            final List<FunctionInfo> all = file.allFunctions();
            functions += all.size();
            pure += (int) all.stream().filter(FunctionInfo::pure).count();
            toolkits.addAll(file.toolkits());
        }
        return new ProjectSummary(totalLoc, ui, logic, mixed, failed, classes,
                functions, pure, List.copyOf(toolkits), webReady);
    }

}
