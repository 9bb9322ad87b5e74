package co.fanki.webready.job.application;

import co.fanki.webready.analysis.domain.EmptyInputException;
import co.fanki.webready.analysis.domain.ProjectAnalysisResult;
import co.fanki.webready.analysis.domain.SourceFile;
import co.fanki.webready.job.domain.AnalysisJob;
import co.fanki.webready.shared.DomainException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * REST controller for analysis jobs.
 *
 * <p>Files are submitted inline, each as a path and its content. Content
 * is plain text by default, or base64 bytes when {@code encoding} is
 * {@code base64}; byte content is decoded honouring a coding declaration.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/analyses")
public class AnalysisController {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisController.class);

    private static final MediaType CSV = new MediaType("text", "csv",
            StandardCharsets.UTF_8);

    private static final MediaType ZIP = MediaType.parseMediaType(
            "application/zip");

    private final AnalysisJobService jobService;

    private final ExportService exportService;

    /**
     * Creates a new AnalysisController.
     *
     * @param theJobService the job service
     * @param theExportService the export service
     */
    public AnalysisController(final AnalysisJobService theJobService,
            final ExportService theExportService) {
        this.jobService = theJobService;
        this.exportService = theExportService;
    }

    /**
     * Submits a project for analysis.
     *
     * @param request the project name and files
     * @return the accepted job
     */
    @PostMapping
    public ResponseEntity<JobResponse> submit(
            @RequestBody final SubmitAnalysisRequest request) {
        LOG.info("Received analysis request for: {}", request.projectName());

        final List<FileContent> files = request.files() == null
                ? List.of() : request.files();
        final List<SourceFile> sources = new ArrayList<>();
        for (final FileContent file : files) {
            sources.add(file.toSourceFile());
        }

        final AnalysisJob job = jobService.submit(request.projectName(),
                sources);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(JobResponse.of(job));
    }

    /**
     * Lists all jobs, newest first.
     *
     * @return the jobs
     */
    @GetMapping
    public ResponseEntity<JobListResponse> list() {
        LOG.debug("Listing analysis jobs");
        return ResponseEntity.ok(new JobListResponse(jobService.list()
                .stream()
                .map(JobResponse::of)
                .toList()));
    }

    /**
     * Returns the status and progress of a job.
     *
     * @param jobId the job ID
     * @return the job
     */
    @GetMapping("/{jobId}")
    public ResponseEntity<JobResponse> get(@PathVariable final String jobId) {
        return ResponseEntity.ok(JobResponse.of(jobService.getById(jobId)));
    }

    /**
     * Returns the result of a completed job.
     *
     * @param jobId the job ID
     * @return the project result
     */
    @GetMapping("/{jobId}/result")
    public ResponseEntity<ProjectAnalysisResult> result(
            @PathVariable final String jobId) {
        return ResponseEntity.ok(jobService.getResult(jobId));
    }

    /**
     * Streams the progress of a job as server-sent events.
     *
     * @param jobId the job ID
     * @return the event stream
     */
    @GetMapping(path = "/{jobId}/events",
            produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable final String jobId) {
        return jobService.subscribe(jobId);
    }

    /**
     * Requests cancellation of a job.
     *
     * @param jobId the job ID
     * @return the job
     */
    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<JobResponse> cancel(
            @PathVariable final String jobId) {
        LOG.info("Received cancellation for job {}", jobId);
        return ResponseEntity.ok(JobResponse.of(jobService.cancel(jobId)));
    }

    /**
     * Exports the result of a job as JSON.
     *
     * @param jobId the job ID
     * @return the JSON attachment
     */
    @GetMapping("/{jobId}/export/json")
    public ResponseEntity<byte[]> exportJson(@PathVariable final String jobId) {
        final ProjectAnalysisResult result = jobService.getResult(jobId);
        return attachment(exportService.exportJson(result),
                MediaType.APPLICATION_JSON, result.projectName() + ".json");
    }

    /**
     * Exports the per-file summary of a job as CSV.
     *
     * @param jobId the job ID
     * @return the CSV attachment
     */
    @GetMapping("/{jobId}/export/csv")
    public ResponseEntity<byte[]> exportCsv(@PathVariable final String jobId) {
        final ProjectAnalysisResult result = jobService.getResult(jobId);
        return attachment(exportService.exportCsv(result), CSV,
                result.projectName() + ".csv");
    }

    /**
     * Exports the pure functions of a job as a ZIP archive.
     *
     * @param jobId the job ID
     * @return the ZIP attachment
     */
    @GetMapping("/{jobId}/export/zip")
    public ResponseEntity<byte[]> exportZip(@PathVariable final String jobId) {
        final ProjectAnalysisResult result = jobService.getResult(jobId);
        final AnalysisJob job = jobService.getById(jobId);
        return attachment(exportService.exportPureFunctionsZip(result,
                job.sources()), ZIP, result.projectName() + "_pure.zip");
    }

    /**
     * Maps domain errors to an error body.
     *
     * @param e the error
     * @return the error response
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomainException(
            final DomainException e) {
        final HttpStatus status = statusOf(e.getErrorCode());
        if (status.is5xxServerError()) {
            LOG.error("Request failed", e);
        } else {
            LOG.warn("Request rejected: {}", e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    /**
     * Maps invalid arguments to a bad request.
     *
     * @param e the error
     * @return the error response
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidArgument(
            final IllegalArgumentException e) {
        LOG.warn("Invalid request", e);
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("INVALID_REQUEST", e.getMessage()));
    }

    static HttpStatus statusOf(final String errorCode) {
        return switch (errorCode) {
            case "JOB_NOT_FOUND" -> HttpStatus.NOT_FOUND;
            case "JOB_NOT_COMPLETED", "JOB_ALREADY_FINISHED" ->
                    HttpStatus.CONFLICT;
            case EmptyInputException.CODE, "DUPLICATE_PATH",
                    "INVALID_CONTENT" -> HttpStatus.BAD_REQUEST;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<byte[]> attachment(final byte[] body,
            final MediaType type, final String fileName) {
        return ResponseEntity.ok()
                .contentType(type)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition
                        .attachment()
                        .filename(fileName, StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .body(body);
    }

    /**
     * Request to analyze a project.
     */
    public record SubmitAnalysisRequest(
            String projectName,
            List<FileContent> files
    ) {}

    /**
     * One submitted file.
     *
     * @param path the file path relative to the project root
     * @param content the file content
     * @param encoding {@code text} (default) or {@code base64}
     */
    public record FileContent(
            String path,
            String content,
            String encoding
    ) {

        SourceFile toSourceFile() {
            if (content == null) {
                throw new DomainException("Missing content for: " + path,
                        "INVALID_CONTENT");
            }
            if (encoding == null || "text".equalsIgnoreCase(encoding)) {
                return SourceFile.ofText(path, content);
            }
            if (!"base64".equalsIgnoreCase(encoding)) {
                throw new DomainException("Unknown content encoding "
                        + encoding + " for: " + path, "INVALID_CONTENT");
            }
            final byte[] bytes;
            try {
                bytes = Base64.getMimeDecoder().decode(content);
            } catch (final IllegalArgumentException e) {
                throw new DomainException("Invalid base64 content for: "
                        + path, "INVALID_CONTENT", e);
            }
            return SourceFile.ofBytes(path, bytes);
        }
    }

    /**
     * Response for a single job.
     */
    public record JobResponse(
            String id,
            String projectName,
            String status,
            int progress,
            String message,
            String errorCode,
            String errorMessage,
            boolean hasResult,
            Instant createdAt,
            Instant updatedAt,
            Instant finishedAt
    ) {

        static JobResponse of(final AnalysisJob job) {
            return new JobResponse(job.id(), job.projectName(),
                    job.status().token(), job.progress(), job.message(),
                    job.errorCode(), job.errorMessage(),
                    job.result().isPresent() && job.errorCode() == null,
                    job.createdAt(),
                    job.updatedAt(), job.finishedAt());
        }
    }

    /**
     * Response containing a list of jobs.
     */
    public record JobListResponse(
            List<JobResponse> jobs
    ) {}

    /**
     * Error body.
     */
    public record ErrorResponse(
            String code,
            String message
    ) {}

}
