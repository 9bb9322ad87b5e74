package co.fanki.webready.job.domain;

import co.fanki.webready.analysis.domain.AnalysisRequest;
import co.fanki.webready.analysis.domain.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link AnalysisJobRepository}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisJobRepositoryTest {

    @Test
    void whenSaving_givenNewJob_shouldFindItById() {
        final AnalysisJobRepository repository = new AnalysisJobRepository(10);
        final AnalysisJob job = job();

        repository.save(job);

        assertEquals(job, repository.findById(job.id()).orElseThrow());
    }

    @Test
    void whenFinding_givenUnknownOrNullId_shouldReturnEmpty() {
        final AnalysisJobRepository repository = new AnalysisJobRepository(10);

        assertTrue(repository.findById("missing").isEmpty());
        assertTrue(repository.findById(null).isEmpty());
    }

    @Test
    void whenSaving_givenMoreFinishedJobsThanRetention_shouldEvictOldest() {
        final AnalysisJobRepository repository = new AnalysisJobRepository(2);
        final AnalysisJob running = job();
        running.start();
        repository.save(running);

        for (int i = 0; i < 3; i++) {
            final AnalysisJob failed = job();
            failed.fail("ANALYSIS_FAILED", "boom " + i, null);
            repository.save(failed);
        }

        final List<AnalysisJob> all = repository.findAll();
        assertEquals(3, all.size());
        assertTrue(all.contains(running));
        assertEquals(2, all.stream().filter(AnalysisJob::isFinished).count());
    }

    @Test
    void whenListing_givenJobs_shouldReturnNewestFirst() throws Exception {
        final AnalysisJobRepository repository = new AnalysisJobRepository(10);
        final AnalysisJob older = job();
        Thread.sleep(5);
        final AnalysisJob newer = job();
        repository.save(older);
        repository.save(newer);

        assertEquals(List.of(newer, older), repository.findAll());
    }

    @Test
    void whenCreating_givenZeroRetention_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new AnalysisJobRepository(0));
    }

    private static AnalysisJob job() {
        return AnalysisJob.create(new AnalysisRequest("demo",
                List.of(SourceFile.ofText("a.py", "x = 1\n"))));
    }

}
