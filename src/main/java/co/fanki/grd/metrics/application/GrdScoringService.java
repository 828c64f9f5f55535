package co.fanki.grd.metrics.application;

import co.fanki.grd.diagram.domain.MermaidExtractor;
import co.fanki.grd.metrics.domain.GrdMetrics;
import co.fanki.grd.metrics.domain.QualityScore;
import co.fanki.grd.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Scores model answers that contain a reasoning diagram.
 *
 * <p>Each answer is reduced to its diagram code (the first fenced block,
 * or the raw answer when it has none) and scored with
 * {@link GrdMetrics}. Batches are scored concurrently; the metrics hold
 * no shared state.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class GrdScoringService {

    private static final Logger LOG = LoggerFactory.getLogger(
            GrdScoringService.class);

    private final int parallelism;

    /**
     * Creates a new GrdScoringService.
     *
     * @param theParallelism the number of threads used to score a batch
     */
    public GrdScoringService(
            @Value("${grd.scoring.parallelism:4}") final int theParallelism) {
        this.parallelism = Preconditions.requirePositive(theParallelism,
                "Scoring parallelism must be positive");
    }

    /**
     * Scores a single answer.
     *
     * @param answer the answer text, may be null
     * @return the quality scores
     */
    public QualityScore score(final String answer) {
        final String diagram = MermaidExtractor.extract(answer)
                .orElse(answer);
        return GrdMetrics.evaluate(diagram);
    }

    /**
     * Scores a batch of answers concurrently.
     *
     * @param answers the answers to score
     * @return one score per answer, in the same order
     */
    public List<QualityScore> scoreAll(final List<String> answers) {
        Preconditions.requireNonNull(answers, "Answers list is required");

        if (answers.isEmpty()) {
            return List.of();
        }

        LOG.info("Scoring batch of {} diagrams", answers.size());

        final List<QualityScore> results = new ArrayList<>(answers.size());
        final ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(parallelism, answers.size()));

        try {
            final List<Future<QualityScore>> futures =
                    new ArrayList<>(answers.size());

            for (final String answer : answers) {
                futures.add(executor.submit(() -> score(answer)));
            }

            for (final Future<QualityScore> future : futures) {
                try {
                    results.add(future.get());
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.error("Interrupted while scoring diagrams");
                    results.add(QualityScore.zero());
                } catch (final Exception e) {
                    LOG.error("Unexpected error scoring diagram: {}",
                            e.getMessage());
                    results.add(QualityScore.zero());
                }
            }
        } finally {
            executor.shutdownNow();
        }

        return results;
    }

}
