package tech.compendium.pipeline.job.statemachine;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.compendium.pipeline.job.dto.CreateJobRequest;
import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.entity.Stage;
import tech.compendium.pipeline.job.model.JobStatus;
import tech.compendium.pipeline.job.model.PipelineStage;
import tech.compendium.pipeline.job.model.StageStatus;
import tech.compendium.pipeline.shared.TsidGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Pure transition function for jobs and their stages.
 *
 * <p>Every method returns a new {@link Job}; nothing is stored here. Callers apply
 * transitions through {@code JobRepository.update} so that concurrent transitions of
 * the same job are serialized by the repository's compare-and-update.
 *
 * <h2>Stage transitions</h2>
 * <pre>
 * PENDING → PROCESSING → COMPLETED
 *                ↓
 *             FAILED
 * </pre>
 *
 * <p>Only the job's current stage may move, and only once every earlier stage has
 * completed. Anything else raises {@link TransitionException}.
 */
@ApplicationScoped
public class JobStateMachine {

    private static final Logger LOG = Logger.getLogger(JobStateMachine.class);

    private final Clock clock;

    public JobStateMachine() {
        this(Clock.systemUTC());
    }

    public JobStateMachine(Clock clock) {
        this.clock = clock;
    }

    /**
     * Build a new pending job positioned at stage 1 with every stage pending.
     */
    public Job create(CreateJobRequest request) {
        Instant now = clock.instant();
        List<Stage> stages = new ArrayList<>(PipelineStage.COUNT);
        for (PipelineStage definition : PipelineStage.values()) {
            stages.add(Stage.pending(definition));
        }

        return Job.builder()
            .id(TsidGenerator.generate(TsidGenerator.JOB_PREFIX))
            .status(JobStatus.PENDING)
            .progress(0)
            .currentStage(1)
            .stages(stages)
            .fileName(request.fileName())
            .deckName(request.deckName())
            .pageCount(request.pageCount())
            .payload(request.payload())
            .retryCount(0)
            .maxRetries(Job.DEFAULT_MAX_RETRIES)
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    /**
     * Apply an outcome to one stage of a job.
     *
     * @throws TransitionException if the job is terminal, the stage is not the current one,
     *                             or the stage is not in a state the outcome can follow
     */
    public Job apply(Job job, int stage, StageOutcome outcome) {
        if (job.isTerminal()) {
            throw new TransitionException(job.id(), stage,
                "Job " + job.id() + " is " + job.status().getValue() + "; no further transitions allowed");
        }
        if (stage < 1 || stage > PipelineStage.COUNT) {
            throw new TransitionException(job.id(), stage,
                "Stage " + stage + " out of range for job " + job.id());
        }
        if (stage != job.currentStage()) {
            throw new TransitionException(job.id(), stage,
                "Stage " + stage + " is not the current stage (" + job.currentStage() + ") of job " + job.id());
        }

        Job updated;
        if (outcome instanceof StageOutcome.Started) {
            updated = start(job, stage);
        } else if (outcome instanceof StageOutcome.Succeeded succeeded) {
            updated = succeed(job, stage, succeeded.deckId());
        } else if (outcome instanceof StageOutcome.Failed failed) {
            updated = fail(job, stage, failed.error());
        } else {
            throw new IllegalArgumentException("Unsupported stage outcome: " + outcome);
        }

        LOG.debugf("Job [%s] stage %d %s: job %s, progress %d%%",
            job.id(), stage, outcome.getClass().getSimpleName().toLowerCase(),
            updated.status().getValue(), updated.progress());
        return updated;
    }

    private Job start(Job job, int stageNumber) {
        Stage stage = job.stage(stageNumber);
        if (stage.status() != StageStatus.PENDING) {
            throw new TransitionException(job.id(), stageNumber,
                "Stage " + stageNumber + " of job " + job.id() + " cannot start from " + stage.status().getValue());
        }
        for (int earlier = 1; earlier < stageNumber; earlier++) {
            if (!job.stage(earlier).isCompleted()) {
                throw new TransitionException(job.id(), stageNumber,
                    "Stage " + stageNumber + " of job " + job.id() + " cannot start before stage " + earlier + " completed");
            }
        }

        Instant now = clock.instant();
        return job.withStage(stage.withStatus(StageStatus.PROCESSING).withStartTime(now))
            .toBuilder()
            .status(JobStatus.PROCESSING)
            .startedAt(job.startedAt() != null ? job.startedAt() : now)
            .updatedAt(now)
            .build();
    }

    private Job succeed(Job job, int stageNumber, String deckId) {
        Stage stage = requireProcessing(job, stageNumber, "complete");
        Instant now = clock.instant();
        Job updated = job.withStage(stage.withStatus(StageStatus.COMPLETED).withEndTime(now));

        if (PipelineStage.of(stageNumber).isLast()) {
            return updated.toBuilder()
                .status(JobStatus.COMPLETED)
                .progress(100)
                .deckId(deckId != null ? deckId : job.deckId())
                .completedAt(now)
                .updatedAt(now)
                .build();
        }

        int next = stageNumber + 1;
        return updated.toBuilder()
            .currentStage(next)
            .progress(Math.max(job.progress(), progressFor(next)))
            .deckId(deckId != null ? deckId : job.deckId())
            .updatedAt(now)
            .build();
    }

    private Job fail(Job job, int stageNumber, String error) {
        Stage stage = requireProcessing(job, stageNumber, "fail");
        Instant now = clock.instant();
        return job.withStage(stage.withStatus(StageStatus.FAILED).withEndTime(now).withError(error))
            .toBuilder()
            .status(JobStatus.FAILED)
            .errorMessage(error)
            .updatedAt(now)
            .build();
    }

    private Stage requireProcessing(Job job, int stageNumber, String action) {
        Stage stage = job.stage(stageNumber);
        if (stage.status() != StageStatus.PROCESSING) {
            throw new TransitionException(job.id(), stageNumber,
                "Stage " + stageNumber + " of job " + job.id() + " cannot " + action + " from " + stage.status().getValue());
        }
        return stage;
    }

    /**
     * Return a failed job to pending so its failed stage can be dispatched again.
     * Completed stages keep their history; progress is left as it was.
     *
     * @throws TransitionException if the job is not failed or has used up its retries
     */
    public Job rearmForRetry(Job job) {
        if (job.status() != JobStatus.FAILED) {
            throw new TransitionException(job.id(), job.currentStage(),
                "Job " + job.id() + " is " + job.status().getValue() + "; only failed jobs can be retried");
        }
        if (!job.canRetry()) {
            throw new TransitionException(job.id(), job.currentStage(),
                "Job " + job.id() + " has reached its retry limit (" + job.maxRetries() + ")");
        }

        Stage failed = job.stage(job.currentStage());
        Instant now = clock.instant();
        return job.withStage(failed.toBuilder()
                .status(StageStatus.PENDING)
                .startTime(null)
                .endTime(null)
                .error(null)
                .build())
            .toBuilder()
            .status(JobStatus.PENDING)
            .errorMessage(null)
            .retryCount(job.retryCount() + 1)
            .completedAt(null)
            .updatedAt(now)
            .build();
    }

    /**
     * Progress of a job positioned at the given stage, with every stage weighted equally
     * and rounded half-up.
     */
    public static int progressFor(int currentStage) {
        return (int) Math.round(currentStage * 100.0 / PipelineStage.COUNT);
    }
}
