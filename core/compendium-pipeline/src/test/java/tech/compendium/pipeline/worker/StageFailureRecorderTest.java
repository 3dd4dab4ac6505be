package tech.compendium.pipeline.worker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.compendium.pipeline.JobFixtures;
import tech.compendium.pipeline.dispatch.JobEventPublisher;
import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.entity.Stage;
import tech.compendium.pipeline.job.model.JobStatus;
import tech.compendium.pipeline.job.model.StageStatus;
import tech.compendium.pipeline.job.repository.InMemoryJobRepository;
import tech.compendium.pipeline.job.statemachine.JobStateMachine;
import tech.compendium.pipeline.job.statemachine.StageOutcome;
import tech.compendium.queue.WorkMessage;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StageFailureRecorder")
class StageFailureRecorderTest {

    @Mock
    private JobEventPublisher eventPublisher;

    private InMemoryJobRepository repository;
    private JobStateMachine stateMachine;
    private StageFailureRecorder recorder;

    @BeforeEach
    void setUp() {
        repository = new InMemoryJobRepository();
        stateMachine = new JobStateMachine();
        recorder = new StageFailureRecorder(repository, stateMachine, eventPublisher);
    }

    @Test
    @DisplayName("should fail the processing stage and the job, then publish the failure")
    void onDeadLetter_shouldFailStageAndJob() {
        Job job = repository.insert(JobFixtures.withCompletedStages(stateMachine, 3));
        repository.update(job.id(), current -> stateMachine.apply(current, 4, StageOutcome.started()));
        WorkMessage last = WorkMessage.fresh(job.id(), 4, null).nextAttempt().nextAttempt();

        recorder.onDeadLetter("deck.generation", last, "topic model timed out");

        Job failed = repository.findById(job.id()).orElseThrow();
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.errorMessage()).isEqualTo("topic model timed out");
        assertThat(failed.stage(4).status()).isEqualTo(StageStatus.FAILED);
        assertThat(failed.stages().subList(0, 3)).allMatch(Stage::isCompleted);
        assertThat(failed.stages().subList(4, 8)).allMatch(Stage::isPending);
        verify(eventPublisher).publishFailed(failed);
    }

    @Test
    @DisplayName("should record a failure for a stage that never started")
    void onDeadLetter_pendingStage_shouldStillFail() {
        Job job = repository.insert(JobFixtures.newJob(stateMachine));

        recorder.onDeadLetter("pdf.processing", WorkMessage.fresh(job.id(), 1, null), "storage unavailable");

        Job failed = repository.findById(job.id()).orElseThrow();
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.stage(1).startTime()).isNotNull();
        assertThat(failed.stage(1).endTime()).isNotNull();
    }

    @Test
    @DisplayName("should fail the next stage when a completed stage kept failing to dispatch it")
    void onDeadLetter_completedStageWithUndispatchedNext_shouldFailNextStage() {
        Job job = repository.insert(JobFixtures.withCompletedStages(stateMachine, 1));
        WorkMessage last = WorkMessage.fresh(job.id(), 1, null).nextAttempt().nextAttempt();
        String reason = "Publish to tasks/embedding.generate failed: broker unreachable";

        recorder.onDeadLetter("pdf.processing", last, reason);

        Job failed = repository.findById(job.id()).orElseThrow();
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.currentStage()).isEqualTo(2);
        assertThat(failed.stage(1).isCompleted()).isTrue();
        assertThat(failed.stage(2).status()).isEqualTo(StageStatus.FAILED);
        assertThat(failed.stage(2).error()).isEqualTo(reason);
        assertThat(failed.stages().subList(2, 8)).allMatch(Stage::isPending);
        verify(eventPublisher).publishFailed(failed);
    }

    @Test
    @DisplayName("should leave a terminal job untouched")
    void onDeadLetter_terminalJob_shouldBeIgnored() {
        Job completed = repository.insert(JobFixtures.withCompletedStages(stateMachine, 8));

        recorder.onDeadLetter("deck.generation", WorkMessage.fresh(completed.id(), 8, null), "late failure");

        assertThat(repository.findById(completed.id())).contains(completed);
        verify(eventPublisher, never()).publishFailed(any());
    }

    @Test
    @DisplayName("should ignore messages of deleted jobs")
    void onDeadLetter_deletedJob_shouldBeIgnored() {
        recorder.onDeadLetter("pdf.processing", WorkMessage.fresh("job_gone", 1, null), "boom");

        verifyNoInteractions(eventPublisher);
    }
}
