package tech.compendium.pipeline.worker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.compendium.messagerouter.model.DeliveryOutcome;
import tech.compendium.messagerouter.model.DeliveryResult;
import tech.compendium.pipeline.JobFixtures;
import tech.compendium.pipeline.dispatch.JobEventPublisher;
import tech.compendium.pipeline.dispatch.StageDispatcher;
import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.model.JobStatus;
import tech.compendium.pipeline.job.model.PipelineStage;
import tech.compendium.pipeline.job.model.StageStatus;
import tech.compendium.pipeline.job.repository.InMemoryJobRepository;
import tech.compendium.pipeline.job.statemachine.JobStateMachine;
import tech.compendium.pipeline.job.statemachine.StageOutcome;
import tech.compendium.queue.DispatchException;
import tech.compendium.queue.WorkMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("StageWorker")
class StageWorkerTest {

    @Mock
    private StageDispatcher stageDispatcher;

    @Mock
    private JobEventPublisher eventPublisher;

    private InMemoryJobRepository repository;
    private JobStateMachine stateMachine;
    private List<StageExecutor> executors;
    private StageWorker worker;

    @BeforeEach
    void setUp() {
        repository = new InMemoryJobRepository();
        stateMachine = new JobStateMachine();
        executors = new ArrayList<>();
    }

    private StageWorker worker() {
        if (worker == null) {
            worker = new StageWorker(repository, stateMachine, new StageExecutorRegistry(executors),
                stageDispatcher, eventPublisher);
        }
        return worker;
    }

    @FunctionalInterface
    private interface StageBody {
        StageResult run(Job job, WorkMessage message) throws Exception;
    }

    private static StageExecutor executor(PipelineStage stage, StageBody body) {
        return new StageExecutor() {
            @Override
            public PipelineStage stage() {
                return stage;
            }

            @Override
            public StageResult execute(Job job, WorkMessage message) throws Exception {
                return body.run(job, message);
            }
        };
    }

    @Test
    @DisplayName("should start, run and complete the stage, then dispatch the next one")
    void handle_shouldCompleteStageAndDispatchNext() {
        Job job = repository.insert(JobFixtures.newJob(stateMachine));
        AtomicInteger runs = new AtomicInteger();
        executors.add(executor(PipelineStage.EXTRACT_TEXT, (j, m) -> {
            assertThat(j.stage(1).status()).isEqualTo(StageStatus.PROCESSING);
            runs.incrementAndGet();
            return StageResult.done();
        }));

        DeliveryOutcome outcome = worker().handle(WorkMessage.fresh(job.id(), 1, job.payload()));

        assertThat(outcome.result()).isEqualTo(DeliveryResult.SUCCESS);
        assertThat(runs.get()).isEqualTo(1);
        Job stored = repository.findById(job.id()).orElseThrow();
        assertThat(stored.stage(1).status()).isEqualTo(StageStatus.COMPLETED);
        assertThat(stored.currentStage()).isEqualTo(2);
        assertThat(stored.progress()).isEqualTo(25);

        ArgumentCaptor<Job> dispatched = ArgumentCaptor.forClass(Job.class);
        verify(stageDispatcher).dispatchNext(dispatched.capture());
        assertThat(dispatched.getValue().currentStage()).isEqualTo(2);
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("should complete the job on the last stage and publish the completion event")
    void handle_lastStage_shouldCompleteJob() {
        Job job = repository.insert(JobFixtures.withCompletedStages(stateMachine, 7));
        executors.add(executor(PipelineStage.BUILD_DECK, (j, m) -> StageResult.withDeck("deck-42")));

        DeliveryOutcome outcome = worker().handle(WorkMessage.fresh(job.id(), 8, null));

        assertThat(outcome.result()).isEqualTo(DeliveryResult.SUCCESS);
        Job stored = repository.findById(job.id()).orElseThrow();
        assertThat(stored.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(stored.deckId()).isEqualTo("deck-42");
        verify(eventPublisher).publishCompleted(stored);
        verifyNoInteractions(stageDispatcher);
    }

    @Test
    @DisplayName("should report an executor exception as a failed delivery and keep the stage processing")
    void handle_executorThrows_shouldFail() {
        Job job = repository.insert(JobFixtures.newJob(stateMachine));
        executors.add(executor(PipelineStage.EXTRACT_TEXT, (j, m) -> {
            throw new IllegalStateException("PDF is encrypted");
        }));

        DeliveryOutcome outcome = worker().handle(WorkMessage.fresh(job.id(), 1, null));

        assertThat(outcome.result()).isEqualTo(DeliveryResult.FAILED);
        assertThat(outcome.error()).contains("PDF is encrypted");
        Job stored = repository.findById(job.id()).orElseThrow();
        assertThat(stored.status()).isEqualTo(JobStatus.PROCESSING);
        assertThat(stored.stage(1).status()).isEqualTo(StageStatus.PROCESSING);
        verifyNoInteractions(stageDispatcher);
    }

    @Test
    @DisplayName("should resume a stage left in processing by an earlier attempt")
    void handle_retryOfProcessingStage_shouldResume() {
        Job job = repository.insert(JobFixtures.newJob(stateMachine));
        repository.update(job.id(), current -> stateMachine.apply(current, 1, StageOutcome.started()));
        WorkMessage retry = WorkMessage.fresh(job.id(), 1, null).nextAttempt();

        DeliveryOutcome outcome = worker().handle(retry);

        assertThat(outcome.result()).isEqualTo(DeliveryResult.SUCCESS);
        assertThat(repository.findById(job.id()).orElseThrow().stage(1).status()).isEqualTo(StageStatus.COMPLETED);
        verify(stageDispatcher).dispatchNext(any(Job.class));
    }

    @Test
    @DisplayName("should acknowledge a redelivered completed stage without running it again")
    void handle_completedStage_shouldBeTreatedAsDuplicate() {
        Job job = repository.insert(JobFixtures.withCompletedStages(stateMachine, 2));
        AtomicInteger runs = new AtomicInteger();
        executors.add(executor(PipelineStage.CHUNK_CONTENT, (j, m) -> {
            runs.incrementAndGet();
            return StageResult.done();
        }));

        DeliveryOutcome outcome = worker().handle(WorkMessage.fresh(job.id(), 2, null));

        assertThat(outcome.result()).isEqualTo(DeliveryResult.SUCCESS);
        assertThat(runs.get()).isZero();
        // Stage 3 never started, so it is dispatched again
        verify(stageDispatcher).dispatchNext(job);
    }

    @Test
    @DisplayName("should not re-dispatch when the next stage already started")
    void handle_completedStageWithNextRunning_shouldOnlyAck() {
        Job job = repository.insert(JobFixtures.withCompletedStages(stateMachine, 2));
        repository.update(job.id(), current -> stateMachine.apply(current, 3, StageOutcome.started()));

        DeliveryOutcome outcome = worker().handle(WorkMessage.fresh(job.id(), 2, null));

        assertThat(outcome.result()).isEqualTo(DeliveryResult.SUCCESS);
        verifyNoInteractions(stageDispatcher);
    }

    @Test
    @DisplayName("should acknowledge and drop messages for deleted jobs")
    void handle_deletedJob_shouldSucceed() {
        DeliveryOutcome outcome = worker().handle(WorkMessage.fresh("job_gone", 1, null));

        assertThat(outcome.result()).isEqualTo(DeliveryResult.SUCCESS);
        verifyNoInteractions(stageDispatcher, eventPublisher);
    }

    @Test
    @DisplayName("should reject a message for a stage that is not current")
    void handle_stageAhead_shouldReject() {
        Job job = repository.insert(JobFixtures.newJob(stateMachine));

        DeliveryOutcome outcome = worker().handle(WorkMessage.fresh(job.id(), 3, null));

        assertThat(outcome.result()).isEqualTo(DeliveryResult.REJECTED);
        assertThat(outcome.error()).hasValueSatisfying(error -> assertThat(error).contains("not the current stage"));
        assertThat(repository.findById(job.id()).orElseThrow()).isEqualTo(job);
    }

    @Test
    @DisplayName("should reject a message for a failed job")
    void handle_failedJob_shouldReject() {
        Job job = repository.insert(JobFixtures.failedAt(stateMachine, 2, "boom"));

        DeliveryOutcome outcome = worker().handle(WorkMessage.fresh(job.id(), 2, null));

        assertThat(outcome.result()).isEqualTo(DeliveryResult.REJECTED);
    }

    @Test
    @DisplayName("should fail the delivery when the next stage cannot be published")
    void handle_dispatchFails_shouldFail() {
        Job job = repository.insert(JobFixtures.newJob(stateMachine));
        doThrow(new DispatchException("m-1", "embedding.generate", "broker unreachable"))
            .when(stageDispatcher).dispatchNext(any(Job.class));

        DeliveryOutcome outcome = worker().handle(WorkMessage.fresh(job.id(), 1, null));

        assertThat(outcome.result()).isEqualTo(DeliveryResult.FAILED);
        // The stage itself completed; a redelivery re-dispatches stage 2
        assertThat(repository.findById(job.id()).orElseThrow().stage(1).isCompleted()).isTrue();
    }
}
