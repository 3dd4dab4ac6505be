package tech.compendium.pipeline.job.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.compendium.pipeline.dispatch.StageDispatcher;
import tech.compendium.pipeline.job.dto.CreateJobRequest;
import tech.compendium.pipeline.job.dto.JobFilter;
import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.model.JobStatus;
import tech.compendium.pipeline.job.repository.InMemoryJobRepository;
import tech.compendium.pipeline.job.statemachine.JobStateMachine;
import tech.compendium.queue.DispatchException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobSubmissionService")
class JobSubmissionServiceTest {

    @Spy
    private InMemoryJobRepository jobRepository = new InMemoryJobRepository();

    @Spy
    private JobStateMachine stateMachine = new JobStateMachine();

    @Mock
    private StageDispatcher stageDispatcher;

    @InjectMocks
    private JobSubmissionService service;

    @Test
    @DisplayName("submit should store a pending job and dispatch stage 1")
    void submit_shouldStoreAndDispatch() {
        // Act
        Job job = service.submit(new CreateJobRequest("notes.pdf", "Notes", 10, null));

        // Assert
        assertThat(job.status()).isEqualTo(JobStatus.PENDING);
        assertThat(jobRepository.findById(job.id())).contains(job);
        verify(stageDispatcher).dispatchNext(job);
    }

    @Test
    @DisplayName("submit should propagate a publish failure and leave the job pending")
    void submit_shouldPropagateDispatchFailure() {
        // Arrange
        doThrow(new DispatchException("m-1", "pdf.process", "broker unreachable"))
            .when(stageDispatcher).dispatchNext(any(Job.class));

        // Act + Assert
        assertThatThrownBy(() -> service.submit(CreateJobRequest.of("notes.pdf")))
            .isInstanceOf(DispatchException.class);
        assertThat(jobRepository.count()).isEqualTo(1);
        assertThat(jobRepository.findWithFilter(JobFilter.all()))
            .allMatch(job -> job.status() == JobStatus.PENDING);
    }

    @Test
    @DisplayName("submit should reject a request without a file name")
    void submit_shouldRejectMissingFileName() {
        assertThatThrownBy(() -> service.submit(new CreateJobRequest(" ", null, null, null)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("fileName");
        verifyNoInteractions(stageDispatcher);
    }
}
