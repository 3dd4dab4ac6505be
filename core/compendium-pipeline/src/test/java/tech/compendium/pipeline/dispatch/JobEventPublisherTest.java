package tech.compendium.pipeline.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.compendium.pipeline.JobFixtures;
import tech.compendium.pipeline.job.entity.Job;
import tech.compendium.pipeline.job.statemachine.JobStateMachine;
import tech.compendium.queue.DispatchException;
import tech.compendium.queue.WorkDispatcher;
import tech.compendium.queue.WorkMessage;
import tech.compendium.queue.topology.PipelineTopology;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobEventPublisher")
class JobEventPublisherTest {

    @Mock
    private WorkDispatcher eventDispatcher;

    private ObjectMapper objectMapper;
    private JobEventPublisher publisher;
    private JobStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        publisher = new JobEventPublisher(eventDispatcher, objectMapper);
        stateMachine = new JobStateMachine();
    }

    @Test
    @DisplayName("should publish a completed event on notification.completed")
    void publishCompleted_shouldPublishEvent() throws Exception {
        Job completed = JobFixtures.withCompletedStages(stateMachine, 8);

        assertThat(publisher.publishCompleted(completed)).isTrue();

        ArgumentCaptor<WorkMessage> message = ArgumentCaptor.forClass(WorkMessage.class);
        verify(eventDispatcher).publish(eq(PipelineTopology.NOTIFICATION_COMPLETED_KEY), message.capture());
        JobEvent event = objectMapper.readValue(message.getValue().payload(), JobEvent.class);
        assertThat(event.type()).isEqualTo(JobEvent.Type.COMPLETED);
        assertThat(event.jobId()).isEqualTo(completed.id());
        assertThat(event.occurredAt()).isEqualTo(completed.completedAt());
    }

    @Test
    @DisplayName("should publish a failed event carrying the stage and error")
    void publishFailed_shouldPublishEvent() throws Exception {
        Job failed = JobFixtures.failedAt(stateMachine, 5, "tagging model unavailable");

        assertThat(publisher.publishFailed(failed)).isTrue();

        ArgumentCaptor<WorkMessage> message = ArgumentCaptor.forClass(WorkMessage.class);
        verify(eventDispatcher).publish(eq(PipelineTopology.NOTIFICATION_FAILED_KEY), message.capture());
        assertThat(message.getValue().stage()).isEqualTo(5);
        JobEvent event = objectMapper.readValue(message.getValue().payload(), JobEvent.class);
        assertThat(event.failedStage()).isEqualTo(5);
        assertThat(event.error()).isEqualTo("tagging model unavailable");
    }

    @Test
    @DisplayName("should report a broker failure without throwing")
    void publish_shouldReportFailure() {
        doThrow(new DispatchException("m-1", PipelineTopology.NOTIFICATION_FAILED_KEY, "nope"))
            .when(eventDispatcher).publish(anyString(), any(WorkMessage.class));

        assertThat(publisher.publishFailed(JobFixtures.failedAt(stateMachine, 1, "boom"))).isFalse();
    }
}
