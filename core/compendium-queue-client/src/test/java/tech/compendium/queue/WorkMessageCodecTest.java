package tech.compendium.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkMessageCodecTest {

    private final WorkMessageCodec codec = new WorkMessageCodec();

    @Test
    void ignoresUnknownFields() throws Exception {
        var message = codec.decode("""
            {"messageId":"m-1","jobId":"job-1","stage":4,"attempt":2,"payload":null,"producer":"legacy"}
            """);

        assertEquals("job-1", message.jobId());
        assertEquals(4, message.stage());
        assertEquals(2, message.attempt());
        assertEquals("m-1:2", message.deliveryKey());
    }

    @Test
    void rejectsInvalidJson() {
        assertThrows(JsonProcessingException.class, () -> codec.decode("{not json"));
    }

    @Test
    void rejectsMessageWithoutJobId() {
        assertThrows(WorkMessageCodec.MalformedWorkMessageException.class,
            () -> codec.decode("{\"messageId\":\"m-1\",\"stage\":1,\"attempt\":0}"));
    }

    @Test
    void nextAttemptKeepsMessageIdAndIncrementsAttempt() {
        var message = WorkMessage.fresh("job-1", 1, "{}");
        var next = message.nextAttempt();

        assertEquals(message.messageId(), next.messageId());
        assertEquals(1, next.attempt());
        assertNotEquals(message.deliveryKey(), next.deliveryKey());
    }
}
