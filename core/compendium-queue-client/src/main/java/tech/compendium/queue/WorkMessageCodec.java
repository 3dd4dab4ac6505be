package tech.compendium.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON wire format for {@link WorkMessage}.
 */
public class WorkMessageCodec {

    private final ObjectMapper objectMapper;

    public WorkMessageCodec() {
        this(new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public WorkMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(WorkMessage message) throws JsonProcessingException {
        return objectMapper.writeValueAsString(message);
    }

    /**
     * @throws JsonProcessingException if the body is not a well-formed work message
     */
    public WorkMessage decode(String body) throws JsonProcessingException {
        WorkMessage message = objectMapper.readValue(body, WorkMessage.class);
        if (message == null || message.jobId() == null || message.messageId() == null || message.stage() < 1) {
            throw new MalformedWorkMessageException("Work message is missing messageId, jobId or stage");
        }
        return message;
    }

    /**
     * Raised when a body parses as JSON but does not describe a usable work message.
     */
    public static class MalformedWorkMessageException extends JsonProcessingException {
        public MalformedWorkMessageException(String message) {
            super(message);
        }
    }
}
