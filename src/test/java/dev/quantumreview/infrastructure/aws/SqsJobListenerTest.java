package dev.quantumreview.infrastructure.aws;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quantumreview.exception.JobExecutionException;
import dev.quantumreview.job.Job;
import dev.quantumreview.job.JobDispatcher;
import dev.quantumreview.job.JobType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class SqsJobListenerTest {

    private final JobDispatcher dispatcher = mock(JobDispatcher.class);
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final SqsJobListener listener = new SqsJobListener(dispatcher, objectMapper);

    @Test
    void dispatchesTheEnvelope() throws Exception {
        Job job = job();

        listener.onJob(objectMapper.writeValueAsString(job));

        verify(dispatcher).execute(job);
    }

    @Test
    void unreadableMessagesAreAcknowledgedWithoutDispatch() {
        listener.onJob("not json");
        listener.onJob("{\"id\": \"" + UUID.randomUUID() + "\", \"type\": \"GENERATE_CHECKLIST\"}");
        listener.onJob("{\"id\": \"" + UUID.randomUUID() + "\", \"type\": \"NO_SUCH_TYPE\", \"payload\": {}}");

        verifyNoInteractions(dispatcher);
    }

    @Test
    void handlerFailurePropagatesSoTheMessageIsRedelivered() throws Exception {
        Job job = job();
        doThrow(new JobExecutionException(job.id(), job.type(), new IllegalStateException("db down")))
                .when(dispatcher).execute(job);

        assertThatThrownBy(() -> listener.onJob(objectMapper.writeValueAsString(job)))
                .isInstanceOf(JobExecutionException.class);
    }

    private Job job() {
        return new Job(UUID.randomUUID(), JobType.PROCESS_WORKFLOW_RUN,
                objectMapper.createObjectNode().put("action", "completed"), "d-1", "repo:acme/shop",
                Instant.parse("2026-03-01T12:00:00Z"));
    }
}
