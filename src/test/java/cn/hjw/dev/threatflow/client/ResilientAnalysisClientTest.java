package cn.hjw.dev.threatflow.client;

import cn.hjw.dev.threatflow.config.PollingGovernance;
import cn.hjw.dev.threatflow.exception.AnalysisClientException;
import cn.hjw.dev.threatflow.exception.NoTasksException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Slf4j
public class ResilientAnalysisClientTest {

    private static final PollingGovernance RETRY_TWICE = PollingGovernance.builder()
            .maxRetries(2)
            .retryBackoff(Duration.ofMillis(5))
            .build();

    @Test
    public void testRetrySuccess() {
        AnalysisClient delegate = mock(AnalysisClient.class);
        when(delegate.poll("job-1"))
                .thenThrow(new AnalysisClientException("模拟网络波动异常"))
                .thenThrow(new AnalysisClientException("模拟网络波动异常"))
                .thenReturn(JobStatus.completed(List.of()));

        JobStatus status = new ResilientAnalysisClient(delegate, RETRY_TWICE).poll("job-1");

        Assertions.assertEquals(JobState.COMPLETED, status.getState());
        verify(delegate, times(3)).poll("job-1");
    }

    @Test
    public void testRetryExhausted() {
        AnalysisClient delegate = mock(AnalysisClient.class);
        when(delegate.submit(anyList(), any())).thenThrow(new AnalysisClientException("503"));

        AnalysisClient client = new ResilientAnalysisClient(delegate, RETRY_TWICE);
        Assertions.assertThrows(AnalysisClientException.class, () -> client.submit(List.of("ClamAV"), new byte[0]));
        verify(delegate, times(3)).submit(anyList(), any());
    }

    @Test
    public void testNoTasksIsNeverRetried() {
        AnalysisClient delegate = mock(AnalysisClient.class);
        when(delegate.submit(anyList(), any())).thenThrow(new NoTasksException());

        AnalysisClient client = new ResilientAnalysisClient(delegate, RETRY_TWICE);
        Assertions.assertThrows(NoTasksException.class, () -> client.submit(List.of(), new byte[0]));
        verify(delegate, times(1)).submit(anyList(), any());
    }
}
