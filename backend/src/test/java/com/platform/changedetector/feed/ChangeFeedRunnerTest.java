package com.platform.changedetector.feed;

import com.platform.changedetector.client.ResourceCollectionClient;
import com.platform.changedetector.config.ChangeDetectorProperties;
import com.platform.changedetector.detector.ChangeDetector;
import com.platform.changedetector.error.ResourceFetchException;
import com.platform.changedetector.model.ChangeEvent;
import com.platform.changedetector.model.ResourceTypeDescriptor;
import com.platform.changedetector.model.WatchedResource;
import com.platform.changedetector.observability.MetricsRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static com.platform.changedetector.TestResources.resource;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mockingDetails;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChangeFeedRunner Tests")
class ChangeFeedRunnerTest {

    private static final ResourceTypeDescriptor EXTERNAL_SECRETS =
        new ResourceTypeDescriptor("kubernetes-client.io", "v1", "externalsecrets");

    @Mock
    private ResourceCollectionClient resourceClient;

    @Mock
    private ChangeEventHandler firstHandler;

    @Mock
    private ChangeEventHandler secondHandler;

    private ChangeDetectorProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private MetricsRegistry metricsRegistry;
    private ChangeFeedRunner runner;

    @BeforeEach
    void setUp() {
        properties = new ChangeDetectorProperties();
        properties.setInterval(Duration.ofMillis(10));
        meterRegistry = new SimpleMeterRegistry();
        metricsRegistry = new MetricsRegistry(meterRegistry);
        runner = new ChangeFeedRunner(
            new ChangeDetector(metricsRegistry),
            resourceClient,
            properties,
            List.of(firstHandler, secondHandler),
            metricsRegistry
        );
    }

    @AfterEach
    void tearDown() {
        runner.stop();
    }

    @Test
    @DisplayName("Should deliver events to every handler in order")
    void shouldDeliverToAllHandlers() {
        // Given
        WatchedResource secret = resource("a", "1");
        when(resourceClient.list(EXTERNAL_SECRETS)).thenReturn(List.of(secret));

        // When
        runner.start();

        // Then
        verify(firstHandler, timeout(2000)).onChange(ChangeEvent.added(secret));
        verify(secondHandler, timeout(2000)).onChange(ChangeEvent.added(secret));
        assertThat(runner.isRunning()).isTrue();
        assertThat(runner.getStatus())
            .hasValueSatisfying(status -> assertThat(status.stream()).isEqualTo("kubernetes-client.io/v1/externalsecrets"));
    }

    @Test
    @DisplayName("Should keep dispatching when a handler throws")
    void shouldSurviveHandlerFailure() {
        // Given
        WatchedResource a1 = resource("a", "1");
        WatchedResource a2 = resource("a", "2");
        when(resourceClient.list(EXTERNAL_SECRETS))
            .thenReturn(List.of(a1))
            .thenReturn(List.of(a2));
        doThrow(new IllegalStateException("sync failed")).when(firstHandler).onChange(any());
        when(firstHandler.getName()).thenReturn("first");

        // When
        runner.start();

        // Then
        verify(secondHandler, timeout(2000)).onChange(ChangeEvent.added(a1));
        verify(secondHandler, timeout(2000)).onChange(ChangeEvent.modified(a2));
        assertThat(meterRegistry.get("changedetector.handler.failures").tag("handler", "first").counter().count())
            .isGreaterThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("Should keep polling through fetch failures")
    void shouldSurviveFetchFailure() {
        // Given
        WatchedResource secret = resource("b", "1");
        when(resourceClient.list(EXTERNAL_SECRETS))
            .thenThrow(ResourceFetchException.unavailable(EXTERNAL_SECRETS.toString(), "connection refused", null))
            .thenReturn(List.of(secret));

        // When
        runner.start();

        // Then
        verify(firstHandler, timeout(2000)).onChange(ChangeEvent.added(secret));
        verify(resourceClient, atLeast(2)).list(EXTERNAL_SECRETS);
    }

    @Test
    @DisplayName("Should stop pulling once stopped")
    void shouldStop() throws InterruptedException {
        // Given
        when(resourceClient.list(EXTERNAL_SECRETS)).thenReturn(List.of());
        runner.start();
        verify(resourceClient, timeout(2000).atLeast(2)).list(EXTERNAL_SECRETS);

        // When
        runner.stop();
        int fetchesAtStop = mockingDetails(resourceClient).getInvocations().size();
        Thread.sleep(properties.getInterval().toMillis() * 10);

        // Then
        assertThat(runner.isRunning()).isFalse();
        assertThat(mockingDetails(resourceClient).getInvocations()).hasSize(fetchesAtStop);
        assertThat(Thread.getAllStackTraces().keySet())
            .extracting(Thread::getName)
            .doesNotContain("change-feed-externalsecrets");
    }

    @Test
    @DisplayName("Should not poll when disabled")
    void shouldNotStartWhenDisabled() {
        // Given
        properties.setEnabled(false);

        // When
        runner.start();

        // Then
        assertThat(runner.isRunning()).isFalse();
        assertThat(runner.getStatus()).isEmpty();
        verifyNoInteractions(resourceClient, firstHandler, secondHandler);
    }
}
