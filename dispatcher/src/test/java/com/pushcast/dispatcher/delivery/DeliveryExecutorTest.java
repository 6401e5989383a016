package com.pushcast.dispatcher.delivery;

import com.pushcast.dispatcher.gateway.PermanentDeliveryException;
import com.pushcast.dispatcher.gateway.PushGateway;
import com.pushcast.dispatcher.gateway.TransientDeliveryException;
import com.pushcast.dispatcher.model.InvalidPayloadException;
import com.pushcast.dispatcher.model.Job;
import com.pushcast.dispatcher.model.NotificationPayload;
import com.pushcast.dispatcher.model.TargetSelector;
import com.pushcast.dispatcher.registry.TargetRegistry;
import com.pushcast.dispatcher.store.StoreConsistencyException;
import com.pushcast.dispatcher.support.Payloads;
import com.pushcast.dispatcher.trigger.TriggerSpec;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeliveryExecutorTest {

    @Mock TargetRegistry registry;
    @Mock PushGateway    gateway;

    SimpleMeterRegistry meters = new SimpleMeterRegistry();
    PayloadCodec        codec  = new PayloadCodec(Payloads.objectMapper());
    DeliveryExecutor    executor;

    @BeforeEach
    void setUp() {
        executor = new DeliveryExecutor(registry, gateway, codec, meters, 2);
    }

    @Test
    void deliver_allTargetsAccept_isSuccess() {
        NotificationPayload payload = Payloads.toTopic("news");
        when(registry.resolve(payload.target())).thenReturn(tokens("t1", "t2"));
        when(gateway.send(any(), any())).thenReturn("msg-id");

        DeliveryResult result = executor.deliver(payload);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isPartial()).isFalse();
        assertThat(result.succeeded()).containsExactly("t1", "t2");
        assertThat(meters.counter("pushcast.delivery.targets", "outcome", "delivered").count()).isEqualTo(2.0);
    }

    @Test
    void deliver_partialFailure_countsAsSuccessAndReportsFailures() {
        NotificationPayload payload = Payloads.toTopic("news");
        when(registry.resolve(payload.target())).thenReturn(tokens("good", "bad"));
        when(gateway.send(eq("good"), any())).thenReturn("msg-id");
        when(gateway.send(eq("bad"), any())).thenThrow(new TransientDeliveryException("503"));

        DeliveryResult result = executor.deliver(payload);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isPartial()).isTrue();
        assertThat(result.isRetryable()).isFalse();
        assertThat(result.failed()).singleElement()
                .satisfies(f -> assertThat(f.retryable()).isTrue());
    }

    @Test
    void deliver_totalFailureWithAnyTransient_isRetryable() {
        NotificationPayload payload = Payloads.toTokens("a", "b");
        when(registry.resolve(payload.target())).thenReturn(tokens("a", "b"));
        when(gateway.send(eq("a"), any())).thenThrow(new PermanentDeliveryException("INVALID_ARGUMENT", "bad"));
        when(gateway.send(eq("b"), any())).thenThrow(new TransientDeliveryException("timeout"));

        DeliveryResult result = executor.deliver(payload);

        assertThat(result.isTotalFailure()).isTrue();
        assertThat(result.isRetryable()).isTrue();
    }

    @Test
    void deliver_totalPermanentFailure_isNotRetryable() {
        NotificationPayload payload = Payloads.toTokens("a");
        when(registry.resolve(payload.target())).thenReturn(tokens("a"));
        when(gateway.send(eq("a"), any())).thenThrow(new PermanentDeliveryException("INVALID_ARGUMENT", "bad"));

        DeliveryResult result = executor.deliver(payload);

        assertThat(result.isTotalFailure()).isTrue();
        assertThat(result.isRetryable()).isFalse();
    }

    @Test
    void deliver_noTargets_isPermanentFailureWithoutGatewayCall() {
        NotificationPayload payload = Payloads.toTopic("empty");
        when(registry.resolve(payload.target())).thenReturn(Set.of());

        DeliveryResult result = executor.deliver(payload);

        assertThat(result.isTotalFailure()).isTrue();
        assertThat(result.isRetryable()).isFalse();
        assertThat(result.describe()).isEqualTo("no deliverable targets");
        verifyNoInteractions(gateway);
    }

    @Test
    void deliver_unregisteredToken_isPrunedFromRegistry() {
        NotificationPayload payload = Payloads.toTokens("stale", "fresh");
        when(registry.resolve(payload.target())).thenReturn(tokens("stale", "fresh"));
        when(gateway.send(eq("stale"), any()))
                .thenThrow(new PermanentDeliveryException(PermanentDeliveryException.UNREGISTERED, "gone"));
        when(gateway.send(eq("fresh"), any())).thenReturn("msg-id");
        when(registry.removeToken("stale")).thenReturn(true);

        executor.deliver(payload);

        verify(registry).removeToken("stale");
        verify(registry, never()).removeToken("fresh");
        assertThat(meters.counter("pushcast.registry.tokens.pruned").count()).isEqualTo(1.0);
    }

    @Test
    void deliver_pruneFailure_doesNotChangeOutcome() {
        NotificationPayload payload = Payloads.toTokens("stale");
        when(registry.resolve(payload.target())).thenReturn(tokens("stale"));
        when(gateway.send(eq("stale"), any()))
                .thenThrow(new PermanentDeliveryException(PermanentDeliveryException.UNREGISTERED, "gone"));
        when(registry.removeToken("stale")).thenThrow(new IllegalStateException("db down"));

        DeliveryResult result = executor.deliver(payload);

        assertThat(result.isTotalFailure()).isTrue();
        assertThat(result.isRetryable()).isFalse();
    }

    @Test
    void execute_decodesStoredPayload() {
        NotificationPayload payload = new NotificationPayload(TargetSelector.users("u1"), Payloads.message("A", "B"));
        Job job = new Job(new TriggerSpec.OneShot(Instant.parse("2025-06-01T12:00:00Z")), codec.encode(payload));
        when(registry.resolve(TargetSelector.users("u1"))).thenReturn(tokens("t1"));
        when(gateway.send(eq("t1"), any())).thenReturn("msg-id");

        assertThat(executor.execute(job, () -> { }).isSuccess()).isTrue();
        verify(gateway).send(eq("t1"), eq(payload.message()));
    }

    @Test
    void execute_unreadablePayload_throwsInvalidPayload() {
        Job job = new Job(new TriggerSpec.OneShot(Instant.parse("2025-06-01T12:00:00Z")), "{not json");

        assertThatThrownBy(() -> executor.execute(job, () -> { })).isInstanceOf(InvalidPayloadException.class);
    }

    @Test
    void execute_longFanOut_beatsHeartbeatBetweenBatches() {
        NotificationPayload payload = Payloads.toTopic("news");
        Job job = new Job(new TriggerSpec.OneShot(Instant.parse("2025-06-01T12:00:00Z")), codec.encode(payload));
        when(registry.resolve(payload.target())).thenReturn(tokens("t1", "t2", "t3", "t4", "t5"));
        when(gateway.send(any(), any())).thenReturn("msg-id");
        AtomicInteger beats = new AtomicInteger();

        DeliveryResult result = executor.execute(job, beats::incrementAndGet);

        assertThat(result.succeeded()).hasSize(5);
        assertThat(beats.get()).isEqualTo(2);
    }

    @Test
    void execute_heartbeatFailure_abortsRemainingSends() {
        NotificationPayload payload = Payloads.toTopic("news");
        Job job = new Job(new TriggerSpec.OneShot(Instant.parse("2025-06-01T12:00:00Z")), codec.encode(payload));
        when(registry.resolve(payload.target())).thenReturn(tokens("t1", "t2", "t3", "t4"));
        when(gateway.send(any(), any())).thenReturn("msg-id");

        assertThatThrownBy(() -> executor.execute(job, () -> {
            throw new StoreConsistencyException("claim lost");
        })).isInstanceOf(StoreConsistencyException.class);

        verify(gateway, times(2)).send(any(), any());
    }

    @Test
    void constructor_rejectsNonPositiveHeartbeatCadence() {
        assertThatThrownBy(() -> new DeliveryExecutor(registry, gateway, codec, meters, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Set<String> tokens(String... tokens) {
        return new LinkedHashSet<>(List.of(tokens));
    }
}
