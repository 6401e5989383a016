package com.pushcast.dispatcher.delivery;

import com.pushcast.dispatcher.gateway.DeliveryException;
import com.pushcast.dispatcher.gateway.PermanentDeliveryException;
import com.pushcast.dispatcher.gateway.PushGateway;
import com.pushcast.dispatcher.model.Job;
import com.pushcast.dispatcher.model.NotificationPayload;
import com.pushcast.dispatcher.registry.TargetRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.pushcast.dispatcher.registry.DatabaseTargetRegistry.abbreviate;

/**
 * Turns a payload into gateway calls: resolve the selector, send to every
 * token, collect a {@link DeliveryResult}.
 *
 * Tokens the gateway reports as UNREGISTERED are removed from the registry
 * so later deliveries stop trying them.
 *
 * A scheduled delivery beats its heartbeat every {@code heartbeatEvery}
 * tokens, which keeps a long topic fan-out from looking like a dead claim.
 */
@Component
public class DeliveryExecutor {

    private static final Logger log = LoggerFactory.getLogger(DeliveryExecutor.class);

    private final TargetRegistry registry;
    private final PushGateway    gateway;
    private final PayloadCodec   codec;
    private final int            heartbeatEvery;

    private final Counter delivered;
    private final Counter transientFailures;
    private final Counter permanentFailures;
    private final Counter pruned;
    private final Timer   deliveryTimer;

    public DeliveryExecutor(TargetRegistry registry, PushGateway gateway, PayloadCodec codec,
                            MeterRegistry meterRegistry,
                            @Value("${pushcast.delivery.heartbeat-every:10}") int heartbeatEvery) {
        if (heartbeatEvery < 1) {
            throw new IllegalArgumentException("heartbeat-every must be at least 1, got " + heartbeatEvery);
        }
        this.registry       = registry;
        this.gateway        = gateway;
        this.codec          = codec;
        this.heartbeatEvery = heartbeatEvery;

        this.delivered         = meterRegistry.counter("pushcast.delivery.targets", "outcome", "delivered");
        this.transientFailures = meterRegistry.counter("pushcast.delivery.targets", "outcome", "transient");
        this.permanentFailures = meterRegistry.counter("pushcast.delivery.targets", "outcome", "permanent");
        this.pruned            = meterRegistry.counter("pushcast.registry.tokens.pruned");
        this.deliveryTimer     = meterRegistry.timer("pushcast.delivery.duration");
    }

    /**
     * Deliver the payload stored on a job. {@code heartbeat} runs after every
     * {@code heartbeatEvery} tokens; whatever it throws aborts the delivery.
     *
     * @throws com.pushcast.dispatcher.model.InvalidPayloadException if the stored payload cannot be read
     */
    public DeliveryResult execute(Job job, Runnable heartbeat) {
        NotificationPayload payload = codec.decode(job.getPayloadJson());
        return deliveryTimer.record(() -> doDeliver(payload, heartbeat));
    }

    public DeliveryResult deliver(NotificationPayload payload) {
        return deliveryTimer.record(() -> doDeliver(payload, () -> { }));
    }

    private DeliveryResult doDeliver(NotificationPayload payload, Runnable heartbeat) {
        Set<String> tokens = registry.resolve(payload.target());
        if (tokens.isEmpty()) {
            log.warn("No deliverable targets for {}", payload.target());
            return DeliveryResult.noTargets();
        }

        List<String> succeeded = new ArrayList<>();
        List<DeliveryResult.TargetFailure> failed = new ArrayList<>();
        int sent = 0;
        for (String token : tokens) {
            if (sent > 0 && sent % heartbeatEvery == 0) {
                heartbeat.run();
            }
            sent++;
            try {
                gateway.send(token, payload.message());
                succeeded.add(token);
                delivered.increment();
            } catch (DeliveryException e) {
                failed.add(new DeliveryResult.TargetFailure(abbreviate(token), e.getMessage(), e.isRetryable()));
                (e.isRetryable() ? transientFailures : permanentFailures).increment();
                log.warn("Delivery to {} failed ({}): {}",
                        abbreviate(token), e.isRetryable() ? "transient" : "permanent", e.getMessage());
                if (e instanceof PermanentDeliveryException permanent && permanent.isUnregistered()) {
                    prune(token);
                }
            }
        }

        DeliveryResult result = new DeliveryResult(succeeded, failed);
        if (result.isPartial()) {
            log.warn("Partial delivery to {}: {}", payload.target(), result.describe());
        } else {
            log.info("Delivery to {}: {}", payload.target(), result.describe());
        }
        return result;
    }

    private void prune(String token) {
        try {
            if (registry.removeToken(token)) {
                pruned.increment();
                log.info("Pruned unregistered token {}", abbreviate(token));
            }
        } catch (RuntimeException e) {
            // The delivery outcome stands; the token is pruned on its next rejection.
            log.warn("Could not prune token {}: {}", abbreviate(token), e.getMessage());
        }
    }
}
