package com.pushcast.dispatcher.delivery;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one delivery: which tokens accepted the message and which did not.
 *
 * Any success makes the delivery a success; per-target failures of a partial
 * delivery are reported but never retried. A delivery with no targets at all
 * is a permanent failure.
 */
public record DeliveryResult(List<String> succeeded, List<TargetFailure> failed) {

    public record TargetFailure(String target, String reason, boolean retryable) {}

    public DeliveryResult {
        succeeded = List.copyOf(succeeded);
        failed    = List.copyOf(failed);
    }

    public static DeliveryResult noTargets() {
        return new DeliveryResult(List.of(), List.of());
    }

    public int targetCount() {
        return succeeded.size() + failed.size();
    }

    public boolean isSuccess() {
        return !succeeded.isEmpty();
    }

    public boolean isTotalFailure() {
        return succeeded.isEmpty();
    }

    public boolean isPartial() {
        return !succeeded.isEmpty() && !failed.isEmpty();
    }

    /** A total failure is retryable if at least one target failed transiently. */
    public boolean isRetryable() {
        return isTotalFailure() && failed.stream().anyMatch(TargetFailure::retryable);
    }

    public String describe() {
        if (targetCount() == 0) {
            return "no deliverable targets";
        }
        String summary = succeeded.size() + "/" + targetCount() + " delivered";
        if (failed.isEmpty()) {
            return summary;
        }
        return summary + "; failures: " + failed.stream()
                .map(f -> f.target() + " (" + f.reason() + ")")
                .limit(5)
                .collect(Collectors.joining(", "))
                + (failed.size() > 5 ? ", …" : "");
    }
}
