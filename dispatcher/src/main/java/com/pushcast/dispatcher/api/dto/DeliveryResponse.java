package com.pushcast.dispatcher.api.dto;

import com.pushcast.dispatcher.delivery.DeliveryResult;

import java.util.List;

public record DeliveryResponse(
        boolean                             success,
        int                                 successCount,
        int                                 failureCount,
        String                              message,
        List<DeliveryResult.TargetFailure>  failures
) {
    public static DeliveryResponse from(DeliveryResult result) {
        return new DeliveryResponse(
                result.isSuccess(),
                result.succeeded().size(),
                result.failed().size(),
                result.describe(),
                result.failed());
    }
}
