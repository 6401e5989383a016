package com.pushcast.dispatcher.service;

import com.pushcast.dispatcher.model.InvalidPayloadException;
import com.pushcast.dispatcher.model.NotificationPayload;
import com.pushcast.dispatcher.model.PushMessage;
import com.pushcast.dispatcher.model.TargetSelector;
import com.pushcast.dispatcher.support.Payloads;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadValidatorTest {

    PayloadValidator validator = new PayloadValidator();

    @Test
    void acceptsEveryTargetKind() {
        assertThatCode(() -> {
            validator.validate(Payloads.toTopic("news"));
            validator.validate(Payloads.toTokens("t1", "t2"));
            validator.validate(new NotificationPayload(TargetSelector.users("u1"), Payloads.message("A", "B")));
            validator.validate(new NotificationPayload(
                    TargetSelector.condition("'a' in topics && !('b' in topics)"), Payloads.message("A", "B")));
        }).doesNotThrowAnyException();
    }

    @Test
    void rejectsInvalidTopicName() {
        assertThatThrownBy(() -> validator.validate(Payloads.toTopic("no spaces allowed")))
                .isInstanceOf(InvalidPayloadException.class)
                .hasMessageContaining("Invalid topic name");
    }

    @Test
    void rejectsMalformedCondition() {
        NotificationPayload payload = new NotificationPayload(
                TargetSelector.condition("'a' in topics &&"), Payloads.message("A", "B"));

        assertThatThrownBy(() -> validator.validate(payload)).isInstanceOf(InvalidPayloadException.class);
    }

    @Test
    void rejectsBlankTargetValue() {
        assertThatThrownBy(() -> validator.validate(Payloads.toTokens("t1", " ")))
                .isInstanceOf(InvalidPayloadException.class)
                .hasMessageContaining("blank");
    }

    @Test
    void rejectsMissingBody() {
        NotificationPayload payload = new NotificationPayload(TargetSelector.topics("news"),
                new PushMessage("Title", null, null, null, null, null, null, null));

        assertThatThrownBy(() -> validator.validate(payload))
                .isInstanceOf(InvalidPayloadException.class)
                .hasMessageContaining("body");
    }

    @ParameterizedTest
    @ValueSource(strings = {"from", "notification", "message_type", "google.sender", "gcm.notification.x"})
    void rejectsReservedDataKeys(String key) {
        NotificationPayload payload = new NotificationPayload(TargetSelector.topics("news"),
                new PushMessage("A", "B", null, null, Map.of(key, "x"), null, null, null));

        assertThatThrownBy(() -> validator.validate(payload))
                .isInstanceOf(InvalidPayloadException.class)
                .hasMessageContaining("reserved");
    }
}
