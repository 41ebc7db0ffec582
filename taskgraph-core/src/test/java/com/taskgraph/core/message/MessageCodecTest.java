package com.taskgraph.core.message;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.taskgraph.core.exception.MessageFormatException;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();

    private RunRequest request() {
        return new RunRequest(
            UUID.randomUUID(), UUID.randomUUID(), "fetch", "http.get",
            JsonNodeFactory.instance.objectNode().put("url", "http://example"),
            2, UUID.randomUUID());
    }

    @Test
    void completionMessage_shouldCarryTypeDiscriminator() {
        TaskCompletionMessage message = TaskCompletionMessage.failure(request(), "IO", "connection reset", true);

        String payload = codec.encode(message);

        assertThat(payload).contains("\"type\":\"completion\"");
        ChannelMessage decoded = codec.decodeChannelMessage(payload);
        assertThat(decoded).isInstanceOf(TaskCompletionMessage.class).isEqualTo(message);
    }

    @Test
    void retryTimerMessage_shouldDecodeToItsOwnType() {
        RetryTimerMessage timer = new RetryTimerMessage(UUID.randomUUID(), UUID.randomUUID(), 1);

        ChannelMessage decoded = codec.decodeChannelMessage(codec.encode(timer));

        assertThat(decoded).isEqualTo(timer);
    }

    @Test
    void runRequest_unknownFields_shouldBeIgnored() {
        RunRequest request = request();
        String payload = codec.encode(request).replaceFirst("\\{", "{\"extra\":true,");

        assertThat(codec.decodeRunRequest(payload)).isEqualTo(request);
    }

    @Test
    void decode_garbage_shouldFailWithMessageFormatException() {
        assertThatThrownBy(() -> codec.decodeChannelMessage("not json"))
            .isInstanceOf(MessageFormatException.class);
        assertThatThrownBy(() -> codec.decodeChannelMessage("  "))
            .isInstanceOf(MessageFormatException.class);
        assertThatThrownBy(() -> codec.decodeChannelMessage("{\"type\":\"bogus\"}"))
            .isInstanceOf(MessageFormatException.class);
    }
}
