package com.phillippitts.imageoptimizer.service.protocol;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SidecarMessageDecoderTest {

    private static final String RESULT_JSON = "{\"path\":\"/in/a.png\",\"original_size\":1000,"
            + "\"optimized_size\":600,\"saved_bytes\":400,\"compression_ratio\":\"40.00\","
            + "\"format\":\"png\",\"success\":true}";

    @Test
    void decodesGenericProgressMessage() {
        String line = "{\"progressType\":\"complete\",\"taskId\":\"/in/a.png\",\"workerId\":3,"
                + "\"result\":" + RESULT_JSON + ",\"metrics\":{\"completedTasks\":1,\"totalTasks\":2}}";

        Optional<SidecarMessage> decoded = SidecarMessageDecoder.decode(line);

        assertThat(decoded).get().isInstanceOf(ProgressMessage.class);
        ProgressMessage msg = (ProgressMessage) decoded.get();
        assertThat(msg.progressType()).isEqualTo("complete");
        assertThat(msg.workerId()).isEqualTo("3");
        assertThat(msg.result().savedBytes()).isEqualTo(400);
        assertThat(msg.completedTasks()).isEqualTo(1);
        assertThat(msg.totalTasks()).isEqualTo(2);
    }

    @Test
    void workerIdIsOptional() {
        Optional<SidecarMessage> decoded =
                SidecarMessageDecoder.decode("{\"progressType\":\"start\",\"taskId\":\"/in/a.png\"}");

        assertThat(decoded).get().isInstanceOf(ProgressMessage.class);
        assertThat(((ProgressMessage) decoded.get()).workerId()).isNull();
        assertThat(((ProgressMessage) decoded.get()).hasMetrics()).isFalse();
    }

    @Test
    void unknownProgressTypeIsNotAMessage() {
        assertThat(SidecarMessageDecoder.decode("{\"progressType\":\"paused\",\"taskId\":\"a\"}")).isEmpty();
    }

    @Test
    void malformedResultRejectsTheWholeLine() {
        String line = "{\"progressType\":\"complete\",\"taskId\":\"a\",\"result\":{\"path\":\"a\"}}";

        assertThat(SidecarMessageDecoder.decode(line)).isEmpty();
    }

    @Test
    void decodesSimplifiedUpdate() {
        String line = "{\"completedTasks\":3,\"totalTasks\":10,\"progressPercentage\":30,"
                + "\"status\":\"processing\",\"metadata\":{\"formattedMessage\":\"3 of 10\"}}";

        Optional<SidecarMessage> decoded = SidecarMessageDecoder.decode(line);

        assertThat(decoded).get().isInstanceOf(SimplifiedProgressUpdate.class);
        SimplifiedProgressUpdate update = (SimplifiedProgressUpdate) decoded.get();
        assertThat(update.progressPercentage()).isEqualTo(30);
        assertThat(update.metadata()).containsEntry("formattedMessage", "3 of 10");
    }

    @Test
    void decodesDetailedUpdateWithNumericRatio() {
        String line = "{\"fileName\":\"a.png\",\"taskId\":\"/in/a.png\","
                + "\"optimizationMetrics\":{\"originalSize\":2048,\"optimizedSize\":1024,\"savedBytes\":1024,"
                + "\"compressionRatio\":50.5,\"format\":\"png\"},"
                + "\"batchMetrics\":{\"completedTasks\":1,\"totalTasks\":4,\"progressPercentage\":25}}";

        Optional<SidecarMessage> decoded = SidecarMessageDecoder.decode(line);

        assertThat(decoded).get().isInstanceOf(DetailedProgressUpdate.class);
        DetailedProgressUpdate update = (DetailedProgressUpdate) decoded.get();
        assertThat(update.metrics().compressionRatio()).isEqualTo("50.5");
        assertThat(update.batch().progressPercentage()).isEqualTo(25);
        assertThat(update.formattedMessage()).isNull();
    }

    @Test
    void fractionalCountsAreRejected() {
        String line = "{\"completedTasks\":3.5,\"totalTasks\":10,\"progressPercentage\":30,\"status\":\"processing\"}";

        assertThat(SidecarMessageDecoder.decode(line)).isEmpty();
    }

    @Test
    void negativeCountsAreRejected() {
        String line = "{\"completedTasks\":-1,\"totalTasks\":10,\"progressPercentage\":30,\"status\":\"processing\"}";

        assertThat(SidecarMessageDecoder.decode(line)).isEmpty();
    }

    @Test
    void plainTextAndBrokenJsonAreDiagnostics() {
        assertThat(SidecarMessageDecoder.decode("vips warning: libheif not found")).isEmpty();
        assertThat(SidecarMessageDecoder.decode("{\"progressType\":")).isEmpty();
        assertThat(SidecarMessageDecoder.decode("[1,2,3]")).isEmpty();
        assertThat(SidecarMessageDecoder.decode("")).isEmpty();
    }

    @Test
    void decodesPayloadWithMetrics() {
        String json = "{\"results\":[" + RESULT_JSON + "],\"metrics\":{\"durationMs\":12,\"note\":null}}";

        BatchResultPayload payload = SidecarMessageDecoder.decodePayload(json);

        assertThat(payload.results()).hasSize(1);
        assertThat(payload.results().get(0).compressionRatioValue()).isCloseTo(40.0, within(0.0001));
        assertThat(payload.metrics()).containsEntry("durationMs", 12).doesNotContainKey("note");
    }

    @Test
    void payloadWithoutResultsArrayIsRejected() {
        assertThatThrownBy(() -> SidecarMessageDecoder.decodePayload("{\"metrics\":{}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("results");
        assertThatThrownBy(() -> SidecarMessageDecoder.decodePayload("not json"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void payloadWithMalformedEntryIsRejected() {
        assertThatThrownBy(() -> SidecarMessageDecoder.decodePayload("{\"results\":[" + RESULT_JSON + ",{}]}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index 1");
    }

    @Test
    void unparsableRatioFallsBackToZero() {
        assertThat(SidecarMessageDecoder.parseRatio("n/a")).isZero();
        assertThat(SidecarMessageDecoder.parseRatio(null)).isZero();
        assertThat(SidecarMessageDecoder.parseRatio("NaN")).isZero();
        assertThat(SidecarMessageDecoder.parseRatio(" 12.5 ")).isEqualTo(12.5);
    }

    @Test
    void recognizesUnframedPayloadLines() {
        assertThat(SidecarMessageDecoder.looksLikePayload("{\"results\":[]}")).isTrue();
        assertThat(SidecarMessageDecoder.looksLikePayload("{\"result\":{}}")).isFalse();
    }
}
