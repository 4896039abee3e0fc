package io.voxeldaemon.core.rpc;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.voxeldaemon.core.testkit.CapturingReplyChannel;
import io.voxeldaemon.core.testkit.DispatchRig;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link Dispatcher}: classification, notifications and batches. */
class DispatcherTest {

    private DispatchRig rig;
    private CapturingReplyChannel channel;

    @BeforeEach
    void setUp() {
        rig = new DispatchRig();
        channel = new CapturingReplyChannel();
    }

    @AfterEach
    void tearDown() {
        rig.close();
    }

    @Nested
    @DisplayName("single requests")
    class SingleRequests {

        @Test
        void pingReturnsPong() throws Exception {
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":1}", channel);

            JsonNode response = channel.awaitOne();
            assertThat(response.path("jsonrpc").asText()).isEqualTo("2.0");
            assertThat(response.path("result").asText()).isEqualTo("pong");
            assertThat(response.path("id").asInt()).isEqualTo(1);
            assertThat(response.has("error")).isFalse();
        }

        @Test
        void stringIdIsEchoed() throws Exception {
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":\"abc\"}", channel);

            assertThat(channel.awaitOne().path("id").asText()).isEqualTo("abc");
        }

        @Test
        void malformedJsonIsParseErrorWithNullId() throws Exception {
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":", channel);

            JsonNode response = channel.awaitOne();
            assertThat(response.path("error").path("code").asInt()).isEqualTo(-32700);
            assertThat(response.get("id").isNull()).isTrue();
        }

        @Test
        void trailingGarbageIsParseError() throws Exception {
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":1} x", channel);

            assertThat(channel.awaitOne().path("error").path("code").asInt()).isEqualTo(-32700);
        }

        @Test
        void scalarValueIsInvalidRequest() throws Exception {
            rig.send("42", channel);

            JsonNode response = channel.awaitOne();
            assertThat(response.path("error").path("code").asInt()).isEqualTo(-32600);
            assertThat(response.get("id").isNull()).isTrue();
        }

        @Test
        void wrongVersionKeepsReadableId() throws Exception {
            rig.send("{\"jsonrpc\":\"1.0\",\"method\":\"ping\",\"id\":7}", channel);

            JsonNode response = channel.awaitOne();
            assertThat(response.path("error").path("code").asInt()).isEqualTo(-32600);
            assertThat(response.path("id").asInt()).isEqualTo(7);
        }

        @Test
        void objectIdIsInvalidRequestWithNullId() throws Exception {
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":{\"a\":1}}", channel);

            JsonNode response = channel.awaitOne();
            assertThat(response.path("error").path("code").asInt()).isEqualTo(-32600);
            assertThat(response.get("id").isNull()).isTrue();
        }

        @Test
        void scalarParamsAreInvalidRequest() throws Exception {
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"params\":3,\"id\":2}", channel);

            assertThat(channel.awaitOne().path("error").path("code").asInt()).isEqualTo(-32600);
        }

        @Test
        void unknownMethodIsMethodNotFound() throws Exception {
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"goxel.fly\",\"id\":3}", channel);

            JsonNode response = channel.awaitOne();
            assertThat(response.path("error").path("code").asInt()).isEqualTo(-32601);
            assertThat(response.path("error").path("data").path("method").asText()).isEqualTo("goxel.fly");
            assertThat(response.path("id").asInt()).isEqualTo(3);
        }

        @Test
        void invalidColorIsInvalidParamsWithViolations() throws Exception {
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"goxel.add_voxel\","
                    + "\"params\":{\"x\":0,\"y\":0,\"z\":0,\"r\":300,\"g\":0,\"b\":0},\"id\":4}", channel);

            JsonNode error = channel.awaitOne().path("error");
            assertThat(error.path("code").asInt()).isEqualTo(-32602);
            assertThat(error.path("data").path("violations").size()).isGreaterThan(0);
        }

        @Test
        void tooManyPositionalParamsIsInvalidParams() throws Exception {
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"goxel.get_voxel\",\"params\":[1,2,3,4],\"id\":5}", channel);

            assertThat(channel.awaitOne().path("error").path("code").asInt()).isEqualTo(-32602);
        }

        @Test
        void positionalParamsAreBoundInDeclarationOrder() throws Exception {
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"goxel.create_project\",\"params\":[\"p\",8,8,8],\"id\":1}",
                    channel);
            channel.awaitOne();
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"goxel.add_voxel\",\"params\":[1,2,3,10,20,30],\"id\":2}",
                    channel);
            channel.await(2, Duration.ofSeconds(5));
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"goxel.get_voxel\",\"params\":[1,2,3],\"id\":3}", channel);

            JsonNode result = channel.await(3, Duration.ofSeconds(5)).get(2).path("result");
            assertThat(result.path("exists").asBoolean()).isTrue();
            assertThat(result.path("color").toString()).isEqualTo("[10,20,30,255]");
        }
    }

    @Nested
    @DisplayName("notifications")
    class Notifications {

        @Test
        void unknownMethodNotificationProducesNothing() {
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"nope\"}", channel);

            assertThat(channel.delivered()).isEmpty();
        }

        @Test
        void invalidNotificationAttemptIsDropped() {
            rig.send("{\"jsonrpc\":\"1.0\",\"method\":\"ping\"}", channel);

            assertThat(channel.delivered()).isEmpty();
        }

        @Test
        void explicitNullIdIsTreatedAsNotification() throws Exception {
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":null}", channel);
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":9}", channel);

            JsonNode response = channel.awaitOne();
            Thread.sleep(100);
            assertThat(channel.delivered()).hasSize(1);
            assertThat(response.path("id").asInt()).isEqualTo(9);
        }

        @Test
        void failingNotificationStaysSilent() throws Exception {
            // no project exists, so the engine raises an error that must not be written
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"goxel.list_layers\"}", channel);
            rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":1}", channel);

            channel.awaitOne();
            Thread.sleep(100);
            assertThat(channel.delivered()).hasSize(1);
        }

        @Test
        void objectWithoutMethodIsAnswered() throws Exception {
            rig.send("{\"jsonrpc\":\"2.0\"}", channel);

            assertThat(channel.awaitOne().path("error").path("code").asInt()).isEqualTo(-32600);
        }
    }

    @Nested
    @DisplayName("batches")
    class Batches {

        @Test
        void responsesKeepInputPositionsAndSkipNotifications() throws Exception {
            rig.send("["
                    + "{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":1},"
                    + "{\"jsonrpc\":\"2.0\",\"method\":\"echo\",\"params\":{\"n\":1}},"
                    + "17,"
                    + "{\"jsonrpc\":\"2.0\",\"method\":\"nope\",\"id\":3},"
                    + "{\"jsonrpc\":\"2.0\",\"method\":\"echo\",\"params\":[\"x\"],\"id\":4}"
                    + "]", channel);

            JsonNode batch = channel.awaitOne();
            assertThat(batch.isArray()).isTrue();
            assertThat(batch).hasSize(4);
            assertThat(batch.get(0).path("result").asText()).isEqualTo("pong");
            assertThat(batch.get(1).path("error").path("code").asInt()).isEqualTo(-32600);
            assertThat(batch.get(1).get("id").isNull()).isTrue();
            assertThat(batch.get(2).path("error").path("code").asInt()).isEqualTo(-32601);
            assertThat(batch.get(3).path("result").toString()).isEqualTo("[\"x\"]");
        }

        @Test
        void emptyBatchIsSingleInvalidRequest() throws Exception {
            rig.send("[]", channel);

            JsonNode response = channel.awaitOne();
            assertThat(response.isObject()).isTrue();
            assertThat(response.path("error").path("code").asInt()).isEqualTo(-32600);
        }

        @Test
        void notificationOnlyBatchProducesNothing() throws Exception {
            rig.send("[{\"jsonrpc\":\"2.0\",\"method\":\"ping\"},{\"jsonrpc\":\"2.0\",\"method\":\"echo\"}]", channel);

            Thread.sleep(150);
            assertThat(channel.delivered()).isEmpty();
            assertThat(channel.inFlight()).isZero();
        }

        @Test
        void batchIsWrittenOnce() throws Exception {
            StringBuilder frame = new StringBuilder("[");
            for (int i = 0; i < 20; i++) {
                if (i > 0) {
                    frame.append(',');
                }
                frame.append("{\"jsonrpc\":\"2.0\",\"method\":\"ping\",\"id\":").append(i).append('}');
            }
            rig.send(frame.append(']').toString(), channel);

            List<JsonNode> delivered = channel.await(1, Duration.ofSeconds(5));
            Thread.sleep(100);
            assertThat(channel.delivered()).hasSize(1);
            JsonNode batch = delivered.get(0);
            for (int i = 0; i < 20; i++) {
                assertThat(batch.get(i).path("id").asInt()).isEqualTo(i);
            }
        }
    }

    @Test
    void closedChannelDiscardsResponse() throws Exception {
        channel.close();
        rig.send("{\"jsonrpc\":\"2.0\",\"method\":\"ghost\",\"id\":1}", channel);

        assertThat(channel.delivered()).isEmpty();
        assertThat(rig.stats.responsesDiscarded()).isEqualTo(1);
    }
}
