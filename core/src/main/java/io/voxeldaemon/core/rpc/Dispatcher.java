package io.voxeldaemon.core.rpc;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.voxeldaemon.core.error.ErrorCode;
import io.voxeldaemon.core.error.RpcException;
import io.voxeldaemon.core.error.ServerBusyException;
import io.voxeldaemon.core.error.ShuttingDownException;
import io.voxeldaemon.core.registry.MethodRegistry;
import io.voxeldaemon.core.registry.Params;
import io.voxeldaemon.core.registry.RegisteredMethod;
import io.voxeldaemon.core.stats.DaemonStats;
import io.voxeldaemon.core.worker.Job;
import io.voxeldaemon.core.worker.JobSink;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns complete frames into jobs.
 *
 * <p>
 * Runs on the I/O thread, in frame arrival order, so response sequence
 * numbers are reserved in the order requests arrived. Everything that can be
 * answered without touching the engine (parse errors, envelope violations,
 * unknown methods, invalid params, rejection by the pool) is answered here;
 * the rest is handed to the {@link JobSink}.
 */
public final class Dispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    private static final ObjectReader READER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .reader();

    private final MethodRegistry registry;
    private final JobSink sink;
    private final DaemonStats stats;

    public Dispatcher(MethodRegistry registry, JobSink sink, DaemonStats stats) {
        this.registry = registry;
        this.sink = sink;
        this.stats = stats;
    }

    public MethodRegistry registry() {
        return registry;
    }

    /**
     * Dispatches one frame received on {@code channel}.
     *
     * @param frame UTF-8 JSON text without the line terminator
     */
    public void dispatch(byte[] frame, ReplyChannel channel) {
        JsonNode root;
        try {
            root = READER.readTree(frame);
        } catch (IOException e) {
            LOG.debug("Unparseable frame on {}: {}", channel.id(), e.getMessage());
            root = null;
        }
        if (root == null || root.isMissingNode()) {
            stats.dispatchError(ErrorCode.PARSE_ERROR);
            reply(new SingleReply(channel), RpcResponses.error(NullNode.getInstance(), ErrorCode.PARSE_ERROR));
            return;
        }
        if (root.isArray()) {
            dispatchBatch((ArrayNode) root, channel);
        } else {
            dispatchSingle(root, channel);
        }
    }

    private void dispatchSingle(JsonNode node, ReplyChannel channel) {
        Envelope envelope = EnvelopeParser.parse(node);
        if (!envelope.isValid()) {
            stats.dispatchError(ErrorCode.INVALID_REQUEST);
            if (envelope.silent()) {
                LOG.warn("Dropped invalid notification on {}: {}", channel.id(), envelope.error().getMessage());
                return;
            }
            reply(new SingleReply(channel), RpcResponses.error(envelope.errorId(), envelope.error()));
            return;
        }
        RpcRequest request = envelope.request();
        ResponseSlot slot = request.isNotification() ? ResponseSlot.SILENT : new SingleReply(channel);
        submit(request, slot, channel);
    }

    private void dispatchBatch(ArrayNode batch, ReplyChannel channel) {
        stats.batchReceived();
        if (batch.isEmpty()) {
            stats.dispatchError(ErrorCode.INVALID_REQUEST);
            reply(new SingleReply(channel),
                    RpcResponses.error(NullNode.getInstance(), ErrorCode.INVALID_REQUEST, "Invalid Request: empty batch"));
            return;
        }
        List<Envelope> envelopes = new ArrayList<>(batch.size());
        int responding = 0;
        for (JsonNode element : batch) {
            Envelope envelope = EnvelopeParser.parse(element);
            envelopes.add(envelope);
            if (envelope.expectsResponse()) {
                responding++;
            }
        }

        BatchReply reply = responding == 0 ? null : new BatchReply(channel, responding);
        int position = 0;
        for (Envelope envelope : envelopes) {
            if (!envelope.isValid()) {
                stats.dispatchError(ErrorCode.INVALID_REQUEST);
                if (envelope.silent()) {
                    LOG.warn("Dropped invalid notification in batch on {}: {}", channel.id(),
                            envelope.error().getMessage());
                } else {
                    reply(reply.slot(position++), RpcResponses.error(envelope.errorId(), envelope.error()));
                }
                continue;
            }
            RpcRequest request = envelope.request();
            ResponseSlot slot = request.isNotification() ? ResponseSlot.SILENT : reply.slot(position++);
            submit(request, slot, channel);
        }
    }

    private void submit(RpcRequest request, ResponseSlot slot, ReplyChannel channel) {
        if (request.isNotification()) {
            stats.notificationReceived();
        } else {
            stats.requestReceived();
        }
        try {
            RegisteredMethod method = registry.resolve(request.method());
            Params params = method.bind(request.params());
            sink.submit(new Job(method, params, request.id(), registry, slot, channel));
        } catch (RpcException e) {
            if (!(e instanceof ServerBusyException) && !(e instanceof ShuttingDownException)) {
                stats.dispatchError(e.errorCode());
            }
            if (request.isNotification()) {
                LOG.warn("Notification {} on {} not executed: {} {}", request.method(), channel.id(), e.code(),
                        e.getMessage());
            } else {
                reply(slot, RpcResponses.error(request.id(), e));
            }
        }
    }

    private void reply(ResponseSlot slot, JsonNode response) {
        if (slot.fill(response) == Delivery.DISCARDED) {
            stats.responseDiscarded();
        }
    }
}
