package io.voxeldaemon.daemon.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/** Blocking line-oriented client for integration tests. A reader thread collects response lines. */
final class RpcTestClient implements AutoCloseable {

    static final Duration DEFAULT_WAIT = Duration.ofSeconds(5);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SocketChannel channel;
    private final BlockingQueue<String> lines = new LinkedBlockingQueue<>();
    private final Thread reader;
    private volatile boolean closedByPeer;

    private RpcTestClient(SocketChannel channel) {
        this.channel = channel;
        this.reader = new Thread(this::readLoop, "rpc-test-client-reader");
        reader.setDaemon(true);
        reader.start();
    }

    static RpcTestClient connect(Path socket) throws IOException {
        return new RpcTestClient(SocketChannel.open(UnixDomainSocketAddress.of(socket)));
    }

    static String request(String method, String params, Object id) {
        String idJson = id instanceof String s ? "\"" + s + "\"" : String.valueOf(id);
        return "{\"jsonrpc\":\"2.0\",\"method\":\"" + method + "\""
                + (params == null ? "" : ",\"params\":" + params) + ",\"id\":" + idJson + "}";
    }

    static String notification(String method, String params) {
        return "{\"jsonrpc\":\"2.0\",\"method\":\"" + method + "\""
                + (params == null ? "" : ",\"params\":" + params) + "}";
    }

    void send(String line) throws IOException {
        write((line + "\n").getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Writes raw bytes.
     *
     * @return {@code false} if the daemon closed the connection during the write
     */
    boolean sendRaw(byte[] bytes) {
        try {
            write(bytes);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    private void write(byte[] bytes) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    /** Sends a request and returns the next response line. */
    JsonNode call(String method, String params, int id) throws Exception {
        send(request(method, params, id));
        return next();
    }

    JsonNode next() throws Exception {
        JsonNode node = next(DEFAULT_WAIT);
        if (node == null) {
            throw new AssertionError("No response within " + DEFAULT_WAIT.toMillis() + " ms");
        }
        return node;
    }

    /** The next response, or {@code null} if none arrives within {@code wait}. */
    JsonNode next(Duration wait) throws Exception {
        String line = lines.poll(wait.toMillis(), TimeUnit.MILLISECONDS);
        return line == null ? null : MAPPER.readTree(line);
    }

    List<JsonNode> next(int count) throws Exception {
        List<JsonNode> responses = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            responses.add(next());
        }
        return responses;
    }

    /** Waits for the daemon to close the connection. */
    boolean awaitClosedByPeer(Duration wait) throws InterruptedException {
        reader.join(wait.toMillis());
        return closedByPeer;
    }

    private void readLoop() {
        ByteBuffer buffer = ByteBuffer.allocate(8192);
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        try {
            while (channel.read(buffer) >= 0) {
                buffer.flip();
                while (buffer.hasRemaining()) {
                    byte b = buffer.get();
                    if (b == '\n') {
                        lines.add(line.toString(StandardCharsets.UTF_8));
                        line.reset();
                    } else {
                        line.write(b);
                    }
                }
                buffer.clear();
            }
            closedByPeer = true;
        } catch (IOException e) {
            closedByPeer = channel.isOpen();
        }
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
