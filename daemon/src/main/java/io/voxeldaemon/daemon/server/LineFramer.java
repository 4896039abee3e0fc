package io.voxeldaemon.daemon.server;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.function.Consumer;

/**
 * Splits a byte stream into newline-terminated frames.
 *
 * <p>
 * A {@code \r} directly before the terminator is stripped and blank lines are
 * skipped. Bytes after the last terminator are kept until the next read. A
 * frame longer than the cap is rejected as soon as the cap is crossed, without
 * waiting for its terminator.
 *
 * <p>
 * Not thread-safe; owned by the I/O thread. Only the cap may be changed from
 * another thread.
 */
public final class LineFramer {

    private static final int INITIAL_CAPACITY = 1024;

    private volatile int maxFrameBytes;
    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int length;

    public LineFramer(int maxFrameBytes) {
        setMaxFrameBytes(maxFrameBytes);
    }

    public void setMaxFrameBytes(int maxFrameBytes) {
        if (maxFrameBytes < 1) {
            throw new IllegalArgumentException("maxFrameBytes must be >= 1, got " + maxFrameBytes);
        }
        this.maxFrameBytes = maxFrameBytes;
    }

    public int maxFrameBytes() {
        return maxFrameBytes;
    }

    /** Bytes of the incomplete frame currently buffered. */
    public int buffered() {
        return length;
    }

    /**
     * Consumes every remaining byte of {@code input}, handing each complete
     * frame to {@code sink} in order.
     *
     * @throws FrameTooLargeException if the frame being assembled exceeds the
     *                                cap; frames completed earlier in the same
     *                                input have already been delivered
     */
    public void feed(ByteBuffer input, Consumer<byte[]> sink) throws FrameTooLargeException {
        int cap = maxFrameBytes;
        while (input.hasRemaining()) {
            byte b = input.get();
            if (b == '\n') {
                emit(sink);
                continue;
            }
            if (length >= cap) {
                length = 0;
                throw new FrameTooLargeException(cap);
            }
            append(b, cap);
        }
    }

    private void emit(Consumer<byte[]> sink) {
        int end = length;
        if (end > 0 && buffer[end - 1] == '\r') {
            end--;
        }
        length = 0;
        if (isBlank(end)) {
            return;
        }
        sink.accept(Arrays.copyOf(buffer, end));
        if (buffer.length > INITIAL_CAPACITY * 64) {
            buffer = new byte[INITIAL_CAPACITY];
        }
    }

    private boolean isBlank(int end) {
        for (int i = 0; i < end; i++) {
            byte b = buffer[i];
            if (b != ' ' && b != '\t' && b != '\r') {
                return false;
            }
        }
        return true;
    }

    private void append(byte b, int cap) {
        if (length == buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.min(buffer.length * 2, cap));
        }
        buffer[length++] = b;
    }
}
