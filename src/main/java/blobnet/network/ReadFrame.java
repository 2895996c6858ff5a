package blobnet.network;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;

/**
 * Reads one length-prefixed frame (4-byte big-endian length, then payload) from a
 * non-blocking channel across as many reads as it takes.
 */
public class ReadFrame {

    private final int maxFrameBytes;
    private final ByteBuffer headerBuffer = ByteBuffer.allocate(4);
    private ByteBuffer payloadBuffer;

    public ReadFrame(int maxFrameBytes) {
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * @return true if a complete frame has been read, false if more data is needed
     * @throws EOFException if the channel reached end of stream
     */
    public boolean read(ReadableByteChannel channel) throws IOException {
        if (payloadBuffer == null) {
            if (!readHeader(channel)) {
                return false;
            }
        }
        if (payloadBuffer.hasRemaining()) {
            int read = channel.read(payloadBuffer);
            if (read == -1) throw new EOFException();
        }
        return !payloadBuffer.hasRemaining();
    }

    private boolean readHeader(ReadableByteChannel channel) throws IOException {
        int read = channel.read(headerBuffer);
        if (read == -1) throw new EOFException();
        if (headerBuffer.hasRemaining()) return false;

        headerBuffer.flip();
        int payloadLength = headerBuffer.getInt();
        headerBuffer.clear();
        if (payloadLength < 0 || payloadLength > maxFrameBytes) {
            throw new IOException("Invalid frame length: " + payloadLength);
        }
        payloadBuffer = ByteBuffer.allocate(payloadLength);
        return true;
    }

    /**
     * Returns the payload of the completed frame and resets for the next one.
     */
    public byte[] complete() {
        if (payloadBuffer == null || payloadBuffer.hasRemaining()) {
            throw new IllegalStateException("Frame is not complete");
        }
        byte[] payload = payloadBuffer.array();
        payloadBuffer = null;
        return payload;
    }

    public boolean isReadingHeader() {
        return payloadBuffer == null;
    }
}
