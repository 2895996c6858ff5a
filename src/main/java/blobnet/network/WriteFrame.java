package blobnet.network;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;

/**
 * A length-prefixed frame being written, possibly over several writes.
 */
public class WriteFrame {

    private final ByteBuffer buffer;

    public WriteFrame(byte[] payload) {
        buffer = ByteBuffer.allocate(4 + payload.length);
        buffer.putInt(payload.length);
        buffer.put(payload);
        buffer.flip();
    }

    /**
     * @return true once the whole frame has been written
     */
    public boolean write(WritableByteChannel channel) throws IOException {
        channel.write(buffer);
        return !buffer.hasRemaining();
    }

    public int remaining() {
        return buffer.remaining();
    }
}
