package blobnet.network;

import blobnet.messaging.NetworkAddress;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;

/**
 * One direction of a TCP link. Outbound connections only write frames, inbound
 * connections only read them.
 */
public class NioConnection {

    public enum ConnectionType {
        INBOUND,
        OUTBOUND
    }

    private final NetworkAddress remoteAddress;
    private final SocketChannel channel;
    private final ConnectionType connectionType;
    private final ReadFrame readFrame;
    private final Queue<WriteFrame> outgoingFrames = new ArrayDeque<>();
    private SelectionKey key;

    private NioConnection(NetworkAddress remoteAddress, SocketChannel channel, ConnectionType connectionType, int maxFrameBytes) {
        this.remoteAddress = remoteAddress;
        this.channel = channel;
        this.connectionType = connectionType;
        this.readFrame = new ReadFrame(maxFrameBytes);
    }

    /**
     * Starts a non-blocking connect to {@code destination}.
     */
    public static NioConnection forOutbound(Selector selector, NetworkAddress destination, int maxFrameBytes) throws IOException {
        SocketChannel channel = SocketChannel.open();
        try {
            channel.configureBlocking(false);
            NioConnection connection = new NioConnection(destination, channel, ConnectionType.OUTBOUND, maxFrameBytes);
            boolean connected = channel.connect(new InetSocketAddress(destination.ipAddress(), destination.port()));
            connection.key = channel.register(selector, connected ? 0 : SelectionKey.OP_CONNECT, connection);
            return connection;
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }

    public static NioConnection forInbound(Selector selector, SocketChannel accepted, int maxFrameBytes) throws IOException {
        accepted.configureBlocking(false);
        NetworkAddress remote = NetworkAddress.from((InetSocketAddress) accepted.getRemoteAddress());
        NioConnection connection = new NioConnection(remote, accepted, ConnectionType.INBOUND, maxFrameBytes);
        connection.key = accepted.register(selector, SelectionKey.OP_READ, connection);
        return connection;
    }

    public void finishConnect() throws IOException {
        if (channel.finishConnect()) {
            updateInterest();
        }
    }

    public void enqueue(byte[] payload) {
        outgoingFrames.add(new WriteFrame(payload));
        updateInterest();
    }

    /**
     * Writes as many queued frames as the socket accepts.
     */
    public void flush() throws IOException {
        WriteFrame frame;
        while ((frame = outgoingFrames.peek()) != null) {
            if (!frame.write(channel)) {
                break;
            }
            outgoingFrames.poll();
        }
        updateInterest();
    }

    /**
     * Reads every complete frame currently available.
     */
    public List<byte[]> readFrames() throws IOException {
        List<byte[]> frames = new ArrayList<>();
        while (readFrame.read(channel)) {
            frames.add(readFrame.complete());
        }
        return frames;
    }

    private void updateInterest() {
        if (key == null || !key.isValid() || connectionType == ConnectionType.INBOUND) {
            return;
        }
        if (!channel.isConnected()) {
            return;
        }
        key.interestOps(outgoingFrames.isEmpty() ? 0 : SelectionKey.OP_WRITE);
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    public NetworkAddress getRemoteAddress() {
        return remoteAddress;
    }

    public ConnectionType getConnectionType() {
        return connectionType;
    }

    public int getOutgoingFrameCount() {
        return outgoingFrames.size();
    }

    public void close() throws IOException {
        if (key != null) {
            key.cancel();
        }
        outgoingFrames.clear();
        channel.close();
    }

    @Override
    public String toString() {
        return "NioConnection{" + connectionType + " " + remoteAddress + ", queued=" + outgoingFrames.size() + "}";
    }
}
