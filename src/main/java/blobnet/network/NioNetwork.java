package blobnet.network;

import blobnet.messaging.Message;
import blobnet.messaging.MessageCodec;
import blobnet.messaging.NetworkAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Queue;

/**
 * TCP transport over a single NIO {@link Selector}, driven by {@link #tick()}.
 * <p>
 * One connection per direction: {@link #send(Message)} always writes on an
 * outbound connection to the destination (created on first use), and accepted
 * inbound connections are only read from. Responses therefore travel on the
 * responder's own outbound connection to the requester's listen address.
 * <p>
 * Each frame is a 4-byte length prefix followed by the encoded {@link Message}.
 * A failed connection is closed and its queued frames are lost; callers rely on
 * request timeouts.
 */
public class NioNetwork implements Network {

    private static final Logger log = LoggerFactory.getLogger(NioNetwork.class);

    private final MessageCodec codec;
    private final NetworkConfig config;
    private final Selector selector;

    private final Map<NetworkAddress, ServerSocketChannel> serverChannels = new HashMap<>();
    private final Map<NetworkAddress, NioConnection> outboundConnections = new HashMap<>();
    private final Queue<Message> inboundMessages = new ArrayDeque<>();
    private MessageCallback messageCallback;

    public NioNetwork(MessageCodec codec, NetworkConfig config) {
        this.codec = codec;
        this.config = config;
        try {
            this.selector = Selector.open();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create NIO selector", e);
        }
    }

    @Override
    public NetworkAddress bind(NetworkAddress address) {
        if (address == null) {
            throw new IllegalArgumentException("Address cannot be null");
        }
        try {
            ServerSocketChannel serverChannel = ServerSocketChannel.open();
            serverChannel.configureBlocking(false);
            serverChannel.bind(new InetSocketAddress(address.ipAddress(), address.port()));
            serverChannel.register(selector, SelectionKey.OP_ACCEPT);
            int port = ((InetSocketAddress) serverChannel.getLocalAddress()).getPort();
            NetworkAddress bound = new NetworkAddress(address.ipAddress(), port);
            serverChannels.put(bound, serverChannel);
            log.info("Listening on {}", bound);
            return bound;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind to address: " + address, e);
        }
    }

    @Override
    public void send(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        if (serverChannels.containsKey(message.destination())) {
            inboundMessages.add(message);
            return;
        }
        byte[] frame = codec.encode(message);
        if (frame.length > config.maxFrameBytes()) {
            throw new IllegalArgumentException("Frame of " + frame.length + " bytes to " + message.destination()
                    + " exceeds limit of " + config.maxFrameBytes());
        }
        try {
            NioConnection connection = outboundConnections.get(message.destination());
            if (connection == null || !connection.isOpen()) {
                connection = NioConnection.forOutbound(selector, message.destination(), config.maxFrameBytes());
                outboundConnections.put(message.destination(), connection);
                log.debug("Opening connection to {}", message.destination());
            }
            connection.enqueue(frame);
        } catch (IOException e) {
            log.warn("Cannot connect to {}, dropping {}: {}", message.destination(), message, e.getMessage());
        }
    }

    @Override
    public void tick() {
        if (!selector.isOpen()) {
            return;
        }
        try {
            selector.selectNow();
        } catch (IOException e) {
            throw new IllegalStateException("Error in network tick", e);
        }
        Iterator<SelectionKey> keys = selector.selectedKeys().iterator();
        while (keys.hasNext()) {
            SelectionKey key = keys.next();
            keys.remove();
            try {
                if (!key.isValid()) {
                    continue;
                }
                if (key.isAcceptable()) {
                    handleAccept(key);
                } else if (key.isConnectable()) {
                    ((NioConnection) key.attachment()).finishConnect();
                } else if (key.isReadable()) {
                    handleRead(key);
                } else if (key.isWritable()) {
                    ((NioConnection) key.attachment()).flush();
                }
            } catch (IOException e) {
                closeFailed(key, e);
            }
        }
        deliverInbound();
    }

    private void handleAccept(SelectionKey key) throws IOException {
        SocketChannel accepted = ((ServerSocketChannel) key.channel()).accept();
        if (accepted != null) {
            NioConnection connection = NioConnection.forInbound(selector, accepted, config.maxFrameBytes());
            log.debug("Accepted connection from {}", connection.getRemoteAddress());
        }
    }

    private void handleRead(SelectionKey key) throws IOException {
        NioConnection connection = (NioConnection) key.attachment();
        for (byte[] frame : connection.readFrames()) {
            try {
                inboundMessages.add(codec.decode(frame));
            } catch (RuntimeException e) {
                log.warn("Discarding undecodable frame from {}", connection.getRemoteAddress(), e);
            }
        }
    }

    private void closeFailed(SelectionKey key, IOException cause) {
        Object attachment = key.attachment();
        if (attachment instanceof NioConnection connection) {
            log.debug("Closing {}: {}", connection, cause.toString());
            if (connection.getConnectionType() == NioConnection.ConnectionType.OUTBOUND) {
                outboundConnections.remove(connection.getRemoteAddress(), connection);
            }
            try {
                connection.close();
            } catch (IOException e) {
                log.warn("Error closing {}", connection, e);
            }
        } else {
            key.cancel();
            log.warn("Selector key failed", cause);
        }
    }

    private void deliverInbound() {
        int delivered = 0;
        Message message;
        while (delivered < config.maxInboundPerTick() && (message = inboundMessages.poll()) != null) {
            delivered++;
            if (messageCallback == null) {
                log.warn("No message callback registered, dropping {}", message);
                continue;
            }
            try {
                messageCallback.onMessage(message);
            } catch (RuntimeException e) {
                log.error("Error in message callback for {}", message, e);
            }
        }
    }

    @Override
    public void registerMessageHandler(MessageCallback callback) {
        this.messageCallback = callback;
    }

    @Override
    public void close() {
        for (SelectionKey key : selector.keys()) {
            try {
                key.channel().close();
            } catch (IOException e) {
                log.warn("Error closing channel {}", key.channel(), e);
            }
        }
        serverChannels.clear();
        outboundConnections.clear();
        try {
            selector.close();
        } catch (IOException e) {
            log.warn("Error closing selector", e);
        }
    }
}
