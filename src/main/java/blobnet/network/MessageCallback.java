package blobnet.network;

import blobnet.messaging.Message;

/**
 * Receives messages delivered by a {@link Network} during its {@code tick()}.
 */
public interface MessageCallback {

    void onMessage(Message message);
}
