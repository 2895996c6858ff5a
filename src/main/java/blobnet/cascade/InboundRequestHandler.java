package blobnet.cascade;

import blobnet.client.NetworkClient;
import blobnet.error.ArtifactException;
import blobnet.overlay.InboundEvent;
import blobnet.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Answers artifact requests from other peers out of the local store, on its own
 * worker thread so that disk reads never run on the engine thread.
 */
public class InboundRequestHandler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InboundRequestHandler.class);

    private final BlockingQueue<InboundEvent> events;
    private final ArtifactStore store;
    private final NetworkClient client;
    private volatile boolean running;
    private Thread worker;

    public InboundRequestHandler(BlockingQueue<InboundEvent> events, ArtifactStore store, NetworkClient client) {
        this.events = events;
        this.store = store;
        this.client = client;
    }

    public void start() {
        running = true;
        worker = new Thread(this::run, "inbound-requests");
        worker.setDaemon(true);
        worker.start();
    }

    private void run() {
        while (running) {
            InboundEvent event;
            try {
                event = events.poll(100, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event != null) {
                handle(event);
            }
        }
    }

    public void handle(InboundEvent event) {
        if (!(event instanceof InboundEvent.ArtifactRequested requested)) {
            return;
        }
        byte[] content = null;
        if (store.contains(requested.hash())) {
            try {
                content = store.get(requested.hash());
            } catch (ArtifactException e) {
                log.warn("Cannot read {} for peer {}: {}", requested.hash(), requested.requester().shortId(), e.getMessage());
            }
        }
        if (content != null) {
            log.debug("Serving {} to {}", requested.hash(), requested.requester().shortId());
            client.respondArtifact(requested.channel(), content)
                    .onFailure(e -> log.warn("Response for {} not sent: {}", requested.hash(), e.getMessage()));
        } else {
            client.respondNotFound(requested.channel())
                    .onFailure(e -> log.warn("Not-found for {} not sent: {}", requested.hash(), e.getMessage()));
        }
    }

    @Override
    public void close() {
        running = false;
        if (worker != null) {
            worker.interrupt();
            try {
                worker.join(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
