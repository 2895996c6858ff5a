package blobnet.messaging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Tracks outstanding requests by key until a response arrives, an error is
 * reported, or the request expires after a number of ticks.
 * <p>
 * Each pending entry is released exactly once: a late response for an expired
 * key is ignored.
 */
public class RequestWaitingList<K, V> {

    private static final Logger log = LoggerFactory.getLogger(RequestWaitingList.class);

    private final Map<K, PendingRequest<V>> pendingRequests = new LinkedHashMap<>();
    private final long expiryTicks;

    public RequestWaitingList(long expiryTicks) {
        if (expiryTicks <= 0) {
            throw new IllegalArgumentException("Expiry ticks must be positive");
        }
        this.expiryTicks = expiryTicks;
    }

    public void add(K key, RequestCallback<V> callback) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        if (callback == null) {
            throw new IllegalArgumentException("Callback cannot be null");
        }
        if (pendingRequests.containsKey(key)) {
            throw new IllegalStateException("Request already pending for key " + key);
        }
        pendingRequests.put(key, new PendingRequest<>(callback));
    }

    /**
     * @return true if a pending request was completed
     */
    public boolean handleResponse(K key, V response, NetworkAddress fromNode) {
        PendingRequest<V> pending = pendingRequests.remove(key);
        if (pending == null) {
            log.debug("No pending request for {}, response ignored", key);
            return false;
        }
        pending.callback.onResponse(response, fromNode);
        return true;
    }

    public boolean handleError(K key, Exception error) {
        PendingRequest<V> pending = pendingRequests.remove(key);
        if (pending == null) {
            return false;
        }
        pending.callback.onError(error);
        return true;
    }

    /**
     * Advances every pending request by one tick and fails the ones whose age has
     * passed the expiry with a {@link TimeoutException}.
     */
    public void tick() {
        List<Map.Entry<K, PendingRequest<V>>> expired = new ArrayList<>();
        for (Map.Entry<K, PendingRequest<V>> entry : pendingRequests.entrySet()) {
            if (++entry.getValue().ageTicks > expiryTicks) {
                expired.add(entry);
            }
        }
        for (Map.Entry<K, PendingRequest<V>> entry : expired) {
            pendingRequests.remove(entry.getKey());
            log.debug("Request {} expired after {} ticks", entry.getKey(), expiryTicks);
            entry.getValue().callback.onError(
                    new TimeoutException("Request " + entry.getKey() + " timed out after " + expiryTicks + " ticks"));
        }
    }

    /**
     * Fails every pending request with {@code error}, for shutdown.
     */
    public void failAll(Exception error) {
        List<PendingRequest<V>> pending = new ArrayList<>(pendingRequests.values());
        pendingRequests.clear();
        pending.forEach(p -> p.callback.onError(error));
    }

    public boolean contains(K key) {
        return pendingRequests.containsKey(key);
    }

    public int size() {
        return pendingRequests.size();
    }

    private static final class PendingRequest<V> {
        private final RequestCallback<V> callback;
        private long ageTicks;

        private PendingRequest(RequestCallback<V> callback) {
            this.callback = callback;
        }
    }
}
