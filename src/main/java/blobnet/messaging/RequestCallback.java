package blobnet.messaging;

/**
 * Receives the outcome of a request tracked by {@link RequestWaitingList}.
 * Exactly one of the two methods is called.
 */
public interface RequestCallback<T> {

    void onResponse(T response, NetworkAddress fromNode);

    void onError(Exception error);
}
