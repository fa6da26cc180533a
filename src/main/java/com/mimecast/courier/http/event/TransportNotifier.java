package com.mimecast.courier.http.event;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Dispatches lifecycle events to registered listeners.
 *
 * <p>Listeners are called in registration order.
 * <br>A listener that throws is logged and the remaining listeners are still called.
 */
public class TransportNotifier {
    private static final Logger log = LogManager.getLogger(TransportNotifier.class);

    private final List<TransportListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers listener.
     *
     * @param listener TransportListener instance.
     */
    public void add(TransportListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes listener.
     *
     * @param listener TransportListener instance.
     * @return Boolean, true if it was registered.
     */
    public boolean remove(TransportListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Gets registered listener count.
     *
     * @return Integer.
     */
    public int size() {
        return listeners.size();
    }

    public void request(TransportRequestEvent event) {
        dispatch("request", listener -> listener.onRequest(event));
    }

    public void response(TransportResponseEvent event) {
        dispatch("response", listener -> listener.onResponse(event));
    }

    public void success(TransportEvent event) {
        dispatch("success", listener -> listener.onSuccess(event));
    }

    public void fail(TransportFailEvent event) {
        dispatch("fail", listener -> listener.onFail(event));
    }

    /**
     * Calls every listener.
     *
     * @param name   Event name for logging.
     * @param action Listener call.
     */
    private void dispatch(String name, Consumer<TransportListener> action) {
        for (TransportListener listener : listeners) {
            try {
                action.accept(listener);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on {} event: {}", listener.getClass().getName(), name, e.getMessage(), e);
            }
        }
    }
}
