// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy.event;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.custos.proxy.Checkpoint;
import sh.custos.proxy.Journaled;

/**
 * Append-only audit log of a proxy.
 *
 * <p>
 * Events appended during an operation are pending until the operation commits;
 * only then are they handed to listeners. A rolled-back operation removes its
 * events again.
 *
 * @since 0.1.0
 */
public final class ProxyEventLog implements Journaled {

    private static final Logger log = LoggerFactory.getLogger(ProxyEventLog.class);

    private static final ObjectWriter WRITER = new ObjectMapper().writerFor(ProxyEvent.class);

    private final List<ProxyEvent> entries = new ArrayList<>();
    private final List<ProxyEventListener> listeners = new CopyOnWriteArrayList<>();
    private int published;

    public void addListener(final ProxyEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void append(final ProxyEvent event) {
        entries.add(Objects.requireNonNull(event, "event"));
    }

    /**
     * @return every event appended so far, committed ones first, then pending ones
     */
    public List<ProxyEvent> events() {
        return List.copyOf(entries);
    }

    /**
     * @return events that have been published to listeners
     */
    public List<ProxyEvent> committedEvents() {
        return List.copyOf(entries.subList(0, published));
    }

    @Override
    public Checkpoint checkpoint() {
        final int size = entries.size();
        return () -> entries.subList(size, entries.size()).clear();
    }

    @Override
    public void commit() {
        List<ProxyEvent> pending = List.copyOf(entries.subList(published, entries.size()));
        published = entries.size();
        for (ProxyEvent event : pending) {
            if (log.isDebugEnabled()) {
                log.debug("event {}", toJson(event));
            }
            for (ProxyEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.warn("listener {} failed on {}", listener, event, e);
                }
            }
        }
    }

    /**
     * Serializes an event to its JSON form.
     *
     * @param event the event
     * @return the JSON text
     */
    public static String toJson(final ProxyEvent event) {
        try {
            return WRITER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + event.getClass().getSimpleName(), e);
        }
    }
}
