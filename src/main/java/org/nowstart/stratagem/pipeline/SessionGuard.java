package org.nowstart.stratagem.pipeline;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.nowstart.stratagem.data.exception.ConcurrencyConflictException;

/**
 * In-flight marker per session. At most one start, resume, recover, cancel or cleanup runs per session at a time.
 * A cancel request is stored on the marker itself, so it is discarded together with the marker on release.
 */
public class SessionGuard {

    private final ConcurrentMap<String, Flight> inFlight = new ConcurrentHashMap<>();

    public void acquire(String sessionId) {
        if (!tryAcquire(sessionId)) {
            throw new ConcurrencyConflictException(sessionId);
        }
    }

    public boolean tryAcquire(String sessionId) {
        return inFlight.putIfAbsent(sessionId, new Flight()) == null;
    }

    public void release(String sessionId) {
        inFlight.remove(sessionId);
    }

    /**
     * Flags the run currently holding the session.
     *
     * @return false when no run holds the session
     */
    public boolean requestCancel(String sessionId) {
        return inFlight.computeIfPresent(sessionId, (id, flight) -> flight.cancel()) != null;
    }

    public boolean isCancelRequested(String sessionId) {
        Flight flight = inFlight.get(sessionId);
        return flight != null && flight.cancelRequested;
    }

    private static final class Flight {

        private volatile boolean cancelRequested;

        private Flight cancel() {
            cancelRequested = true;
            return this;
        }
    }
}
