package com.signalhub.model;

import java.lang.ref.WeakReference;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * One peer's socket as seen by the hub.
 *
 * Producers (router, presence broadcaster) push encoded frames into a bounded
 * outbound queue; the WebSocket handler drains it via {@link #outbound()}.
 * A full queue means the peer is not keeping up: the frame is refused and the
 * connection is closed instead of blocking the producer.
 *
 * The room back-reference is weak so a dropped connection never keeps an
 * evicted room alive.
 */
public class Connection {

    private static final Logger logger = LoggerFactory.getLogger(Connection.class);

    private final String peerId;
    private final String roomId;

    private final Sinks.Many<String> outboundSink;
    private final Sinks.Empty<Void> closedSink = Sinks.empty();

    private volatile WeakReference<Room> room = new WeakReference<>(null);

    // guarded by this
    private boolean closed;
    private Runnable closeHandler = () -> { };

    public Connection(String peerId, String roomId, int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        this.peerId = peerId;
        this.roomId = roomId;
        this.outboundSink = Sinks.many().unicast().onBackpressureBuffer(new ArrayBlockingQueue<>(queueCapacity));
    }

    /**
     * Enqueue one encoded frame without blocking.
     *
     * @return false if the connection is closed or the queue was full; in the
     *         latter case the connection is closed as unresponsive
     */
    public boolean send(String frame) {
        Sinks.EmitResult result;
        synchronized (this) {
            if (closed) {
                return false;
            }
            result = outboundSink.tryEmitNext(frame);
        }

        if (result.isSuccess()) {
            return true;
        }

        logger.warn("🐢 Outbound queue rejected frame for peer {} in room {} ({}), dropping connection",
                peerId, roomId, result);
        close();
        return false;
    }

    /**
     * Close the outbound queue. Frames already queued are still drained; the
     * close handler (socket teardown) runs once, outside the connection lock.
     */
    public void close() {
        Runnable handler;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            outboundSink.tryEmitComplete();
            closedSink.tryEmitEmpty();
            handler = closeHandler;
        }

        try {
            handler.run();
        } catch (Exception e) {
            logger.error("Close handler failed for peer {}: {}", peerId, e.getMessage());
        }
    }

    /**
     * Register the socket teardown to run on close. Runs immediately if the
     * connection is already closed.
     */
    public void onClose(Runnable handler) {
        boolean runNow;
        synchronized (this) {
            runNow = closed;
            if (!runNow) {
                this.closeHandler = handler;
            }
        }
        if (runNow) {
            handler.run();
        }
    }

    /**
     * Frames in enqueue order. Single subscriber.
     */
    public Flux<String> outbound() {
        return outboundSink.asFlux();
    }

    /**
     * Completes when the connection is closed.
     */
    public Mono<Void> closed() {
        return closedSink.asMono();
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public void bindRoom(Room room) {
        this.room = new WeakReference<>(room);
    }

    public Optional<Room> room() {
        return Optional.ofNullable(room.get());
    }

    public String getPeerId() {
        return peerId;
    }

    public String getRoomId() {
        return roomId;
    }

    @Override
    public String toString() {
        return "Connection{peerId='" + peerId + "', roomId='" + roomId + "'}";
    }
}
