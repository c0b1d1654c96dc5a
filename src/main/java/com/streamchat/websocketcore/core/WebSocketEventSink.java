package com.streamchat.websocketcore.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamchat.event.ChatEvent;
import com.streamchat.websocketcore.model.EventSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes events to one WebSocket session as {@code {"type": ..., "data": ...}} text frames.
 *
 * {@link #deliver} only serializes and enqueues. Frames are written by a single drain task at a
 * time on the outbound executor, so delivery order is kept and the caller (usually holding a
 * room lock) never waits on the network. A receiver whose backlog exceeds the buffer limit, or
 * whose current write has been stuck past the time limit, is closed.
 */
public class WebSocketEventSink implements EventSink {

    private static final Logger logger = LogManager.getLogger(WebSocketEventSink.class);

    private final WebSocketSession session;
    private final ObjectMapper objectMapper;
    private final TaskExecutor outboundExecutor;
    private final long sendTimeLimitMillis;
    private final int sendBufferSizeLimit;

    private final Queue<String> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pendingBytes = new AtomicInteger();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean overflowed = new AtomicBoolean();
    private volatile long sendStartedAt;

    public WebSocketEventSink(
            WebSocketSession session,
            ObjectMapper objectMapper,
            TaskExecutor outboundExecutor,
            long sendTimeLimitMillis,
            int sendBufferSizeLimit) {

        this.session = session;
        this.objectMapper = objectMapper;
        this.outboundExecutor = outboundExecutor;
        this.sendTimeLimitMillis = sendTimeLimitMillis;
        this.sendBufferSizeLimit = sendBufferSizeLimit;
    }

    @Override
    public void deliver(ChatEvent event) {
        if (!session.isOpen() || overflowed.get()) {
            logger.debug("[deliver skipped] session closed: sessionId={}, type={}", session.getId(), event.getType());
            return;
        }
        String frame;
        try {
            frame = toFrame(event);
        } catch (JsonProcessingException e) {
            logger.error("[deliver failed] serialization: type={}, error={}", event.getType(), e.getMessage());
            return;
        }

        if (isSlowReceiver(frame.length())) {
            abandon("receiver too slow: backlog=" + pendingBytes.get() + " bytes");
            return;
        }
        pending.add(frame);
        pendingBytes.addAndGet(frame.length());
        scheduleDrain();
    }

    @Override
    public void close(int code, String reason) {
        pending.clear();
        pendingBytes.set(0);
        try {
            session.close(new CloseStatus(code, reason));
        } catch (IOException e) {
            logger.warn("[close failed] sessionId={}, error={}", session.getId(), e.getMessage());
        }
    }

    int getPendingFrameCount() {
        return pending.size();
    }

    String toFrame(ChatEvent event) throws JsonProcessingException {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", event.getType());
        frame.put("data", event);
        return objectMapper.writeValueAsString(frame);
    }

    private boolean isSlowReceiver(int nextFrameLength) {
        if (pendingBytes.get() + nextFrameLength > sendBufferSizeLimit) {
            return true;
        }
        long startedAt = sendStartedAt;
        return startedAt > 0 && System.currentTimeMillis() - startedAt > sendTimeLimitMillis;
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            outboundExecutor.execute(this::drain);
        } catch (TaskRejectedException e) {
            draining.set(false);
            abandon("outbound executor rejected drain: " + e.getMessage());
        }
    }

    private void drain() {
        try {
            String frame;
            while ((frame = pending.poll()) != null) {
                pendingBytes.addAndGet(-frame.length());
                if (!session.isOpen()) {
                    pending.clear();
                    pendingBytes.set(0);
                    return;
                }
                sendStartedAt = System.currentTimeMillis();
                try {
                    session.sendMessage(new TextMessage(frame));
                } catch (IOException | RuntimeException e) {
                    logger.warn("[deliver failed] sessionId={}, error={}", session.getId(), e.getMessage());
                } finally {
                    sendStartedAt = 0;
                }
            }
        } finally {
            draining.set(false);
        }
        // a frame enqueued after the last poll but before the flag was cleared
        if (!pending.isEmpty()) {
            scheduleDrain();
        }
    }

    private void abandon(String cause) {
        if (!overflowed.compareAndSet(false, true)) {
            return;
        }
        logger.warn("[deliver abandoned] sessionId={}, cause={}", session.getId(), cause);
        close(CloseStatus.SESSION_NOT_RELIABLE.getCode(), "send buffer overflow");
    }
}
