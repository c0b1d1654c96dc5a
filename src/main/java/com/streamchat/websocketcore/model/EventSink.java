package com.streamchat.websocketcore.model;

import com.streamchat.event.ChatEvent;

/**
 * Outbound side of one client connection. Implementations never throw from {@link #deliver}
 * and never block the caller on a slow receiver.
 */
public interface EventSink {

    void deliver(ChatEvent event);

    void close(int code, String reason);
}
