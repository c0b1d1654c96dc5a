package com.streamchat.room.model;

import com.streamchat.message.model.ChatMessage;
import com.streamchat.message.model.MessageKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Bounded, arrival-ordered message log of one room. Oldest entries are dropped first once the
 * capacity is reached. Not thread-safe: guarded by the room lock.
 */
public class MessageHistory {

    private final int capacity;
    private final Deque<ChatMessage> messages = new ArrayDeque<>();

    public MessageHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("history capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void append(ChatMessage message) {
        messages.addLast(message);
        while (messages.size() > capacity) {
            messages.pollFirst();
        }
    }

    /** Last {@code count} entries, oldest first. */
    public List<ChatMessage> recent(int count) {
        int skip = Math.max(0, messages.size() - count);
        List<ChatMessage> result = new ArrayList<>(Math.min(count, messages.size()));
        Iterator<ChatMessage> it = messages.iterator();
        for (int i = 0; it.hasNext(); i++) {
            ChatMessage message = it.next();
            if (i >= skip) {
                result.add(message);
            }
        }
        return result;
    }

    public Optional<ChatMessage> findById(String messageId) {
        return messages.stream().filter(m -> m.getId().equals(messageId)).findFirst();
    }

    public Optional<ChatMessage> lastMessageBy(String userId, MessageKind kind) {
        Iterator<ChatMessage> it = messages.descendingIterator();
        while (it.hasNext()) {
            ChatMessage message = it.next();
            if (message.isAuthoredBy(userId, kind)) {
                return Optional.of(message);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return messages.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
