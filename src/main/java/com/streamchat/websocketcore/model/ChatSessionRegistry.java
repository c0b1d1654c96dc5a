package com.streamchat.websocketcore.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * @class ChatSessionRegistry
 * @brief Connection bookkeeping of the WebSocket layer.
 *
 * - connections: connection id → connection
 * - userConnections: user id → its single live connection (a newer register displaces the older)
 * - roomSubscribers / userRooms: which users receive which room's broadcasts
 *
 * Subscriptions of one room are only changed by room services holding that room's lock, so
 * the two subscription maps agree per room even though they are updated one after the other.
 */
@Component
public class ChatSessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ChatSessionRegistry.class);

    private final Map<String, ChatConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, ChatConnection> userConnections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> roomSubscribers = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> userRooms = new ConcurrentHashMap<>();

    // =========================================================================
    // connections
    // =========================================================================

    public void addConnection(ChatConnection connection) {
        connections.put(connection.getId(), connection);
    }

    public Optional<ChatConnection> getConnection(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Optional<ChatConnection> removeConnection(String connectionId) {
        return Optional.ofNullable(connections.remove(connectionId));
    }

    public int getConnectionCount() {
        return connections.size();
    }

    // =========================================================================
    // user bindings
    // =========================================================================

    /**
     * Binds {@code userId} to {@code connection}.
     * @return the connection previously bound to the same user, if it was a different one
     */
    public Optional<ChatConnection> bindUser(String userId, ChatConnection connection) {
        ChatConnection previous = userConnections.put(userId, connection);
        if (previous != null && previous != connection) {
            logger.info("[duplicate session] userId={}, previous={}, current={}", userId, previous.getId(), connection.getId());
            return Optional.of(previous);
        }
        return Optional.empty();
    }

    /**
     * Unbinds the connection's user, but only if the connection is still the one bound.
     * @return false when a newer connection has taken the user over
     */
    public boolean releaseUser(ChatConnection connection) {
        String userId = connection.getUserId();
        return userId != null && userConnections.remove(userId, connection);
    }

    public Optional<ChatConnection> connectionOf(String userId) {
        return Optional.ofNullable(userConnections.get(userId));
    }

    // =========================================================================
    // room subscriptions
    // =========================================================================

    public void subscribe(String roomId, String userId) {
        roomSubscribers.computeIfAbsent(roomId, k -> ConcurrentHashMap.newKeySet()).add(userId);
        userRooms.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(roomId);
    }

    public void unsubscribe(String roomId, String userId) {
        roomSubscribers.computeIfPresent(roomId, (k, users) -> {
            users.remove(userId);
            return users.isEmpty() ? null : users;
        });
        userRooms.computeIfPresent(userId, (k, rooms) -> {
            rooms.remove(roomId);
            return rooms.isEmpty() ? null : rooms;
        });
    }

    /** Snapshot, safe to iterate while subscriptions change. */
    public Set<String> subscribersOf(String roomId) {
        Set<String> users = roomSubscribers.get(roomId);
        return users == null ? Set.of() : Set.copyOf(users);
    }

    /** Snapshot, safe to iterate while subscriptions change. */
    public Set<String> roomsOf(String userId) {
        Set<String> rooms = userRooms.get(userId);
        return rooms == null ? Set.of() : Set.copyOf(rooms);
    }
}
