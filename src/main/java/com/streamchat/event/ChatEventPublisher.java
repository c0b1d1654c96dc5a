package com.streamchat.event;

/**
 * @interface ChatEventPublisher
 * @brief Transport seam of the chat engine. The room services only ever talk to connections
 *        through this interface.
 *
 * Room services call subscribe/unsubscribe and broadcast while holding the room lock, so the
 * order of events within one room is the order in which the room applied them. Delivery is
 * fire-and-forget: an implementation must never block on a slow or dead receiver.
 */
public interface ChatEventPublisher {

    void subscribe(String roomId, String userId);

    void unsubscribe(String roomId, String userId);

    void broadcast(String roomId, ChatEvent event);

    void broadcastExcept(String roomId, String excludedUserId, ChatEvent event);

    void sendToUser(String userId, ChatEvent event);
}
