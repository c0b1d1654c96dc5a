package com.streamchat.websocketcore.service;

import com.streamchat.auth.model.StreamIdentity;
import com.streamchat.auth.service.ChatRoleResolver;
import com.streamchat.event.ChatEvent;
import com.streamchat.exception.ChatForbiddenException;
import com.streamchat.exception.InvalidChatRequestException;
import com.streamchat.exception.NotRegisteredException;
import com.streamchat.member.model.UserIdentity;
import com.streamchat.member.service.MembershipService;
import com.streamchat.message.model.ChatMessage;
import com.streamchat.message.service.MessageAdmissionService;
import com.streamchat.moderation.model.ModerationCommand;
import com.streamchat.moderation.service.ModerationService;
import com.streamchat.room.model.RoomState;
import com.streamchat.room.service.RoomRegistry;
import com.streamchat.websocketcore.model.ChatConnection;
import com.streamchat.websocketcore.model.ChatSessionRegistry;
import com.streamchat.websocketcore.model.EventSink;
import com.streamchat.websocketcore.model.JoinRoomRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * ChatConnectionService
 * ──────────────────────────────────────────────────────────────
 * Per-connection lifecycle on top of the room services.
 * - open / register: binds a user id to the connection, displacing an older connection of
 *   the same user (closed with 3000 "duplicate session")
 * - join / send / moderate / leave: resolve the caller from the connection, then delegate
 * - disconnect: leaves every room of the user, unless a newer connection has taken it over
 */
@Service
public class ChatConnectionService {

    private static final Logger logger = LoggerFactory.getLogger(ChatConnectionService.class);

    public static final int DUPLICATE_SESSION_CLOSE_CODE = 3000;
    public static final String DUPLICATE_SESSION_REASON = "duplicate session";

    private final ChatSessionRegistry chatSessionRegistry;
    private final RoomRegistry roomRegistry;
    private final MembershipService membershipService;
    private final MessageAdmissionService messageAdmissionService;
    private final ModerationService moderationService;
    private final ChatRoleResolver chatRoleResolver;

    public ChatConnectionService(
            ChatSessionRegistry chatSessionRegistry,
            RoomRegistry roomRegistry,
            MembershipService membershipService,
            MessageAdmissionService messageAdmissionService,
            ModerationService moderationService,
            ChatRoleResolver chatRoleResolver) {

        this.chatSessionRegistry = chatSessionRegistry;
        this.roomRegistry = roomRegistry;
        this.membershipService = membershipService;
        this.messageAdmissionService = messageAdmissionService;
        this.moderationService = moderationService;
        this.chatRoleResolver = chatRoleResolver;
    }

    public ChatConnection open(String connectionId, EventSink sink, StreamIdentity identity) {
        ChatConnection connection = new ChatConnection(connectionId, sink, identity);
        chatSessionRegistry.addConnection(connection);
        logger.info("[connection opened] {}", connection);
        return connection;
    }

    public Optional<ChatConnection> find(String connectionId) {
        return chatSessionRegistry.getConnection(connectionId);
    }

    /**
     * @method register
     * @brief An authenticated connection always registers as its token's user. An anonymous one
     *        may name its own user id, unless that id is held by an authenticated connection.
     */
    public void register(ChatConnection connection, String requestedUserId, String username, String displayName) {
        StreamIdentity identity = connection.getVerifiedIdentity();

        String userId;
        if (identity != null) {
            userId = identity.getUserId();
            if (isBlank(username)) {
                username = identity.getUsername();
            }
        } else if (!isBlank(requestedUserId)) {
            userId = requestedUserId;
            boolean heldByVerified = chatSessionRegistry.connectionOf(userId)
                    .filter(ChatConnection::isAuthenticated)
                    .isPresent();
            if (heldByVerified) {
                throw new ChatForbiddenException("User id is already in use");
            }
        } else if (connection.isRegistered()) {
            // re-register without an id keeps the one already bound
            userId = connection.getUserId();
        } else {
            userId = UUID.randomUUID().toString();
        }

        if (isBlank(username)) {
            throw new InvalidChatRequestException("Username is required");
        }
        if (connection.isRegistered() && !connection.getUserId().equals(userId)) {
            throw new InvalidChatRequestException("Connection is already registered as another user");
        }

        String resolvedDisplayName = isBlank(displayName) ? username : displayName;
        connection.bindIdentity(userId, username, resolvedDisplayName);

        chatSessionRegistry.bindUser(userId, connection).ifPresent(previous ->
                previous.close(DUPLICATE_SESSION_CLOSE_CODE, DUPLICATE_SESSION_REASON));

        connection.deliver(new ChatEvent.Registered(userId, username, resolvedDisplayName));
        logger.info("[registered] connectionId={}, userId={}, username={}, authenticated={}",
                connection.getId(), userId, username, connection.isAuthenticated());
    }

    public MembershipService.JoinResult join(ChatConnection connection, JoinRoomRequest request) {
        requireRegistered(connection);

        RoomState room;
        if (!isBlank(request.getStreamKey())) {
            room = roomRegistry.getOrCreateByStreamKey(request.getStreamKey());
        } else if (!isBlank(request.getRoomId())) {
            room = roomRegistry.getOrCreate(request.getRoomId());
        } else {
            throw new InvalidChatRequestException("Room ID or stream key is required");
        }

        String userId = connection.getUserId();
        Set<String> roles = room.withLock(() -> chatRoleResolver.resolve(
                room.getRoom(), userId, connection.getVerifiedIdentity(), request.getRoles()));

        String username = !isBlank(request.getUsername()) ? request.getUsername() : connection.getUsername();
        String displayName = !isBlank(request.getDisplayName())
                ? request.getDisplayName()
                : (!isBlank(request.getUsername()) ? request.getUsername() : connection.getDisplayName());

        UserIdentity identity = UserIdentity.builder()
                .userId(userId)
                .username(username)
                .displayName(displayName)
                .roles(roles)
                .color(request.getColor())
                .build();

        return membershipService.join(room, identity);
    }

    public ChatMessage sendMessage(ChatConnection connection, String roomId, String body, String replyToId) {
        requireRegistered(connection);
        return messageAdmissionService.submit(roomId, connection.getUserId(), body, replyToId);
    }

    public void moderate(ChatConnection connection, String roomId, ModerationCommand command) {
        requireRegistered(connection);
        moderationService.apply(roomId, connection.getUserId(), command);
    }

    public boolean leaveRoom(ChatConnection connection, String roomId) {
        requireRegistered(connection);
        return membershipService.leave(roomId, connection.getUserId());
    }

    /**
     * @method disconnect
     * @brief Called once per closed transport connection. A connection displaced by a newer
     *        one of the same user leaves nothing: its rooms now belong to the newer connection.
     */
    public void disconnect(String connectionId) {
        Optional<ChatConnection> removed = chatSessionRegistry.removeConnection(connectionId);
        if (removed.isEmpty()) {
            return;
        }
        ChatConnection connection = removed.get();
        if (!connection.isRegistered() || !chatSessionRegistry.releaseUser(connection)) {
            logger.info("[connection closed] no rooms to leave: {}", connection);
            return;
        }

        int left = 0;
        for (String roomId : chatSessionRegistry.roomsOf(connection.getUserId())) {
            if (membershipService.leave(roomId, connection.getUserId())) {
                left++;
            }
        }
        logger.info("[connection closed] userId={}, roomsLeft={}", connection.getUserId(), left);
    }

    private void requireRegistered(ChatConnection connection) {
        if (!connection.isRegistered()) {
            throw new NotRegisteredException("You must register first");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
