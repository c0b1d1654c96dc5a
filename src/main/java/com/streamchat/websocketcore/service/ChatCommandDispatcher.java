package com.streamchat.websocketcore.service;

import com.streamchat.event.ChatEvent;
import com.streamchat.exception.ChatErrorCode;
import com.streamchat.exception.ChatException;
import com.streamchat.exception.InvalidChatRequestException;
import com.streamchat.exception.RateLimitedException;
import com.streamchat.moderation.model.ModerationAction;
import com.streamchat.moderation.model.ModerationCommand;
import com.streamchat.websocketcore.model.ChatCommandType;
import com.streamchat.websocketcore.model.ChatConnection;
import com.streamchat.websocketcore.model.JoinRoomRequest;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * @class ChatCommandDispatcher
 * @brief Decodes one inbound text frame ({@code {"type": ..., ...fields}}) and routes it to
 *        {@link ChatConnectionService}.
 *
 * Every rejection ends here: it is turned into an {@code error} event sent to the originating
 * connection only. Unexpected failures are logged and reported as UNKNOWN.
 */
@Component
public class ChatCommandDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ChatCommandDispatcher.class);

    private final ChatConnectionService chatConnectionService;

    public ChatCommandDispatcher(ChatConnectionService chatConnectionService) {
        this.chatConnectionService = chatConnectionService;
    }

    public void dispatch(ChatConnection connection, String payload) {
        String type = null;
        try {
            JSONObject frame = new JSONObject(payload);
            type = optText(frame, "type");
            ChatCommandType command = ChatCommandType.fromWireName(type)
                    .orElseThrow(() -> new InvalidChatRequestException("Unknown message type"));

            switch (command) {
                case REGISTER -> chatConnectionService.register(connection,
                        optText(frame, "userId"), optText(frame, "username"), optText(frame, "displayName"));
                case JOIN_ROOM -> chatConnectionService.join(connection, toJoinRequest(frame));
                case SEND_MESSAGE -> chatConnectionService.sendMessage(connection,
                        optText(frame, "roomId"), optText(frame, "message"), optText(frame, "replyToId"));
                case MODERATE -> chatConnectionService.moderate(connection,
                        optText(frame, "roomId"), toModerationCommand(frame));
                case LEAVE_ROOM -> chatConnectionService.leaveRoom(connection, optText(frame, "roomId"));
            }
        } catch (JSONException e) {
            logger.info("[malformed frame] connectionId={}, error={}", connection.getId(), e.getMessage());
            reject(connection, new InvalidChatRequestException("Malformed message"));
        } catch (ChatException e) {
            logger.info("[rejected] connectionId={}, type={}, code={}, message={}",
                    connection.getId(), type, e.getCode(), e.getMessage());
            reject(connection, e);
        } catch (RuntimeException e) {
            logger.error("[dispatch failed] connectionId={}, type={}", connection.getId(), type, e);
            reject(connection, new ChatException(ChatErrorCode.UNKNOWN, "Failed to process " + type, e));
        }
    }

    private void reject(ChatConnection connection, ChatException e) {
        Long retryAfter = e instanceof RateLimitedException rate ? rate.getRetryAfterSeconds() : null;
        connection.deliver(new ChatEvent.Error(e.getMessage(), e.getCode(), retryAfter));
    }

    private JoinRoomRequest toJoinRequest(JSONObject frame) {
        JoinRoomRequest.JoinRoomRequestBuilder builder = JoinRoomRequest.builder()
                .roomId(optText(frame, "roomId"))
                .streamKey(optText(frame, "streamKey"));

        JSONObject user = frame.optJSONObject("user");
        if (user != null) {
            builder.username(optText(user, "username"))
                    .displayName(optText(user, "displayName"))
                    .color(optText(user, "color"));
            JSONArray roles = user.optJSONArray("roles");
            if (roles != null) {
                for (int i = 0; i < roles.length(); i++) {
                    String role = roles.optString(i, null);
                    if (role != null) {
                        builder.role(role);
                    }
                }
            }
        }
        return builder.build();
    }

    private ModerationCommand toModerationCommand(JSONObject frame) {
        Long duration = null;
        if (frame.has("duration") && !frame.isNull("duration")) {
            duration = frame.getLong("duration");
        }
        return ModerationCommand.builder()
                .action(ModerationAction.fromWireName(optText(frame, "action")))
                .targetId(optText(frame, "targetId"))
                .messageId(optText(frame, "messageId"))
                .durationSeconds(duration)
                .reason(optText(frame, "reason"))
                .build();
    }

    private static String optText(JSONObject object, String key) {
        return object.optString(key, null);
    }
}
