package com.streamchat.websocketcore.service;

import com.streamchat.auth.model.StreamIdentity;
import com.streamchat.auth.service.ChatRoleResolver;
import com.streamchat.config.ChatProperties;
import com.streamchat.event.ChatEvent;
import com.streamchat.exception.ChatErrorCode;
import com.streamchat.member.model.ChatRoles;
import com.streamchat.room.model.RoomSettings;
import com.streamchat.room.model.RoomState;
import com.streamchat.support.ChatClient;
import com.streamchat.support.ChatTestFixture;
import com.streamchat.support.RecordingEventSink;
import com.streamchat.websocketcore.core.ChatSessionEventPublisher;
import com.streamchat.websocketcore.model.ChatConnection;
import com.streamchat.websocketcore.model.ChatSessionRegistry;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class ChatCommandDispatcherTest {

    private ChatSessionRegistry sessionRegistry;
    private ChatTestFixture fixture;
    private ChatConnectionService connectionService;
    private ChatCommandDispatcher dispatcher;
    private int connectionSeq;

    @BeforeEach
    void setUp() {
        ChatProperties properties = new ChatProperties();
        sessionRegistry = new ChatSessionRegistry();
        fixture = new ChatTestFixture(properties, new ChatSessionEventPublisher(sessionRegistry));
        connectionService = new ChatConnectionService(
                sessionRegistry,
                fixture.roomRegistry,
                fixture.membershipService,
                fixture.admissionService,
                fixture.moderationService,
                new ChatRoleResolver(properties));
        dispatcher = new ChatCommandDispatcher(connectionService);
    }

    @Test
    void commandsBeforeRegisterAreRejected() {
        ChatClient client = connect(null);

        client.send(joinByStreamKey("abc", "alice"));

        ChatEvent.Error error = client.sink().lastOf(ChatEvent.Error.class);
        assertThat(error.getCode()).isEqualTo(ChatErrorCode.NOT_REGISTERED);
        assertThat(error.getMessage()).isEqualTo("You must register first");
        assertThat(fixture.roomRegistry.getRooms()).isEmpty();
    }

    @Test
    void anonymousRegisterGeneratesUserId() {
        ChatClient client = connect(null);

        client.send(new JSONObject().put("type", "register").put("username", "alice"));

        ChatEvent.Registered registered = client.sink().lastOf(ChatEvent.Registered.class);
        assertThat(registered.getUserId()).isNotBlank();
        assertThat(registered.getUsername()).isEqualTo("alice");
        assertThat(registered.getDisplayName()).isEqualTo("alice");
    }

    @Test
    void authenticatedRegisterUsesTokenIdentity() {
        ChatClient client = connect(identity("u-42", "streamer42", "abc"));

        client.send(new JSONObject().put("type", "register").put("userId", "someone-else"));

        ChatEvent.Registered registered = client.sink().lastOf(ChatEvent.Registered.class);
        assertThat(registered.getUserId()).isEqualTo("u-42");
        assertThat(registered.getUsername()).isEqualTo("streamer42");
    }

    @Test
    void malformedAndUnknownFramesAreInvalidRequests() {
        ChatClient client = connect(null);

        client.sendRaw("{not json");
        assertThat(client.sink().lastOf(ChatEvent.Error.class).getMessage()).isEqualTo("Malformed message");

        client.send(new JSONObject().put("type", "dance"));
        assertThat(client.sink().eventsOf(ChatEvent.Error.class))
                .extracting(ChatEvent.Error::getCode)
                .containsOnly(ChatErrorCode.INVALID_REQUEST);

        client.send(new JSONObject().put("type", "register"));
        assertThat(client.sink().lastOf(ChatEvent.Error.class).getMessage()).isEqualTo("Username is required");
    }

    @Test
    void joinSendMessageAndLeaveFlow() {
        ChatClient alice = registered("alice", null);
        ChatClient bob = registered("bob", null);

        alice.send(joinByStreamKey("abc", "alice"));
        bob.send(new JSONObject().put("type", "join-room").put("roomId", "stream_abc")
                .put("user", new JSONObject().put("username", "bob").put("displayName", "Bobby")));

        ChatEvent.RoomJoined joined = bob.sink().lastOf(ChatEvent.RoomJoined.class);
        assertThat(joined.getRoomId()).isEqualTo("stream_abc");
        assertThat(joined.getUserCount()).isEqualTo(2);
        assertThat(joined.getUser().getDisplayName()).isEqualTo("Bobby");
        assertThat(alice.sink().lastOf(ChatEvent.UserJoined.class).getUser().getDisplayName()).isEqualTo("Bobby");

        alice.send(sendMessage("stream_abc", "hello bob"));
        assertThat(bob.sink().lastOf(ChatEvent.NewMessage.class).getMessage().getBody()).isEqualTo("hello bob");

        bob.send(new JSONObject().put("type", "leave-room").put("roomId", "stream_abc"));
        assertThat(alice.sink().lastOf(ChatEvent.UserLeft.class).getUsername()).isEqualTo("bob");
        assertThat(fixture.roomRegistry.require("stream_abc").getMemberCount()).isEqualTo(1);
    }

    @Test
    void joinWithoutRoomReferenceIsInvalid() {
        ChatClient alice = registered("alice", null);

        alice.send(new JSONObject().put("type", "join-room"));

        assertThat(alice.sink().lastOf(ChatEvent.Error.class).getCode()).isEqualTo(ChatErrorCode.INVALID_REQUEST);
    }

    @Test
    void rateLimitErrorCarriesRetryAfter() {
        ChatClient alice = registered("alice", null);
        alice.send(joinByStreamKey("abc", "alice"));
        RoomState room = fixture.roomRegistry.require("stream_abc");
        room.getRoom().updateSettings(RoomSettings.builder().slowMode(true).slowModeInterval(3).filteredWords(List.of()).build());

        alice.send(sendMessage("stream_abc", "one"));
        fixture.clock.advance(Duration.ofSeconds(1));
        alice.send(sendMessage("stream_abc", "two"));

        ChatEvent.Error error = alice.sink().lastOf(ChatEvent.Error.class);
        assertThat(error.getCode()).isEqualTo(ChatErrorCode.RATE_LIMITED);
        assertThat(error.getRetryAfterSeconds()).isEqualTo(2L);
    }

    @Test
    void clientDeclaredPrivilegedRolesAreDropped() {
        ChatClient alice = registered("alice", null);

        alice.send(new JSONObject().put("type", "join-room").put("streamKey", "abc")
                .put("user", new JSONObject().put("username", "alice")
                        .put("roles", new JSONArray().put("moderator").put("subscriber"))));

        assertThat(alice.sink().lastOf(ChatEvent.RoomJoined.class).getUser().getRoles())
                .containsExactlyInAnyOrder(ChatRoles.VIEWER, ChatRoles.SUBSCRIBER);

        alice.send(new JSONObject().put("type", "moderate").put("roomId", "stream_abc")
                .put("action", "ban").put("targetId", "bob"));
        assertThat(alice.sink().lastOf(ChatEvent.Error.class).getCode()).isEqualTo(ChatErrorCode.FORBIDDEN);
    }

    @Test
    void streamOwnerModeratesOwnRoom() {
        ChatClient owner = registered("owner", identity("owner", "owner", "abc"));
        ChatClient troll = registered("troll", null);
        owner.send(joinByStreamKey("abc", "owner"));
        troll.send(joinByStreamKey("abc", "troll"));

        assertThat(owner.sink().lastOf(ChatEvent.RoomJoined.class).getUser().getRoles())
                .contains(ChatRoles.BROADCASTER);

        owner.send(new JSONObject().put("type", "moderate").put("roomId", "stream_abc")
                .put("action", "timeout").put("targetId", "troll").put("duration", 120).put("reason", "calm down"));

        ChatEvent.Moderation notice = troll.sink().lastOf(ChatEvent.Moderation.class);
        assertThat(notice.getAction()).isEqualTo("timeout");
        assertThat(notice.getDuration()).isEqualTo(120L);
        assertThat(owner.sink().eventsOf(ChatEvent.Error.class)).isEmpty();

        troll.send(sendMessage("stream_abc", "still here"));
        assertThat(troll.sink().lastOf(ChatEvent.Error.class).getCode()).isEqualTo(ChatErrorCode.FORBIDDEN);
    }

    @Test
    void unexpectedFailureIsReportedAsUnknown() {
        ChatConnectionService failing = mock(ChatConnectionService.class);
        doThrow(new IllegalStateException("boom")).when(failing).leaveRoom(any(), any());
        RecordingEventSink sink = new RecordingEventSink();
        ChatClient client = new ChatClient(
                new ChatConnection("c-x", sink, null),
                sink, new ChatCommandDispatcher(failing));

        client.send(new JSONObject().put("type", "leave-room").put("roomId", "lobby"));

        ChatEvent.Error error = sink.lastOf(ChatEvent.Error.class);
        assertThat(error.getCode()).isEqualTo(ChatErrorCode.UNKNOWN);
        assertThat(error.getMessage()).isEqualTo("Failed to process leave-room");
    }

    private ChatClient connect(StreamIdentity identity) {
        RecordingEventSink sink = new RecordingEventSink();
        return new ChatClient(connectionService.open("c-" + (++connectionSeq), sink, identity), sink, dispatcher);
    }

    private ChatClient registered(String userId, StreamIdentity identity) {
        ChatClient client = connect(identity);
        client.send(new JSONObject().put("type", "register").put("userId", userId).put("username", userId));
        assertThat(client.sink().eventsOf(ChatEvent.Registered.class)).hasSize(1);
        return client;
    }

    private static StreamIdentity identity(String userId, String username, String streamKey) {
        return StreamIdentity.builder()
                .userId(userId)
                .username(username)
                .role(StreamIdentity.ROLE_STREAMER)
                .streamKey(streamKey)
                .allowedToStream(true)
                .build();
    }

    private static JSONObject joinByStreamKey(String streamKey, String username) {
        return new JSONObject().put("type", "join-room").put("streamKey", streamKey)
                .put("user", new JSONObject().put("username", username));
    }

    private static JSONObject sendMessage(String roomId, String body) {
        return new JSONObject().put("type", "send-message").put("roomId", roomId).put("message", body);
    }
}
