package com.streamchat.member.service;

import com.streamchat.config.ChatProperties;
import com.streamchat.event.ChatEvent;
import com.streamchat.exception.ChatForbiddenException;
import com.streamchat.exception.ChatNotFoundException;
import com.streamchat.member.model.ChatRoles;
import com.streamchat.member.model.UserIdentity;
import com.streamchat.message.model.ChatMessage;
import com.streamchat.message.model.MessageKind;
import com.streamchat.moderation.model.ModerationAction;
import com.streamchat.moderation.model.ModerationCommand;
import com.streamchat.room.model.RoomState;
import com.streamchat.support.ChatTestFixture;
import com.streamchat.support.RecordingEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MembershipServiceTest {

    private ChatTestFixture fixture;
    private RecordingEventPublisher events;
    private RoomState room;

    @BeforeEach
    void setUp() {
        fixture = new ChatTestFixture();
        events = fixture.recorder();
        room = fixture.roomRegistry.getOrCreateByStreamKey("abc");
    }

    @Test
    void joinSendsRoomJoinedWithReplayAndCount() {
        fixture.join(room, "alice");
        MembershipService.JoinResult result = fixture.join(room, "bob");

        assertThat(result.getUserCount()).isEqualTo(2);
        assertThat(result.getUser().getRoles()).containsExactly(ChatRoles.VIEWER);

        ChatEvent.RoomJoined joined = events.eventsFor("bob", ChatEvent.RoomJoined.class).get(0);
        assertThat(joined.getRoomId()).isEqualTo("stream_abc");
        assertThat(joined.getUserCount()).isEqualTo(2);
        assertThat(joined.getRecentMessages())
                .extracting(ChatMessage::getBody)
                .containsExactly("Welcome to Stream Chat: abc!", "Alice joined the chat");
    }

    @Test
    void joinIsAnnouncedToOthersButNotToTheJoiner() {
        fixture.join(room, "alice");
        fixture.join(room, "bob");

        List<ChatEvent.UserJoined> seenByAlice = events.eventsFor("alice", ChatEvent.UserJoined.class);
        assertThat(seenByAlice).hasSize(1);
        assertThat(seenByAlice.get(0).getUser().getId()).isEqualTo("bob");
        assertThat(events.eventsFor("bob", ChatEvent.UserJoined.class)).isEmpty();

        List<String> bodiesSeenByBob = events.eventsFor("bob", ChatEvent.NewMessage.class).stream()
                .map(e -> e.getMessage().getBody())
                .collect(Collectors.toList());
        assertThat(bodiesSeenByBob).containsExactly("Bob joined the chat");
    }

    @Test
    void leaveIsIdempotent() {
        fixture.join(room, "alice");
        fixture.join(room, "bob");

        assertThat(fixture.membershipService.leave("stream_abc", "bob")).isTrue();
        assertThat(fixture.membershipService.leave("stream_abc", "bob")).isFalse();
        assertThat(fixture.membershipService.leave("no-such-room", "bob")).isFalse();

        List<ChatEvent.UserLeft> left = events.eventsFor("alice", ChatEvent.UserLeft.class);
        assertThat(left).hasSize(1);
        assertThat(left.get(0).getUserId()).isEqualTo("bob");
        assertThat(room.getMemberCount()).isEqualTo(1);
        assertThat(events.subscribersOf("stream_abc")).containsExactly("alice");
    }

    @Test
    void memberCountMatchesPresentUsersForAnyJoinLeaveSequence() {
        Random random = new Random(42);
        String[] users = {"u1", "u2", "u3", "u4", "u5"};

        for (int step = 0; step < 300; step++) {
            String user = users[random.nextInt(users.length)];
            if (random.nextBoolean()) {
                fixture.join(room, user);
            } else {
                fixture.membershipService.leave("stream_abc", user);
            }
            int present = room.withLock(() -> room.getMembers().size());
            assertThat(room.withLock(room::getMemberCount)).isEqualTo(present);
            assertThat(events.subscribersOf("stream_abc")).hasSize(present);
        }
    }

    @Test
    void concurrentJoinSendModerateAndLeaveOnOneRoomStayConsistent() throws Exception {
        ChatProperties properties = new ChatProperties();
        properties.setHistoryLimit(100);
        ChatTestFixture concurrent = new ChatTestFixture(properties, new RecordingEventPublisher());
        RecordingEventPublisher recorder = concurrent.recorder();
        RoomState shared = concurrent.roomRegistry.getOrCreateByStreamKey("live");
        concurrent.join(shared, "mod", ChatRoles.MODERATOR);

        int threads = 16;
        int messagesPerUser = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threads + 1);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                String userId = "user" + t;
                boolean leaves = t % 2 == 0;
                futures.add(executor.submit(() -> {
                    start.await();
                    concurrent.join(shared, userId);
                    for (int i = 0; i < messagesPerUser; i++) {
                        concurrent.admissionService.submit("stream_live", userId, userId + " #" + i, null);
                    }
                    if (leaves) {
                        concurrent.membershipService.leave("stream_live", userId);
                        concurrent.membershipService.leave("stream_live", userId);
                    }
                    return null;
                }));
            }
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    try {
                        concurrent.moderationService.apply("stream_live", "mod", ModerationCommand.builder()
                                .action(ModerationAction.UNMUTE).targetId("user" + (i % threads)).build());
                    } catch (ChatNotFoundException notPresent) {
                        // target not joined yet, or already gone
                    }
                }
                return null;
            }));

            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        int present = shared.withLock(() -> shared.getMembers().size());
        assertThat(shared.withLock(shared::getMemberCount)).isEqualTo(present).isEqualTo(1 + threads / 2);
        assertThat(recorder.subscribersOf("stream_live")).hasSize(present);

        for (int t = 0; t < threads; t += 2) {
            String userId = "user" + t;
            assertThat(recorder.eventsFor("mod", ChatEvent.UserLeft.class))
                    .filteredOn(left -> left.getUserId().equals(userId))
                    .hasSize(1);
        }

        List<ChatMessage> history = shared.withLock(() -> shared.getHistory().recent(1000));
        assertThat(history).hasSizeLessThanOrEqualTo(100);

        // history keeps the order in which entries were broadcast
        Set<String> kept = history.stream().map(ChatMessage::getId).collect(Collectors.toSet());
        List<String> broadcastOrder = recorder.eventsFor("mod", ChatEvent.NewMessage.class).stream()
                .map(event -> event.getMessage().getId())
                .filter(kept::contains)
                .collect(Collectors.toList());
        Set<String> received = Set.copyOf(broadcastOrder);
        assertThat(broadcastOrder).containsExactlyElementsOf(history.stream()
                .map(ChatMessage::getId)
                .filter(received::contains)
                .collect(Collectors.toList()));
        assertThat(history).filteredOn(m -> m.getKind() == MessageKind.MESSAGE).isNotEmpty();

        // each sender's surviving messages are still in the order they were sent
        for (int t = 0; t < threads; t++) {
            String prefix = "user" + t + " #";
            List<Integer> sequence = history.stream()
                    .map(ChatMessage::getBody)
                    .filter(body -> body.startsWith(prefix))
                    .map(body -> Integer.parseInt(body.substring(prefix.length())))
                    .collect(Collectors.toList());
            assertThat(sequence).isSorted();
        }
    }

    @Test
    void rejoinByPresentMemberKeepsCount() {
        fixture.join(room, "alice");
        MembershipService.JoinResult again = fixture.join(room, "alice");

        assertThat(again.getUserCount()).isEqualTo(1);
        assertThat(room.getMemberCount()).isEqualTo(1);
    }

    @Test
    void bannedUserCannotRejoin() {
        fixture.join(room, "mod", ChatRoles.MODERATOR);
        fixture.join(room, "alice");
        fixture.moderationService.apply("stream_abc", "mod",
                ModerationCommand.builder().action(ModerationAction.BAN).targetId("alice").build());

        assertThatThrownBy(() -> fixture.join(room, "alice"))
                .isInstanceOf(ChatForbiddenException.class)
                .hasMessage("You are banned from this chat");
        assertThat(room.getMemberCount()).isEqualTo(1);
    }

    @Test
    void suppliedColorIsKeptOtherwisePaletteIsDeterministic() {
        UserIdentity withColor = UserIdentity.builder()
                .userId("alice").username("alice").displayName("Alice").color("#00ff00").build();
        assertThat(fixture.membershipService.join(room, withColor).getUser().getColor()).isEqualTo("#00FF00");

        String first = fixture.join(room, "bob").getUser().getColor();
        String second = fixture.join(room, "bob").getUser().getColor();
        assertThat(first).isEqualTo(second);
        assertThat(UserColorPalette.COLORS).contains(first);
    }
}
