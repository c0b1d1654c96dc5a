package com.streamchat.room.service;

import com.streamchat.exception.ChatNotFoundException;
import com.streamchat.exception.InvalidChatRequestException;
import com.streamchat.message.model.ChatMessage;
import com.streamchat.message.model.MessageKind;
import com.streamchat.room.model.RoomState;
import com.streamchat.support.ChatTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class RoomRegistryTest {

    private static final Duration GRACE = Duration.ofMinutes(10);

    private ChatTestFixture fixture;
    private RoomRegistry registry;

    @BeforeEach
    void setUp() {
        fixture = new ChatTestFixture();
        registry = fixture.roomRegistry;
    }

    @Test
    void createsStreamRoomWithWelcomeMessage() {
        RoomState room = registry.getOrCreateByStreamKey("abc");

        assertThat(room.getId()).isEqualTo("stream_abc");
        assertThat(room.getRoom().getName()).isEqualTo("Stream Chat: abc");
        assertThat(room.getRoom().isPersistent()).isTrue();

        List<ChatMessage> history = room.getHistory().recent(10);
        assertThat(history).hasSize(1);
        assertThat(history.get(0).getBody()).isEqualTo("Welcome to Stream Chat: abc!");
        assertThat(history.get(0).getKind()).isEqualTo(MessageKind.SYSTEM);
    }

    @Test
    void concurrentStreamKeyLookupsCreateOneRoom() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<RoomState>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<RoomState> lookup = () -> {
                    start.await();
                    return registry.getOrCreateByStreamKey("abc");
                };
                futures.add(executor.submit(lookup));
            }
            start.countDown();

            RoomState first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<RoomState> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(registry.getRooms()).hasSize(1);
        assertThat(registry.require("stream_abc").getHistory().size()).isEqualTo(1);
    }

    @Test
    void streamPrefixedRoomIdBindsStreamKey() {
        RoomState byId = registry.getOrCreate("stream_xyz");

        assertThat(registry.findByStreamKey("xyz")).containsSame(byId);
        assertThat(registry.getOrCreateByStreamKey("xyz")).isSameAs(byId);
    }

    @Test
    void adHocRoomIsNamedAfterItsId() {
        RoomState room = registry.getOrCreate("lobby");

        assertThat(room.getRoom().getName()).isEqualTo("Chat Room lobby");
        assertThat(room.getRoom().getStreamKey()).isNull();
        assertThat(room.getRoom().isPersistent()).isFalse();
    }

    @Test
    void rejectsInvalidReferences() {
        assertThatThrownBy(() -> registry.getOrCreate("bad id!"))
                .isInstanceOf(InvalidChatRequestException.class);
        assertThatThrownBy(() -> registry.getOrCreateByStreamKey(""))
                .isInstanceOf(InvalidChatRequestException.class);
        assertThatThrownBy(() -> registry.require("missing"))
                .isInstanceOf(ChatNotFoundException.class)
                .hasMessage("Room not found");
    }

    @Test
    void emptyRoomIsEvictedAfterGraceWindow() {
        RoomState room = registry.getOrCreate("lobby");
        fixture.join(room, "alice");
        fixture.membershipService.leave("lobby", "alice");

        Runnable eviction = captureEviction(ChatTestFixture.START.plus(GRACE));
        fixture.clock.advance(GRACE);
        eviction.run();

        assertThat(registry.get("lobby")).isEmpty();
        assertThat(room.isActive()).isFalse();
    }

    @Test
    void rejoinBeforeGraceWindowCancelsEviction() {
        RoomState room = registry.getOrCreate("lobby");
        fixture.join(room, "alice");
        fixture.membershipService.leave("lobby", "alice");
        Runnable eviction = captureEviction(ChatTestFixture.START.plus(GRACE));

        fixture.clock.advance(Duration.ofMinutes(5));
        fixture.join(room, "bob");
        fixture.clock.advance(Duration.ofMinutes(5));
        eviction.run();

        assertThat(registry.get("lobby")).containsSame(room);
        assertThat(room.isActive()).isTrue();
    }

    @Test
    void evictionWaitsForTheFullGraceOfTheLatestEmptyPeriod() {
        RoomState room = registry.getOrCreate("lobby");
        fixture.join(room, "alice");
        fixture.membershipService.leave("lobby", "alice");

        fixture.clock.advance(Duration.ofMinutes(5));
        fixture.join(room, "alice");
        fixture.membershipService.leave("lobby", "alice");

        ArgumentCaptor<Runnable> tasks = ArgumentCaptor.forClass(Runnable.class);
        verify(fixture.taskScheduler, times(2)).schedule(tasks.capture(), any(Instant.class));

        fixture.clock.advance(Duration.ofMinutes(5));
        tasks.getAllValues().get(0).run();
        assertThat(registry.get("lobby")).isPresent();

        fixture.clock.advance(Duration.ofMinutes(5));
        tasks.getAllValues().get(1).run();
        assertThat(registry.get("lobby")).isEmpty();
    }

    @Test
    void persistentRoomsAreNeverEvicted() {
        RoomState room = registry.getOrCreateByStreamKey("abc");
        fixture.join(room, "alice");
        fixture.membershipService.leave("stream_abc", "alice");

        verify(fixture.taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));

        fixture.clock.advance(Duration.ofHours(2));
        assertThat(registry.evictIfIdle("stream_abc")).isFalse();
        assertThat(registry.evictIdleRooms()).isZero();
        assertThat(registry.get("stream_abc")).containsSame(room);
    }

    @Test
    void joinOnEvictedInstanceLandsOnFreshRoom() {
        RoomState stale = registry.getOrCreate("lobby");
        fixture.join(stale, "alice");
        fixture.membershipService.leave("lobby", "alice");
        fixture.clock.advance(GRACE);
        assertThat(registry.evictIfIdle("lobby")).isTrue();

        fixture.join(stale, "bob");

        RoomState live = registry.require("lobby");
        assertThat(live).isNotSameAs(stale);
        assertThat(live.getMemberCount()).isEqualTo(1);
        assertThat(stale.getMemberCount()).isZero();
    }

    @Test
    void sweepEvictsRoomsThatNobodyJoined() {
        registry.getOrCreate("never-joined");
        registry.getOrCreate("busy");
        fixture.join(registry.require("busy"), "alice");

        fixture.clock.advance(GRACE.plusSeconds(1));

        assertThat(registry.evictIdleRooms()).isEqualTo(1);
        assertThat(registry.get("never-joined")).isEmpty();
        assertThat(registry.get("busy")).isPresent();
    }

    private Runnable captureEviction(Instant expectedFireAt) {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(fixture.taskScheduler).schedule(task.capture(), eq(expectedFireAt));
        return task.getValue();
    }
}
