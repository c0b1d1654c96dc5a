package com.streamchat.scheduler;

import com.streamchat.room.service.RoomRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ChatServiceScheduler {

	private static final Logger logger = LoggerFactory.getLogger(ChatServiceScheduler.class);

	private final RoomRegistry roomRegistry;

	public ChatServiceScheduler(RoomRegistry roomRegistry) {
		this.roomRegistry = roomRegistry;
	}

	/**
	 * [idle room sweep]
	 *
	 * - evictions are normally one-shot tasks scheduled when a room empties
	 * - this sweep catches rooms whose task was lost, using the same re-check
	 */
	@Scheduled(fixedDelayString = "${streamchat.chat.idle-sweep-millis:60000}")
	public void evictIdleRoomsJob() {
		try {
			int evicted = roomRegistry.evictIdleRooms();
			if (evicted > 0) {
				logger.info("[idle room sweep] evicted={}", evicted);
			}
		} catch (Exception e) {
			logger.error("[idle room sweep] failed", e);
		}
	}
}
