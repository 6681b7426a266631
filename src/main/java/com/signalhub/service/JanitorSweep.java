package com.signalhub.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.signalhub.config.SignalingProperties;
import com.signalhub.model.Room;

/**
 * Periodically evicts rooms that are empty or have been inactive too long.
 * The only place rooms are removed from the directory.
 */
@Service
public class JanitorSweep {
    private static final Logger logger = LoggerFactory.getLogger(JanitorSweep.class);

    private final RoomDirectory roomDirectory;
    private final Clock clock;
    private final Duration inactivityThreshold;

    private final AtomicLong roomsEvicted = new AtomicLong();

    public JanitorSweep(RoomDirectory roomDirectory, Clock clock, SignalingProperties properties) {
        this.roomDirectory = roomDirectory;
        this.clock = clock;
        this.inactivityThreshold = properties.getJanitor().getInactivityThreshold();
    }

    @Scheduled(fixedRateString = "${signalhub.janitor.interval:PT5M}",
               initialDelayString = "${signalhub.janitor.interval:PT5M}")
    public void scheduledSweep() {
        sweep();
    }

    /**
     * One pass over a snapshot of the directory.
     *
     * @return number of rooms evicted
     */
    public int sweep() {
        Instant now = clock.instant();
        int evicted = 0;

        for (Room room : roomDirectory.getAllRooms()) {
            if (roomDirectory.evictIfIdle(room, now, inactivityThreshold)) {
                evicted++;
            }
        }

        roomsEvicted.addAndGet(evicted);
        if (evicted > 0) {
            logger.info("🧹 Janitor evicted {} rooms ({} remaining)", evicted, roomDirectory.getRoomCount());
        } else {
            logger.debug("Janitor sweep found nothing to evict ({} rooms)", roomDirectory.getRoomCount());
        }
        return evicted;
    }

    public long getRoomsEvicted() {
        return roomsEvicted.get();
    }
}
