package com.ivamare.eventsourcing.snapshot;

import com.ivamare.eventsourcing.aggregate.Aggregate;
import com.ivamare.eventsourcing.model.Event;

import java.util.List;

/**
 * Decides after a save whether the repository should take a snapshot.
 */
@FunctionalInterface
public interface SnapshotStrategy {

    /**
     * @param aggregate the aggregate after the save, version already advanced
     * @param committedEvents the events just saved
     * @return true to take a snapshot now
     */
    boolean shouldTakeSnapshot(Aggregate aggregate, List<Event> committedEvents);

    /**
     * Never take snapshots.
     */
    static SnapshotStrategy never() {
        return (aggregate, committedEvents) -> false;
    }

    /**
     * Take a snapshot whenever a save crosses a multiple of {@code interval} events.
     */
    static SnapshotStrategy everyNumberOfEvents(int interval) {
        if (interval <= 0) {
            return never();
        }
        return (aggregate, committedEvents) -> {
            int newVersion = aggregate.aggregateVersion();
            int previousVersion = newVersion - committedEvents.size();
            return newVersion / interval > previousVersion / interval;
        };
    }
}
