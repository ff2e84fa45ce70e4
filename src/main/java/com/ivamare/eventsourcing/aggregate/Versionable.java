package com.ivamare.eventsourcing.aggregate;

/**
 * Anything carrying the version of the last committed event it reflects.
 */
public interface Versionable {

    /**
     * @return last committed version, 0 for a new aggregate
     */
    int aggregateVersion();
}
