package com.subtrack.subbackend.database;

import java.time.Duration;

/** Maps a 1-based attempt number to the wait that follows a failed attempt. */
@FunctionalInterface
public interface BackoffPolicy {

    Duration delayAfter(int attempt);

    /** Attempt n waits n seconds. No jitter. */
    static BackoffPolicy linear() {
        return attempt -> Duration.ofSeconds(attempt);
    }
}
