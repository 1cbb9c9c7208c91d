package io.tempo4j;

import java.time.Instant;

/**
 * What a handler knows about the firing it runs for.
 *
 * @param jobId    id of the job that fired
 * @param ownerId  tenant owning the job
 * @param fireTime scheduled instant of this firing (not the wall-clock start time)
 */
public record JobContext(String jobId, String ownerId, Instant fireTime) {
}
