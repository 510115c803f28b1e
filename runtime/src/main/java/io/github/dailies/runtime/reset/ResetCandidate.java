package io.github.dailies.runtime.reset;

import java.time.Instant;

/** A completed task joined with the frequency it recurs on. */
public record ResetCandidate(
        String taskId,
        String taskName,
        Instant lastModified,
        String frequencyId,
        String frequencyName,
        String expression,
        String timezone
) {}
