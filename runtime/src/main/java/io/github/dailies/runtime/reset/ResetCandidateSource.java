package io.github.dailies.runtime.reset;

import java.util.List;

public interface ResetCandidateSource {

    /** Completed, non-deleted tasks that reference a frequency, with the frequency preloaded. */
    List<ResetCandidate> loadResettableCandidates();
}
