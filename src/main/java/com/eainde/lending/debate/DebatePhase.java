package com.eainde.lending.debate;

/**
 * Progress of a single debate. The moderator phases are skipped when round 0 converges.
 */
public enum DebatePhase {
    ROUND_0_PENDING,
    ROUND_0_COMPLETE,
    MODERATOR_PENDING,
    MODERATOR_COMPLETE,
    DEBATE_DONE
}
