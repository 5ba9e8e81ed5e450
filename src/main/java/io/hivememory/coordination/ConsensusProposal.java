package io.hivememory.coordination;

import java.util.List;

/**
 * A decision put to a vote. It is approved once {@code votes} holds {@code quorum}
 * distinct agents.
 *
 * @param votes      agents that voted for the decision, in voting order
 * @param version    bumped on every vote or status change
 * @param ttlSeconds 0 means the proposal never expires
 */
public record ConsensusProposal(
        String id,
        String decision,
        String proposer,
        List<String> votes,
        int quorum,
        ConsensusStatus status,
        int version,
        long ttlSeconds,
        long expiresAt,
        long createdAt
) {

    public ConsensusProposal {
        votes = votes == null ? List.of() : List.copyOf(votes);
    }

    public boolean isDecided() {
        return status != ConsensusStatus.PENDING;
    }
}
