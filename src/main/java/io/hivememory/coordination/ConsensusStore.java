package io.hivememory.coordination;

import com.fasterxml.jackson.core.type.TypeReference;
import io.hivememory.core.Expiry;
import io.hivememory.core.MemoryContext;
import io.hivememory.core.NotFoundException;
import io.hivememory.core.SchemaTable;
import io.hivememory.core.StorageException;
import io.hivememory.core.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Consensus gating in {@code consensus_state}: an agent proposes a decision and
 * other agents vote on it until the quorum is reached.
 *
 * <p>Every vote is a read-modify-write inside one transaction, so concurrent votes
 * are never lost. Proposals expire after a week unless created with another TTL;
 * expired proposals are invisible and removed by the TTL sweep.</p>
 */
@Component
public class ConsensusStore {

    private static final Logger log = LoggerFactory.getLogger(ConsensusStore.class);
    private static final TypeReference<List<String>> VOTES = new TypeReference<>() {
    };
    private static final String COLUMNS =
            "id, decision, proposer, votes, quorum, status, version, ttl, expires_at, created_at";

    public static final long DEFAULT_TTL_SECONDS = 604_800L;

    private final MemoryContext context;

    public ConsensusStore(MemoryContext context) {
        this.context = context;
    }

    /**
     * Opens a pending proposal.
     *
     * @param id         proposal id, or null for a random one
     * @param ttlSeconds null for the one-week default, 0 for never
     * @throws ValidationException bad arguments, or a live proposal with the same id exists
     */
    public ConsensusProposal propose(String id, String decision, String proposer, int quorum, Long ttlSeconds) {
        if (decision == null || decision.isBlank()) {
            throw new ValidationException("decision is required");
        }
        if (proposer == null || proposer.isBlank()) {
            throw new ValidationException("proposer is required");
        }
        if (quorum < 1) {
            throw new ValidationException("quorum must be at least 1, got " + quorum);
        }
        String proposalId = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
        long ttl = ttlSeconds == null ? DEFAULT_TTL_SECONDS : ttlSeconds;
        long now = context.now();
        var proposal = new ConsensusProposal(proposalId, decision, proposer, List.of(), quorum,
                ConsensusStatus.PENDING, 1, ttl, Expiry.expiresAt(now, ttl), now);

        context.database().ensureTable(SchemaTable.CONSENSUS_STATE);
        context.database().write(conn -> {
            if (find(conn, proposalId, now).isPresent()) {
                throw new ValidationException("Proposal already exists: " + proposalId);
            }
            // An expired proposal with the same id is replaced.
            try (var stmt = conn.prepareStatement("INSERT OR REPLACE INTO consensus_state (" + COLUMNS + ")"
                    + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                stmt.setString(1, proposal.id());
                stmt.setString(2, proposal.decision());
                stmt.setString(3, proposal.proposer());
                stmt.setString(4, context.toJson(proposal.votes()));
                stmt.setInt(5, proposal.quorum());
                stmt.setString(6, proposal.status().tag());
                stmt.setInt(7, proposal.version());
                stmt.setLong(8, proposal.ttlSeconds());
                stmt.setLong(9, proposal.expiresAt());
                stmt.setLong(10, proposal.createdAt());
                return stmt.executeUpdate();
            }
        });
        log.info("Agent {} proposed '{}' ({}), quorum {}", proposer, decision, proposalId, quorum);
        return proposal;
    }

    /**
     * Records a vote for the proposal. Voting twice counts once; voting on an
     * approved proposal changes nothing.
     *
     * @return the proposal after the vote
     * @throws NotFoundException   no live proposal with that id
     * @throws ValidationException the proposal was rejected
     */
    public ConsensusProposal vote(String proposalId, String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new ValidationException("agentId is required");
        }
        long now = context.now();
        context.database().ensureTable(SchemaTable.CONSENSUS_STATE);
        ConsensusProposal result = context.database().write(conn -> {
            ConsensusProposal current = find(conn, proposalId, now)
                    .orElseThrow(() -> new NotFoundException("Consensus proposal not found: " + proposalId));
            if (current.status() == ConsensusStatus.REJECTED) {
                throw new ValidationException("Proposal was rejected: " + proposalId);
            }
            if (current.votes().contains(agentId)) {
                return current;
            }
            List<String> votes = new ArrayList<>(current.votes());
            votes.add(agentId);
            ConsensusStatus status = votes.size() >= current.quorum() ? ConsensusStatus.APPROVED : current.status();
            var updated = new ConsensusProposal(current.id(), current.decision(), current.proposer(), votes,
                    current.quorum(), status, current.version() + 1, current.ttlSeconds(), current.expiresAt(),
                    current.createdAt());
            update(conn, updated);
            if (status != current.status()) {
                log.info("Proposal {} approved with {} votes", proposalId, votes.size());
            }
            return updated;
        });
        log.debug("Agent {} voted on proposal {} ({}/{})", agentId, proposalId, result.votes().size(),
                result.quorum());
        return result;
    }

    /**
     * Closes a pending proposal without approval.
     *
     * @throws NotFoundException   no live proposal with that id
     * @throws ValidationException the proposal is already approved
     */
    public ConsensusProposal reject(String proposalId) {
        long now = context.now();
        context.database().ensureTable(SchemaTable.CONSENSUS_STATE);
        ConsensusProposal result = context.database().write(conn -> {
            ConsensusProposal current = find(conn, proposalId, now)
                    .orElseThrow(() -> new NotFoundException("Consensus proposal not found: " + proposalId));
            if (current.status() == ConsensusStatus.APPROVED) {
                throw new ValidationException("Proposal already approved: " + proposalId);
            }
            if (current.status() == ConsensusStatus.REJECTED) {
                return current;
            }
            var updated = new ConsensusProposal(current.id(), current.decision(), current.proposer(),
                    current.votes(), current.quorum(), ConsensusStatus.REJECTED, current.version() + 1,
                    current.ttlSeconds(), current.expiresAt(), current.createdAt());
            update(conn, updated);
            return updated;
        });
        log.info("Proposal {} rejected", proposalId);
        return result;
    }

    /**
     * @throws NotFoundException no live proposal with that id
     */
    public ConsensusProposal getProposal(String proposalId) {
        return findProposal(proposalId)
                .orElseThrow(() -> new NotFoundException("Consensus proposal not found: " + proposalId));
    }

    public Optional<ConsensusProposal> findProposal(String proposalId) {
        long now = context.now();
        context.database().ensureTable(SchemaTable.CONSENSUS_STATE);
        return context.database().read(conn -> find(conn, proposalId, now));
    }

    /**
     * Live proposals with the given status, oldest first.
     */
    public List<ConsensusProposal> listByStatus(ConsensusStatus status) {
        long now = context.now();
        context.database().ensureTable(SchemaTable.CONSENSUS_STATE);
        return context.database().read(conn -> {
            try (var stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM consensus_state"
                    + " WHERE status = ? AND " + Expiry.LIVE + " ORDER BY created_at, id")) {
                stmt.setString(1, status.tag());
                stmt.setLong(2, now);
                List<ConsensusProposal> proposals = new ArrayList<>();
                try (var rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        proposals.add(readProposal(rs));
                    }
                }
                return proposals;
            }
        });
    }

    private Optional<ConsensusProposal> find(Connection conn, String proposalId, long now) throws SQLException {
        try (var stmt = conn.prepareStatement("SELECT " + COLUMNS + " FROM consensus_state WHERE id = ? AND "
                + Expiry.LIVE)) {
            stmt.setString(1, proposalId);
            stmt.setLong(2, now);
            try (var rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(readProposal(rs)) : Optional.empty();
            }
        }
    }

    private void update(Connection conn, ConsensusProposal proposal) throws SQLException {
        try (var stmt = conn.prepareStatement(
                "UPDATE consensus_state SET votes = ?, status = ?, version = ? WHERE id = ?")) {
            stmt.setString(1, context.toJson(proposal.votes()));
            stmt.setString(2, proposal.status().tag());
            stmt.setInt(3, proposal.version());
            stmt.setString(4, proposal.id());
            stmt.executeUpdate();
        }
    }

    private ConsensusProposal readProposal(ResultSet rs) throws SQLException {
        return new ConsensusProposal(
                rs.getString("id"),
                rs.getString("decision"),
                rs.getString("proposer"),
                readVotes(rs.getString("votes")),
                rs.getInt("quorum"),
                ConsensusStatus.fromTag(rs.getString("status")),
                rs.getInt("version"),
                rs.getLong("ttl"),
                rs.getLong("expires_at"),
                rs.getLong("created_at"));
    }

    private List<String> readVotes(String json) {
        try {
            return context.objectMapper().readValue(json, VOTES);
        } catch (Exception e) {
            throw new StorageException("Corrupt consensus record: " + json, e);
        }
    }
}
