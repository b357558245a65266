package ibft.common.messages;

import com.google.protobuf.ByteString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pure extraction and certificate checks over consensus messages.
 * <p>
 * Extractors never fail on a message of the wrong kind: they return an empty {@link Optional}.
 */
public final class Messages {
    private Messages() {}

    public static Optional<Proposal> extractProposal(ConsensusMessage message) {
        if (message.payload() instanceof PrePrepareData d) return Optional.of(d.proposal());
        return Optional.empty();
    }

    public static Optional<ByteString> extractProposalHash(ConsensusMessage message) {
        if (message.payload() instanceof PrePrepareData d) return Optional.of(d.proposalHash());
        return Optional.empty();
    }

    public static Optional<RoundChangeCertificate> extractRoundChangeCertificate(ConsensusMessage message) {
        if (message.payload() instanceof PrePrepareData d) return Optional.ofNullable(d.certificate());
        return Optional.empty();
    }

    public static Optional<ByteString> extractPrepareHash(ConsensusMessage message) {
        if (message.payload() instanceof PrepareData d) return Optional.of(d.proposalHash());
        return Optional.empty();
    }

    public static Optional<ByteString> extractCommitHash(ConsensusMessage message) {
        if (message.payload() instanceof CommitData d) return Optional.of(d.proposalHash());
        return Optional.empty();
    }

    public static Optional<CommittedSeal> extractCommittedSeal(ConsensusMessage message) {
        if (message.payload() instanceof CommitData d) {
            return Optional.of(new CommittedSeal(message.sender(), d.committedSeal()));
        }
        return Optional.empty();
    }

    /**
     * Seals of every message, in order; empty when any message is not a COMMIT.
     */
    public static Optional<List<CommittedSeal>> extractCommittedSeals(Collection<ConsensusMessage> commits) {
        List<CommittedSeal> seals = new ArrayList<>(commits.size());
        for (ConsensusMessage m : commits) {
            Optional<CommittedSeal> seal = extractCommittedSeal(m);
            if (seal.isEmpty()) return Optional.empty();
            seals.add(seal.get());
        }
        return Optional.of(seals);
    }

    public static Optional<PreparedCertificate> extractLatestPreparedCertificate(ConsensusMessage message) {
        if (message.payload() instanceof RoundChangeData d) return Optional.ofNullable(d.latestPreparedCertificate());
        return Optional.empty();
    }

    public static Optional<Proposal> extractLastPreparedProposal(ConsensusMessage message) {
        if (message.payload() instanceof RoundChangeData d) return Optional.ofNullable(d.lastPreparedProposal());
        return Optional.empty();
    }

    public static boolean hasUniqueSenders(Collection<ConsensusMessage> messages) {
        if (messages.isEmpty()) return false;
        Set<String> seen = new HashSet<>(messages.size() * 2);
        for (ConsensusMessage m : messages) {
            if (!seen.add(m.sender())) return false;
        }
        return true;
    }

    /**
     * Structural check of the messages of a prepared certificate: same height, one common round
     * strictly below {@code roundLimit}, one proposal hash taken from PRE_PREPARE/PREPARE payloads,
     * distinct senders. COMMIT and ROUND_CHANGE members make the set invalid.
     */
    public static boolean validatePreparedCertificateSet(List<ConsensusMessage> messages, long height, long roundLimit) {
        if (messages.isEmpty()) return false;

        long round = messages.get(0).round();
        Set<String> senders = new HashSet<>();
        ByteString hash = null;

        for (ConsensusMessage m : messages) {
            if (m.height() != height) return false;
            if (m.round() != round || m.round() >= roundLimit) return false;

            Optional<ByteString> extracted = extractPCMessageHash(m);
            if (extracted.isEmpty()) return false;
            if (hash == null) {
                hash = extracted.get();
            } else if (!hash.equals(extracted.get())) {
                return false;
            }

            if (!senders.add(m.sender())) return false;
        }
        return true;
    }

    public static boolean allRoundsBelowThreshold(Collection<ConsensusMessage> messages, long round) {
        if (messages.isEmpty()) return false;
        for (ConsensusMessage m : messages) {
            if (m.round() >= round) return false;
        }
        return true;
    }

    static Optional<ByteString> extractPCMessageHash(ConsensusMessage message) {
        return switch (message.type()) {
            case PRE_PREPARE -> extractProposalHash(message);
            case PREPARE -> extractPrepareHash(message);
            case COMMIT, ROUND_CHANGE -> Optional.empty();
        };
    }
}
