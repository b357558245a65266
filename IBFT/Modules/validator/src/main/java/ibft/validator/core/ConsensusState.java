package ibft.validator.core;

import com.google.protobuf.ByteString;
import ibft.common.messages.ConsensusMessage;
import ibft.common.messages.Messages;
import ibft.common.messages.PreparedCertificate;
import ibft.common.messages.Proposal;
import ibft.common.messages.View;

final class ConsensusState {
    private long height;
    private long round;
    private StateName name = StateName.IDLE;

    // accepted PRE_PREPARE of the current round
    private ConsensusMessage proposalMessage;
    private Proposal proposal;
    private ByteString proposalHash;

    // survive round changes within a height
    private PreparedCertificate latestPreparedCertificate;
    private Proposal latestPreparedProposal;

    void reset(long height) {
        this.height = height;
        this.round = 0;
        this.name = StateName.NEW_ROUND;
        clearProposal();
        this.latestPreparedCertificate = null;
        this.latestPreparedProposal = null;
    }

    void newRound(long round) {
        this.round = round;
        this.name = StateName.NEW_ROUND;
        clearProposal();
    }

    void acceptProposal(ConsensusMessage prePrepare) {
        this.proposalMessage = prePrepare;
        this.proposal = Messages.extractProposal(prePrepare).orElseThrow();
        this.proposalHash = Messages.extractProposalHash(prePrepare).orElseThrow();
        this.name = StateName.PREPARE;
    }

    void prepared(PreparedCertificate pc) {
        this.latestPreparedCertificate = pc;
        this.latestPreparedProposal = proposal;
        this.name = StateName.COMMIT;
    }

    private void clearProposal() {
        this.proposalMessage = null;
        this.proposal = null;
        this.proposalHash = null;
    }

    long height() { return height; }
    long round() { return round; }
    View view() { return new View(height, round); }
    StateName name() { return name; }
    void name(StateName name) { this.name = name; }
    ConsensusMessage proposalMessage() { return proposalMessage; }
    Proposal proposal() { return proposal; }
    ByteString proposalHash() { return proposalHash; }
    PreparedCertificate latestPreparedCertificate() { return latestPreparedCertificate; }
    Proposal latestPreparedProposal() { return latestPreparedProposal; }
}
