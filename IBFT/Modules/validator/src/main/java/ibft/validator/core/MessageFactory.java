package ibft.validator.core;

import com.google.protobuf.ByteString;
import ibft.common.crypto.MessageSigning;
import ibft.common.crypto.Signatures;
import ibft.common.messages.CommitData;
import ibft.common.messages.ConsensusMessage;
import ibft.common.messages.Payload;
import ibft.common.messages.PrePrepareData;
import ibft.common.messages.PrepareData;
import ibft.common.messages.PreparedCertificate;
import ibft.common.messages.Proposal;
import ibft.common.messages.RoundChangeCertificate;
import ibft.common.messages.RoundChangeData;
import ibft.common.messages.View;

public final class MessageFactory {
    private final String selfId;
    private final Signatures signatures;

    public MessageFactory(String selfId, Signatures signatures) {
        this.selfId = selfId;
        this.signatures = signatures;
    }

    public ConsensusMessage prePrepare(View view, Proposal proposal, ByteString proposalHash,
                                       RoundChangeCertificate certificate) {
        return sign(view, new PrePrepareData(proposal, proposalHash, certificate));
    }

    public ConsensusMessage prepare(View view, ByteString proposalHash) {
        return sign(view, new PrepareData(proposalHash));
    }

    public ConsensusMessage commit(View view, ByteString proposalHash) {
        return sign(view, new CommitData(proposalHash, MessageSigning.seal(proposalHash, signatures)));
    }

    public ConsensusMessage roundChange(View view, PreparedCertificate latestPrepared, Proposal lastPreparedProposal) {
        return sign(view, new RoundChangeData(latestPrepared, lastPreparedProposal));
    }

    private ConsensusMessage sign(View view, Payload payload) {
        return MessageSigning.sign(ConsensusMessage.unsigned(view, selfId, payload), signatures);
    }
}
