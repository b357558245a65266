package ibft.common.validation;

import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import ibft.common.messages.*;
import ibft.proto.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

// Converts consensus messages to and from the protobuf wire schema.
public final class MessageCodec {
    private MessageCodec() {}

    public static byte[] encode(ConsensusMessage message) {
        return serialize(toProto(message));
    }

    public static ConsensusMessage decode(byte[] data) throws DecodeException {
        if (data == null || data.length == 0) throw new DecodeException("empty payload");
        IbftMessage wire;
        try {
            wire = IbftMessage.parseFrom(data);
        } catch (InvalidProtocolBufferException e) {
            throw new DecodeException("bad payload: " + e.getMessage(), e);
        }
        return fromProto(wire);
    }

    public static byte[] signingBytes(ConsensusMessage message) {
        return serialize(toProto(message).toBuilder().clearSignature().build());
    }

    public static IbftMessage toProto(ConsensusMessage message) {
        IbftMessage.Builder b = IbftMessage.newBuilder()
                .setView(IbftView.newBuilder().setHeight(message.height()).setRound(message.round()))
                .setFrom(message.sender())
                .setSignature(message.signature())
                .setType(toWireType(message.type()));

        Payload payload = message.payload();
        if (payload instanceof PrePrepareData d) {
            PrePrepareMessage.Builder pb = PrePrepareMessage.newBuilder()
                    .setProposal(toProto(d.proposal()))
                    .setProposalHash(d.proposalHash());
            if (d.certificate() != null) {
                IbftRoundChangeCertificate.Builder rcc = IbftRoundChangeCertificate.newBuilder();
                d.certificate().roundChangeMessages().forEach(m -> rcc.addRoundChangeMessages(toProto(m)));
                pb.setCertificate(rcc);
            }
            b.setPreprepareData(pb);
        } else if (payload instanceof PrepareData d) {
            b.setPrepareData(PrepareMessage.newBuilder().setProposalHash(d.proposalHash()));
        } else if (payload instanceof CommitData d) {
            b.setCommitData(CommitMessage.newBuilder()
                    .setProposalHash(d.proposalHash())
                    .setCommittedSeal(d.committedSeal()));
        } else if (payload instanceof RoundChangeData d) {
            RoundChangeMessage.Builder rb = RoundChangeMessage.newBuilder();
            if (d.lastPreparedProposal() != null) {
                rb.setLastPreparedProposal(toProto(d.lastPreparedProposal()));
            }
            if (d.latestPreparedCertificate() != null) {
                PreparedCertificate pc = d.latestPreparedCertificate();
                IbftPreparedCertificate.Builder pcb = IbftPreparedCertificate.newBuilder()
                        .setProposalMessage(toProto(pc.proposalMessage()));
                pc.prepareMessages().forEach(m -> pcb.addPrepareMessages(toProto(m)));
                rb.setLatestPreparedCertificate(pcb);
            }
            b.setRoundChangeData(rb);
        }
        return b.build();
    }

    public static ConsensusMessage fromProto(IbftMessage wire) throws DecodeException {
        try {
            return convert(wire);
        } catch (IllegalArgumentException e) {
            // uint64 fields above Long.MAX_VALUE, checked by the domain records
            throw new DecodeException("bad field value: " + e.getMessage(), e);
        }
    }

    private static ConsensusMessage convert(IbftMessage wire) throws DecodeException {
        if (!wire.hasView()) throw new DecodeException("missing view");
        if (wire.getFrom().isEmpty()) throw new DecodeException("missing sender");

        MessageType type = fromWireType(wire.getType());
        View view = new View(wire.getView().getHeight(), wire.getView().getRound());
        Payload payload = switch (type) {
            case PRE_PREPARE -> {
                if (!wire.hasPreprepareData()) throw mismatch(type, wire);
                PrePrepareMessage p = wire.getPreprepareData();
                if (!p.hasProposal()) throw new DecodeException("PRE_PREPARE without proposal");
                RoundChangeCertificate rcc = null;
                if (p.hasCertificate()) {
                    rcc = new RoundChangeCertificate(fromProtoList(p.getCertificate().getRoundChangeMessagesList()));
                }
                yield new PrePrepareData(fromProto(p.getProposal()), p.getProposalHash(), rcc);
            }
            case PREPARE -> {
                if (!wire.hasPrepareData()) throw mismatch(type, wire);
                yield new PrepareData(wire.getPrepareData().getProposalHash());
            }
            case COMMIT -> {
                if (!wire.hasCommitData()) throw mismatch(type, wire);
                CommitMessage c = wire.getCommitData();
                yield new CommitData(c.getProposalHash(), c.getCommittedSeal());
            }
            case ROUND_CHANGE -> {
                if (!wire.hasRoundChangeData()) throw mismatch(type, wire);
                RoundChangeMessage r = wire.getRoundChangeData();
                PreparedCertificate pc = null;
                if (r.hasLatestPreparedCertificate()) {
                    IbftPreparedCertificate w = r.getLatestPreparedCertificate();
                    if (!w.hasProposalMessage()) throw new DecodeException("prepared certificate without PRE_PREPARE");
                    pc = new PreparedCertificate(convert(w.getProposalMessage()), fromProtoList(w.getPrepareMessagesList()));
                }
                Proposal last = r.hasLastPreparedProposal() ? fromProto(r.getLastPreparedProposal()) : null;
                yield new RoundChangeData(pc, last);
            }
        };
        return new ConsensusMessage(view, wire.getFrom(), payload, wire.getSignature());
    }

    private static List<ConsensusMessage> fromProtoList(List<IbftMessage> wires) throws DecodeException {
        List<ConsensusMessage> out = new ArrayList<>(wires.size());
        for (IbftMessage w : wires) out.add(convert(w));
        return out;
    }

    private static IbftProposal toProto(Proposal p) {
        return IbftProposal.newBuilder().setRawProposal(p.rawProposal()).setRound(p.round()).build();
    }

    private static Proposal fromProto(IbftProposal p) {
        return new Proposal(p.getRawProposal(), p.getRound());
    }

    private static IbftMessageType toWireType(MessageType t) {
        return switch (t) {
            case PRE_PREPARE -> IbftMessageType.PREPREPARE;
            case PREPARE -> IbftMessageType.PREPARE;
            case COMMIT -> IbftMessageType.COMMIT;
            case ROUND_CHANGE -> IbftMessageType.ROUND_CHANGE;
        };
    }

    private static MessageType fromWireType(IbftMessageType t) throws DecodeException {
        return switch (t) {
            case PREPREPARE -> MessageType.PRE_PREPARE;
            case PREPARE -> MessageType.PREPARE;
            case COMMIT -> MessageType.COMMIT;
            case ROUND_CHANGE -> MessageType.ROUND_CHANGE;
            case UNRECOGNIZED -> throw new DecodeException("unknown message type");
        };
    }

    private static DecodeException mismatch(MessageType type, IbftMessage wire) {
        return new DecodeException("type " + type + " carries payload " + wire.getPayloadCase());
    }

    private static byte[] serialize(IbftMessage msg) {
        byte[] out = new byte[msg.getSerializedSize()];
        CodedOutputStream cos = CodedOutputStream.newInstance(out);
        cos.useDeterministicSerialization();
        try {
            msg.writeTo(cos);
            cos.checkNoSpaceLeft();
        } catch (IOException e) {
            throw new IllegalStateException("serialization into a sized array failed", e);
        }
        return out;
    }
}
