package ibft.common.messages;

public record RoundChangeData(PreparedCertificate latestPreparedCertificate, Proposal lastPreparedProposal)
        implements Payload {

    public static RoundChangeData empty() { return new RoundChangeData(null, null); }

    @Override public MessageType type() { return MessageType.ROUND_CHANGE; }
}
