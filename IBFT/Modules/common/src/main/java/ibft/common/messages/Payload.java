package ibft.common.messages;

public sealed interface Payload permits PrePrepareData, PrepareData, CommitData, RoundChangeData {
    MessageType type();
}
