package ibft.common.messages;

public enum MessageType {
    PRE_PREPARE, PREPARE, COMMIT, ROUND_CHANGE
}
