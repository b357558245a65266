package ibft.validator.core;

public enum StateName {
    IDLE,
    NEW_ROUND,
    PRE_PREPARE,
    PREPARE,
    COMMIT,
    ROUND_CHANGE,
    FINALIZED
}
