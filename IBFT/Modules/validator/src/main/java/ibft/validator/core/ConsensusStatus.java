package ibft.validator.core;

public record ConsensusStatus(long height, long round, StateName state) {
    static ConsensusStatus idle() { return new ConsensusStatus(0, 0, StateName.IDLE); }
}
