package ibft.common.validators;

/**
 * Deterministic choice of the proposer for a height and round.
 */
@FunctionalInterface
public interface ProposerSchedule {

    /**
     * @return index into {@link ValidatorSet#validators()}
     */
    int proposerIndex(int validatorCount, long height, long round);

    static ProposerSchedule roundRobin() {
        return (n, height, round) -> (int) Long.remainderUnsigned(height + round, n);
    }
}
