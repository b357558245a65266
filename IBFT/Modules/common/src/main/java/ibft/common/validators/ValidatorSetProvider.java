package ibft.common.validators;

/**
 * Source of per-height roster snapshots, owned by whatever tracks validator membership.
 */
@FunctionalInterface
public interface ValidatorSetProvider {
    ValidatorSet forHeight(long height);
}
