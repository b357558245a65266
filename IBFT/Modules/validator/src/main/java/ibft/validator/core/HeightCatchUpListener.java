package ibft.validator.core;

/**
 * Told when a validator sees traffic for a height beyond the one it is running.
 * Called on the consensus thread, must not block.
 */
@FunctionalInterface
public interface HeightCatchUpListener {
    void onFutureHeight(long height, String reportedBy);

    HeightCatchUpListener NONE = (height, reportedBy) -> {};
}
