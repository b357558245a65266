package ibft.validator.core;

/**
 * Receives every finalized proposal; applying and persisting it is the sink's business.
 * Called on the consensus thread.
 */
@FunctionalInterface
public interface FinalizationSink {
    void insertProposal(FinalizedProposal finalized);
}
