package ibft.validator.core;

import com.google.protobuf.ByteString;
import ibft.common.messages.View;

/**
 * Supplies candidate blocks and judges proposals made by others.
 */
public interface ProposalSource {

    ByteString buildProposal(View view);

    default boolean isValidProposal(ByteString rawProposal) {
        return !rawProposal.isEmpty();
    }
}
