package ibft.common.messages;

import java.util.List;

public record RoundChangeCertificate(List<ConsensusMessage> roundChangeMessages) {
    public RoundChangeCertificate {
        roundChangeMessages = List.copyOf(roundChangeMessages);
    }
}
