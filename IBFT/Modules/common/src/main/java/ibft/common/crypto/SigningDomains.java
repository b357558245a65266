package ibft.common.crypto;

import ibft.common.messages.MessageType;

public final class SigningDomains {
    private SigningDomains() {}

    public static final String PRE_PREPARE    = "IBFT:PRE-PREPARE";
    public static final String PREPARE        = "IBFT:PREPARE";
    public static final String COMMIT         = "IBFT:COMMIT";
    public static final String ROUND_CHANGE   = "IBFT:ROUND-CHANGE";
    public static final String COMMITTED_SEAL = "IBFT:COMMITTED-SEAL";

    public static String forType(MessageType type) {
        return switch (type) {
            case PRE_PREPARE -> PRE_PREPARE;
            case PREPARE -> PREPARE;
            case COMMIT -> COMMIT;
            case ROUND_CHANGE -> ROUND_CHANGE;
        };
    }
}
