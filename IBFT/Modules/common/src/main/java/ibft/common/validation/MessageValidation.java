package ibft.common.validation;

public final class MessageValidation {
    public enum Code {
        OK,
        UNKNOWN_SIGNER,
        BAD_SIGNATURE,
        BAD_SEAL,
        NOT_PROPOSER,
        BAD_VIEW,
        BAD_HASH,
        BAD_CERTIFICATE,
        INVALID_PROPOSAL
    }

    public record Result(Code code, String reason) {
        public static Result ok() { return new Result(Code.OK, ""); }

        public static Result fail(Code code, String reason) { return new Result(code, reason); }

        public boolean isOk() { return code == Code.OK; }

        public boolean isSignatureError() { return code == Code.BAD_SIGNATURE || code == Code.BAD_SEAL; }
    }

    private MessageValidation() {}
}
