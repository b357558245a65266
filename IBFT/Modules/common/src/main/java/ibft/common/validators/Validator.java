package ibft.common.validators;

import java.security.PublicKey;
import java.util.Objects;

public record Validator(String id, PublicKey publicKey) {
    public Validator {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(publicKey, "publicKey");
    }
}
