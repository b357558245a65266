package ibft.common.messages;

import com.google.protobuf.ByteString;

public record CommittedSeal(String signer, ByteString signature) {}
