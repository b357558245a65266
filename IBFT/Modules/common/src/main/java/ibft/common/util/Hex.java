package ibft.common.util;

import com.google.protobuf.ByteString;

public final class Hex {
    private static final int SHORT_BYTES = 4;

    private Hex() {}

    public static String toHex(byte[] data) {
        if (data == null) return "";
        StringBuilder sb = new StringBuilder(data.length * 2);
        for (byte b : data) {
            sb.append(Character.forDigit((b >>> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }

    public static String shortHex(ByteString hash) {
        if (hash == null || hash.isEmpty()) return "-";
        return toHex(hash.substring(0, Math.min(SHORT_BYTES, hash.size())).toByteArray());
    }
}
