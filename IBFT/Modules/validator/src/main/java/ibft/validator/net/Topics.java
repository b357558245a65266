package ibft.validator.net;

public final class Topics {
    private Topics() {}

    public static String forShard(String protocol, int shardId) {
        return protocol + "/shard/" + shardId;
    }
}
