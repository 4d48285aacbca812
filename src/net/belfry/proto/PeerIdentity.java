package net.belfry.proto;

/**
 * Channel and player identifiers of a connection.
 * Both are read off the request path: the last segment names the player,
 * the one before it the channel. Case is not significant.
 */
public final class PeerIdentity {

    public static final String HOST = "host";

    private final String channelId;
    private final String playerId;

    public PeerIdentity(String channelId, String playerId) {
        this.channelId = channelId;
        this.playerId = playerId;
    }

    public String getChannelId() {
        return channelId;
    }

    public String getPlayerId() {
        return playerId;
    }

    public boolean isHost() {
        return HOST.equals(playerId);
    }

    public String toString() {
        return channelId + "/" + playerId;
    }

    /**
     * Derive an identity from a request path.
     * Missing segments resolve to the empty string; a trailing slash
     * counts as an (empty) segment.
     */
    public static PeerIdentity fromPath(String path) {
        if (path == null) path = "";
        String[] parts = path.toLowerCase().split("/", -1);
        int n = parts.length;
        String player = (n >= 1) ? parts[n - 1] : "";
        String channel = (n >= 2) ? parts[n - 2] : "";
        return new PeerIdentity(channel, player);
    }

}
