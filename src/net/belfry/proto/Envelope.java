package net.belfry.proto;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * A decoded inbound payload.
 * Payloads are JSON arrays whose first element is a type tag; only the tag
 * is inspected up front, everything else is relayed as is. Payloads that
 * are not tagged arrays, or carry an unknown tag, are plain broadcasts.
 */
public abstract class Envelope {

    public enum Kind { PING, DIRECT, BROADCAST }

    public static final String TAG_PING = "ping";
    public static final String TAG_DIRECT = "direct";

    /**
     * Placeholder in ping payloads that is replaced by the latency
     * estimate.
     */
    public static final String LATENCY_FIELD = "latency";

    /**
     * Latency probe between a host and a player.
     */
    public static final class Ping extends Envelope {

        private Ping(String raw) {
            super(raw);
        }

        public Kind getKind() {
            return Kind.PING;
        }

        /**
         * The payload with its latency placeholder replaced by latency.
         * A quoted placeholder in value position is replaced including its
         * quotes, so that the value arrives as a number. Otherwise the
         * first bare occurrence is replaced, which keeps an object key
         * quoted. The rest of the payload is untouched.
         */
        public String withLatency(long latency) {
            String raw = getRaw();
            String value = Long.toString(latency);
            String quoted = "\"" + LATENCY_FIELD + "\"";
            int idx = raw.indexOf(quoted);
            while (idx != -1) {
                int end = idx + quoted.length();
                if (! isFollowedByColon(raw, end))
                    return raw.substring(0, idx) + value + raw.substring(end);
                idx = raw.indexOf(quoted, end);
            }
            idx = raw.indexOf(LATENCY_FIELD);
            if (idx != -1)
                return raw.substring(0, idx) + value +
                    raw.substring(idx + LATENCY_FIELD.length());
            return raw;
        }

        private static boolean isFollowedByColon(String raw, int from) {
            for (int i = from; i < raw.length(); i++) {
                char ch = raw.charAt(i);
                if (! Character.isWhitespace(ch)) return ch == ':';
            }
            return false;
        }

    }

    /**
     * Individual payloads for some of the channel's players.
     */
    public static final class Direct extends Envelope {

        private final JSONObject targets;

        private Direct(String raw) throws JSONException {
            super(raw);
            this.targets = new JSONArray(raw).getJSONObject(1);
        }

        public Kind getKind() {
            return Kind.DIRECT;
        }

        public boolean isAddressedTo(String playerId) {
            return targets.has(playerId);
        }

        /**
         * The serialized payload for playerId, or null if there is none.
         */
        public String payloadFor(String playerId) {
            if (! targets.has(playerId)) return null;
            return JSONObject.valueToString(targets.get(playerId));
        }

    }

    /**
     * Anything else; relayed verbatim to every other member.
     */
    public static final class Broadcast extends Envelope {

        private Broadcast(String raw) {
            super(raw);
        }

        public Kind getKind() {
            return Kind.BROADCAST;
        }

    }

    private final String raw;

    private Envelope(String raw) {
        this.raw = raw;
    }

    public abstract Kind getKind();

    public String getRaw() {
        return raw;
    }

    /**
     * Decode a payload.
     * Throws JSONException only if the payload is tagged as a direct
     * message but does not carry an object of per-player payloads as its
     * second element.
     */
    public static Envelope decode(String raw) throws JSONException {
        String tag = readTag(raw);
        if (TAG_PING.equals(tag)) {
            return new Ping(raw);
        } else if (TAG_DIRECT.equals(tag)) {
            return new Direct(raw);
        } else {
            return new Broadcast(raw);
        }
    }

    /**
     * Extract the lower-cased type tag of a payload.
     * Returns null if raw does not start with a JSON array whose first
     * element is a string.
     */
    public static String readTag(String raw) {
        if (raw == null) return null;
        try {
            JSONTokener tok = new JSONTokener(raw);
            if (tok.nextClean() != '[') return null;
            Object first = tok.nextValue();
            if (! (first instanceof String)) return null;
            return ((String) first).toLowerCase();
        } catch (JSONException exc) {
            return null;
        }
    }

}
