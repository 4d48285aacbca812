package net.belfry.util;

public final class Util {

    private Util() {}

    public static boolean nonempty(String s) {
        return (s != null && ! s.isEmpty());
    }

    /**
     * Split a "key=value" string at its first equals sign.
     * Returns null if there is none.
     */
    public static String[] splitPair(String s) {
        int idx = s.indexOf('=');
        if (idx == -1) return null;
        return new String[] { s.substring(0, idx), s.substring(idx + 1) };
    }

}
