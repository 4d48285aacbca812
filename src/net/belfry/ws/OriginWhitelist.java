package net.belfry.ws;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import net.belfry.api.AdmissionPolicy;

/**
 * Admits connections whose Origin header starts with a match of any of a
 * list of patterns.
 * Requests without an Origin are refused.
 */
public class OriginWhitelist implements AdmissionPolicy {

    public static final String DEFAULT_PATTERN =
        "^https?://([^.]+\\.github\\.io|localhost|clocktower\\.online|" +
        "eddbra1nprivatetownsquare\\.xyz)";

    private final List<Pattern> patterns;

    public OriginWhitelist() {
        patterns = new ArrayList<Pattern>();
    }
    public OriginWhitelist(String pattern) {
        this();
        add(pattern);
    }

    public OriginWhitelist add(Pattern p) {
        patterns.add(p);
        return this;
    }
    public OriginWhitelist add(String p) {
        return add(Pattern.compile(p, Pattern.CASE_INSENSITIVE));
    }

    public boolean admit(String origin) {
        if (origin == null || origin.isEmpty()) return false;
        for (Pattern p : patterns) {
            if (p.matcher(origin).lookingAt()) return true;
        }
        return false;
    }

    public static OriginWhitelist makeDefault() {
        return new OriginWhitelist(DEFAULT_PATTERN);
    }

}
