package io.statutedsl.core.engine;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Glob matching for {@code LIKE}: {@code *} matches any run of characters, {@code ?} exactly one,
 * everything else matches itself. The whole text must match.
 */
public final class GlobPattern {

    private static final int MAX_CACHED = 1024;

    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();

    private GlobPattern() {
        // utility class
    }

    /** Translates a glob into an anchored regular expression. */
    public static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder("^");
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.append('$').toString();
    }

    public static boolean matches(String glob, String text, boolean caseSensitive) {
        return compile(glob, caseSensitive).matcher(text).matches();
    }

    static Pattern compile(String glob, boolean caseSensitive) {
        String key = (caseSensitive ? "s:" : "i:") + glob;
        Pattern cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }
        int flags = Pattern.DOTALL | (caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        Pattern pattern = Pattern.compile(toRegex(glob), flags);
        if (CACHE.size() < MAX_CACHED) {
            CACHE.put(key, pattern);
        }
        return pattern;
    }
}
