package com.threatintel.auth.inside;

import org.jboss.logging.Logger;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matches URLs against an event's URL pattern, which may be written either as a
 * regular expression or as a shell-style glob.
 * <p>
 * Both readings are tried: as a regular expression the pattern may match
 * anywhere in the URL; as a glob it must match the whole URL. A URL matches when
 * either reading that compiles matches it.
 */
public final class UrlPatternMatcher {

    private static final Logger LOG = Logger.getLogger(UrlPatternMatcher.class);

    private final String pattern;
    private final Pattern regex;
    private final Pattern glob;

    private UrlPatternMatcher(String pattern, Pattern regex, Pattern glob) {
        this.pattern = pattern;
        this.regex = regex;
        this.glob = glob;
    }

    /**
     * @return the matcher, or null if the pattern compiles in neither syntax (the problem is logged)
     */
    public static UrlPatternMatcher compile(String pattern) {
        Pattern regex = null;
        Pattern glob = null;
        PatternSyntaxException regexError = null;
        try {
            regex = Pattern.compile(pattern, Pattern.UNICODE_CHARACTER_CLASS);
        } catch (PatternSyntaxException e) {
            regexError = e;
        }
        try {
            glob = Pattern.compile(translateGlob(pattern), Pattern.DOTALL);
        } catch (PatternSyntaxException e) {
            LOG.warnf("Cannot process url_pattern '%s' (as a regular expression: %s; as a glob: %s)",
                    pattern,
                    regexError != null ? regexError.getDescription() : "ok",
                    e.getDescription());
        }
        if (regex == null && glob == null) {
            return null;
        }
        return new UrlPatternMatcher(pattern, regex, glob);
    }

    public boolean matches(String url) {
        if (regex != null && regex.matcher(url).find()) {
            return true;
        }
        return glob != null && glob.matcher(url).matches();
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * Translates a shell-style glob ({@code *}, {@code ?}, {@code [seq]},
     * {@code [!seq]}) into an equivalent regular expression.
     */
    static String translateGlob(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() * 2);
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[') {
                int j = i;
                if (j < n && glob.charAt(j) == '!') {
                    j++;
                }
                if (j < n && glob.charAt(j) == ']') {
                    j++;
                }
                while (j < n && glob.charAt(j) != ']') {
                    j++;
                }
                if (j >= n) {
                    regex.append("\\[");
                } else {
                    String content = glob.substring(i, j).replace("\\", "\\\\");
                    i = j + 1;
                    if (content.startsWith("!")) {
                        content = "^" + content.substring(1);
                    } else if (content.startsWith("^")) {
                        content = "\\" + content;
                    }
                    content = content.replace("[", "\\[").replace("&&", "\\&\\&");
                    regex.append('[').append(content).append(']');
                }
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }
}
