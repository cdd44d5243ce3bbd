package net.spookly.arbiter.util;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Compiled path template such as {@code /users/:id/posts/*}.
 * <p>
 * A {@code :name} segment matches one non-empty path segment and {@code *} matches any suffix.
 * Everything else is matched literally against the whole path.
 */
public final class PathTemplate {
    private final String template;
    private final Pattern pattern;

    private PathTemplate(String template, Pattern pattern) {
        this.template = template;
        this.pattern = pattern;
    }

    public static PathTemplate compile(String template) {
        Objects.requireNonNull(template, "template");
        StringBuilder regex = new StringBuilder("^");
        int index = 0;
        while (index < template.length()) {
            char current = template.charAt(index);
            if (current == ':' && index + 1 < template.length() && isNameChar(template.charAt(index + 1))) {
                int end = index + 1;
                while (end < template.length() && isNameChar(template.charAt(end))) {
                    end++;
                }
                regex.append("[^/]+");
                index = end;
                continue;
            }
            if (current == '*') {
                regex.append(".*");
            } else {
                regex.append(Pattern.quote(String.valueOf(current)));
            }
            index++;
        }
        regex.append('$');
        return new PathTemplate(template, Pattern.compile(regex.toString()));
    }

    public boolean matches(String path) {
        if (path == null) {
            return false;
        }
        return pattern.matcher(path).matches();
    }

    public String template() {
        return template;
    }

    @Override
    public String toString() {
        return template;
    }

    private static boolean isNameChar(char value) {
        return Character.isLetterOrDigit(value) || value == '_';
    }
}
