package tessera.utils;

import java.util.regex.Pattern;

/**
 * Redis-style glob: {@code *}, {@code ?}, {@code [abc]}, {@code [^abc]}, {@code [a-z]} and
 * backslash escapes. Matching is done on Latin-1 text so that one char is one byte.
 */
public final class GlobPattern {
    private final Pattern regex;

    private GlobPattern(Pattern regex) {
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() + 8);
        int i = 0;
        while (i < glob.length()) {
            char ch = glob.charAt(i);
            switch (ch) {
                case '*':
                    sb.append(".*");
                    break;
                case '?':
                    sb.append('.');
                    break;
                case '\\':
                    if (i + 1 < glob.length()) {
                        i++;
                        sb.append(Pattern.quote(String.valueOf(glob.charAt(i))));
                    } else {
                        sb.append("\\\\");
                    }
                    break;
                case '[':
                    int end = classEnd(glob, i);
                    if (end < 0) {
                        // unterminated: treat '[' literally
                        sb.append("\\[");
                    } else {
                        sb.append(characterClass(glob.substring(i + 1, end)));
                        i = end;
                    }
                    break;
                default:
                    sb.append(Pattern.quote(String.valueOf(ch)));
            }
            i++;
        }
        return new GlobPattern(Pattern.compile(sb.toString(), Pattern.DOTALL));
    }

    public boolean matches(String text) {
        return regex.matcher(text).matches();
    }

    private static int classEnd(String glob, int open) {
        for (int j = open + 1; j < glob.length(); j++) {
            char ch = glob.charAt(j);
            if (ch == '\\') {
                j++;
            } else if (ch == ']' && j > open + 1) {
                return j;
            }
        }
        return -1;
    }

    private static String characterClass(String body) {
        StringBuilder sb = new StringBuilder("[");
        int k = 0;
        if (body.startsWith("^")) {
            sb.append('^');
            k = 1;
        }
        for (; k < body.length(); k++) {
            char ch = body.charAt(k);
            if (ch == '\\' && k + 1 < body.length()) {
                k++;
                ch = body.charAt(k);
                if (Character.isLetterOrDigit(ch)) sb.append(ch);
                else sb.append('\\').append(ch);
            } else if (ch == '-' && k > 0 && k + 1 < body.length()) {
                sb.append('-');
            } else if (Character.isLetterOrDigit(ch)) {
                sb.append(ch);
            } else {
                sb.append('\\').append(ch);
            }
        }
        return sb.append(']').toString();
    }
}
