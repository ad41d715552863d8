package org.pyken.parser;

/**
 * Decodes Python string tokens: prefix, quoting and backslash escapes.
 */
final class StringLiterals {

    record Decoded(String value, boolean bytes, boolean formatted) {}

    private StringLiterals() {
    }

    static Decoded decode(String token) {
        int quote = 0;
        while (quote < token.length() && token.charAt(quote) != '\'' && token.charAt(quote) != '"') {
            quote++;
        }
        String prefix = token.substring(0, quote).toLowerCase();
        String body = token.substring(quote);
        int delimiter = body.startsWith("\"\"\"") || body.startsWith("'''") ? 3 : 1;
        String content = body.substring(delimiter, body.length() - delimiter);

        boolean raw = prefix.indexOf('r') >= 0;
        boolean bytes = prefix.indexOf('b') >= 0;
        boolean formatted = prefix.indexOf('f') >= 0;
        return new Decoded(raw ? content : unescape(content, bytes), bytes, formatted);
    }

    static String unescape(String content, boolean bytes) {
        if (content.indexOf('\\') < 0) {
            return content;
        }
        StringBuilder sb = new StringBuilder(content.length());
        int i = 0;
        while (i < content.length()) {
            char ch = content.charAt(i);
            if (ch != '\\' || i + 1 >= content.length()) {
                sb.append(ch);
                i++;
                continue;
            }
            char next = content.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\n':
                    break;
                case '\\':
                case '\'':
                case '"':
                    sb.append(next);
                    break;
                case 'n':
                    sb.append('\n');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                case '0':
                    sb.append('\0');
                    break;
                case 'x':
                    if (i + 2 <= content.length()) {
                        sb.append((char) Integer.parseInt(content.substring(i, i + 2), 16));
                        i += 2;
                    }
                    break;
                case 'u':
                    if (!bytes && i + 4 <= content.length()) {
                        sb.append((char) Integer.parseInt(content.substring(i, i + 4), 16));
                        i += 4;
                    } else {
                        sb.append('\\').append(next);
                    }
                    break;
                default:
                    // unknown escapes keep their backslash, as in Python
                    sb.append('\\').append(next);
                    break;
            }
        }
        return sb.toString();
    }
}
