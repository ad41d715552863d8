package org.pyken.emitter;

import org.pyken.diagnostic.DiagnosticKind;
import org.pyken.diagnostic.DiagnosticSink;
import org.pyken.diagnostic.SourceLocation;
import org.pyken.ir.NameRef;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Turns Python identifiers into valid Aiken value names.
 * <p>
 * Names are converted to snake_case, stripped of leading underscores (Aiken
 * reads {@code _x} as a discarded binding) and suffixed with {@code _} when
 * they hit a reserved word. Two Python names that end up identical are told
 * apart with {@code _1}, {@code _2}, ... in the order they are first seen,
 * and an {@link DiagnosticKind#IDENTIFIER_COLLISION} is reported.
 * <p>
 * One instance covers one naming scope: the module, or the locals of a single
 * function. A function scope starts with the module's names reserved, so a
 * local never shadows a function or module qualifier the output refers to.
 */
public final class IdentifierSanitizer {

    private static final Set<String> RESERVED = Set.of(
            "if", "fn", "let", "when", "is", "expect", "trace", "fail", "todo", "use", "pub", "type",
            "opaque", "const", "test", "validator", "else", "as", "and", "or", "via", "bench", "once");

    private final DiagnosticSink sink;
    private final String function;
    private final SourceLocation location;
    private final Map<String, String> assigned = new HashMap<>();
    private final Set<String> taken = new HashSet<>();

    /**
     * @param function function the scope belongs to, or {@code null} for the module scope
     * @param location where collisions are reported when no better position is given
     */
    public IdentifierSanitizer(DiagnosticSink sink, String function, SourceLocation location) {
        this.sink = sink;
        this.function = function;
        this.location = location;
    }

    public String name(String python) {
        return name(python, location);
    }

    /**
     * The Aiken name for {@code python}. The same Python name always gets the same answer.
     */
    public String name(String python, SourceLocation at) {
        String existing = assigned.get(python);
        if (existing != null) {
            return existing;
        }
        boolean synthetic = python.startsWith(NameRef.SYNTHETIC_PREFIX);
        String base = sanitize(synthetic ? python.substring(NameRef.SYNTHETIC_PREFIX.length()) : python);
        String candidate = base;
        int suffix = 0;
        while (taken.contains(candidate)) {
            candidate = base + "_" + (++suffix);
        }
        if (suffix > 0 && !synthetic) {
            sink.report(DiagnosticKind.IDENTIFIER_COLLISION, at, function,
                        "'" + python + "' collides with another name as '" + base + "'; renamed to '" + candidate + "'");
        }
        assigned.put(python, candidate);
        taken.add(candidate);
        return candidate;
    }

    /**
     * Keep {@code names} out of this scope without binding any Python name to
     * them, so a later name that sanitises to one of them is suffixed.
     */
    public IdentifierSanitizer reserve(Collection<String> names) {
        taken.addAll(names);
        return this;
    }

    /** Aiken names handed out or reserved so far. */
    public Set<String> taken() {
        return Collections.unmodifiableSet(taken);
    }

    /** Sanitised name without collision tracking. */
    public static String sanitize(String python) {
        String name = snakeCase(python);
        int start = 0;
        while (start < name.length() && name.charAt(start) == '_') {
            start++;
        }
        name = name.substring(start);
        if (name.isEmpty()) {
            name = "value";
        }
        return RESERVED.contains(name) ? name + "_" : name;
    }

    /**
     * Record field or accessor name. Tuple accessors such as {@code 1st} are already valid and pass through.
     */
    public static String field(String name) {
        if (!name.isEmpty() && Character.isDigit(name.charAt(0))) {
            return name;
        }
        return sanitize(name);
    }

    public static boolean isReserved(String name) {
        return RESERVED.contains(name);
    }

    /**
     * {@code checkOwner} → {@code check_owner}, {@code HTTPServer} → {@code http_server}.
     */
    public static String snakeCase(String name) {
        StringBuilder sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    char prev = name.charAt(i - 1);
                    boolean nextLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                    if (prev != '_' && (Character.isLowerCase(prev) || Character.isDigit(prev)
                            || (Character.isUpperCase(prev) && nextLower))) {
                        sb.append('_');
                    }
                }
                sb.append(Character.toLowerCase(c));
            } else if (Character.isLetterOrDigit(c) || c == '_') {
                sb.append(c);
            } else {
                sb.append('_');
            }
        }
        return sb.toString();
    }
}
