package org.pyken;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps source paths to artifact paths. Each segment is lower-cased and every
 * character outside {@code [a-z0-9_]} becomes {@code _}; the {@code .py}
 * extension is replaced by {@code .ak}. Two sources that land on the same
 * artifact are told apart with {@code _1}, {@code _2}, ... in input order.
 */
final class OutputPaths {

    private OutputPaths() {
    }

    /**
     * @param sources relative source paths with {@code /} separators, already sorted
     * @return source path → relative artifact path, in input order
     */
    static Map<String, String> assign(List<String> sources) {
        Map<String, String> result = new LinkedHashMap<>();
        Set<String> taken = new HashSet<>();
        for (String source : sources) {
            String base = artifactBase(source);
            String candidate = base + ".ak";
            int suffix = 0;
            while (!taken.add(candidate)) {
                candidate = base + "_" + (++suffix) + ".ak";
            }
            result.put(source, candidate);
        }
        return result;
    }

    /** {@code Examples/Module 102/Always-succeed.py} → {@code examples/module_102/always_succeed}. */
    static String artifactBase(String source) {
        String withoutExtension = source.endsWith(".py") ? source.substring(0, source.length() - 3) : source;
        String[] segments = withoutExtension.split("/");
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            if (segment.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(segment(segment));
        }
        return sb.toString();
    }

    static String segment(String segment) {
        String lower = segment.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(lower.length());
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            sb.append((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' ? c : '_');
        }
        return sb.toString();
    }
}
