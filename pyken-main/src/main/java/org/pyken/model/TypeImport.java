package org.pyken.model;

import java.util.Comparator;

/**
 * A name that must be brought into scope with {@code use module.{name}}.
 *
 * @param name the imported name, or {@code Name as Alias}
 */
public record TypeImport(String module, String name) implements Comparable<TypeImport> {

    private static final Comparator<TypeImport> ORDER =
            Comparator.comparing(TypeImport::module).thenComparing(TypeImport::name);

    @Override
    public int compareTo(TypeImport other) {
        return ORDER.compare(this, other);
    }
}
