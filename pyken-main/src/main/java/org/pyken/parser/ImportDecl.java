package org.pyken.parser;

import java.util.List;

/**
 * A module-level import of an {@code aiken} or {@code cardano} module.
 *
 * @param module slash-separated module path, e.g. {@code cardano/transaction}
 * @param alias  {@code import x as alias}, or {@code null}
 * @param names  imported names for {@code from x import ...}; empty for a plain import
 */
public record ImportDecl(String module, String alias, List<ImportedName> names) {

    public record ImportedName(String name, String alias) {

        public String boundName() {
            return alias != null ? alias : name;
        }
    }

    public ImportDecl {
        names = List.copyOf(names);
    }

    public boolean isPlain() {
        return names.isEmpty();
    }

    /** The name a plain import binds in the module: its alias or its last segment. */
    public String boundName() {
        if (alias != null) {
            return alias;
        }
        int slash = module.lastIndexOf('/');
        return slash < 0 ? module : module.substring(slash + 1);
    }
}
