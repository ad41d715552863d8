package org.pyken.emitter;

import org.pyken.ir.IrNode;
import org.pyken.ir.IrVisitorWithDefaults;
import org.pyken.ir.Lambda;
import org.pyken.ir.Let;
import org.pyken.ir.NameRef;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Gathers the names a translated body refers to, so the emitter can keep only
 * the imports and type declarations that are actually used.
 */
public class ReferenceCollector extends IrVisitorWithDefaults<Void, Void> {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Set<String> modules = new LinkedHashSet<>();
    private final Set<String> names = new LinkedHashSet<>();
    private final Set<String> values = new LinkedHashSet<>();

    public ReferenceCollector collect(IrNode node) {
        if (node != null) {
            node.accept(this, null);
        }
        return this;
    }

    /**
     * Record every identifier in an Aiken type expression such as {@code Option<Datum>}.
     */
    public ReferenceCollector collectType(String type) {
        if (type != null) {
            Matcher matcher = IDENTIFIER.matcher(type);
            while (matcher.find()) {
                names.add(matcher.group());
            }
        }
        return this;
    }

    @Override
    public Void visit(NameRef n, Void arg) {
        if (n.kind() == NameRef.Kind.VALUE) {
            values.add(n.name());
        } else if (n.kind() == NameRef.Kind.MODULE) {
            modules.add(n.name());
        } else if (n.kind() == NameRef.Kind.CONSTRUCTOR) {
            names.add(n.name());
            if (n.typeName() != null) {
                names.add(n.typeName());
            }
        }
        return super.visit(n, arg);
    }

    @Override
    public Void visit(Let n, Void arg) {
        collectType(n.type());
        values.add(n.name());
        return super.visit(n, arg);
    }

    @Override
    public Void visit(Lambda n, Void arg) {
        values.addAll(n.parameters());
        return super.visit(n, arg);
    }

    /** Module qualifiers used, such as {@code list}. */
    public Set<String> modules() {
        return modules;
    }

    /** Local value names bound or read, in first-seen order. */
    public Set<String> values() {
        return values;
    }

    /** Type and constructor names used, in first-seen order. */
    public Set<String> names() {
        return names;
    }
}
