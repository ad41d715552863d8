package org.pyken.parser;

import org.pyken.diagnostic.SourceLocation;
import org.pyken.parser.ast.Expr;

import java.util.List;
import java.util.Optional;

/**
 * A data type declared by a top-level class.
 */
public sealed interface TypeDecl {

    String name();

    SourceLocation location();

    /**
     * A class whose body only binds names to literals. Each binding becomes a
     * constructor without fields.
     */
    record SumType(String name, List<Member> members, SourceLocation location) implements TypeDecl {

        public SumType {
            members = List.copyOf(members);
        }

        public boolean hasMember(String member) {
            return members.stream().anyMatch(m -> m.name().equals(member));
        }

        /** The member a string tag refers to, by member name or by literal value. */
        public Optional<String> memberFor(String tag) {
            for (Member member : members) {
                if (member.name().equals(tag)) {
                    return Optional.of(member.name());
                }
            }
            for (Member member : members) {
                if (member.value() instanceof Expr.StringLiteral literal && literal.value().equals(tag)) {
                    return Optional.of(member.name());
                }
            }
            return Optional.empty();
        }
    }

    record Member(String name, Expr value) {}

    /** A class with annotated fields or an annotated {@code __init__}. */
    record RecordType(String name, List<Field> fields, SourceLocation location) implements TypeDecl {

        public RecordType {
            fields = List.copyOf(fields);
        }
    }

    record Field(String name, Expr annotation) {}
}
