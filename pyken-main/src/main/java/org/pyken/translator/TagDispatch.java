package org.pyken.translator;

import org.pyken.parser.SourceModule;
import org.pyken.parser.TypeDecl;
import org.pyken.parser.ast.Expr;
import org.pyken.parser.ast.Stmt;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recognises {@code if/elif} chains that dispatch on the tag of one variable.
 * <p>
 * A chain qualifies when every test compares the same name against literal tags
 * ({@code x == tag}, {@code tag == x} or {@code x in (tag, ...)}), the tags are
 * pairwise distinct and of one kind (constructors of one declared sum type, or
 * integers), and the chain either ends with {@code else} or names every member
 * of the sum type. Anything else yields no plan; the caller then keeps the
 * nested conditionals. This class only inspects the tree and never reports.
 */
public final class TagDispatch {

    /**
     * A constructor of a declared sum type, or an integer.
     */
    public record Tag(String typeName, String member, BigInteger value) {

        static Tag constructor(String typeName, String member) {
            return new Tag(typeName, member, null);
        }

        static Tag integer(BigInteger value) {
            return new Tag(null, null, value);
        }

        public boolean isConstructor() {
            return member != null;
        }
    }

    public record Arm(List<Tag> tags, List<Stmt> body) {}

    /**
     * @param wildcard body of the trailing {@code else}, or {@code null} when the tags are exhaustive
     */
    public record Plan(String subject, List<Arm> arms, List<Stmt> wildcard) {

        public boolean hasWildcard() {
            return wildcard != null;
        }
    }

    private record Candidate(String subject, List<Expr> tags) {}

    private record Branch(Expr test, List<Stmt> body) {}

    private final SourceModule module;

    public TagDispatch(SourceModule module) {
        this.module = module;
    }

    public Optional<Plan> analyze(Stmt.If chain, BindingTable scope) {
        List<Branch> branches = new ArrayList<>();
        List<Stmt> elseBody;
        Stmt.If current = chain;
        while (true) {
            branches.add(new Branch(current.test(), current.body()));
            List<Stmt> orElse = current.orElse();
            if (orElse.size() == 1 && orElse.get(0) instanceof Stmt.If next) {
                current = next;
                continue;
            }
            elseBody = orElse.isEmpty() ? null : orElse;
            break;
        }
        if (branches.size() < 2) {
            return Optional.empty();
        }

        String subject = null;
        List<Candidate> candidates = new ArrayList<>();
        for (Branch branch : branches) {
            Candidate candidate = candidate(branch.test());
            if (candidate == null || (subject != null && !subject.equals(candidate.subject()))) {
                return Optional.empty();
            }
            subject = candidate.subject();
            candidates.add(candidate);
        }

        Set<String> owners = tagOwners(candidates);
        if (owners.size() > 1) {
            return Optional.empty();
        }
        InferredType subjectType = scope.typeOrUnknown(subject);
        String typeName = !owners.isEmpty() ? owners.iterator().next()
                : subjectType.isKnown() ? subjectType.name() : null;
        Optional<TypeDecl.SumType> sumType = typeName == null ? Optional.empty() : module.sumType(typeName);

        Set<Tag> seen = new HashSet<>();
        Boolean constructors = null;
        List<Arm> arms = new ArrayList<>();
        for (int i = 0; i < branches.size(); i++) {
            List<Tag> tags = new ArrayList<>();
            for (Expr expr : candidates.get(i).tags()) {
                Tag tag = tag(expr, sumType.orElse(null));
                if (tag == null || !seen.add(tag)) {
                    return Optional.empty();
                }
                if (constructors != null && constructors != tag.isConstructor()) {
                    return Optional.empty();
                }
                constructors = tag.isConstructor();
                tags.add(tag);
            }
            arms.add(new Arm(List.copyOf(tags), branches.get(i).body()));
        }

        if (elseBody == null) {
            boolean exhaustive = sumType.isPresent() && Boolean.TRUE.equals(constructors)
                    && seen.size() == sumType.get().members().size();
            if (!exhaustive) {
                return Optional.empty();
            }
        }
        return Optional.of(new Plan(subject, List.copyOf(arms), elseBody));
    }

    private static Candidate candidate(Expr test) {
        if (!(test instanceof Expr.Compare compare) || compare.operators().size() != 1) {
            return null;
        }
        String operator = compare.operators().get(0);
        Expr left = compare.left();
        Expr right = compare.comparators().get(0);
        if (operator.equals("==")) {
            if (left instanceof Expr.Name name && !(right instanceof Expr.Name)) {
                return new Candidate(name.id(), List.of(right));
            }
            if (right instanceof Expr.Name name && !(left instanceof Expr.Name)) {
                return new Candidate(name.id(), List.of(left));
            }
            return null;
        }
        if (operator.equals("in") && left instanceof Expr.Name name) {
            List<Expr> elements = right instanceof Expr.TupleDisplay tuple ? tuple.elements()
                    : right instanceof Expr.ListDisplay list ? list.elements() : List.of();
            return elements.isEmpty() ? null : new Candidate(name.id(), elements);
        }
        return null;
    }

    /** Type names used as qualifiers in {@code Type.Member} tags. */
    private static Set<String> tagOwners(List<Candidate> candidates) {
        Set<String> owners = new HashSet<>();
        for (Candidate candidate : candidates) {
            for (Expr tag : candidate.tags()) {
                if (tag instanceof Expr.Attribute attribute && attribute.value() instanceof Expr.Name owner) {
                    owners.add(owner.id());
                }
            }
        }
        return owners;
    }

    /** An integer, {@code Type.Member}, a bare member name, or a string naming a member. */
    private static Tag tag(Expr expr, TypeDecl.SumType sumType) {
        if (expr instanceof Expr.IntLiteral literal) {
            return Tag.integer(literal.value());
        }
        if (sumType == null) {
            return null;
        }
        if (expr instanceof Expr.Attribute attribute
                && attribute.value() instanceof Expr.Name owner
                && owner.id().equals(sumType.name())
                && sumType.hasMember(attribute.attribute())) {
            return Tag.constructor(sumType.name(), attribute.attribute());
        }
        if (expr instanceof Expr.Name name && sumType.hasMember(name.id())) {
            return Tag.constructor(sumType.name(), name.id());
        }
        if (expr instanceof Expr.StringLiteral literal) {
            return sumType.memberFor(literal.value())
                    .map(member -> Tag.constructor(sumType.name(), member))
                    .orElse(null);
        }
        return null;
    }
}
