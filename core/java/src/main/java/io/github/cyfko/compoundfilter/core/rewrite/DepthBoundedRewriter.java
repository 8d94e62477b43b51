package io.github.cyfko.compoundfilter.core.rewrite;

import io.github.cyfko.compoundfilter.core.config.RewritePolicy;
import io.github.cyfko.compoundfilter.core.exception.FilterComplexityException;
import io.github.cyfko.compoundfilter.core.exception.IncompleteRuleException;
import io.github.cyfko.compoundfilter.core.exception.InvalidStructureException;
import io.github.cyfko.compoundfilter.core.model.FilterGroup;
import io.github.cyfko.compoundfilter.core.model.FilterNode;
import io.github.cyfko.compoundfilter.core.model.FilterPath;
import io.github.cyfko.compoundfilter.core.model.FilterRule;
import io.github.cyfko.compoundfilter.core.model.GroupOperator;
import io.github.cyfko.compoundfilter.core.wire.WireCompoundFilter;
import io.github.cyfko.compoundfilter.core.wire.WireFilter;
import io.github.cyfko.compoundfilter.core.wire.WirePropertyFilter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Rewrites a negation-free filter tree of any depth into an equivalent remote filter whose
 * compound nesting stays within {@link RewritePolicy#maxNestingDepth()}.
 * <p>
 * The tree is converted bottom-up with the depth of every group tracked from the root:
 * </p>
 * <ol>
 *   <li><strong>Children first.</strong> Each child is converted with its own depth.</li>
 *   <li><strong>Associative flattening.</strong> A converted child compound with its parent's
 *       connective is spliced into the parent: {@code (A ∨ B) ∨ C → A ∨ B ∨ C}. A compound left
 *       with a single member is replaced by that member.</li>
 *   <li><strong>Boundary rewriting.</strong> A group at depth {@code maxNestingDepth - 1} may only
 *       hold one further level of compounds. Its whole subtree is rewritten into a two-level
 *       normal form by the distributive laws, trading depth for breadth:
 *       <ul>
 *         <li>an AND group becomes an OR of conjunctions: {@code a ∧ (b ∨ c) → (a ∧ b) ∨ (a ∧ c)}</li>
 *         <li>an OR group becomes an AND of disjunctions: {@code a ∨ (b ∧ c) → (a ∨ b) ∧ (a ∨ c)}</li>
 *       </ul>
 *       Several OR groups under one AND are combined by cartesian product, one operand taken from
 *       each: {@code (a ∨ b) ∧ (c ∨ d) → (a∧c) ∨ (a∧d) ∨ (b∧c) ∨ (b∧d)}. A subtree without opposite
 *       connectives simply flattens.</li>
 *   <li><strong>Check.</strong> The output nesting is verified against the ceiling.</li>
 * </ol>
 *
 * <p>
 * Repeated rules inside a term and repeated terms are dropped (idempotence:
 * {@code a ∧ a → a}). The number of generated terms is capped by
 * {@link RewritePolicy#maxExpandedTerms()}.
 * </p>
 *
 * <p><strong>Example</strong> (ceiling 1):</p>
 * <pre>{@code
 * // A AND (B OR C)
 * WireFilter wire = new DepthBoundedRewriter(RewritePolicy.builder().maxNestingDepth(1).build())
 *         .rewrite(FilterGroup.and(a, FilterGroup.or(b, c)));
 * // {"or": [{"and": [A, B]}, {"and": [A, C]}]}
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @since 1.0.0
 */
public final class DepthBoundedRewriter {

    private static final Logger log = Logger.getLogger(DepthBoundedRewriter.class.getName());

    private final RewritePolicy policy;

    public DepthBoundedRewriter(RewritePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "rewrite policy is required");
    }

    public RewritePolicy policy() {
        return policy;
    }

    /**
     * @param root the root of a tree without negated groups
     * @return the equivalent remote filter, nested at most {@code maxNestingDepth} levels
     * @throws IncompleteRuleException    if a rule lacks its property or category
     * @throws InvalidStructureException  if a rule is unfit for conversion or a negated group remains
     * @throws FilterComplexityException  if distribution would exceed the term ceiling
     */
    public WireFilter rewrite(FilterNode root) {
        Objects.requireNonNull(root, "root cannot be null");

        WireFilter result = convertNode(root, 0, FilterPath.root());
        if (result.nestingDepth() > policy.maxNestingDepth()) {
            throw new IllegalStateException(String.format(
                    "Rewritten filter is nested %d levels deep, above the ceiling of %d",
                    result.nestingDepth(), policy.maxNestingDepth()));
        }
        return result;
    }

    private WireFilter convertNode(FilterNode node, int depth, FilterPath path) {
        if (node instanceof FilterRule rule) {
            return LeafConverter.convert(rule, path);
        }

        FilterGroup group = requireNotNegated((FilterGroup) node, path);
        if (depth >= policy.maxNestingDepth() - 1) {
            return rewriteAtBoundary(group, path);
        }

        List<WireFilter> members = new ArrayList<>(group.size());
        for (int i = 0; i < group.size(); i++) {
            members.add(convertNode(group.child(i), depth + 1, path.child(i)));
        }
        return wrap(group.operator(), flattenAssociative(group.operator(), members));
    }

    private static List<WireFilter> flattenAssociative(GroupOperator operator, List<WireFilter> members) {
        List<WireFilter> flattened = new ArrayList<>(members.size());
        for (WireFilter member : members) {
            if (member instanceof WireCompoundFilter compound && compound.operator() == operator) {
                flattened.addAll(compound.members());
            } else {
                flattened.add(member);
            }
        }
        return flattened;
    }

    private WireFilter rewriteAtBoundary(FilterGroup group, FilterPath path) {
        GroupOperator inner = group.operator();
        List<List<WirePropertyFilter>> terms = expand(group, inner, path);

        if (terms.size() == 1) {
            return wrap(inner, new ArrayList<>(terms.get(0)));
        }

        log.fine(() -> String.format("Distributed %s group at %s into %d terms",
                inner.wireKey(), path, terms.size()));

        List<WireFilter> members = new ArrayList<>(terms.size());
        for (List<WirePropertyFilter> term : terms) {
            members.add(wrap(inner, new ArrayList<>(term)));
        }
        return new WireCompoundFilter(inner.flip(), members);
    }

    /**
     * Expands {@code node} into terms joined by {@code inner}, the terms themselves being joined
     * by the dual connective. With {@code inner = AND} this is the disjunctive normal form, with
     * {@code inner = OR} the conjunctive one.
     */
    private List<List<WirePropertyFilter>> expand(FilterNode node, GroupOperator inner, FilterPath path) {
        if (node instanceof FilterRule rule) {
            List<List<WirePropertyFilter>> single = new ArrayList<>(1);
            single.add(List.of(LeafConverter.convert(rule, path)));
            return single;
        }

        FilterGroup group = requireNotNegated((FilterGroup) node, path);
        List<List<WirePropertyFilter>> result = null;
        for (int i = 0; i < group.size(); i++) {
            List<List<WirePropertyFilter>> child = expand(group.child(i), inner, path.child(i));
            if (result == null) {
                result = child;
            } else if (group.operator() == inner) {
                result = product(result, child);
            } else {
                result = union(result, child);
            }
        }
        return result;
    }

    private List<List<WirePropertyFilter>> product(List<List<WirePropertyFilter>> left,
                                                   List<List<WirePropertyFilter>> right) {
        long size = (long) left.size() * right.size();
        if (size > policy.maxExpandedTerms()) {
            throw new FilterComplexityException(policy.maxExpandedTerms(), (int) Math.min(size, Integer.MAX_VALUE));
        }

        LinkedHashSet<List<WirePropertyFilter>> combined = new LinkedHashSet<>();
        for (List<WirePropertyFilter> l : left) {
            for (List<WirePropertyFilter> r : right) {
                LinkedHashSet<WirePropertyFilter> term = new LinkedHashSet<>(l);
                term.addAll(r);
                combined.add(List.copyOf(term));
            }
        }
        return new ArrayList<>(combined);
    }

    private static List<List<WirePropertyFilter>> union(List<List<WirePropertyFilter>> left,
                                                        List<List<WirePropertyFilter>> right) {
        LinkedHashSet<List<WirePropertyFilter>> combined = new LinkedHashSet<>(left);
        combined.addAll(right);
        return new ArrayList<>(combined);
    }

    private static WireFilter wrap(GroupOperator operator, List<? extends WireFilter> members) {
        if (members.size() == 1) {
            return members.get(0);
        }
        return new WireCompoundFilter(operator, new ArrayList<>(members));
    }

    private static FilterGroup requireNotNegated(FilterGroup group, FilterPath path) {
        if (group.negated()) {
            throw new InvalidStructureException("Negated group must be normalized before conversion", path);
        }
        return group;
    }
}
