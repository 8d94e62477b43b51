package io.github.cyfko.compoundfilter.core.validation;

import io.github.cyfko.compoundfilter.core.model.CompoundFilter;
import io.github.cyfko.compoundfilter.core.model.FilterGroup;
import io.github.cyfko.compoundfilter.core.model.FilterNode;
import io.github.cyfko.compoundfilter.core.model.FilterPath;
import io.github.cyfko.compoundfilter.core.model.FilterRule;
import io.github.cyfko.compoundfilter.core.utils.ValidationResult;
import io.github.cyfko.compoundfilter.core.wire.WireCompoundFilter;
import io.github.cyfko.compoundfilter.core.wire.WireFilter;
import io.github.cyfko.compoundfilter.core.wire.WirePropertyFilter;

import java.util.Objects;

/**
 * Structural checks on client trees and on the remote filters produced from them.
 * <p>
 * Both checks stop at the first problem found in depth-first order and report it as a
 * {@link ValidationResult}; neither throws for an invalid input.
 * </p>
 *
 * @since 1.0.0
 */
public final class StructureValidator {

    private StructureValidator() {}

    /**
     * Checks a client tree before conversion.
     * <p>
     * A rule without property or category, an operator its category does not offer, or a
     * missing value on a value-requiring operator is invalid. An empty filter is valid.
     * </p>
     *
     * @param filter the tree to check
     * @return success, or the first failure with the path of the offending node
     */
    public static ValidationResult validateStructure(CompoundFilter filter) {
        Objects.requireNonNull(filter, "filter cannot be null");
        return filter.root()
                .map(root -> validateNode(root, FilterPath.root()))
                .orElse(ValidationResult.success());
    }

    private static ValidationResult validateNode(FilterNode node, FilterPath path) {
        if (node instanceof FilterRule rule) {
            return validateRule(rule, path);
        }

        FilterGroup group = (FilterGroup) node;
        if (group.children().isEmpty()) {
            return ValidationResult.failure("Group has no conditions", path);
        }
        for (int i = 0; i < group.size(); i++) {
            ValidationResult child = validateNode(group.child(i), path.child(i));
            if (!child.isValid()) {
                return child;
            }
        }
        return ValidationResult.success();
    }

    private static ValidationResult validateRule(FilterRule rule, FilterPath path) {
        if (rule.selectedProperty().isEmpty()) {
            return ValidationResult.failure("Condition has no property", path);
        }
        if (rule.selectedCategory().isEmpty()) {
            return ValidationResult.failure("Condition has no property type", path);
        }
        if (!rule.category().supports(rule.operator())) {
            return ValidationResult.failure(String.format("Operator %s is not supported for property type %s",
                    rule.operator().wireKey(), rule.category().wireKey()), path);
        }
        if (rule.operator().requiresValue() && rule.value().isNull()) {
            return ValidationResult.failure("Value is required for operator " + rule.operator().wireKey(), path);
        }
        return ValidationResult.success();
    }

    /**
     * Checks a remote filter before it is sent. Paths in the result address compound members.
     *
     * @param wire the produced filter
     * @return success, or the first failure with the path of the offending member
     */
    public static ValidationResult validateWireOutput(WireFilter wire) {
        Objects.requireNonNull(wire, "wire filter cannot be null");
        return validateWire(wire, FilterPath.root());
    }

    private static ValidationResult validateWire(WireFilter wire, FilterPath path) {
        if (wire instanceof WirePropertyFilter leaf) {
            return validateWireLeaf(leaf, path);
        }

        WireCompoundFilter compound = (WireCompoundFilter) wire;
        if (compound.members().isEmpty()) {
            return ValidationResult.failure("Compound filter '" + compound.operator().wireKey() + "' is empty", path);
        }
        if (compound.members().size() == 1) {
            return ValidationResult.failure(
                    "Compound filter '" + compound.operator().wireKey() + "' has a single member", path);
        }
        for (int i = 0; i < compound.members().size(); i++) {
            ValidationResult member = validateWire(compound.members().get(i), path.child(i));
            if (!member.isValid()) {
                return member;
            }
        }
        return ValidationResult.success();
    }

    private static ValidationResult validateWireLeaf(WirePropertyFilter leaf, FilterPath path) {
        if (!leaf.isTimestamp() && (leaf.property() == null || leaf.property().isBlank())) {
            return ValidationResult.failure("Property filter has no property name", path);
        }
        if (!leaf.category().supports(leaf.operator())) {
            return ValidationResult.failure(String.format("Operator %s is not supported for property type %s",
                    leaf.operator().wireKey(), leaf.category().wireKey()), path);
        }
        if (leaf.operator().requiresValue() && leaf.value().isNull()) {
            return ValidationResult.failure("Property filter on '" + leaf.property() + "' has no value", path);
        }
        return ValidationResult.success();
    }
}
