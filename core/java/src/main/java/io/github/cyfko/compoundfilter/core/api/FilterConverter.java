package io.github.cyfko.compoundfilter.core.api;

import io.github.cyfko.compoundfilter.core.exception.FilterComplexityException;
import io.github.cyfko.compoundfilter.core.exception.IncompleteRuleException;
import io.github.cyfko.compoundfilter.core.exception.InvalidStructureException;
import io.github.cyfko.compoundfilter.core.exception.UnsupportedNegationException;
import io.github.cyfko.compoundfilter.core.model.CompoundFilter;
import io.github.cyfko.compoundfilter.core.wire.WireFilter;

import java.util.Optional;

/**
 * Converts a client filter tree into a filter accepted by the remote API.
 * <p>
 * A conversion runs three stages in order:
 * </p>
 * <ol>
 *   <li><strong>Negation normalization</strong>: every negated group is removed by De Morgan's law.</li>
 *   <li><strong>Depth-bounded rewrite</strong>: the tree is rewritten within the API's nesting ceiling.</li>
 *   <li><strong>Output validation</strong>: the produced filter is checked before it leaves.</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * FilterConverter converter = new DefaultFilterConverter();
 * Optional<WireFilter> wire = converter.convert(draft);
 * wire.ifPresent(transport::query);   // empty: query without filter
 * }</pre>
 *
 * <h2>Errors</h2>
 * <p>
 * The first three exceptions below describe user-correctable trees. An
 * {@link IllegalStateException} means the converter itself produced an invalid filter.
 * </p>
 *
 * @since 1.0.0
 */
public interface FilterConverter {

    /**
     * @param filter the client tree, possibly empty
     * @return the remote filter, or empty when {@code filter} is empty
     * @throws UnsupportedNegationException if a negated group holds operators without complement
     * @throws IncompleteRuleException      if a rule lacks its property or category
     * @throws InvalidStructureException    if a rule is unfit for conversion
     * @throws FilterComplexityException    if distribution would generate too many terms
     * @throws IllegalStateException        if the produced filter fails output validation
     */
    Optional<WireFilter> convert(CompoundFilter filter);
}
