package io.github.cyfko.compoundfilter.core.impl;

import io.github.cyfko.compoundfilter.core.api.FilterConverter;
import io.github.cyfko.compoundfilter.core.config.RewritePolicy;
import io.github.cyfko.compoundfilter.core.editor.CompoundFilterEditor;
import io.github.cyfko.compoundfilter.core.model.CompoundFilter;
import io.github.cyfko.compoundfilter.core.model.FilterNode;
import io.github.cyfko.compoundfilter.core.negation.NegationNormalizer;
import io.github.cyfko.compoundfilter.core.rewrite.DepthBoundedRewriter;
import io.github.cyfko.compoundfilter.core.utils.ValidationResult;
import io.github.cyfko.compoundfilter.core.validation.StructureValidator;
import io.github.cyfko.compoundfilter.core.wire.WireFilter;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Default {@link FilterConverter}: {@link NegationNormalizer}, then {@link DepthBoundedRewriter},
 * then {@link StructureValidator#validateWireOutput(WireFilter)}.
 *
 * <pre>{@code
 * // API ceiling, default term limit
 * FilterConverter converter = new DefaultFilterConverter();
 *
 * // Shallower output, tighter term limit
 * FilterConverter strict = new DefaultFilterConverter(
 *         RewritePolicy.builder().maxNestingDepth(1).maxExpandedTerms(100).build());
 * }</pre>
 *
 * <p>Instances are stateless and thread-safe.</p>
 *
 * @since 1.0.0
 */
public class DefaultFilterConverter implements FilterConverter {

    private static final Logger log = Logger.getLogger(DefaultFilterConverter.class.getName());

    private final DepthBoundedRewriter rewriter;

    /**
     * Uses {@link RewritePolicy#defaults()}.
     */
    public DefaultFilterConverter() {
        this(RewritePolicy.defaults());
    }

    /**
     * @param policy the rewrite limits
     * @throws NullPointerException if policy is null
     */
    public DefaultFilterConverter(RewritePolicy policy) {
        this.rewriter = new DepthBoundedRewriter(Objects.requireNonNull(policy, "rewrite policy is required"));
    }

    public RewritePolicy getPolicy() {
        return rewriter.policy();
    }

    @Override
    public Optional<WireFilter> convert(CompoundFilter filter) {
        Objects.requireNonNull(filter, "filter cannot be null");
        if (filter.isEmpty()) {
            return Optional.empty();
        }

        CompoundFilter normalized = NegationNormalizer.normalize(filter);
        FilterNode root = normalized.root().orElseThrow();
        WireFilter wire = rewriter.rewrite(root);

        ValidationResult check = StructureValidator.validateWireOutput(wire);
        if (!check.isValid()) {
            throw new IllegalStateException("Converter produced an invalid filter: " + check.getErrorMessage()
                    + check.getPath().map(p -> " at " + p).orElse(""));
        }

        log.fine(() -> String.format("Converted filter of depth %d into remote filter of nesting %d",
                CompoundFilterEditor.nestingDepth(filter), wire.nestingDepth()));
        return Optional.of(wire);
    }
}
