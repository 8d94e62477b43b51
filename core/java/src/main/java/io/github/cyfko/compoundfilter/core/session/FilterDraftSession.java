package io.github.cyfko.compoundfilter.core.session;

import io.github.cyfko.compoundfilter.core.api.FilterConverter;
import io.github.cyfko.compoundfilter.core.config.NestingPolicy;
import io.github.cyfko.compoundfilter.core.editor.CompoundFilterEditor;
import io.github.cyfko.compoundfilter.core.model.CompoundFilter;
import io.github.cyfko.compoundfilter.core.model.FilterNode;
import io.github.cyfko.compoundfilter.core.model.FilterPath;
import io.github.cyfko.compoundfilter.core.model.FilterRule;
import io.github.cyfko.compoundfilter.core.model.GroupOperator;
import io.github.cyfko.compoundfilter.core.model.RuleUpdate;
import io.github.cyfko.compoundfilter.core.wire.WireFilter;

import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Editing session over one table: a draft filter the user edits, the filter last applied, and
 * the user's max nesting depth.
 * <p>
 * Edits only touch the draft. {@link #apply()} converts the draft once; on success the draft
 * becomes the applied filter and the {@link AppliedFilterListener} receives both forms. On
 * failure the exception propagates and the applied filter is left as it was.
 * </p>
 *
 * <pre>{@code
 * FilterDraftSession session = new FilterDraftSession(new DefaultFilterConverter(), transport::query);
 * session.addRule(FilterRule.of("Status", PropertyCategory.STATUS, FilterOperator.EQUALS, FilterValue.of("Done")));
 * session.addGroupAtPath(FilterPath.root(), GroupOperator.OR);
 * session.apply();
 * }</pre>
 *
 * <p>
 * State access is synchronized on the session. Filters are immutable and may be handed out
 * freely. The listener is notified outside the lock.
 * </p>
 *
 * @since 1.0.0
 */
public class FilterDraftSession {

    private static final Logger log = Logger.getLogger(FilterDraftSession.class.getName());

    private final FilterConverter converter;
    private final NestingPolicy nestingPolicy;
    private final AppliedFilterListener listener;

    private CompoundFilter draft = CompoundFilter.empty();
    private CompoundFilter applied = CompoundFilter.empty();
    private int requestedMaxDepth;

    public FilterDraftSession(FilterConverter converter, AppliedFilterListener listener) {
        this(converter, NestingPolicy.defaults(), listener);
    }

    public FilterDraftSession(FilterConverter converter, NestingPolicy nestingPolicy, AppliedFilterListener listener) {
        this.converter = Objects.requireNonNull(converter, "converter is required");
        this.nestingPolicy = Objects.requireNonNull(nestingPolicy, "nesting policy is required");
        this.listener = Objects.requireNonNull(listener, "listener is required");
        this.requestedMaxDepth = nestingPolicy.defaultDepth();
    }

    public synchronized CompoundFilter getDraft() {
        return draft;
    }

    public synchronized CompoundFilter getApplied() {
        return applied;
    }

    /**
     * @return the selected max depth, raised to the draft's current depth when the draft is deeper
     */
    public synchronized int getMaxNestingDepth() {
        return CompoundFilterEditor.effectiveMaxDepth(requestedMaxDepth, CompoundFilterEditor.nestingDepth(draft));
    }

    /**
     * Selects the max nesting depth, clamped to the {@link NestingPolicy} bounds.
     *
     * @return the effective max depth after the change
     */
    public synchronized int setMaxNestingDepth(int requested) {
        this.requestedMaxDepth = nestingPolicy.clamp(requested);
        return getMaxNestingDepth();
    }

    public synchronized boolean hasUnsavedChanges() {
        return CompoundFilterEditor.hasUnsavedChanges(draft, applied);
    }

    /**
     * Applies {@code operation} to the draft.
     *
     * @return the new draft
     */
    public synchronized CompoundFilter edit(UnaryOperator<CompoundFilter> operation) {
        Objects.requireNonNull(operation, "operation cannot be null");
        this.draft = Objects.requireNonNull(operation.apply(draft), "an edit must not return null");
        return draft;
    }

    public CompoundFilter addRule(FilterRule rule) {
        return edit(filter -> CompoundFilterEditor.addRule(filter, rule));
    }

    public CompoundFilter removeNode(FilterPath path) {
        return edit(filter -> CompoundFilterEditor.removeNode(filter, path));
    }

    public CompoundFilter updateRule(FilterPath path, RuleUpdate update) {
        return edit(filter -> CompoundFilterEditor.updateRule(filter, path, update));
    }

    public CompoundFilter toggleGroupOperator(FilterPath path) {
        return edit(filter -> CompoundFilterEditor.toggleGroupOperator(filter, path));
    }

    public CompoundFilter toggleGroupNegation(FilterPath path) {
        return edit(filter -> CompoundFilterEditor.toggleGroupNegation(filter, path));
    }

    public CompoundFilter addGroup(GroupOperator operator) {
        return edit(filter -> CompoundFilterEditor.addGroup(filter, operator));
    }

    /**
     * Nests a new group at {@code path} within the session's max nesting depth; no-op when the
     * depth would be exceeded.
     */
    public synchronized CompoundFilter addGroupAtPath(FilterPath path, GroupOperator operator) {
        int maxDepth = getMaxNestingDepth();
        return edit(filter -> CompoundFilterEditor.addGroupAtPath(filter, path, operator, maxDepth));
    }

    public synchronized boolean canAddGroupAtPath(FilterPath path) {
        return CompoundFilterEditor.canAddGroupAtPath(draft, path, getMaxNestingDepth());
    }

    public CompoundFilter addNodeToGroup(FilterPath path, FilterNode node) {
        return edit(filter -> CompoundFilterEditor.addNodeToGroup(filter, path, node));
    }

    public CompoundFilter duplicateNode(FilterPath path) {
        return edit(filter -> CompoundFilterEditor.duplicateNode(filter, path));
    }

    /**
     * Clears the draft. The applied filter is kept until the next {@link #apply()}.
     */
    public CompoundFilter reset() {
        return edit(filter -> CompoundFilterEditor.reset());
    }

    /**
     * Replaces the draft with the applied filter.
     */
    public synchronized CompoundFilter discardChanges() {
        this.draft = applied;
        return draft;
    }

    /**
     * Converts the draft and, when conversion succeeds, makes it the applied filter and notifies
     * the listener.
     *
     * @return the remote form of the applied filter, empty when no filter is applied
     * @throws RuntimeException any failure of {@link FilterConverter#convert(CompoundFilter)};
     *                          the applied filter is then unchanged
     */
    public Optional<WireFilter> apply() {
        CompoundFilter candidate;
        Optional<WireFilter> wire;
        synchronized (this) {
            candidate = draft;
            try {
                wire = converter.convert(candidate);
            } catch (RuntimeException e) {
                log.info(() -> "Filter rejected on apply: " + e.getMessage());
                throw e;
            }
            this.applied = candidate;
        }

        listener.onApplied(candidate, wire);
        return wire;
    }
}
