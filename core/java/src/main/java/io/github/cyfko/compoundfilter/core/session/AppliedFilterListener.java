package io.github.cyfko.compoundfilter.core.session;

import io.github.cyfko.compoundfilter.core.model.CompoundFilter;
import io.github.cyfko.compoundfilter.core.wire.WireFilter;

import java.util.Optional;

/**
 * Receives each successfully applied filter, typically to issue the remote query.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AppliedFilterListener {

    /**
     * @param applied the client tree that was applied
     * @param wire    its remote form, empty when no filter is applied
     */
    void onApplied(CompoundFilter applied, Optional<WireFilter> wire);
}
