package org.framebind.engine;

import org.framebind.model.StateRecord;

import java.util.List;

/**
 * Outcome of a reassignment or insertion.
 *
 * @param target    The target record as it is now held in the sequence.
 * @param discarded Records removed from the sequence, in their former order.
 * @param created   Records materialized by expanding a frame-avoiding record, in frame order.
 * @param <P>       The payload type.
 */
public record ReassignmentResult<P>(StateRecord<P> target, List<StateRecord<P>> discarded, List<StateRecord<P>> created) {

    public ReassignmentResult {
        discarded = List.copyOf(discarded);
        created = List.copyOf(created);
    }

    public boolean expanded() {
        return !created.isEmpty();
    }
}
