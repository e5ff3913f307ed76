package org.framebind.model;

import java.util.Objects;

/**
 * A state record owned by a primitive: an opaque payload plus its frame association.
 * <p>
 * Records are immutable. The {@code id} identifies the record within its owning engine and
 * survives reassignment, which replaces the record object but keeps its id and payload.
 *
 * @param id          Engine-scoped identity of the record.
 * @param payload     Geometry/appearance state, never interpreted by the engine.
 * @param association The frames in which the record is visible.
 * @param <P>         The payload type.
 */
public record StateRecord<P>(long id, P payload, FrameAssociation association) {

    public StateRecord {
        Objects.requireNonNull(association, "Frame association cannot be null.");
    }

    /**
     * @param newAssociation The association for the returned record.
     * @return A record with the same id and payload and the given association.
     */
    public StateRecord<P> withAssociation(FrameAssociation newAssociation) {
        return new StateRecord<>(id, payload, newAssociation);
    }

    public boolean isVisibleIn(int frame) {
        return association.isVisibleIn(frame);
    }

    @Override
    public String toString() {
        return "StateRecord#" + id + "[" + association + "]";
    }
}
