package org.framebind.engine;

import org.framebind.config.EngineSettings;
import org.framebind.model.FrameAssociation;
import org.framebind.model.MalformedAssociationException;
import org.framebind.model.StateRecord;
import org.framebind.spi.IFrameSource;
import org.framebind.spi.IPayloadDuplicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Owns the state records of one annotation primitive and decides which record governs each frame.
 * <p>
 * All mutations rebuild the sequence off to the side and install it in one step, so a failed
 * mutation leaves the previous sequence in place and readers never observe a partial rebuild.
 * The engine is not thread-safe: callers serialize {@code reassign}, {@code insert} and
 * {@code reconcileFrames} per primitive.
 *
 * @param <P> The payload type of the records.
 */
public class FrameVisibilityEngine<P> {

    private static final Logger log = LoggerFactory.getLogger(FrameVisibilityEngine.class);

    private final IFrameSource frameSource;
    private final IPayloadDuplicator<P> duplicator;
    private final EngineSettings settings;

    private volatile List<StateRecord<P>> records = List.of();
    private long nextRecordId = 1;

    /**
     * Creates an empty engine.
     *
     * @param frameSource Supplies valid frame indices for expansion and reconciliation.
     * @param duplicator  Copies payloads into materialized records.
     * @param settings    Runtime checks to apply.
     */
    public FrameVisibilityEngine(IFrameSource frameSource, IPayloadDuplicator<P> duplicator, EngineSettings settings) {
        this.frameSource = Objects.requireNonNull(frameSource, "Frame source cannot be null.");
        this.duplicator = Objects.requireNonNull(duplicator, "Payload duplicator cannot be null.");
        this.settings = Objects.requireNonNull(settings, "Engine settings cannot be null.");
    }

    /**
     * Creates an empty engine that shares payloads between materialized records.
     *
     * @param frameSource Supplies valid frame indices for expansion and reconciliation.
     * @param settings    Runtime checks to apply.
     */
    public FrameVisibilityEngine(IFrameSource frameSource, EngineSettings settings) {
        this(frameSource, IPayloadDuplicator.sharing(), settings);
    }

    /**
     * @return An unmodifiable snapshot of the record sequence.
     */
    public List<StateRecord<P>> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public EngineSettings settings() {
        return settings;
    }

    /**
     * Finds the record currently held under the given id.
     *
     * @param id The record id.
     * @return The record, or empty if no record with this id is in the sequence.
     */
    public Optional<StateRecord<P>> find(long id) {
        for (StateRecord<P> record : records) {
            if (record.id() == id) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the record visible in the given frame.
     *
     * @param frame A non-negative frame index, not necessarily present in the dataset.
     * @return The visible record, or empty if no record applies.
     * @throws MalformedAssociationException if {@code frame} is negative.
     * @throws IllegalStateException if strict queries are enabled and several records are visible.
     */
    public Optional<StateRecord<P>> activeRecord(int frame) {
        if (frame < 0) {
            throw new MalformedAssociationException("Frame index must be non-negative, got " + frame);
        }
        List<StateRecord<P>> snapshot = records;
        StateRecord<P> found = null;
        for (StateRecord<P> record : snapshot) {
            if (!record.isVisibleIn(frame)) continue;
            if (!settings.strictQueries()) {
                return Optional.of(record);
            }
            if (found != null) {
                throw new IllegalStateException(String.format("Frame %d resolves to both %s and %s", frame, found, record));
            }
            found = record;
        }
        return Optional.ofNullable(found);
    }

    /**
     * Reassigns the record at the given position.
     *
     * @param position    Zero-based position in {@link #records()}.
     * @param association The new frame association.
     * @return The outcome of the reassignment.
     * @throws InvalidTargetException if {@code position} is out of range.
     */
    public ReassignmentResult<P> reassign(int position, FrameAssociation association) {
        List<StateRecord<P>> current = records;
        if (position < 0 || position >= current.size()) {
            throw new InvalidTargetException(String.format("No record at position %d (sequence holds %d)", position, current.size()));
        }
        return reassign(current.get(position), association);
    }

    /**
     * Reassigns the given record to a new frame association and rebuilds the sequence so
     * that every frame keeps at most one visible record.
     *
     * @param target      A record of this engine, identified by its id.
     * @param association The new frame association.
     * @return The outcome of the reassignment.
     * @throws InvalidTargetException if {@code target} is not in the sequence.
     */
    public ReassignmentResult<P> reassign(StateRecord<P> target, FrameAssociation association) {
        Objects.requireNonNull(association, "Frame association cannot be null.");
        if (target == null) {
            throw new InvalidTargetException("Target record cannot be null.");
        }
        List<StateRecord<P>> current = records;
        int index = indexOf(current, target.id());
        if (index < 0) {
            throw new InvalidTargetException("Record #" + target.id() + " is not held by this engine.");
        }
        log.debug("Reassigning {} to {}", current.get(index), association);
        return rebuild(current, index, association);
    }

    /**
     * Reassigns using the signed-integer encoding of {@link FrameAssociation#decode(Integer)}.
     *
     * @param target  A record of this engine.
     * @param encoded {@code null} for ubiquitous, a non-negative frame, or the complement of a frame to avoid.
     * @return The outcome of the reassignment.
     */
    public ReassignmentResult<P> reassignEncoded(StateRecord<P> target, Integer encoded) {
        return reassign(target, FrameAssociation.decode(encoded));
    }

    /**
     * Creates a new record and places it in the sequence with the same rules as {@link #reassign}.
     *
     * @param payload     The state payload.
     * @param association The frame association of the new record.
     * @return The outcome, whose target is the new record.
     */
    public ReassignmentResult<P> insert(P payload, FrameAssociation association) {
        Objects.requireNonNull(association, "Frame association cannot be null.");
        List<StateRecord<P>> current = new ArrayList<>(records);
        StateRecord<P> created = new StateRecord<>(nextRecordId++, payload, association);
        current.add(created);
        log.debug("Inserting {}", created);
        return rebuild(current, current.size() - 1, association);
    }

    /**
     * Drops records that refer to frames the dataset no longer has.
     * <p>
     * Single-frame records outside the valid frame set are discarded. A frame-avoiding record whose
     * excluded frame disappeared covers every remaining frame and becomes ubiquitous.
     *
     * @return The discarded records.
     */
    public List<StateRecord<P>> reconcileFrames() {
        SortedSet<Integer> validFrames = frameSource.validFrameIndices();
        List<StateRecord<P>> current = records;
        List<StateRecord<P>> kept = new ArrayList<>(current.size());
        List<StateRecord<P>> discarded = new ArrayList<>();

        for (StateRecord<P> record : current) {
            FrameAssociation association = record.association();
            if (association.isSingleFrame() && !validFrames.contains(association.frame())) {
                discarded.add(record);
            } else {
                kept.add(record);
            }
        }
        for (int i = 0; i < kept.size(); i++) {
            StateRecord<P> record = kept.get(i);
            if (record.association().isFrameAvoiding() && !validFrames.contains(record.association().frame())) {
                kept.set(i, record.withAssociation(FrameAssociation.ubiquitous()));
            }
        }

        install(kept);
        if (!discarded.isEmpty()) {
            log.info("Discarded {} record(s) for frames no longer in the dataset: {}", discarded.size(), discarded);
        }
        return Collections.unmodifiableList(discarded);
    }

    private ReassignmentResult<P> rebuild(List<StateRecord<P>> current, int targetIndex, FrameAssociation association) {
        StateRecord<P> updated = current.get(targetIndex).withAssociation(association);
        List<StateRecord<P>> rebuilt = new ArrayList<>(current.size());
        List<StateRecord<P>> discarded = new ArrayList<>();
        List<StateRecord<P>> created = new ArrayList<>();

        for (int i = 0; i < current.size(); i++) {
            StateRecord<P> other = current.get(i);
            if (i == targetIndex) {
                rebuilt.add(updated);
                continue;
            }
            switch (association.kind()) {
                case UBIQUITOUS -> discarded.add(other);
                case FRAME_AVOIDING -> {
                    if (other.association().equals(FrameAssociation.singleFrame(association.frame()))) {
                        rebuilt.add(other);
                    } else {
                        discarded.add(other);
                    }
                }
                case SINGLE_FRAME -> placeBesideSingleFrame(other, association.frame(), current, rebuilt, discarded, created);
            }
        }

        install(rebuilt);
        if (!discarded.isEmpty() || !created.isEmpty()) {
            log.debug("{} now {}: discarded {}, created {}", updated, association, discarded.size(), created.size());
        }
        return new ReassignmentResult<>(updated, discarded, created);
    }

    /**
     * Decides what happens to {@code other} when the target claims exclusive visibility of {@code frame}.
     */
    private void placeBesideSingleFrame(StateRecord<P> other, int frame, List<StateRecord<P>> current,
                                        List<StateRecord<P>> rebuilt, List<StateRecord<P>> discarded,
                                        List<StateRecord<P>> created) {
        FrameAssociation association = other.association();
        switch (association.kind()) {
            case SINGLE_FRAME -> {
                // Last writer wins the slot.
                if (association.frame() == frame) {
                    discarded.add(other);
                } else {
                    rebuilt.add(other);
                }
            }
            case FRAME_AVOIDING -> {
                if (association.frame() == frame) {
                    rebuilt.add(other);
                } else {
                    discarded.add(other);
                    List<StateRecord<P>> expansion = expand(other, frame, current);
                    rebuilt.addAll(expansion);
                    created.addAll(expansion);
                }
            }
            case UBIQUITOUS -> rebuilt.add(other.withAssociation(FrameAssociation.avoiding(frame)));
        }
    }

    /**
     * Materializes single-frame records for every valid frame the avoiding record covered,
     * except the claimed frame, the frame it already excluded, and frames held by other records.
     */
    private List<StateRecord<P>> expand(StateRecord<P> avoidingRecord, int claimedFrame, List<StateRecord<P>> current) {
        int excludedFrame = avoidingRecord.association().frame();
        SortedSet<Integer> validFrames = frameSource.validFrameIndices();
        if (validFrames == null || validFrames.isEmpty()) {
            log.debug("Dataset has no frames; dropping {} without expansion", avoidingRecord);
            return List.of();
        }

        List<StateRecord<P>> expansion = new ArrayList<>();
        for (int frame : validFrames) {
            if (frame < 0 || frame == claimedFrame || frame == excludedFrame) continue;
            if (isOccupied(current, avoidingRecord, frame)) continue;
            P payload = duplicator.duplicate(avoidingRecord.payload());
            expansion.add(new StateRecord<>(nextRecordId++, payload, FrameAssociation.singleFrame(frame)));
        }
        log.debug("Expanded {} into {} single-frame record(s)", avoidingRecord, expansion.size());
        return expansion;
    }

    private boolean isOccupied(List<StateRecord<P>> current, StateRecord<P> avoidingRecord, int frame) {
        for (StateRecord<P> record : current) {
            if (record != avoidingRecord
                    && record.association().isSingleFrame()
                    && record.association().frame() == frame) {
                return true;
            }
        }
        return false;
    }

    private void install(List<StateRecord<P>> rebuilt) {
        List<StateRecord<P>> frozen = Collections.unmodifiableList(rebuilt);
        if (settings.verifyInvariants()) {
            FrameVisibilityInvariants.verify(frozen);
        }
        records = frozen;
    }

    private static int indexOf(List<? extends StateRecord<?>> list, long id) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).id() == id) {
                return i;
            }
        }
        return -1;
    }
}
