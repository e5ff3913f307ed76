package org.framebind.primitive;

import org.framebind.config.EngineSettings;
import org.framebind.engine.FrameVisibilityEngine;
import org.framebind.engine.InvalidTargetException;
import org.framebind.engine.ReassignmentResult;
import org.framebind.model.FrameAssociation;
import org.framebind.model.MalformedAssociationException;
import org.framebind.model.StateRecord;
import org.framebind.spi.IFrameSource;
import org.framebind.spi.IPayloadDuplicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A graphical annotation primitive (cursor, region) overlaid on a multi-frame dataset.
 * <p>
 * The primitive exclusively owns its state records through a {@link FrameVisibilityEngine}
 * and tracks the frame the host currently displays. The rendering surface asks
 * {@link #currentState()} or {@link #stateForFrame(int)}; editing code changes frame
 * associations through {@link #reassign(StateRecord, FrameAssociation)}.
 *
 * @param <P> The payload type of the state records.
 */
public class Primitive<P> {

    private static final Logger log = LoggerFactory.getLogger(Primitive.class);

    private final String name;
    private final FrameVisibilityEngine<P> engine;
    private final IPayloadDuplicator<P> duplicator;
    private int currentFrame;

    /**
     * Creates a primitive without any state.
     *
     * @param name        The display name of the primitive.
     * @param frameSource The dataset the primitive is overlaid on.
     * @param duplicator  Copies payloads when states are materialized or propagated.
     * @param settings    Engine runtime checks.
     */
    public Primitive(String name, IFrameSource frameSource, IPayloadDuplicator<P> duplicator, EngineSettings settings) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Primitive name must be a non-empty string.");
        }
        this.name = name;
        this.duplicator = Objects.requireNonNull(duplicator, "Payload duplicator cannot be null.");
        this.engine = new FrameVisibilityEngine<>(frameSource, duplicator, settings);
        this.currentFrame = 0;
    }

    /**
     * Creates a primitive with a single state visible in every frame.
     *
     * @param name           The display name of the primitive.
     * @param frameSource    The dataset the primitive is overlaid on.
     * @param duplicator     Copies payloads when states are materialized or propagated.
     * @param settings       Engine runtime checks.
     * @param initialPayload The payload of the ubiquitous state.
     */
    public Primitive(String name, IFrameSource frameSource, IPayloadDuplicator<P> duplicator, EngineSettings settings, P initialPayload) {
        this(name, frameSource, duplicator, settings);
        engine.insert(initialPayload, FrameAssociation.ubiquitous());
    }

    public String name() {
        return name;
    }

    public List<StateRecord<P>> states() {
        return engine.records();
    }

    public FrameVisibilityEngine<P> engine() {
        return engine;
    }

    public int currentFrame() {
        return currentFrame;
    }

    /**
     * Called by the host when it displays another frame.
     *
     * @param frame The displayed frame, non-negative.
     */
    public void setCurrentFrame(int frame) {
        if (frame < 0) {
            throw new MalformedAssociationException("Current frame must be non-negative, got " + frame);
        }
        this.currentFrame = frame;
    }

    public Optional<StateRecord<P>> stateForFrame(int frame) {
        return engine.activeRecord(frame);
    }

    public Optional<StateRecord<P>> currentState() {
        return engine.activeRecord(currentFrame);
    }

    public boolean hasStateForFrame(int frame) {
        return engine.activeRecord(frame).isPresent();
    }

    /**
     * @return true if the primitive should be drawn in the frame the host displays.
     */
    public boolean hasStateForCurrentFrame() {
        return hasStateForFrame(currentFrame);
    }

    /**
     * @return The frames explicitly claimed by single-frame states, ascending.
     */
    public SortedSet<Integer> frameIndices() {
        SortedSet<Integer> frames = new TreeSet<>();
        for (StateRecord<P> record : engine.records()) {
            if (record.association().isSingleFrame()) {
                frames.add(record.association().frame());
            }
        }
        return frames;
    }

    /**
     * @return true if at least one state is bound to a single frame.
     */
    public boolean hasHardFrameAssociations() {
        for (StateRecord<P> record : engine.records()) {
            if (record.association().isSingleFrame()) {
                return true;
            }
        }
        return false;
    }

    public ReassignmentResult<P> addState(P payload, FrameAssociation association) {
        return engine.insert(payload, association);
    }

    public ReassignmentResult<P> reassign(StateRecord<P> target, FrameAssociation association) {
        return engine.reassign(target, association);
    }

    public ReassignmentResult<P> reassign(int position, FrameAssociation association) {
        return engine.reassign(position, association);
    }

    /**
     * Makes the state shown in {@code frame} visible in every frame, discarding all other states.
     *
     * @param frame The frame whose state is kept.
     * @return The outcome of the reassignment.
     * @throws InvalidTargetException if no state is visible in {@code frame}.
     */
    public ReassignmentResult<P> propagateStateToAllFrames(int frame) {
        StateRecord<P> source = engine.activeRecord(frame)
                .orElseThrow(() -> new InvalidTargetException(String.format("Primitive '%s' has no state in frame %d", name, frame)));
        return engine.reassign(source, FrameAssociation.ubiquitous());
    }

    /**
     * Copies the state shown in {@code frame} into single-frame states for each of the target frames.
     * <p>
     * The source state keeps every frame that no copy claims. A ubiquitous source is narrowed and a
     * frame-avoiding source is expanded by the engine as the copies are inserted.
     *
     * @param frame        The frame whose state is copied.
     * @param targetFrames The frames that receive a copy; {@code frame} itself is skipped.
     * @return The states created, in ascending frame order.
     * @throws InvalidTargetException if no state is visible in {@code frame}.
     * @throws MalformedAssociationException if a target frame is null or negative; nothing is changed.
     */
    public List<StateRecord<P>> propagateState(int frame, Collection<Integer> targetFrames) {
        SortedSet<Integer> targets = checkedFrames(targetFrames);
        StateRecord<P> source = engine.activeRecord(frame)
                .orElseThrow(() -> new InvalidTargetException(String.format("Primitive '%s' has no state in frame %d", name, frame)));

        List<StateRecord<P>> copies = new ArrayList<>();
        for (int target : targets) {
            if (target == frame) continue;
            P payload = duplicator.duplicate(source.payload());
            copies.add(engine.insert(payload, FrameAssociation.singleFrame(target)).target());
        }
        log.debug("Propagated state of '{}' from frame {} to {} frame(s)", name, frame, copies.size());
        return copies;
    }

    /**
     * Sets the frames in which the current state is visible, discarding every other state.
     * <p>
     * An empty collection makes the current state common to all frames. Otherwise the current state
     * moves to the lowest listed frame and each further frame receives a copy of its payload.
     *
     * @param frames The frames of visibility; empty for all frames.
     * @throws InvalidTargetException if no state is visible in the current frame.
     * @throws MalformedAssociationException if a frame is null or negative; nothing is changed.
     */
    public void setFrameIndices(Collection<Integer> frames) {
        SortedSet<Integer> targets = checkedFrames(frames);
        StateRecord<P> source = currentState()
                .orElseThrow(() -> new InvalidTargetException(String.format("Primitive '%s' has no state in frame %d", name, currentFrame)));

        engine.reassign(source, FrameAssociation.ubiquitous());
        if (targets.isEmpty()) {
            return;
        }
        engine.reassign(source, FrameAssociation.singleFrame(targets.first()));
        for (int target : targets.tailSet(targets.first() + 1)) {
            engine.insert(duplicator.duplicate(source.payload()), FrameAssociation.singleFrame(target));
        }
        log.debug("Primitive '{}' now visible in frames {}", name, targets);
    }

    private static SortedSet<Integer> checkedFrames(Collection<Integer> frames) {
        Objects.requireNonNull(frames, "Frames cannot be null.");
        SortedSet<Integer> checked = new TreeSet<>();
        for (Integer frame : frames) {
            if (frame == null || frame < 0) {
                throw new MalformedAssociationException("Frame index must be non-negative, got " + frame);
            }
            checked.add(frame);
        }
        return checked;
    }

    /**
     * Notification from the dataset that frames were added or removed.
     *
     * @return The states discarded because their frame no longer exists.
     */
    public List<StateRecord<P>> framesChanged() {
        return engine.reconcileFrames();
    }

    @Override
    public String toString() {
        return "Primitive[" + name + ", states=" + engine.records() + "]";
    }
}
