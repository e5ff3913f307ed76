package org.framebind.model;

import java.util.Objects;

/**
 * Describes in which frames a state record is visible.
 * <p>
 * Exactly one of three kinds applies:
 * <ul>
 *   <li>{@link Kind#UBIQUITOUS}: visible in every frame,</li>
 *   <li>{@link Kind#FRAME_AVOIDING}: visible in every frame except {@link #frame()},</li>
 *   <li>{@link Kind#SINGLE_FRAME}: visible only in {@link #frame()}.</li>
 * </ul>
 * Hosts that still store associations as a nullable signed integer can use
 * {@link #decode(Integer)} and {@link #encode()}: {@code null} is ubiquitous, a
 * non-negative value is a single frame and a negative value {@code n} avoids frame {@code ~n}.
 *
 * @param kind  The association kind.
 * @param frame The frame index for {@code FRAME_AVOIDING} and {@code SINGLE_FRAME}; {@link #NO_FRAME} otherwise.
 */
public record FrameAssociation(Kind kind, int frame) {

    /** Frame value carried by ubiquitous associations. */
    public static final int NO_FRAME = -1;

    private static final FrameAssociation UBIQUITOUS = new FrameAssociation(Kind.UBIQUITOUS, NO_FRAME);

    /**
     * The three association kinds.
     */
    public enum Kind {
        UBIQUITOUS,
        FRAME_AVOIDING,
        SINGLE_FRAME
    }

    public FrameAssociation {
        Objects.requireNonNull(kind, "Association kind cannot be null.");
        if (kind == Kind.UBIQUITOUS) {
            if (frame != NO_FRAME) {
                throw new MalformedAssociationException("Ubiquitous association cannot carry frame " + frame);
            }
        } else if (frame < 0) {
            throw new MalformedAssociationException("Frame index must be non-negative for " + kind + ", got " + frame);
        }
    }

    public static FrameAssociation ubiquitous() {
        return UBIQUITOUS;
    }

    /**
     * @param frame The frame to exclude, must be non-negative.
     * @return An association visible everywhere except {@code frame}.
     * @throws MalformedAssociationException if {@code frame} is negative.
     */
    public static FrameAssociation avoiding(int frame) {
        return new FrameAssociation(Kind.FRAME_AVOIDING, frame);
    }

    /**
     * @param frame The only frame of visibility, must be non-negative.
     * @return An association visible only in {@code frame}.
     * @throws MalformedAssociationException if {@code frame} is negative.
     */
    public static FrameAssociation singleFrame(int frame) {
        return new FrameAssociation(Kind.SINGLE_FRAME, frame);
    }

    /**
     * Converts the legacy signed-integer encoding into an association.
     *
     * @param encoded {@code null} for ubiquitous, {@code n >= 0} for single frame {@code n},
     *                {@code n < 0} for avoiding frame {@code ~n}.
     * @return The decoded association.
     */
    public static FrameAssociation decode(Integer encoded) {
        if (encoded == null) {
            return UBIQUITOUS;
        }
        int value = encoded;
        return value >= 0 ? singleFrame(value) : avoiding(~value);
    }

    /**
     * @return The signed-integer encoding of this association, inverse of {@link #decode(Integer)}.
     */
    public Integer encode() {
        return switch (kind) {
            case UBIQUITOUS -> null;
            case FRAME_AVOIDING -> ~frame;
            case SINGLE_FRAME -> frame;
        };
    }

    /**
     * @param frameIndex A non-negative frame index.
     * @return true if a record with this association is visible in {@code frameIndex}.
     */
    public boolean isVisibleIn(int frameIndex) {
        return switch (kind) {
            case UBIQUITOUS -> true;
            case FRAME_AVOIDING -> frameIndex != frame;
            case SINGLE_FRAME -> frameIndex == frame;
        };
    }

    public boolean isUbiquitous() {
        return kind == Kind.UBIQUITOUS;
    }

    public boolean isFrameAvoiding() {
        return kind == Kind.FRAME_AVOIDING;
    }

    public boolean isSingleFrame() {
        return kind == Kind.SINGLE_FRAME;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case UBIQUITOUS -> "Ubiquitous";
            case FRAME_AVOIDING -> "FrameAvoiding(" + frame + ")";
            case SINGLE_FRAME -> "SingleFrame(" + frame + ")";
        };
    }
}
