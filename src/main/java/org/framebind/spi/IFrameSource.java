package org.framebind.spi;

import java.util.SortedSet;

/**
 * Supplies the frame indices of the dataset a primitive is overlaid on.
 * <p>
 * The engine only calls this when it has to enumerate frames explicitly, i.e. when a
 * frame-avoiding record is expanded into single-frame records, and when the dataset
 * reports that its frames have changed.
 */
@FunctionalInterface
public interface IFrameSource {

    /**
     * Returns the valid frame indices in ascending order.
     *
     * @return the non-negative frame indices of the dataset, empty if it has no frames
     */
    SortedSet<Integer> validFrameIndices();
}
