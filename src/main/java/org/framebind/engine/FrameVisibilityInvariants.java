package org.framebind.engine;

import org.framebind.model.FrameAssociation;
import org.framebind.model.StateRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a record sequence against the one-state-per-frame invariants:
 * <ol>
 *   <li>I1: at most one record is visible in any frame,</li>
 *   <li>I2: a ubiquitous record is the only record,</li>
 *   <li>I3: at most one frame-avoiding record exists,</li>
 *   <li>I4: a record avoiding frame f only coexists with a record showing exactly f,</li>
 *   <li>I5: single-frame records occupy pairwise distinct frames.</li>
 * </ol>
 * I1 follows from I2..I5, so it is not checked separately.
 */
public final class FrameVisibilityInvariants {

    private FrameVisibilityInvariants() {}

    /**
     * Lists all violations found in the given sequence.
     *
     * @param records The sequence to check.
     * @return Human-readable violations, empty if the sequence is consistent.
     */
    public static List<String> violations(List<? extends StateRecord<?>> records) {
        List<String> problems = new ArrayList<>();
        int ubiquitous = 0;
        List<StateRecord<?>> avoiding = new ArrayList<>();
        Map<Integer, StateRecord<?>> singleFrames = new HashMap<>();

        for (StateRecord<?> record : records) {
            FrameAssociation association = record.association();
            switch (association.kind()) {
                case UBIQUITOUS -> ubiquitous++;
                case FRAME_AVOIDING -> avoiding.add(record);
                case SINGLE_FRAME -> {
                    StateRecord<?> previous = singleFrames.putIfAbsent(association.frame(), record);
                    if (previous != null) {
                        problems.add(String.format("I5: %s and %s both claim frame %d", previous, record, association.frame()));
                    }
                }
            }
        }

        if (ubiquitous > 0 && records.size() > 1) {
            problems.add(String.format("I2: %d ubiquitous record(s) share a sequence of %d records", ubiquitous, records.size()));
        }
        if (avoiding.size() > 1) {
            problems.add("I3: more than one frame-avoiding record: " + avoiding);
        }
        if (avoiding.size() == 1) {
            int gap = avoiding.get(0).association().frame();
            for (StateRecord<?> record : records) {
                if (record == avoiding.get(0) || record.association().isFrameAvoiding()) continue;
                if (!record.association().equals(FrameAssociation.singleFrame(gap))) {
                    problems.add(String.format("I4: %s coexists with %s", record, avoiding.get(0)));
                }
            }
        }
        return problems;
    }

    /**
     * @param records The sequence to check.
     * @throws IllegalStateException if the sequence violates any invariant.
     */
    public static void verify(List<? extends StateRecord<?>> records) {
        List<String> problems = violations(records);
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Record sequence violates frame invariants: " + String.join("; ", problems));
        }
    }
}
