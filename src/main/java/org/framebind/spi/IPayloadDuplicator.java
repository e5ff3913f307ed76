package org.framebind.spi;

/**
 * Copies a state payload when the engine materializes several records from one.
 *
 * @param <P> The payload type.
 */
@FunctionalInterface
public interface IPayloadDuplicator<P> {

    /**
     * Returns a copy of the given payload for a new record.
     *
     * @param payload the payload to copy, may be null
     * @return the payload for the new record
     */
    P duplicate(P payload);

    /**
     * Returns a duplicator that shares the payload reference between records.
     *
     * @param <P> The payload type.
     * @return the sharing duplicator
     */
    static <P> IPayloadDuplicator<P> sharing() {
        return payload -> payload;
    }
}
