package com.linlay.agentruntime.stream.service;

import com.linlay.agentruntime.stream.model.StreamEvent;

import java.util.List;

/**
 * Converts the raw chunks of one model-call response into canonical events.
 * <p>
 * Instances are stateful and belong to exactly one response. Each call returns the events for
 * that chunk synchronously. After an {@link StreamEvent.Error} has been returned, or after
 * {@link #complete()}, every further call returns an empty list.
 */
public interface StreamNormalizer {

    List<StreamEvent> normalize(String rawChunk);

    /**
     * Signals the end of the transport stream. Closes blocks that are still open, in the order
     * they were opened, and emits a finish event when the vendor did not send one.
     */
    List<StreamEvent> complete();

    boolean terminated();
}
