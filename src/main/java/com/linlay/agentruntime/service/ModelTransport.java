package com.linlay.agentruntime.service;

import com.linlay.agentruntime.agent.runtime.CancellationSignal;
import com.linlay.agentruntime.model.ProviderProtocol;
import reactor.core.publisher.Flux;

/**
 * Boundary to a model provider. Emits the raw vendor chunks of one streamed response.
 * <p>
 * The returned flux is lazy: nothing is sent before subscription, and cancelling the
 * subscription aborts the call. Transport failures are signalled as {@link ModelCallException}.
 */
public interface ModelTransport {

    Flux<String> issueModelCall(ModelRequest request, CancellationSignal cancellation);

    /**
     * Wire protocol of the chunks this transport emits.
     */
    default ProviderProtocol protocol() {
        return ProviderProtocol.OPENAI;
    }
}
