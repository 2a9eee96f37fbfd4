package com.example.authservice.gate;

import java.util.Optional;

/**
 * Outcome of one gate: either continue with a (possibly updated) context,
 * or terminate with a rejection.
 */
public final class GateResult {

    private final RequestContext context;
    private final GateRejection rejection;

    private GateResult(RequestContext context, GateRejection rejection) {
        this.context = context;
        this.rejection = rejection;
    }

    public static GateResult proceed(RequestContext context) {
        return new GateResult(context, null);
    }

    public static GateResult terminate(GateRejection rejection) {
        return new GateResult(null, rejection);
    }

    public boolean isTerminated() {
        return rejection != null;
    }

    /**
     * Context to hand to the next stage. Empty when terminated.
     */
    public Optional<RequestContext> getContext() {
        return Optional.ofNullable(context);
    }

    public Optional<GateRejection> getRejection() {
        return Optional.ofNullable(rejection);
    }
}
