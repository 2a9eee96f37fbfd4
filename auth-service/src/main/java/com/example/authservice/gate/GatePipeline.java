package com.example.authservice.gate;

import java.util.List;

/**
 * Runs gates in order and stops at the first one that terminates.
 */
public final class GatePipeline {

    private final List<Gate> gates;

    private GatePipeline(List<Gate> gates) {
        this.gates = gates;
    }

    public static GatePipeline of(Gate... gates) {
        return new GatePipeline(List.of(gates));
    }

    public static GatePipeline of(List<Gate> gates) {
        return new GatePipeline(List.copyOf(gates));
    }

    public GateResult run(RequestContext context) {
        RequestContext current = context;
        for (Gate gate : gates) {
            GateResult result = gate.apply(current);
            if (result.isTerminated()) {
                return result;
            }
            current = result.getContext().orElse(current);
        }
        return GateResult.proceed(current);
    }

    public boolean isEmpty() {
        return gates.isEmpty();
    }
}
