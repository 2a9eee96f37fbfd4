package com.example.authservice.gate;

/**
 * A pipeline stage that either lets a request continue or terminates it with a response.
 */
@FunctionalInterface
public interface Gate {

    GateResult apply(RequestContext context);
}
