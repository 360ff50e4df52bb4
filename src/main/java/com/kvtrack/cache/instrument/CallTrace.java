package com.kvtrack.cache.instrument;

import java.util.List;

/**
 * Snapshot of an instrumented operation: how often it was invoked and the recorded calls in call order.
 */
public record CallTrace(String operation, long count, List<Call> calls) {

    public CallTrace {
        calls = List.copyOf(calls);
    }

    public record Call(String input, String output) {
    }

    public String header() {
        return operation + " was called " + count + " times:";
    }

    public String line(Call call) {
        return operation + "(*" + call.input() + ") -> " + call.output();
    }
}
