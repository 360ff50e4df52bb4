package com.kvtrack.cache.instrument;

import com.kvtrack.cache.backend.KeyValueBackend;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads back the counter and history lists of an instrumented operation. Never writes to the backend.
 */
@Slf4j
public class CallReplayer {

    private final KeyValueBackend backend;

    public CallReplayer(KeyValueBackend backend) {
        this.backend = backend;
    }

    public CallTrace trace(OperationId id) {
        long count = backend.counter(id.counterKey());
        List<byte[]> inputs = backend.lrange(id.inputsKey(), 0, -1);
        List<byte[]> outputs = backend.lrange(id.outputsKey(), 0, -1);

        // pairs up to the shorter list; an orphaned input from a failed call is dropped
        int n = Math.min(inputs.size(), outputs.size());
        if (inputs.size() != outputs.size()) {
            log.debug("History of {} is uneven: {} inputs, {} outputs", id, inputs.size(), outputs.size());
        }
        List<CallTrace.Call> calls = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            calls.add(new CallTrace.Call(
                    new String(inputs.get(i), StandardCharsets.UTF_8),
                    new String(outputs.get(i), StandardCharsets.UTF_8)));
        }
        return new CallTrace(id.name(), count, calls);
    }

    public void replay(OperationId id, PrintStream out) {
        CallTrace trace = trace(id);
        out.println(trace.header());
        for (CallTrace.Call call : trace.calls()) {
            out.println(trace.line(call));
        }
        out.flush();
    }
}
