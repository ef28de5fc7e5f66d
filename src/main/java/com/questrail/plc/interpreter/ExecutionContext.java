package com.questrail.plc.interpreter;

import com.questrail.plc.observability.InterpreterDiagnostic;
import com.questrail.plc.observability.ScanObservabilitySink;
import com.questrail.plc.store.VariableStore;

import java.util.Objects;

/**
 * Everything a statement or expression needs, passed explicitly through
 * every call: the root store, the runtime state, the current name scope and
 * the sink that receives diagnostics.
 */
public record ExecutionContext(VariableStore store,
                               RuntimeState runtime,
                               Scope scope,
                               ScanObservabilitySink sink)
{
    public ExecutionContext {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(runtime, "runtime");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(sink, "sink");
    }

    public static ExecutionContext root(VariableStore store, RuntimeState runtime, ScanObservabilitySink sink) {
        return new ExecutionContext(store, runtime, Scope.global(runtime.registry(), store), sink);
    }

    public ExecutionContext withScope(Scope inner) {
        return new ExecutionContext(store, runtime, inner, sink);
    }

    public TypeRegistry registry() {
        return runtime.registry();
    }

    void report(InterpreterDiagnostic.Kind kind, String subject, String message) {
        sink.onDiagnostic(InterpreterDiagnostic.of(kind, subject, message));
    }
}
