package me.christianrobert.cpp2py.transformation.builder;

import me.christianrobert.cpp2py.transformation.context.Diagnostic;
import me.christianrobert.cpp2py.transformation.tree.definition.Module;

import java.util.List;

/**
 * Converted module plus one UNSUPPORTED_CONSTRUCT diagnostic per opaque node.
 */
public class ConversionResult {

    private final Module module;
    private final List<Diagnostic> diagnostics;

    public ConversionResult(Module module, List<Diagnostic> diagnostics) {
        this.module = module;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public Module getModule() {
        return module;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
