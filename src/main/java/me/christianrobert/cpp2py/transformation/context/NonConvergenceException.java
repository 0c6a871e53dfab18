package me.christianrobert.cpp2py.transformation.context;

/**
 * Thrown in strict mode when fixed-point rewriting still changes the tree after the
 * maximum number of passes.
 */
public class NonConvergenceException extends TranslationException {

    private final int passes;

    public NonConvergenceException(int passes) {
        super("Rewriting did not reach a fixed point after " + passes + " passes", null, "rewrite engine");
        this.passes = passes;
    }

    public int getPasses() {
        return passes;
    }
}
