package me.christianrobert.cpp2py.transformation.engine;

/**
 * Engine settings.
 *
 * <p>Defaults: one pass, failure isolation on. With {@code fixedPoint} the engine repeats
 * passes until one changes nothing, at most {@code maxPasses} times. With {@code strict}
 * a failing rule or a non-converging rewrite aborts the translation instead of being
 * reported as a diagnostic.</p>
 */
public final class RewriteOptions {

    public static final int DEFAULT_MAX_PASSES = 10;

    private static final RewriteOptions DEFAULTS = new RewriteOptions(false, DEFAULT_MAX_PASSES, false);

    private final boolean fixedPoint;
    private final int maxPasses;
    private final boolean strict;

    public RewriteOptions(boolean fixedPoint, int maxPasses, boolean strict) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be at least 1, got " + maxPasses);
        }
        this.fixedPoint = fixedPoint;
        this.maxPasses = maxPasses;
        this.strict = strict;
    }

    public static RewriteOptions defaults() {
        return DEFAULTS;
    }

    public boolean isFixedPoint() {
        return fixedPoint;
    }

    public int getMaxPasses() {
        return maxPasses;
    }

    public boolean isStrict() {
        return strict;
    }

    public RewriteOptions withFixedPoint(boolean newFixedPoint) {
        return new RewriteOptions(newFixedPoint, maxPasses, strict);
    }

    public RewriteOptions withMaxPasses(int newMaxPasses) {
        return new RewriteOptions(fixedPoint, newMaxPasses, strict);
    }

    public RewriteOptions withStrict(boolean newStrict) {
        return new RewriteOptions(fixedPoint, maxPasses, newStrict);
    }

    @Override
    public String toString() {
        return "RewriteOptions{fixedPoint=" + fixedPoint + ", maxPasses=" + maxPasses + ", strict=" + strict + "}";
    }
}
