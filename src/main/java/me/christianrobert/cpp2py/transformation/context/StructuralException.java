package me.christianrobert.cpp2py.transformation.context;

/**
 * Thrown when a tree node is constructed with a child that does not fit its slot.
 *
 * <p>This is a converter or rule defect, never a problem with the user's input.
 * The rewrite engine does not recover from it: the file's translation fails.</p>
 */
public class StructuralException extends TranslationException {

    public StructuralException(String message) {
        super(message, null, "tree construction");
    }
}
