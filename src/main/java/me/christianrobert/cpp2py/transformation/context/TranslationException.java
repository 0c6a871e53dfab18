package me.christianrobert.cpp2py.transformation.context;

/**
 * Exception thrown during the C++ to Python translation process.
 * Captures the offending C++ source and a short context description.
 */
public class TranslationException extends RuntimeException {

    private final String cppSource;
    private final String context;

    public TranslationException(String message) {
        super(message);
        this.cppSource = null;
        this.context = null;
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
        this.cppSource = null;
        this.context = null;
    }

    public TranslationException(String message, String cppSource, String context) {
        super(message);
        this.cppSource = cppSource;
        this.context = context;
    }

    public TranslationException(String message, String cppSource, String context, Throwable cause) {
        super(message, cause);
        this.cppSource = cppSource;
        this.context = context;
    }

    public String getCppSource() {
        return cppSource;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including the C++ source and context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (cppSource != null) {
            sb.append("\nC++ source: ").append(cppSource);
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
