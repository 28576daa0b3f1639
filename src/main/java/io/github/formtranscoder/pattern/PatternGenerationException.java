package io.github.formtranscoder.pattern;

import io.github.formtranscoder.TranscodingException;

/**
 * Exception thrown when a field hierarchy cannot be compiled into patterns.
 */
public class PatternGenerationException extends TranscodingException {

    private final String arrayPath;

    public PatternGenerationException(String arrayPath, String message) {
        super(message);
        this.arrayPath = arrayPath;
    }

    public PatternGenerationException(String arrayPath, String message, Throwable cause) {
        super(message, cause);
        this.arrayPath = arrayPath;
    }

    /**
     * Returns the hierarchy entry that failed to compile.
     */
    public String getArrayPath() {
        return arrayPath;
    }

    @Override
    public String getMessage() {
        if (arrayPath != null) {
            return "Array '" + arrayPath + "': " + super.getMessage();
        }
        return super.getMessage();
    }
}
