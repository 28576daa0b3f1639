package io.github.formtranscoder;

/**
 * Base exception for all transcoding errors.
 */
public class TranscodingException extends RuntimeException {

    private final String schemaName;

    public TranscodingException(String message) {
        super(message);
        this.schemaName = null;
    }

    public TranscodingException(String message, Throwable cause) {
        super(message, cause);
        this.schemaName = null;
    }

    public TranscodingException(String schemaName, String message) {
        super(message);
        this.schemaName = schemaName;
    }

    public TranscodingException(String schemaName, String message, Throwable cause) {
        super(message, cause);
        this.schemaName = schemaName;
    }

    /**
     * Returns the schema (workflow) name the error relates to, or null.
     */
    public String getSchemaName() {
        return schemaName;
    }

    @Override
    public String getMessage() {
        if (schemaName != null && !schemaName.isEmpty()) {
            return "Schema '" + schemaName + "': " + super.getMessage();
        }
        return super.getMessage();
    }
}
