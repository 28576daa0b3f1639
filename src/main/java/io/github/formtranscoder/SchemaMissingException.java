package io.github.formtranscoder;

/**
 * Thrown when no schema is supplied, none is cached under the requested name,
 * and therefore no container field can be determined.
 */
public class SchemaMissingException extends TranscodingException {

    public SchemaMissingException(String message) {
        super(message);
    }

    public SchemaMissingException(String schemaName, String message) {
        super(schemaName, message);
    }
}
