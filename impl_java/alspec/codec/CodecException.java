package alspec.codec;

import alspec.SpecException;

/**
 * The interchange form does not describe a node: unknown discriminator, or a
 * field that is missing or of the wrong JSON type.
 */
public class CodecException extends SpecException {
    private final String nodeType;
    private final String field;

    private CodecException(Kind kind, String nodeType, String field, String message, Throwable cause) {
        super(kind, field == null ? nodeType : field, message, cause);
        this.nodeType = nodeType;
        this.field = field;
    }

    public static CodecException unknownNodeType(String category, String type) {
        return new CodecException(Kind.UNKNOWN_NODE_TYPE, type, null,
                String.format("Unknown %s node type '%s'", category, type), null);
    }

    public static CodecException malformed(String nodeType, String field, String expected) {
        return new CodecException(Kind.MALFORMED_NODE, nodeType, field,
                String.format("%s node: field '%s' is missing or not %s", nodeType, field, expected), null);
    }

    public static CodecException malformed(String nodeType, String field, String message, Throwable cause) {
        return new CodecException(Kind.MALFORMED_NODE, nodeType, field, nodeType + " node: " + message, cause);
    }

    public String nodeType() {
        return nodeType;
    }

    /**
     * The offending field, or null when the discriminator itself was the problem.
     */
    public String field() {
        return field;
    }
}
