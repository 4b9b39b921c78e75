package json.formatter;

/// Base of every diagnostic the formatting pipeline raises.
///
/// The pipeline fails fast: the first lexical or syntactic violation is thrown as
/// either a {@link JsonTokenizeException} or a {@link JsonParseException}, and
/// {@link #getMessage()} is the human-readable diagnostic for it.
public abstract sealed class JsonFormatException extends RuntimeException
        permits JsonTokenizeException, JsonParseException {

    private static final long serialVersionUID = 1L;

    JsonFormatException(String message) {
        super(message);
    }
}
