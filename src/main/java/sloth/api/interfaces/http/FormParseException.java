package sloth.api.interfaces.http;

/** Thrown when a request's query string or form body cannot be decoded. */
public class FormParseException extends Exception {
    public FormParseException(String message) {
        super(message);
    }

    public FormParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
