package sloth.domain.impl;

/** A structured payload could not be serialized. */
public class ResponseEncodingException extends Exception {
    public ResponseEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
