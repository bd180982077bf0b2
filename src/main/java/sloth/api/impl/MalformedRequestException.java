package sloth.api.impl;

/** A request that could not be read off the wire; carries the status to answer with. */
public class MalformedRequestException extends Exception {
    private final int status;

    public MalformedRequestException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() { return status; }
}
