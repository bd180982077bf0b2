package sloth.app;

/** A router was installed on an {@link Api} that already has one. */
public class RouterAlreadyInitializedException extends IllegalStateException {
    public RouterAlreadyInitializedException() {
        super("router already initialized; setRouter must come before any resource is added");
    }
}
