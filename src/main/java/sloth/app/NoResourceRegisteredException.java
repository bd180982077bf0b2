package sloth.app;

/** {@link Api#start(int)} was called before any resource or router was set up. */
public class NoResourceRegisteredException extends IllegalStateException {
    public NoResourceRegisteredException() {
        super("add at least one resource to this API before starting it");
    }
}
