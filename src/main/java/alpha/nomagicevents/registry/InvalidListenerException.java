package alpha.nomagicevents.registry;

/**
 * Thrown by the add operations of {@link ListenerRegistry} if the given object
 * is not a valid listener.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @see ListenerRegistry#isValidListener(Object)
 */
public class InvalidListenerException extends RuntimeException {
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs this object.
     * 
     * @param rejected the invalid listener (may be {@code null})
     */
    public InvalidListenerException(Object rejected) {
        super("Not a valid listener: " + rejected);
    }
}
