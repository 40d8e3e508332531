package alpha.nomagicevents.registry;

/**
 * A listener as stored by the registry.<p>
 * 
 * A record flagged {@code fireOnce} is removed from the event immediately
 * before it is invoked.<p>
 * 
 * The callback is not null-checked by the constructor. A record with a
 * {@code null} callback is not a {@linkplain
 * ListenerRegistry#isValidListener(Object) valid listener} and will be
 * rejected by the registry.
 * 
 * @param callback the listener
 * @param fireOnce whether to remove the listener before its first invocation
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public record ListenerRecord(Listener callback, boolean fireOnce) implements Registrant {
    /**
     * Wraps the given listener in a record flagged to fire once.
     * 
     * @param callback the listener
     * @return a new record
     */
    public static ListenerRecord once(Listener callback) {
        return new ListenerRecord(callback, true);
    }
}
