package alpha.nomagicevents.registry;

/**
 * Something that can be added to a {@link ListenerRegistry}; either a bare
 * {@link Listener} or a {@link ListenerRecord} wrapping one.<p>
 * 
 * A bare listener added to the registry is wrapped in a record that is not
 * flagged to fire once. A record is stored as-is.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public sealed interface Registrant permits Listener, ListenerRecord
{
    /**
     * Converts an untyped object into a registrant.<p>
     * 
     * Useful when listeners come from a source that is not statically typed,
     * e.g. a {@code Map<String, Object>} assembled by reflection.
     * 
     * @param obj to convert (may be {@code null})
     * @return the same object, typed
     * @throws InvalidListenerException
     *             if {@code obj} is not a {@code Registrant}, or
     *             if it is not a {@linkplain ListenerRegistry#isValidListener(Object)
     *             valid listener}
     */
    static Registrant of(Object obj) {
        if (obj instanceof Registrant r && ListenerRegistry.isValidListener(r)) {
            return r;
        }
        throw new InvalidListenerException(obj);
    }
}
