package alpha.nomagicevents.registry;

import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * A callback invoked by a {@link ListenerRegistry} when an event it is
 * registered for is emitted.<p>
 * 
 * The return value is compared against the registry's {@linkplain
 * ListenerRegistry#getOnceReturnValue() once-sentinel}. If equal, the listener
 * is removed from the event after the invocation. A listener that wishes to
 * stay registered should return {@code null} or any other value not equal to
 * the sentinel (by default, {@code Boolean.TRUE}).
 * <pre>
 *   Listener untilReady = (source, args) -> {
 *       return args[0].equals("ready"); // unsubscribes when true
 *   };
 *   registry.addListener("status", untilReady);
 * </pre>
 * 
 * Listeners are identified by {@code equals()}. Lambdas create different
 * instances, so keep a reference to the listener if it is to be removed later.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public non-sealed interface Listener extends Registrant
{
    /**
     * Invoked on emission.
     * 
     * @param source registry emitting the event
     * @param args arguments given to the emitter (never {@code null}, but
     *             may be empty; elements may be {@code null})
     * 
     * @return a value compared against the once-sentinel (may be {@code null})
     */
    Object onEvent(ListenerRegistry source, Object... args);
    
    /**
     * Adapts a consumer of arguments into a listener.<p>
     * 
     * The returned listener always returns {@code null}, and so will be
     * auto-removed only if the registry's once-sentinel has been set to
     * {@code null}.
     * 
     * @param action to invoke on emission
     * @return a new listener
     * @throws NullPointerException if {@code action} is {@code null}
     */
    static Listener consuming(Consumer<Object[]> action) {
        requireNonNull(action);
        return (source, args) -> {
            action.accept(args);
            return null;
        };
    }
}
