package alpha.nomagicevents.registry;

import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Identifies one or more events of a {@link ListenerRegistry}.<p>
 * 
 * An event is addressed either by its exact {@linkplain Named name}, or by a
 * {@linkplain Matching pattern} tested against the names of all events that
 * currently exist in the registry. A pattern never creates an event. An event
 * exists once it has been {@linkplain ListenerRegistry#defineEvent(String)
 * defined}, or once a listener has been added to it by name.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public sealed interface EventId extends EventSelector permits EventId.Named, EventId.Matching
{
    /**
     * Returns an id of the event with the given name.
     * 
     * @param name of event
     * @return an id
     * @throws NullPointerException if {@code name} is {@code null}
     */
    static Named of(String name) {
        return new Named(name);
    }
    
    /**
     * Returns an id of all events whose name matches the given pattern.
     * 
     * @param pattern of event names
     * @return an id
     * @throws NullPointerException if {@code pattern} is {@code null}
     */
    static Matching matching(Pattern pattern) {
        return new Matching(pattern);
    }
    
    /**
     * Returns an id of all events whose name matches the given regular
     * expression.
     * 
     * @param regex of event names
     * @return an id
     * @throws NullPointerException
     *             if {@code regex} is {@code null}
     * @throws java.util.regex.PatternSyntaxException
     *             if {@code regex} is not a valid expression
     */
    static Matching matching(String regex) {
        return new Matching(Pattern.compile(regex));
    }
    
    /**
     * An exact event name.
     * 
     * @param name of event
     */
    record Named(String name) implements EventId {
        /**
         * Constructs this object.
         * 
         * @param name of event
         * @throws NullPointerException if {@code name} is {@code null}
         */
        public Named {
            requireNonNull(name, "Event name is null.");
        }
        
        @Override
        public String toString() {
            return name;
        }
    }
    
    /**
     * A pattern of event names.<p>
     * 
     * Note: {@code Pattern} does not override {@code equals}, and so two
     * {@code Matching} objects are equal only if they hold the same pattern
     * instance.
     * 
     * @param pattern of event names
     */
    record Matching(Pattern pattern) implements EventId {
        /**
         * Constructs this object.
         * 
         * @param pattern of event names
         * @throws NullPointerException if {@code pattern} is {@code null}
         */
        public Matching {
            requireNonNull(pattern, "Pattern is null.");
        }
        
        @Override
        public String toString() {
            return "/" + pattern.pattern() + "/";
        }
    }
}
