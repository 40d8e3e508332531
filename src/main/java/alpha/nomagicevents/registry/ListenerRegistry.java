package alpha.nomagicevents.registry;

import alpha.nomagicevents.Config;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A registry of listeners keyed by event name, and the emitter of those
 * events.<p>
 * 
 * Listeners are added to an event identified by name, and invoked
 * synchronously, in the order they were added, when the event is emitted.
 * Emitting may pass arguments to the listeners.
 * <pre>
 *   ListenerRegistry reg = new {@link DefaultListenerRegistry}();
 *   Listener greeter = (source, args) -> {
 *       System.out.println("Hello " + args[0]);
 *       return null;
 *   };
 *   reg.addListener("greet", greeter);
 *   reg.emit("greet", "World"); // Hello World
 * </pre>
 * 
 * Most operations accept an {@link EventId}, which is either an exact event
 * name or a pattern. A pattern addresses all <i>existing</i> events whose name
 * matches it. A pattern never creates an event, so to add a listener to a
 * group of events using a pattern, the events must first be {@linkplain
 * #defineEvent(String) defined} (or have had a listener added by name).
 * <pre>
 *   reg.defineEvents("bar", "baz");
 *   reg.addListener(EventId.matching("^ba"), listener); // added to bar and baz
 *   reg.emit(EventId.matching("^ba"));                  // emits bar, then baz
 * </pre>
 * 
 * Looking up, adding to, removing from and emitting an exact event name
 * creates the event if it does not exist.<p>
 * 
 * The same listener is stored at most once per event. A listener is
 * identified by {@code equals()}, the {@linkplain ListenerRecord#fireOnce()
 * fire-once} flag is not part of the identity. Adding a listener already
 * present is a NOP, even if the flag differs.<p>
 * 
 * A listener flagged to fire once is removed immediately before it is
 * invoked. Independent of how it was added, a listener returning a value equal
 * to the {@linkplain #getOnceReturnValue() once-sentinel} ({@code Boolean.TRUE}
 * by default) is removed immediately after it returns.<p>
 * 
 * Emission iterates a snapshot of each event's listeners. Listeners added or
 * removed by a listener during emission do not affect the ongoing emission,
 * only subsequent ones.<p>
 * 
 * <strong>There is no special handling/logic concerning exceptions.</strong>
 * If a listener throws an exception, then that exception will propagate to the
 * emitter's caller and remaining listeners, for the same event and any other
 * event selected by a pattern, will miss out on the emission. Callers needing
 * to isolate listener failures must wrap the emission themselves.<p>
 * 
 * Removing something that does not exist is a NOP, never an error.<p>
 * 
 * The registry is not thread-safe. If shared between threads, all access must
 * be externally synchronized.<p>
 * 
 * Methods {@link #on(String, Listener) on}, {@link #once(String, Listener)
 * once}, {@link #off(String, Listener) off}, {@link #removeAllListeners()} and
 * {@link #trigger(String, List) trigger} are aliases forwarding to the
 * canonical method.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface ListenerRegistry
{
    /**
     * Returns {@code true} if the given object is a valid listener.<p>
     * 
     * A valid listener is a {@link Listener}, a {@link Pattern}, or a {@link
     * ListenerRecord} whose callback is a valid listener.<p>
     * 
     * A pattern is considered valid, but it can not be invoked and it is not a
     * {@link Registrant}, so it can never be added to the registry. The check
     * exists to gate add operations on values of unknown type.
     * 
     * @param obj to test (may be {@code null})
     * @return see JavaDoc
     */
    static boolean isValidListener(Object obj) {
        if (obj instanceof Listener || obj instanceof Pattern) {
            return true;
        }
        return obj instanceof ListenerRecord r && isValidListener(r.callback());
    }
    
    /**
     * Extracts the callbacks from the given records.
     * 
     * @param records to flatten
     * @return the callbacks, in the same order
     * @throws NullPointerException if {@code records} is {@code null}
     */
    static List<Listener> flattenListeners(List<ListenerRecord> records) {
        return records.stream().map(ListenerRecord::callback).toList();
    }
    
    /**
     * Returns the listeners of the given event.<p>
     * 
     * The event is created if it does not exist.<p>
     * 
     * The returned list is an unmodifiable, live view.
     * 
     * @param name of event
     * @return the listeners of the given event
     * @throws NullPointerException if {@code name} is {@code null}
     */
    List<ListenerRecord> getListeners(String name);
    
    /**
     * Returns the listeners of all existing events whose name matches the
     * given pattern.<p>
     * 
     * No event is created. If no event matches, the returned map is empty.<p>
     * 
     * The returned map is a snapshot of the matched events, iterated in the
     * order of the registry's event table. Each value is an unmodifiable, live
     * view of the event's listeners.
     * 
     * @param pattern of event names
     * @return event name to listeners
     * @throws NullPointerException if {@code pattern} is {@code null}
     */
    Map<String, List<ListenerRecord>> getListeners(Pattern pattern);
    
    /**
     * Returns the listeners of the given event(s), keyed by event name.<p>
     * 
     * For an exact name, this method behaves as {@link #getListeners(String)}
     * and the map will have one entry. For a pattern, this method behaves as
     * {@link #getListeners(Pattern)}.
     * 
     * @param event to look up
     * @return event name to listeners
     * @throws NullPointerException if {@code event} is {@code null}
     */
    Map<String, List<ListenerRecord>> getListenersAsMap(EventId event);
    
    /**
     * Adds a listener to the given event(s).<p>
     * 
     * A bare {@link Listener} is wrapped in a {@link ListenerRecord} not
     * flagged to fire once. A record is stored as-is. The listener is not added
     * to an event where it is already present.
     * 
     * @param event to add the listener to
     * @param listener to add
     * @return this for chaining/fluency
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws InvalidListenerException
     *             if {@code listener} is not {@linkplain
     *             #isValidListener(Object) valid}
     */
    ListenerRegistry addListener(EventId event, Registrant listener);
    
    /**
     * Adds a listener to the given event(s).<p>
     * 
     * Equivalent to {@link #addListener(EventId, Registrant)}. Exists so that
     * a lambda expression can be passed as the listener.
     * 
     * @param event to add the listener to
     * @param listener to add
     * @return this for chaining/fluency
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws InvalidListenerException
     *             if {@code listener} is {@code null}
     */
    default ListenerRegistry addListener(EventId event, Listener listener) {
        return addListener(event, (Registrant) listener);
    }
    
    /**
     * Adds a listener to the given event.
     * 
     * @param name of event
     * @param listener to add
     * @return this for chaining/fluency
     * @throws NullPointerException
     *             if {@code name} is {@code null}
     * @throws InvalidListenerException
     *             if {@code listener} is not {@linkplain
     *             #isValidListener(Object) valid}
     * @see #addListener(EventId, Registrant)
     */
    default ListenerRegistry addListener(String name, Registrant listener) {
        return addListener(EventId.of(name), listener);
    }
    
    /**
     * Adds a listener to the given event.
     * 
     * @param name of event
     * @param listener to add
     * @return this for chaining/fluency
     * @throws NullPointerException
     *             if {@code name} is {@code null}
     * @throws InvalidListenerException
     *             if {@code listener} is {@code null}
     * @see #addListener(EventId, Registrant)
     */
    default ListenerRegistry addListener(String name, Listener listener) {
        return addListener(EventId.of(name), (Registrant) listener);
    }
    
    /**
     * Adds a listener to the given event(s), flagged to fire once.<p>
     * 
     * Equivalent to
     * <pre>
     *   addListener(event, new ListenerRecord(listener, true));
     * </pre>
     * 
     * @param event to add the listener to
     * @param listener to add
     * @return this for chaining/fluency
     * @throws NullPointerException
     *             if {@code event} is {@code null}
     * @throws InvalidListenerException
     *             if {@code listener} is {@code null}
     */
    default ListenerRegistry addOnceListener(EventId event, Listener listener) {
        return addListener(event, ListenerRecord.once(listener));
    }
    
    /**
     * Adds a listener to the given event, flagged to fire once.
     * 
     * @param name of event
     * @param listener to add
     * @return this for chaining/fluency
     * @throws NullPointerException
     *             if {@code name} is {@code null}
     * @throws InvalidListenerException
     *             if {@code listener} is {@code null}
     * @see #addOnceListener(EventId, Listener)
     */
    default ListenerRegistry addOnceListener(String name, Listener listener) {
        return addOnceListener(EventId.of(name), listener);
    }
    
    /**
     * Defines an event.<p>
     * 
     * A defined event has no listeners, but exists, and so can be selected by
     * a pattern.
     * 
     * @param name of event
     * @return this for chaining/fluency
     * @throws NullPointerException if {@code name} is {@code null}
     */
    ListenerRegistry defineEvent(String name);
    
    /**
     * Defines events.
     * 
     * @param names of events
     * @return this for chaining/fluency
     * @throws NullPointerException if {@code names}, or an element, is {@code null}
     * @see #defineEvent(String)
     */
    default ListenerRegistry defineEvents(Collection<String> names) {
        names.forEach(this::defineEvent);
        return this;
    }
    
    /**
     * Defines events.
     * 
     * @param names of events
     * @return this for chaining/fluency
     * @throws NullPointerException if {@code names}, or an element, is {@code null}
     * @see #defineEvent(String)
     */
    default ListenerRegistry defineEvents(String... names) {
        return defineEvents(Arrays.asList(names));
    }
    
    /**
     * Removes a listener from the given event(s).<p>
     * 
     * If the listener is not present, this method is a NOP.
     * 
     * @param event to remove the listener from
     * @param listener to remove
     * @return this for chaining/fluency
     * @throws NullPointerException if {@code event} is {@code null}
     */
    ListenerRegistry removeListener(EventId event, Listener listener);
    
    /**
     * Removes a listener from the given event.
     * 
     * @param name of event
     * @param listener to remove
     * @return this for chaining/fluency
     * @throws NullPointerException if {@code name} is {@code null}
     * @see #removeListener(EventId, Listener)
     */
    default ListenerRegistry removeListener(String name, Listener listener) {
        return removeListener(EventId.of(name), listener);
    }
    
    /**
     * Adds listeners in bulk.<p>
     * 
     * Equivalent to {@code manipulateListeners(false, selector, listeners)}.
     * 
     * @param selector of event(s)
     * @param listeners to add (ignored if {@code selector} is a {@link
     *        EventSelector.ByMap ByMap})
     * @return this for chaining/fluency
     * @throws NullPointerException
     *             if {@code selector} is {@code null}, or
     *             if {@code selector} is an {@code EventId} and
     *             {@code listeners} is {@code null}
     * @throws InvalidListenerException
     *             if a listener is not {@linkplain #isValidListener(Object) valid}
     * @see #manipulateListeners(boolean, EventSelector, List)
     */
    default ListenerRegistry addListeners(EventSelector selector, List<? extends Registrant> listeners) {
        return manipulateListeners(false, selector, listeners);
    }
    
    /**
     * Adds listeners in bulk, to multiple events.
     * 
     * @param listeners event name to listeners
     * @return this for chaining/fluency
     * @throws NullPointerException if {@code listeners}, or a key, is {@code null}
     * @throws InvalidListenerException
     *             if a listener is not {@linkplain #isValidListener(Object) valid}
     * @see #manipulateListeners(boolean, EventSelector, List)
     */
    default ListenerRegistry addListeners(Map<String, ? extends List<? extends Registrant>> listeners) {
        return addListeners(EventSelector.byMap(listeners), List.of());
    }
    
    /**
     * Removes listeners in bulk.<p>
     * 
     * Equivalent to {@code manipulateListeners(true, selector, listeners)}.
     * 
     * @param selector of event(s)
     * @param listeners to remove (ignored if {@code selector} is a {@link
     *        EventSelector.ByMap ByMap})
     * @return this for chaining/fluency
     * @throws NullPointerException
     *             if {@code selector} is {@code null}, or
     *             if {@code selector} is an {@code EventId} and
     *             {@code listeners} is {@code null}
     * @see #manipulateListeners(boolean, EventSelector, List)
     */
    default ListenerRegistry removeListeners(EventSelector selector, List<? extends Registrant> listeners) {
        return manipulateListeners(true, selector, listeners);
    }
    
    /**
     * Removes listeners in bulk, from multiple events.
     * 
     * @param listeners event name to listeners
     * @return this for chaining/fluency
     * @throws NullPointerException if {@code listeners}, or a key, is {@code null}
     * @see #manipulateListeners(boolean, EventSelector, List)
     */
    default ListenerRegistry removeListeners(Map<String, ? extends List<? extends Registrant>> listeners) {
        return removeListeners(EventSelector.byMap(listeners), List.of());
    }
    
    /**
     * Adds or removes listeners in bulk.<p>
     * 
     * If the selector is an {@link EventId}, the singular operation ({@link
     * #addListener(EventId, Registrant) addListener} or {@link
     * #removeListener(EventId, Listener) removeListener}) is applied for each
     * given listener, starting with the last one.<p>
     * 
     * If the selector is a {@link EventSelector.ByMap ByMap}, the given list
     * is ignored. Each entry's value is applied to the event named by the
     * entry's key; a value with exactly one element using the singular
     * operation, any other value using the plural operation ({@link
     * #addListeners(EventSelector, List) addListeners} or {@link
     * #removeListeners(EventSelector, List) removeListeners}).<p>
     * 
     * Removing a {@link ListenerRecord} removes the record's callback.
     * 
     * @param remove {@code true} to remove, {@code false} to add
     * @param selector of event(s)
     * @param listeners to add or remove
     * @return this for chaining/fluency
     * @throws NullPointerException
     *             if {@code selector} is {@code null}, or
     *             if {@code selector} is an {@code EventId} and
     *             {@code listeners} is {@code null}
     * @throws InvalidListenerException
     *             if adding, and a listener is not {@linkplain
     *             #isValidListener(Object) valid}
     */
    ListenerRegistry manipulateListeners(
            boolean remove, EventSelector selector, List<? extends Registrant> listeners);
    
    /**
     * Removes the given event(s), and with it, all of its listeners.<p>
     * 
     * If the event does not exist, this method is a NOP.
     * 
     * @param event to remove
     * @return this for chaining/fluency
     * @throws NullPointerException if {@code event} is {@code null}
     */
    ListenerRegistry removeEvent(EventId event);
    
    /**
     * Removes the given event, and with it, all of its listeners.
     * 
     * @param name of event
     * @return this for chaining/fluency
     * @throws NullPointerException if {@code name} is {@code null}
     * @see #removeEvent(EventId)
     */
    default ListenerRegistry removeEvent(String name) {
        return removeEvent(EventId.of(name));
    }
    
    /**
     * Removes all events, and with them, all listeners.
     * 
     * @return this for chaining/fluency
     */
    ListenerRegistry removeEvent();
    
    /**
     * Emits the given event(s).<p>
     * 
     * For each selected event, each listener is invoked with the given
     * arguments, in the order the listeners were added. Multiple events
     * selected by a pattern are emitted in the order of the registry's event
     * table.<p>
     * 
     * A listener flagged to fire once is removed from the event before it is
     * invoked. A listener returning a value equal to the {@linkplain
     * #getOnceReturnValue() once-sentinel} is removed after it returns.<p>
     * 
     * An exception thrown by a listener propagates as-is to the caller of this
     * method, and no more listeners will be invoked (for any selected event).
     * 
     * @param event to emit
     * @param args passed to each listener (elements may be {@code null})
     * @return this for chaining/fluency
     * @throws NullPointerException if any arg is {@code null}
     */
    ListenerRegistry emitEvent(EventId event, List<?> args);
    
    /**
     * Emits the given event(s) without arguments.
     * 
     * @param event to emit
     * @return this for chaining/fluency
     * @throws NullPointerException if {@code event} is {@code null}
     * @see #emitEvent(EventId, List)
     */
    default ListenerRegistry emitEvent(EventId event) {
        return emitEvent(event, List.of());
    }
    
    /**
     * Emits the given event.
     * 
     * @param name of event
     * @param args passed to each listener (elements may be {@code null})
     * @return this for chaining/fluency
     * @throws NullPointerException if any arg is {@code null}
     * @see #emitEvent(EventId, List)
     */
    default ListenerRegistry emitEvent(String name, List<?> args) {
        return emitEvent(EventId.of(name), args);
    }
    
    /**
     * Emits the given event(s), passing the trailing arguments.
     * 
     * @param event to emit
     * @param args passed to each listener
     * @return this for chaining/fluency
     * @throws NullPointerException if {@code event} is {@code null}
     * @see #emitEvent(EventId, List)
     */
    default ListenerRegistry emit(EventId event, Object... args) {
        return emitEvent(event, Arrays.asList(args));
    }
    
    /**
     * Emits the given event, passing the trailing arguments.
     * 
     * @param name of event
     * @param args passed to each listener
     * @return this for chaining/fluency
     * @throws NullPointerException if {@code name} is {@code null}
     * @see #emitEvent(EventId, List)
     */
    default ListenerRegistry emit(String name, Object... args) {
        return emit(EventId.of(name), args);
    }
    
    /**
     * Sets the once-sentinel.<p>
     * 
     * A listener returning a value equal to the sentinel is removed from the
     * event it was invoked for. The initial value is taken from {@link
     * Config#onceReturnValue()}.
     * 
     * @param value new sentinel (may be {@code null})
     * @return this for chaining/fluency
     */
    ListenerRegistry setOnceReturnValue(Object value);
    
    /**
     * Returns the once-sentinel.
     * 
     * @return the once-sentinel (may be {@code null})
     * @see #setOnceReturnValue(Object)
     */
    Object getOnceReturnValue();
    
    /**
     * Alias of {@link #addListener(EventId, Registrant)}.
     * 
     * @param event to add the listener to
     * @param listener to add
     * @return this for chaining/fluency
     */
    default ListenerRegistry on(EventId event, Registrant listener) {
        return addListener(event, listener);
    }
    
    /**
     * Alias of {@link #addListener(EventId, Listener)}.
     * 
     * @param event to add the listener to
     * @param listener to add
     * @return this for chaining/fluency
     */
    default ListenerRegistry on(EventId event, Listener listener) {
        return addListener(event, listener);
    }
    
    /**
     * Alias of {@link #addListener(String, Listener)}.
     * 
     * @param name of event
     * @param listener to add
     * @return this for chaining/fluency
     */
    default ListenerRegistry on(String name, Listener listener) {
        return addListener(name, listener);
    }
    
    /**
     * Alias of {@link #addOnceListener(EventId, Listener)}.
     * 
     * @param event to add the listener to
     * @param listener to add
     * @return this for chaining/fluency
     */
    default ListenerRegistry once(EventId event, Listener listener) {
        return addOnceListener(event, listener);
    }
    
    /**
     * Alias of {@link #addOnceListener(String, Listener)}.
     * 
     * @param name of event
     * @param listener to add
     * @return this for chaining/fluency
     */
    default ListenerRegistry once(String name, Listener listener) {
        return addOnceListener(name, listener);
    }
    
    /**
     * Alias of {@link #removeListener(EventId, Listener)}.
     * 
     * @param event to remove the listener from
     * @param listener to remove
     * @return this for chaining/fluency
     */
    default ListenerRegistry off(EventId event, Listener listener) {
        return removeListener(event, listener);
    }
    
    /**
     * Alias of {@link #removeListener(String, Listener)}.
     * 
     * @param name of event
     * @param listener to remove
     * @return this for chaining/fluency
     */
    default ListenerRegistry off(String name, Listener listener) {
        return removeListener(name, listener);
    }
    
    /**
     * Alias of {@link #removeEvent(EventId)}.
     * 
     * @param event to remove
     * @return this for chaining/fluency
     */
    default ListenerRegistry removeAllListeners(EventId event) {
        return removeEvent(event);
    }
    
    /**
     * Alias of {@link #removeEvent()}.
     * 
     * @return this for chaining/fluency
     */
    default ListenerRegistry removeAllListeners() {
        return removeEvent();
    }
    
    /**
     * Alias of {@link #emitEvent(EventId, List)}.
     * 
     * @param event to emit
     * @param args passed to each listener
     * @return this for chaining/fluency
     */
    default ListenerRegistry trigger(EventId event, List<?> args) {
        return emitEvent(event, args);
    }
    
    /**
     * Alias of {@link #emitEvent(String, List)}.
     * 
     * @param name of event
     * @param args passed to each listener
     * @return this for chaining/fluency
     */
    default ListenerRegistry trigger(String name, List<?> args) {
        return emitEvent(name, args);
    }
}
