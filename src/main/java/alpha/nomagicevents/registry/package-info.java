/**
 * A registry of listeners keyed by event name, see {@link
 * alpha.nomagicevents.registry.ListenerRegistry ListenerRegistry}.<p>
 * 
 * Events are plain strings. There is no event type hierarchy and no event
 * object; the emitter passes arbitrary arguments to the listeners. An event can
 * be addressed by its exact name, or a group of events by a {@link
 * java.util.regex.Pattern Pattern}.<p>
 * 
 * Emission is synchronous and happens on the thread that calls {@code emit}.
 * Nothing is queued, saved or retried.
 */
package alpha.nomagicevents.registry;
