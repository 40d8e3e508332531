package alpha.nomagicevents.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Selects the targets of a bulk add or remove operation.<p>
 * 
 * A selector is either an {@link EventId} (exact event name or pattern),
 * paired with a list of listeners given separately to the operation, or a
 * {@link ByMap} carrying its own listeners, per event name.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @see ListenerRegistry#manipulateListeners(boolean, EventSelector, List)
 */
public sealed interface EventSelector permits EventId, EventSelector.ByMap
{
    /**
     * Creates a selector from the given map.
     * 
     * @param entries event name to listeners
     * @return a selector
     * @throws NullPointerException if {@code entries}, or a key, is {@code null}
     */
    @SuppressWarnings("unchecked")
    static ByMap byMap(Map<String, ? extends List<? extends Registrant>> entries) {
        // Only read by the constructor's copy
        return new ByMap((Map<String, List<Registrant>>) (Map<String, ?>) entries);
    }
    
    /**
     * Event names, each mapped to the listeners to add or remove.<p>
     * 
     * Map keys are always exact event names, never patterns. A value with one
     * element is routed to the singular operation ({@code addListener} or
     * {@code removeListener}), any other value to the plural operation.<p>
     * 
     * The constructor takes an insertion-ordered snapshot of the given map.
     * Entries with a {@code null} value are dropped. {@code null} elements of
     * a value list are kept, and will be rejected by the add operation.
     * 
     * @param entries event name to listeners
     */
    record ByMap(Map<String, List<Registrant>> entries) implements EventSelector {
        /**
         * Constructs this object.
         * 
         * @param entries event name to listeners
         * @throws NullPointerException if {@code entries}, or a key, is {@code null}
         */
        public ByMap {
            entries = copy(entries);
        }
        
        private static Map<String, List<Registrant>> copy(
                Map<String, ? extends List<? extends Registrant>> src) {
            var dst = new LinkedHashMap<String, List<Registrant>>();
            src.forEach((k, v) -> {
                requireNonNull(k, "Event name is null.");
                if (v != null) {
                    dst.put(k, Collections.unmodifiableList(new ArrayList<>(v)));
                }
            });
            return Collections.unmodifiableMap(dst);
        }
    }
}
