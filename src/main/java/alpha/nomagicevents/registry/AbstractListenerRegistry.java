package alpha.nomagicevents.registry;

import alpha.nomagicevents.Config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.TRACE;
import static java.util.Objects.requireNonNull;

/**
 * A synchronous implementation of {@link ListenerRegistry}.<p>
 * 
 * The implementation is backed by a {@code Map} of event names to a {@code
 * List} of listener records. By default, the map is a {@link LinkedHashMap},
 * and so events selected by a pattern are emitted in the order the events were
 * created. A subclass may supply a different map implementation, for example a
 * {@code TreeMap} to emit in alphabetical order:
 * <pre>
 *   class SortedRegistry extends AbstractListenerRegistry {
 *       SortedRegistry() {
 *           super(Config.DEFAULT, new TreeMap{@literal <}{@literal >}());
 *       }
 *   }
 * </pre>
 * 
 * The class is designed to be extended by types that wish to offer listener
 * registration and emission as part of their own API.<p>
 * 
 * This class is not thread-safe.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public abstract class AbstractListenerRegistry implements ListenerRegistry
{
    private static final System.Logger LOG
            = System.getLogger(AbstractListenerRegistry.class.getPackageName());
    
    private final Map<String, List<ListenerRecord>> events;
    private final boolean fullMatch;
    private Object onceReturnValue;
    
    /**
     * Constructs a registry using the {@link Config#DEFAULT default}
     * configuration.
     */
    protected AbstractListenerRegistry() {
        this(Config.DEFAULT);
    }
    
    /**
     * Constructs a registry backed by a {@link LinkedHashMap}.
     * 
     * @param config of registry
     * @throws NullPointerException if {@code config} is {@code null}
     */
    protected AbstractListenerRegistry(Config config) {
        this(config, new LinkedHashMap<>());
    }
    
    /**
     * Constructs a registry.<p>
     * 
     * The given map should be empty and must not be referenced elsewhere. The
     * map's iteration order defines the order in which events selected by a
     * pattern are emitted.
     * 
     * @param config of registry
     * @param mapImpl to use as event table
     * @throws NullPointerException if any arg is {@code null}
     */
    protected AbstractListenerRegistry(
            Config config, Map<String, List<ListenerRecord>> mapImpl)
    {
        this.events          = requireNonNull(mapImpl);
        this.fullMatch       = config.fullMatchPatterns();
        this.onceReturnValue = config.onceReturnValue();
    }
    
    @Override
    public List<ListenerRecord> getListeners(String name) {
        return Collections.unmodifiableList(live(name));
    }
    
    @Override
    public Map<String, List<ListenerRecord>> getListeners(Pattern pattern) {
        return readOnly(matching(pattern));
    }
    
    @Override
    public Map<String, List<ListenerRecord>> getListenersAsMap(EventId event) {
        return readOnly(resolve(event));
    }
    
    @Override
    public ListenerRegistry addListener(EventId event, Registrant listener) {
        requireNonNull(event);
        if (!ListenerRegistry.isValidListener(listener)) {
            throw new InvalidListenerException(listener);
        }
        final ListenerRecord rec = listener instanceof ListenerRecord r ?
                r : new ListenerRecord((Listener) listener, false);
        for (var list : resolve(event).values()) {
            if (lastIndexOf(list, rec.callback()) == -1) {
                list.add(rec);
            }
        }
        return this;
    }
    
    @Override
    public ListenerRegistry defineEvent(String name) {
        live(name);
        return this;
    }
    
    @Override
    public ListenerRegistry removeListener(EventId event, Listener listener) {
        for (var list : resolve(event).values()) {
            remove(list, listener);
        }
        return this;
    }
    
    @Override
    public ListenerRegistry manipulateListeners(
            boolean remove, EventSelector selector, List<? extends Registrant> listeners)
    {
        requireNonNull(selector);
        if (selector instanceof EventSelector.ByMap map) {
            map.entries().forEach((name, value) -> {
                var event = EventId.of(name);
                if (value.size() == 1) {
                    single(remove, event, value.get(0));
                } else if (remove) {
                    removeListeners(event, value);
                } else {
                    addListeners(event, value);
                }
            });
        } else if (selector instanceof EventId event) {
            requireNonNull(listeners);
            for (int i = listeners.size() - 1; i >= 0; --i) {
                single(remove, event, listeners.get(i));
            }
        } else {
            throw new AssertionError("Unexpected selector: " + selector);
        }
        return this;
    }
    
    private void single(boolean remove, EventId event, Registrant listener) {
        if (!remove) {
            addListener(event, listener);
        } else if (listener instanceof ListenerRecord r) {
            removeListener(event, r.callback());
        } else {
            removeListener(event, (Listener) listener);
        }
    }
    
    @Override
    public ListenerRegistry removeEvent(EventId event) {
        requireNonNull(event);
        if (event instanceof EventId.Named n) {
            if (events.remove(n.name()) != null) {
                LOG.log(DEBUG, () -> "Removed event \"" + n.name() + "\".");
            }
        } else if (event instanceof EventId.Matching m) {
            var it = events.keySet().iterator();
            while (it.hasNext()) {
                var name = it.next();
                if (test(m.pattern(), name)) {
                    it.remove();
                    LOG.log(DEBUG, () -> "Removed event \"" + name + "\".");
                }
            }
        } else {
            throw new AssertionError("Unexpected event id: " + event);
        }
        return this;
    }
    
    @Override
    public ListenerRegistry removeEvent() {
        final int n = events.size();
        events.clear();
        LOG.log(DEBUG, () -> "Removed all events (" + n + ").");
        return this;
    }
    
    @Override
    public ListenerRegistry emitEvent(EventId event, List<?> args) {
        final Object[] argv = args.toArray();
        for (var e : resolve(event).entrySet()) {
            final String name = e.getKey();
            final List<ListenerRecord> snapshot = List.copyOf(e.getValue());
            LOG.log(TRACE, () -> "Emitting \"" + name + "\" to " +
                    snapshot.size() + " listener(s).");
            for (ListenerRecord r : snapshot) {
                final Listener l = r.callback();
                if (r.fireOnce()) {
                    removeCurrent(name, l);
                    LOG.log(DEBUG, () -> "Removed fire-once listener of \"" + name + "\": " + l);
                }
                Object response = l.onEvent(this, argv.clone());
                if (!r.fireOnce() && Objects.equals(response, onceReturnValue) && removeCurrent(name, l)) {
                    LOG.log(DEBUG, () -> "Listener of \"" + name +
                            "\" returned the once-sentinel and was removed: " + l);
                }
            }
        }
        return this;
    }
    
    @Override
    public ListenerRegistry setOnceReturnValue(Object value) {
        final Object old = onceReturnValue;
        onceReturnValue = value;
        LOG.log(DEBUG, () -> "Once-sentinel changed from " + old + " to " + value + ".");
        return this;
    }
    
    @Override
    public Object getOnceReturnValue() {
        return onceReturnValue;
    }
    
    @Override
    public String toString() {
        return getClass().getSimpleName() + "{events=" + events.keySet() + "}";
    }
    
    private List<ListenerRecord> live(String name) {
        requireNonNull(name, "Event name is null.");
        return events.computeIfAbsent(name, k -> new ArrayList<>());
    }
    
    // Live lists of the selected events, keyed by event name
    private Map<String, List<ListenerRecord>> resolve(EventId event) {
        requireNonNull(event);
        if (event instanceof EventId.Named n) {
            return Map.of(n.name(), live(n.name()));
        } else if (event instanceof EventId.Matching m) {
            return matching(m.pattern());
        }
        throw new AssertionError("Unexpected event id: " + event);
    }
    
    private Map<String, List<ListenerRecord>> matching(Pattern pattern) {
        requireNonNull(pattern);
        var matched = new LinkedHashMap<String, List<ListenerRecord>>();
        events.forEach((name, list) -> {
            if (test(pattern, name)) {
                matched.put(name, list);
            }
        });
        return matched;
    }
    
    private boolean test(Pattern pattern, String name) {
        var m = pattern.matcher(name);
        return fullMatch ? m.matches() : m.find();
    }
    
    private static Map<String, List<ListenerRecord>> readOnly(
            Map<String, List<ListenerRecord>> live) {
        var view = new LinkedHashMap<String, List<ListenerRecord>>();
        live.forEach((name, list) ->
                view.put(name, Collections.unmodifiableList(list)));
        return Collections.unmodifiableMap(view);
    }
    
    // The highest index wins
    private static int lastIndexOf(List<ListenerRecord> list, Listener callback) {
        for (int i = list.size() - 1; i >= 0; --i) {
            if (Objects.equals(list.get(i).callback(), callback)) {
                return i;
            }
        }
        return -1;
    }
    
    // A listener may have replaced or removed the event's list
    private boolean removeCurrent(String name, Listener callback) {
        var list = events.get(name);
        return list != null && remove(list, callback);
    }
    
    private static boolean remove(List<ListenerRecord> list, Listener callback) {
        int i = lastIndexOf(list, callback);
        if (i == -1) {
            return false;
        }
        list.remove(i);
        return true;
    }
}
