package alpha.nomagicevents;

import alpha.nomagicevents.registry.ListenerRegistry;

import java.util.regex.Matcher;

/**
 * Listener registry configuration.<p>
 * 
 * The implementation is immutable and thread-safe.<p>
 * 
 * The implementation used if none is specified is {@link #DEFAULT}.<p>
 * 
 * Any configuration object can be turned into a builder for customization. The
 * static method {@link #configuration()} is a shortcut for {@code
 * Config.DEFAULT.toBuilder()}.
 * <pre>
 *   Config cfg = Config.configuration()
 *                      .onceReturnValue("done")
 *                      .build();
 *   ListenerRegistry reg = new DefaultListenerRegistry(cfg);
 * </pre>
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Config
{
    /**
     * Values used:<p>
     * 
     * Once return value = {@code Boolean.TRUE} <br>
     * Full match patterns = false
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();
    
    /**
     * Returns the initial once-sentinel of a registry.<p>
     * 
     * A listener invocation returning a value equal to the sentinel causes the
     * listener to be removed from the event it was invoked for, as if it had
     * been registered to fire only once. The registry may change the value
     * later using {@link ListenerRegistry#setOnceReturnValue(Object)}.<p>
     * 
     * Equality is tested using {@link java.util.Objects#equals(Object, Object)
     * Objects.equals}, and so {@code null} is a legal sentinel (which will
     * remove every listener that returns {@code null}).<p>
     * 
     * The default implementation returns {@code Boolean.TRUE}.
     * 
     * @return the initial once-sentinel (may be {@code null})
     */
    Object onceReturnValue();
    
    /**
     * Returns whether an event name pattern must match the entire event name.
     * <p>
     * 
     * If {@code false}, a pattern selects each event name for which {@link
     * Matcher#find()} returns {@code true}, i.e. a match anywhere within the
     * name is enough ({@code "^ba"} selects "bar" and "baz"). If {@code true},
     * {@link Matcher#matches()} is used ({@code "ba."} is needed to select
     * "bar").<p>
     * 
     * The default implementation returns {@code false}.
     * 
     * @return see JavaDoc
     */
    boolean fullMatchPatterns();
    
    /**
     * Returns the builder instance that built this configuration.<p>
     * 
     * The builder may be used for further customization of the configuration,
     * without affecting the configuration instance it came from.
     * 
     * @return the builder instance that built this configuration
     */
    Config.Builder toBuilder();
    
    /**
     * Returns the builder used to build the default configuration.
     * 
     * @return the builder used to build the default configuration
     * @see #toBuilder()
     */
    static Config.Builder configuration() {
        return DEFAULT.toBuilder();
    }
    
    /**
     * Builder of a {@link Config}.<p>
     * 
     * The builder type declares methods with the same names as the methods
     * found in the {@code Config} type. Documentation is not repeated here.
     * 
     * The implementation is immutable and thread-safe. Each setter returns a
     * new builder instance representing the new state.
     */
    interface Builder {
        /**
         * Sets a new value.
         * 
         * @param newVal new value (may be {@code null})
         * @return a new builder representing the new state
         * @see Config#onceReturnValue()
         */
        Builder onceReturnValue(Object newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#fullMatchPatterns()
         */
        Builder fullMatchPatterns(boolean newVal);
        
        /**
         * Builds the configuration.
         * 
         * @return a configuration
         */
        Config build();
    }
}
