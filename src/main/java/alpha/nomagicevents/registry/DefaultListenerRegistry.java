package alpha.nomagicevents.registry;

import alpha.nomagicevents.Config;

/**
 * Default implementation of {@link ListenerRegistry}.<p>
 * 
 * The behavior of this class is documented in {@link ListenerRegistry} and
 * {@link AbstractListenerRegistry}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class DefaultListenerRegistry extends AbstractListenerRegistry
{
    /**
     * Constructs a registry using the {@link Config#DEFAULT default}
     * configuration.
     */
    public DefaultListenerRegistry() {
        // super()
    }
    
    /**
     * Constructs a registry.
     * 
     * @param config of registry
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public DefaultListenerRegistry(Config config) {
        super(config);
    }
}
