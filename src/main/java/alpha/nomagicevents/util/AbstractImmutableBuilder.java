package alpha.nomagicevents.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Baseclass for immutable builders.<p>
 * 
 * Each builder instance links back to the builder it was derived from and
 * holds only one modifying action. Building replays all actions of the chain,
 * root first, against a new mutable state container, see {@link
 * #constructState(Supplier)}. A builder may therefore be shared and branched
 * freely; setting a value produces a new builder and leaves the old one as is.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @param <S> mutable state container
 */
public abstract class AbstractImmutableBuilder<S> {
    private final AbstractImmutableBuilder<S> prev;
    private final Consumer<? super S> modifier;
    
    /**
     * Constructs a root builder.<p>
     * 
     * The root has no modifier. It builds the default state.
     */
    protected AbstractImmutableBuilder() {
        this.prev = null;
        this.modifier = null;
    }
    
    /**
     * Constructs a builder derived from another.
     * 
     * @param prev builder derived from
     * @param modifier action to apply on the mutable state
     * @throws NullPointerException if any arg is {@code null}
     */
    protected AbstractImmutableBuilder(AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev);
        this.modifier = requireNonNull(modifier);
    }
    
    /**
     * Creates a new mutable state container and applies all modifiers of the
     * chain, in the order they were added.<p>
     * 
     * The concrete builder's {@code build()} method is expected to call this
     * method and pass the returned state to the constructor of the built
     * object.
     * 
     * @param factory of state
     * @return the populated state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        List<Consumer<? super S>> mods = new ArrayList<>();
        for (var b = this; b.modifier != null; b = b.prev) {
            mods.add(b.modifier);
        }
        Collections.reverse(mods);
        S s = factory.get();
        for (var m : mods) {
            m.accept(s);
        }
        return s;
    }
}
