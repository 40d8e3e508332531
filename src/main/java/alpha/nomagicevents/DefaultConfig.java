package alpha.nomagicevents;

import alpha.nomagicevents.util.AbstractImmutableBuilder;

import java.util.function.Consumer;

/**
 * Default implementation of {@link Config}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultConfig implements Config {
    private final Builder builder;
    private final Object  onceReturnValue;
    private final boolean fullMatchPatterns;
    
    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder           = b;
        onceReturnValue   = s.onceReturnValue;
        fullMatchPatterns = s.fullMatchPatterns;
    }
    
    @Override
    public Object onceReturnValue() {
        return onceReturnValue;
    }
    
    @Override
    public boolean fullMatchPatterns() {
        return fullMatchPatterns;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "onceReturnValue=" + onceReturnValue + ", " +
                "fullMatchPatterns=" + fullMatchPatterns + "}";
    }
    
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static class MutableState {
            Object  onceReturnValue   = Boolean.TRUE;
            boolean fullMatchPatterns = false;
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Builder onceReturnValue(Object newVal) {
            return new DefaultBuilder(this, s -> s.onceReturnValue = newVal);
        }
        
        @Override
        public Builder fullMatchPatterns(boolean newVal) {
            return new DefaultBuilder(this, s -> s.fullMatchPatterns = newVal);
        }
        
        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }
    }
}
