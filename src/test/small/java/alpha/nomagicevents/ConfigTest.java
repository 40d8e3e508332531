package alpha.nomagicevents;

import alpha.nomagicevents.registry.DefaultListenerRegistry;
import alpha.nomagicevents.registry.EventId;
import alpha.nomagicevents.registry.ListenerRegistry;
import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests of {@link Config}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ConfigTest
{
    @Test
    void defaults() {
        assertThat(Config.DEFAULT.onceReturnValue()).isEqualTo(Boolean.TRUE);
        assertThat(Config.DEFAULT.fullMatchPatterns()).isFalse();
        assertThat(Config.configuration().build())
                .usingRecursiveComparison()
                .ignoringFields("builder")
                .isEqualTo(Config.DEFAULT);
    }
    
    @Test
    void builderIsImmutable() {
        var root = Config.configuration();
        var custom = root.onceReturnValue("done");
        var branch = custom.fullMatchPatterns(true);
        
        assertThat(root.build().onceReturnValue()).isEqualTo(Boolean.TRUE);
        assertThat(custom.build().onceReturnValue()).isEqualTo("done");
        assertThat(custom.build().fullMatchPatterns()).isFalse();
        assertThat(branch.build().onceReturnValue()).isEqualTo("done");
        assertThat(branch.build().fullMatchPatterns()).isTrue();
        assertThat(branch.build().toBuilder()).isSameAs(branch);
    }
    
    @Test
    void lastSetterWins() {
        var cfg = Config.configuration()
                .onceReturnValue("first")
                .onceReturnValue(null)
                .build();
        assertThat(cfg.onceReturnValue()).isNull();
    }
    
    @Test
    void registry_initialSentinel() {
        var cfg = Config.configuration().onceReturnValue("done").build();
        ListenerRegistry reg = new DefaultListenerRegistry(cfg);
        assertThat(reg.getOnceReturnValue()).isEqualTo("done");
        reg.addListener("foo", (src, args) -> "done").emit("foo");
        assertThat(reg.getListeners("foo")).isEmpty();
    }
    
    @Test
    void registry_fullMatchPatterns() {
        ListenerRegistry find = new DefaultListenerRegistry(),
                         full = new DefaultListenerRegistry(
                                 Config.configuration().fullMatchPatterns(true).build());
        find.defineEvents("bar", "baz", "foobar");
        full.defineEvents("bar", "baz", "foobar");
        var p = Pattern.compile("ba.");
        assertThat(find.getListeners(p)).containsOnlyKeys("bar", "baz", "foobar");
        assertThat(full.getListeners(p)).containsOnlyKeys("bar", "baz");
        full.removeEvent(EventId.matching(p));
        assertThat(full.getListeners(Pattern.compile(".*"))).containsOnlyKeys("foobar");
    }
}
