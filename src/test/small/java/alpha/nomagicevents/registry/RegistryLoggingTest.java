package alpha.nomagicevents.registry;

import alpha.nomagicevents.testutil.Logging;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.logging.LogRecord;

import static alpha.nomagicevents.testutil.Logging.rec;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.TRACE;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests asserting the log output of {@link AbstractListenerRegistry}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RegistryLoggingTest
{
    private Logging.Recorder recorder;
    
    @BeforeEach
    void beforeEach() {
        recorder = Logging.startRecording(AbstractListenerRegistry.class);
    }
    
    @AfterEach
    void afterEach() {
        recorder.stop();
    }
    
    @Test
    void autoRemovals() {
        Listener once = (src, args) -> null,
                 sentinel = (src, args) -> true;
        new DefaultListenerRegistry()
                .addOnceListener("foo", once)
                .addListener("foo", sentinel)
                .emit("foo");
        assertThat(recorder.records())
            .extracting(LogRecord::getLevel, LogRecord::getMessage)
            .containsExactly(
                rec(TRACE, "Emitting \"foo\" to 2 listener(s)."),
                rec(DEBUG, "Removed fire-once listener of \"foo\": " + once),
                rec(DEBUG, "Listener of \"foo\" returned the once-sentinel and was removed: " + sentinel));
    }
    
    @Test
    void eventRemovals() {
        new DefaultListenerRegistry()
                .defineEvents("foo", "bar", "baz")
                .removeEvent("foo")
                .removeEvent("absent")
                .removeEvent(EventId.matching("^ba"))
                .removeEvent();
        assertThat(recorder.records())
            .extracting(LogRecord::getLevel, LogRecord::getMessage)
            .containsExactly(
                rec(DEBUG, "Removed event \"foo\"."),
                rec(DEBUG, "Removed event \"bar\"."),
                rec(DEBUG, "Removed event \"baz\"."),
                rec(DEBUG, "Removed all events (0)."));
    }
    
    @Test
    void sentinelChanged() {
        new DefaultListenerRegistry().setOnceReturnValue("done");
        assertThat(recorder.records())
            .extracting(LogRecord::getLevel, LogRecord::getMessage)
            .containsExactly(rec(DEBUG, "Once-sentinel changed from true to done."));
    }
}
