package alpha.simplrouter.core;

import alpha.simplrouter.Config;
import alpha.simplrouter.handler.Arguments;
import alpha.simplrouter.handler.Handler;
import alpha.simplrouter.route.Match;
import alpha.simplrouter.route.NoRuleFoundException;
import alpha.simplrouter.testutil.LogRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static alpha.simplrouter.Config.configuration;
import static java.lang.System.Logger.Level.WARNING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Tests of {@link DefaultRouter#dispatch(String)}.
 */
class DispatchTest
{
    private final DefaultRouter testee = new DefaultRouter(Config.DEFAULT);
    
    private LogRecorder log;
    
    @AfterEach
    void stopRecording() {
        if (log != null) {
            log.stopRecording();
        }
    }
    
    @Test
    void handler_receives_arguments() {
        Handler h = mock(Handler.class);
        testee.register("/user/{id}", h).addParam("controller", "user");
        
        Match m = testee.dispatch("/user/7");
        
        var exp = new LinkedHashMap<String, String>();
        exp.put("id", "7");
        exp.put("controller", "user");
        verify(h).handle(new Arguments(exp));
        assertThat(m.routeVar("id")).isEqualTo("7");
    }
    
    @Test
    void param_takes_precedence() {
        Handler h = mock(Handler.class);
        testee.register("/user/{id}", h).addParam("id", "me");
        testee.dispatch("/user/7");
        verify(h).handle(new Arguments(Map.of("id", "me")));
    }
    
    @Test
    void not_found_fallback() {
        Handler home = mock(Handler.class),
                nope = mock(Handler.class);
        testee.register("/", home);
        testee.register("404", nope);
        
        Match m = testee.dispatch("/missing");
        
        assertThat(m.rule().pattern()).isEqualTo("404");
        verify(nope).handle(new Arguments());
        verify(home, never()).handle(any());
    }
    
    @Test
    void not_found_pattern_from_config() {
        var reg = new DefaultRouter(configuration()
                .prefix("/app")
                .notFoundPattern("not-found")
                .build());
        Handler nope = mock(Handler.class);
        // Not prefixed
        assertThat(reg.register("not-found", nope).pattern()).isEqualTo("not-found");
        reg.dispatch("/app/missing");
        verify(nope).handle(new Arguments());
    }
    
    @Test
    void nothing_found() {
        log = LogRecorder.startRecording();
        testee.register("/", mock(Handler.class));
        NoRuleFoundException e = catchThrowableOfType(
                () -> testee.dispatch("/missing"), NoRuleFoundException.class);
        assertThat(e).hasMessage("No rule found for \"/missing\".");
        assertThat(e.getUri()).isEqualTo("/missing");
        log.assertRemove(WARNING,
                "No rule matched \"/missing\" and no rule is registered for the not-found pattern \"404\".")
           .assertNoProblem();
    }
    
    @Test
    void handler_exception_propagates() {
        Handler h = mock(Handler.class);
        var boom = new IllegalStateException("boom");
        doThrow(boom).when(h).handle(any());
        testee.register("/", h);
        assertThatThrownBy(() -> testee.dispatch("/")).isSameAs(boom);
    }
}
