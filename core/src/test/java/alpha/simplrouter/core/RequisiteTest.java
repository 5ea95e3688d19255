package alpha.simplrouter.core;

import alpha.simplrouter.Config;
import alpha.simplrouter.route.Requisite;
import alpha.simplrouter.route.RequisiteException;
import alpha.simplrouter.route.Rule;
import alpha.simplrouter.testutil.LogRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.ArrayList;
import java.util.List;

import static alpha.simplrouter.Config.configuration;
import static java.lang.System.Logger.Level.WARNING;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests of how {@link Requisite}s gate a match.
 */
class RequisiteTest
{
    private DefaultRouter testee = new DefaultRouter(Config.DEFAULT);
    
    private LogRecorder log;
    
    @AfterEach
    void stopRecording() {
        if (log != null) {
            log.stopRecording();
        }
    }
    
    @Test
    void all_pass() {
        Requisite r1 = mock(Requisite.class),
                  r2 = mock(Requisite.class);
        when(r1.test()).thenReturn(true);
        when(r2.test()).thenReturn(true);
        
        Rule r = testee.register("/", args -> {})
                .addRequisite(r1)
                .addRequisite(r2);
        assertThat(testee.match("/").orElseThrow().rule()).isSameAs(r);
        
        InOrder order = inOrder(r1, r2);
        order.verify(r1).test();
        order.verify(r2).test();
    }
    
    @Test
    void short_circuit() {
        Requisite r1 = mock(Requisite.class),
                  r2 = mock(Requisite.class);
        when(r1.test()).thenReturn(false);
        
        testee.register("/", args -> {})
                .addRequisite(r1)
                .addRequisite(r2);
        assertThat(testee.match("/")).isEmpty();
        
        verify(r1).test();
        verify(r2, never()).test();
    }
    
    @Test
    void rejected_rule_falls_through() {
        testee.register("/{x}", args -> {}).addRequisite(() -> false);
        Rule next = testee.register("/[*]", args -> {});
        assertThat(testee.match("/a").orElseThrow().rule()).isSameAs(next);
    }
    
    @Test
    void evaluated_before_segments() {
        Requisite r1 = mock(Requisite.class);
        when(r1.test()).thenReturn(true);
        testee.register("/a", args -> {}).addRequisite(r1);
        assertThat(testee.match("/b")).isEmpty();
        verify(r1).test();
    }
    
    @Test
    void not_evaluated_after_match() {
        Requisite r1 = mock(Requisite.class);
        testee.register("/a", args -> {});
        testee.register("/b", args -> {}).addRequisite(r1);
        assertThat(testee.match("/a")).isPresent();
        verify(r1, never()).test();
    }
    
    @Test
    void evaluated_again_by_wildcard_pass() {
        List<String> calls = new ArrayList<>();
        testee.register("/a", args -> {}).addRequisite(() -> calls.add("A"));
        Rule w = testee.register("/files/[*]", args -> {}).addRequisite(() -> calls.add("W"));
        
        assertThat(testee.match("/files/x").orElseThrow().rule()).isSameAs(w);
        assertThat(calls).containsExactly("A", "W", "A", "W");
    }
    
    @Test
    void evaluated_per_attempt() {
        Requisite r1 = mock(Requisite.class);
        when(r1.test()).thenReturn(true, false);
        testee.register("/", args -> {}).addRequisite(r1);
        assertThat(testee.match("/")).isPresent();
        assertThat(testee.match("/")).isEmpty();
        verify(r1, times(2)).test();
    }
    
    @Test
    void null_is_ignored_with_warning() {
        log = LogRecorder.startRecording();
        Requisite abstain = () -> null;
        Rule r = testee.register("/", args -> {}).addRequisite(abstain);
        assertThat(testee.match("/").orElseThrow().rule()).isSameAs(r);
        log.assertRemove(WARNING,
                "A requisite for rule \"/\" does not return a boolean; it will be ignored.")
           .assertNoProblem();
    }
    
    @Test
    void null_does_not_hide_false() {
        testee.register("/", args -> {})
                .addRequisite(() -> null)
                .addRequisite(() -> false);
        assertThat(testee.match("/")).isEmpty();
    }
    
    @Test
    void null_is_rejected_when_strict() {
        testee = new DefaultRouter(configuration().strictRequisites(true).build());
        Requisite r2 = mock(Requisite.class);
        Rule r = testee.register("/", args -> {})
                .addRequisite(() -> null)
                .addRequisite(r2);
        RequisiteException e = catchThrowableOfType(
                () -> testee.match("/"), RequisiteException.class);
        assertThat(e).hasMessage("A requisite for rule \"/\" did not return a boolean.");
        assertThat(e.getRule()).isSameAs(r);
        verify(r2, never()).test();
    }
}
