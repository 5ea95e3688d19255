package alpha.simplrouter;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static alpha.simplrouter.Config.configuration;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests for {@link Config}.
 */
class ConfigTest
{
    @Test
    void defaults() {
        Config c = Config.DEFAULT;
        assertThat(c.prefix()).isEmpty();
        assertThat(c.strictRequisites()).isFalse();
        assertThat(c.notFoundPattern()).isEqualTo("404");
    }
    
    @Test
    void builder_is_immutable() {
        Config.Builder b1 = configuration(),
                       b2 = b1.prefix("/app");
        assertThat(b1.build().prefix()).isEmpty();
        assertThat(b2.build().prefix()).isEqualTo("/app");
    }
    
    @Test
    void toBuilder_carries_values() {
        Config c = configuration()
                .prefix("/app")
                .strictRequisites(true)
                .notFoundPattern("not-found")
                .build();
        Config d = c.toBuilder().strictRequisites(false).build();
        assertThat(d.prefix()).isEqualTo("/app");
        assertThat(d.strictRequisites()).isFalse();
        assertThat(d.notFoundPattern()).isEqualTo("not-found");
        // Source unchanged
        assertThat(c.strictRequisites()).isTrue();
    }
    
    @Test
    void last_write_wins() {
        Config c = configuration().prefix("/a").prefix("/b").build();
        assertThat(c.prefix()).isEqualTo("/b");
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"", "/app", "/a/b"})
    void prefix_valid(String prefix) {
        assertThat(configuration().prefix(prefix).build().prefix()).isEqualTo(prefix);
    }
    
    @Test
    void prefix_trailing_slash() {
        assertThatThrownBy(() -> configuration().prefix("/app/"))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Prefix can not end with a forward slash (\"/\"). Input was: /app/");
        assertThatThrownBy(() -> configuration().prefix("/"))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }
    
    @Test
    void prefix_no_leading_slash() {
        assertThatThrownBy(() -> configuration().prefix("app"))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Prefix must start with a forward slash (\"/\"). Input was: app");
    }
    
    @Test
    void prefix_null() {
        assertThatThrownBy(() -> configuration().prefix(null))
                .isExactlyInstanceOf(NullPointerException.class);
    }
    
    @Test
    void notFoundPattern_empty() {
        assertThatThrownBy(() -> configuration().notFoundPattern(""))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Not-found pattern is empty.");
    }
    
    @Test
    void notFoundPattern_leading_slash() {
        // Would be prefixed on registration but matched unprefixed by dispatch
        assertThatThrownBy(() -> configuration().prefix("/app").notFoundPattern("/404"))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("Not-found pattern can not start with a forward slash (\"/\"). Input was: /404");
    }
}
