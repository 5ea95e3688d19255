package alpha.simplrouter.core;

import org.junit.jupiter.api.Test;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class SegmentsTest
{
    @Test
    void split() {
        assertThat(Segments.split("")).containsExactly("");
        assertThat(Segments.split("/")).containsExactly("", "");
        assertThat(Segments.split("/about")).containsExactly("", "about");
        assertThat(Segments.split("/a/")).containsExactly("", "a", "");
        assertThat(Segments.split("//")).containsExactly("", "", "");
        assertThat(Segments.split("404")).containsExactly("404");
    }
    
    @Test
    void genericKey() {
        Stream.of(
            e("/",                   "/"),
            e("/user/{id}",          "/user/{}"),
            e("/user/{name}",        "/user/{}"),
            e("/{a}/{b}",            "/{}/{}"),
            e("/files/[*]",          "/files/[*]"),
            e("/x/{id}/[*]",         "/x/{}/[*]"),
            // Not variables
            e("/{}",                 "/{}"),
            e("/{id",                "/{id"),
            e("/id}",                "/id}"),
            e("/a{id}",              "/a{id}"),
            e("404",                 "404")
        ).forEach(e ->
            assertThat(Segments.genericKey(e[0])).isEqualTo(e[1]));
    }
    
    @Test
    void variableName() {
        assertThat(Segments.variableName("{id}")).isEqualTo("id");
        assertThat(Segments.variableName("{a b}")).isEqualTo("a b");
    }
    
    private static String[] e(String... strings) {
        return strings;
    }
}
