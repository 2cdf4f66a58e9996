package com.pathhound.core.service;

import com.pathhound.core.util.Wordlist;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RequestCursorTest {

    private static List<String> drain(RequestCursor c) {
        List<String> out = new ArrayList<>();
        URI u;
        while ((u = c.next()) != null) out.add(u.toString());
        return out;
    }

    @Test
    void expands_slash_and_extensions_in_word_order() {
        RequestCursor c = new RequestCursor("http://t/app/", Wordlist.of("admin", "login"), true, List.of("php", ".bak"));

        assertThat(drain(c)).containsExactly(
                "http://t/app/admin", "http://t/app/admin/", "http://t/app/admin.php", "http://t/app/admin.bak",
                "http://t/app/login", "http://t/app/login/", "http://t/app/login.php", "http://t/app/login.bak");
    }

    @Test
    void malformed_words_are_skipped() {
        RequestCursor c = new RequestCursor("http://t/", Wordlist.of("ok", "bad^word", "fine"), false, List.of());

        assertThat(drain(c)).containsExactly("http://t/ok", "http://t/fine");
    }

    @Test
    void exhausted_cursor_keeps_returning_null() {
        RequestCursor c = new RequestCursor("http://t/", Wordlist.of("a"), false, List.of());
        assertThat(c.next()).isNotNull();
        assertThat(c.next()).isNull();
        assertThat(c.next()).isNull();
    }
}
