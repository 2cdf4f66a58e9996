package com.pathhound.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WordlistTest {

    @Test
    void fromFile_skips_blanks_comments_and_malformed_entries(@TempDir Path dir) throws Exception {
        Path f = dir.resolve("words.txt");
        Files.writeString(f, String.join("\n",
                "# common dirs",
                "admin",
                "",
                "   ",
                "back up",
                "login.php",
                "  api  ",
                "bad\u0001ctl"), StandardCharsets.UTF_8);

        Wordlist w = Wordlist.fromFile(f);

        List<String> words = new ArrayList<>();
        w.forEach(words::add);
        assertThat(words).containsExactly("admin", "login.php", "api");
        assertThat(w.size()).isEqualTo(3);
        assertThat(w.identity()).isEqualTo(f.toString());
    }

    @Test
    void fromFile_skips_lines_that_are_not_utf8(@TempDir Path dir) throws Exception {
        Path f = dir.resolve("latin1.txt");
        Files.write(f, "admin\r\ncaf\u00e9\r\nlogin\r\n".getBytes(StandardCharsets.ISO_8859_1));

        Wordlist w = Wordlist.fromFile(f);

        List<String> words = new ArrayList<>();
        w.forEach(words::add);
        assertThat(words).containsExactly("admin", "login");
    }

    @Test
    void fromFile_keeps_utf8_entries_and_drops_bom(@TempDir Path dir) throws Exception {
        Path f = dir.resolve("utf8.txt");
        Files.writeString(f, "\uFEFFcaf\u00e9\n\u7ba1\u7406\n", StandardCharsets.UTF_8);

        Wordlist w = Wordlist.fromFile(f);

        List<String> words = new ArrayList<>();
        w.forEach(words::add);
        assertThat(words).containsExactly("caf\u00e9", "\u7ba1\u7406");
    }

    @Test
    void iteration_is_restartable() {
        Wordlist w = Wordlist.of("a", "b");
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        w.forEach(first::add);
        w.forEach(second::add);
        assertThat(first).isEqualTo(second).containsExactly("a", "b");
    }
}
