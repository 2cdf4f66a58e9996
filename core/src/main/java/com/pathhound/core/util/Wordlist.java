package com.pathhound.core.util;

import com.pathhound.core.api.IWordlist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * 메모리 적재형 워드리스트.
 * - 빈 줄 / '#' 주석 줄은 건너뜀
 * - 공백·제어문자를 포함한 항목, UTF-8 로 디코딩되지 않는 줄은 경고 후 건너뜀
 */
public final class Wordlist implements IWordlist {
    private static final Logger LOG = LoggerFactory.getLogger(Wordlist.class);

    private final String identity;
    private final List<String> words;

    private Wordlist(String identity, List<String> words) {
        this.identity = identity;
        this.words = Collections.unmodifiableList(words);
    }

    public static Wordlist fromFile(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        byte[] raw = Files.readAllBytes(file);
        CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);

        List<String> out = new ArrayList<>();
        int lineNo = 0;
        int start = 0;
        while (start < raw.length) {
            int end = start;
            while (end < raw.length && raw[end] != '\n') end++;
            lineNo++;
            int len = end - start;
            if (len > 0 && raw[end - 1] == '\r') len--;

            String line;
            try {
                line = utf8.decode(ByteBuffer.wrap(raw, start, len)).toString();
            } catch (CharacterCodingException e) {
                LOG.warn("Skipping non UTF-8 wordlist entry at {}:{}", file.getFileName(), lineNo);
                line = null;
            }
            start = end + 1;
            if (line == null) continue;
            if (lineNo == 1 && line.startsWith("\uFEFF")) line = line.substring(1);   // BOM

            String w = line.strip();
            if (w.isEmpty() || w.startsWith("#")) continue;
            if (!isWellFormed(w)) {
                LOG.warn("Skipping malformed wordlist entry at {}:{}", file.getFileName(), lineNo);
                continue;
            }
            out.add(w);
        }
        LOG.info("Wordlist loaded: {} ({} entries)", file, out.size());
        return new Wordlist(file.toString(), out);
    }

    /** 테스트/임베딩용 */
    public static Wordlist of(String identity, List<String> words) {
        List<String> out = new ArrayList<>();
        for (String w : words) {
            if (w == null) continue;
            String s = w.strip();
            if (!s.isEmpty() && isWellFormed(s)) out.add(s);
        }
        return new Wordlist(identity, out);
    }

    public static Wordlist of(String... words) {
        return of("inline", List.of(words));
    }

    static boolean isWellFormed(String w) {
        for (int i = 0; i < w.length(); i++) {
            char c = w.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) return false;
        }
        return true;
    }

    @Override public Iterator<String> iterator() { return words.iterator(); }
    @Override public int size() { return words.size(); }
    @Override public String identity() { return identity; }
}
