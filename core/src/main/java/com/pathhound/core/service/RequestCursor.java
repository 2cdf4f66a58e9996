package com.pathhound.core.service;

import com.pathhound.core.api.IWordlist;
import com.pathhound.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 스캔 하나의 워드리스트 커서(워커 공유, 스레드 세이프).
 * 워드 하나가 word, word/ (addSlash), word.ext (확장자별) 요청으로 펼쳐진다.
 */
final class RequestCursor {
    private static final Logger LOG = LoggerFactory.getLogger(RequestCursor.class);

    private final String base;
    private final Iterator<String> words;
    private final boolean addSlash;
    private final List<String> extensions;
    private final Deque<URI> pending = new ArrayDeque<>();

    RequestCursor(String base, IWordlist wordlist, boolean addSlash, List<String> extensions) {
        this.base = base;
        this.words = wordlist.iterator();
        this.addSlash = addSlash;
        this.extensions = extensions;
    }

    /** 다음 요청 URL. 소진되면 null */
    synchronized URI next() {
        while (pending.isEmpty()) {
            if (!words.hasNext()) return null;
            expand(words.next());
        }
        return pending.poll();
    }

    private void expand(String word) {
        var plain = UrlUtils.join(base, word);
        if (plain.isEmpty()) {
            LOG.warn("Skipping malformed word '{}' under {}", word, base);
            return;
        }
        pending.add(plain.get());
        if (addSlash && !word.endsWith("/")) {
            UrlUtils.join(base, word + "/").ifPresent(pending::add);
        }
        for (String ext : extensions) {
            String e = ext.startsWith(".") ? ext.substring(1) : ext;
            if (e.isEmpty()) continue;
            UrlUtils.join(base, word + "." + e).ifPresent(pending::add);
        }
    }
}
