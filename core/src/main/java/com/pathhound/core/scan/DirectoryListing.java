package com.pathhound.core.scan;

import com.pathhound.core.model.ScanResponse;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;

/** 웹 서버 자동 목록(Apache/nginx "Index of", Python/Tomcat "Directory listing for") 판별 */
public final class DirectoryListing {
    private DirectoryListing() {}

    private static final List<String> MARKERS = List.of("index of /", "directory listing for /");

    public static boolean isListing(ScanResponse response) {
        if (response == null || response.getStatusCode() < 200 || response.getStatusCode() >= 300) return false;
        String body = response.getBody();
        if (body == null || body.isBlank()) return false;

        Document doc = Jsoup.parse(body);
        if (startsWithMarker(doc.title())) return true;
        Element h1 = doc.selectFirst("h1, h2");
        return h1 != null && startsWithMarker(h1.text());
    }

    private static boolean startsWithMarker(String text) {
        if (text == null) return false;
        String t = text.trim().toLowerCase(Locale.ROOT);
        for (String m : MARKERS) {
            if (t.startsWith(m)) return true;
        }
        return false;
    }
}
