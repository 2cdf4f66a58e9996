package com.pathhound.core.crawler;

import com.pathhound.core.model.ScanResponse;
import com.pathhound.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JSoup + LinkFinder 정규식 기반 추출기.
 * <ul>
 *   <li>HTML 속성: a[href], link[href], img/script/iframe/frame/embed[src], form[action]</li>
 *   <li>원문 텍스트(JS 문자열 등)에서 따옴표로 둘러싸인 경로/URL</li>
 *   <li>같은 호스트만, 각 링크의 상위 경로(/a/b/c.js → /a/b/, /a/)도 함께</li>
 * </ul>
 */
public class JsoupLinkExtractor implements LinkExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(JsoupLinkExtractor.class);

    /** LinkFinder 계열 정규식 (그룹 1 = 따옴표 안의 링크) */
    static final Pattern LINK_FINDER = Pattern.compile(
            "(?:\"|')(((?:[a-zA-Z]{1,10}://|//)[^\"'/]{1,}\\.[a-zA-Z]{2,}[^\"']{0,})"
            + "|((?:/|\\.\\./|\\./)[^\"'><,;| *()(%%$^/\\\\\\[\\]][^\"'><,;|()]{1,})"
            + "|([a-zA-Z0-9_\\-/]{1,}/[a-zA-Z0-9_\\-/]{1,}\\.(?:[a-zA-Z]{1,4}|action)(?:[\\?|#][^\"|']{0,}|))"
            + "|([a-zA-Z0-9_\\-/]{1,}/[a-zA-Z0-9_\\-/]{3,}(?:[\\?|#][^\"|']{0,}|))"
            + "|([a-zA-Z0-9_\\-.]{1,}\\.(?:php|asp|aspx|jsp|json|action|html|js|txt|xml)(?:[\\?|#][^\"|']{0,}|)))"
            + "(?:\"|')");

    private static final String[][] ATTRS = {
            {"a[href]", "href"}, {"link[href]", "href"}, {"img[src]", "src"}, {"script[src]", "src"},
            {"iframe[src]", "src"}, {"frame[src]", "src"}, {"embed[src]", "src"}, {"form[action]", "action"}
    };

    @Override
    public Set<URI> extract(ScanResponse response) {
        Set<URI> out = new LinkedHashSet<>();
        if (response == null || response.getBody().isEmpty()) return out;

        URI base = response.getUrl();
        String body = response.getBody();
        List<String> raw = new ArrayList<>();

        String ct = response.header("content-type");
        boolean html = (ct == null) || ct.toLowerCase(Locale.ROOT).contains("html");
        if (html) {
            try {
                Document doc = Jsoup.parse(body, base.toString());
                for (String[] a : ATTRS) {
                    for (Element el : doc.select(a[0])) {
                        String abs = el.attr("abs:" + a[1]);
                        if (abs != null && !abs.isBlank()) raw.add(abs.trim());
                    }
                }
            } catch (RuntimeException e) {
                LOG.debug("HTML parse failed for {}: {}", base, e.toString());
            }
        }

        Matcher m = LINK_FINDER.matcher(body);
        while (m.find()) {
            String g = m.group(1);
            if (g != null && !g.isBlank()) raw.add(g.trim());
        }

        for (String link : raw) {
            URI abs = resolve(base, link);
            if (abs == null || !UrlUtils.sameDomain(abs, base)) continue;
            addWithParents(abs, out);
        }
        return out;
    }

    private static URI resolve(URI base, String link) {
        try {
            String l = link.startsWith("//") ? base.getScheme() + ":" + link : link;
            URI u = base.resolve(URI.create(l.replace(" ", "%20")));
            String s = u.getScheme();
            if (s == null) return null;
            if (!s.equalsIgnoreCase("http") && !s.equalsIgnoreCase("https")) return null;
            return UrlUtils.normalize(u);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** /a/b/c.js → /a/b/c.js, /a/b/, /a/ (루트는 제외) */
    static void addWithParents(URI link, Set<URI> out) {
        out.add(link);
        String path = link.getRawPath();
        if (path == null || path.isEmpty()) return;
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        int i = trimmed.lastIndexOf('/');
        while (i > 0) {
            String parent = trimmed.substring(0, i + 1);
            out.add(URI.create(origin(link) + parent));
            trimmed = trimmed.substring(0, i);
            i = trimmed.lastIndexOf('/');
        }
    }

    private static String origin(URI u) {
        return u.getScheme() + "://" + u.getRawAuthority();
    }
}
