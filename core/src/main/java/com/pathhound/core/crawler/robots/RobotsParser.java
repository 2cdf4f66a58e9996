package com.pathhound.core.crawler.robots;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * robots.txt 파서. 여기서는 접근 제어가 아니라 "숨은 경로 발견" 용도로 쓴다.
 * - 지원 지시어: User-agent / Allow / Disallow / Sitemap (키 대소문자 무시)
 * - Sitemap 은 그룹과 무관하게 등장 순으로 모은다
 * - 연속된 User-agent 라인은 같은 그룹
 * - {@link ParsedRobots#discoveredPaths()} 는 모든 그룹의 경로를 합친다('*' 이후와 '$' 는 잘라냄)
 */
public final class RobotsParser {

    private RobotsParser() {}

    private static final Pattern KV = Pattern.compile("^\\s*([A-Za-z-]+)\\s*:\\s*(.*?)\\s*$");
    private static final String UA_ALL = "*";

    public static ParsedRobots parse(String robotsTxt) {
        if (robotsTxt == null) robotsTxt = "";

        Map<String, RobotsRules> byUa = new LinkedHashMap<>();
        List<String> currentAgents = new ArrayList<>();
        List<String> sitemaps = new ArrayList<>();
        boolean lastWasUA = false;

        for (String rawLine : robotsTxt.split("\\r?\\n")) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) continue;

            Matcher m = KV.matcher(line);
            if (!m.matches()) continue;

            String key = m.group(1).toLowerCase(Locale.ROOT);
            String val = m.group(2).trim();

            switch (key) {
                case "user-agent" -> {
                    String ua = (val.isEmpty() ? UA_ALL : val).toLowerCase(Locale.ROOT);
                    if (!lastWasUA) currentAgents = new ArrayList<>();
                    currentAgents.add(ua);
                    byUa.putIfAbsent(ua, new RobotsRules());
                    lastWasUA = true;
                }
                case "allow" -> {
                    ensureAgents(currentAgents, byUa);
                    for (String ua : currentAgents) byUa.get(ua).addAllow(val);
                    lastWasUA = false;
                }
                case "disallow" -> {
                    ensureAgents(currentAgents, byUa);
                    for (String ua : currentAgents) byUa.get(ua).addDisallow(val);
                    lastWasUA = false;
                }
                case "sitemap" -> {
                    if (!val.isEmpty() && !sitemaps.contains(val)) sitemaps.add(val);
                    lastWasUA = false;
                }
                default -> lastWasUA = false;
            }
        }
        return new ParsedRobots(byUa, List.copyOf(sitemaps));
    }

    private static void ensureAgents(List<String> currentAgents, Map<String, RobotsRules> byUa) {
        if (currentAgents.isEmpty()) {
            currentAgents.add(UA_ALL);
            byUa.putIfAbsent(UA_ALL, new RobotsRules());
        }
    }

    private static String stripComment(String s) {
        int i = s.indexOf('#');
        return i >= 0 ? s.substring(0, i) : s;
    }

    /** 와일드카드 이후를 잘라 실제 요청 가능한 경로만 남긴다. 루트("/")만 남으면 제외. */
    static String toPath(String rule) {
        String r = rule.trim();
        int star = r.indexOf('*');
        if (star >= 0) r = r.substring(0, star);
        if (r.endsWith("$")) r = r.substring(0, r.length() - 1);
        if (r.isEmpty() || !r.startsWith("/") || r.equals("/")) return null;
        return r;
    }

    public record ParsedRobots(Map<String, RobotsRules> byUa, List<String> sitemaps) {

        /** 모든 그룹의 Allow/Disallow 경로(중복 제거, 등장 순) */
        public Set<String> discoveredPaths() {
            Set<String> out = new LinkedHashSet<>();
            for (RobotsRules rules : byUa.values()) {
                for (String a : rules.allow) {
                    String p = toPath(a);
                    if (p != null) out.add(p);
                }
                for (String d : rules.disallow) {
                    String p = toPath(d);
                    if (p != null) out.add(p);
                }
            }
            return out;
        }
    }
}
