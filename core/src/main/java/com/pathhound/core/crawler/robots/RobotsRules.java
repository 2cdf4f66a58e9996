package com.pathhound.core.crawler.robots;

import java.util.ArrayList;
import java.util.List;

/** 한 User-agent 그룹의 Allow/Disallow 경로 */
public final class RobotsRules {
    public final List<String> allow = new ArrayList<>();
    public final List<String> disallow = new ArrayList<>();

    public RobotsRules addAllow(String path) {
        if (path != null && !path.isBlank()) allow.add(path.trim());
        return this;
    }

    public RobotsRules addDisallow(String path) {
        // Disallow: (빈값) 은 규칙으로 취급하지 않음
        if (path != null && !path.isBlank()) disallow.add(path.trim());
        return this;
    }
}
