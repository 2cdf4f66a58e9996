package com.pathhound.core.state;

import com.pathhound.core.api.IWordlist;
import com.pathhound.core.error.IncompatibleStateException;
import com.pathhound.core.model.RunConfig;
import com.pathhound.core.model.StateFile;
import com.pathhound.core.util.UrlUtils;

import java.util.Set;
import java.util.TreeSet;

/** 저장된 상태가 현재 실행과 호환되는지 검사. 불일치는 치명적. */
public final class ResumeValidator {
    private ResumeValidator() {}

    /**
     * 규칙:
     * - 현재 타깃이 비어 있으면 저장된 타깃을 채택(검사 생략)
     * - 그 외엔 타깃 집합이 같아야 함(정규화 후 비교)
     * - 워드리스트 항목 수가 같아야 함(경로가 둘 다 있으면 경로도 같아야 함)
     */
    public static void ensureCompatible(StateFile saved, RunConfig current, IWordlist wordlist) {
        RunConfig prev = saved.config;

        if (!current.getTargets().isEmpty()) {
            Set<String> a = normalized(prev.getTargets());
            Set<String> b = normalized(current.getTargets());
            if (!a.equals(b)) {
                throw new IncompatibleStateException("targets differ from saved state: saved=" + a + " current=" + b);
            }
        }

        if (prev.getWordlist() != null && current.getWordlist() != null
                && !prev.getWordlist().equals(current.getWordlist())) {
            throw new IncompatibleStateException("wordlist differs from saved state: saved="
                    + prev.getWordlist() + " current=" + current.getWordlist());
        }
        if (wordlist != null && saved.wordlistEntries > 0 && saved.wordlistEntries != wordlist.size()) {
            throw new IncompatibleStateException("wordlist size differs from saved state: saved="
                    + saved.wordlistEntries + " current=" + wordlist.size());
        }
    }

    private static Set<String> normalized(Iterable<String> targets) {
        Set<String> out = new TreeSet<>();
        for (String t : targets) out.add(UrlUtils.directoryBase(t));
        return out;
    }
}
