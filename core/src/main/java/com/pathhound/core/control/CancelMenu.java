package com.pathhound.core.control;

import com.pathhound.core.model.Scan;
import com.pathhound.core.scan.ScanRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * 일시정지 중 표시하는 취소 메뉴.
 * 입력: "1,3" / "2-4" / "1, 5-6" (1부터). 잘못된 토큰·범위 밖 번호는 알림 후 무시.
 */
public final class CancelMenu {
    private CancelMenu() {}

    public static final String USER_CANCEL_REASON = "cancelled from menu";

    public static String render(List<Scan> cancelable) {
        StringBuilder sb = new StringBuilder();
        sb.append("──────────── scan management ────────────").append(System.lineSeparator());
        if (cancelable.isEmpty()) {
            sb.append("  (no cancelable scans)").append(System.lineSeparator());
        }
        for (int i = 0; i < cancelable.size(); i++) {
            Scan s = cancelable.get(i);
            sb.append(String.format(Locale.ROOT, "  %2d: %-9s %s (depth %d)%n",
                    i + 1, s.getStatus(), s.getBaseUrl(), s.getDepth()));
        }
        sb.append("Enter scan numbers to cancel (e.g. 1,3-4), or press Enter to resume: ");
        return sb.toString();
    }

    /**
     * @param input 사용자 입력
     * @param max   메뉴 항목 수
     * @param notice 무시한 토큰 알림
     * @return 정렬·중복 제거된 1-based 번호
     */
    public static List<Integer> parseSelection(String input, int max, Consumer<String> notice) {
        TreeSet<Integer> out = new TreeSet<>();
        if (input == null || input.isBlank()) return List.of();
        for (String raw : input.split(",")) {
            String tok = raw.trim();
            if (tok.isEmpty()) continue;
            int dash = tok.indexOf('-', 1);
            try {
                if (dash > 0) {
                    int a = Integer.parseInt(tok.substring(0, dash).trim());
                    int b = Integer.parseInt(tok.substring(dash + 1).trim());
                    if (a > b) { int t = a; a = b; b = t; }
                    for (int i = a; i <= b; i++) addIfValid(out, i, max, notice);
                } else {
                    addIfValid(out, Integer.parseInt(tok), max, notice);
                }
            } catch (NumberFormatException e) {
                notice.accept("ignored invalid entry '" + tok + "'");
            }
        }
        return new ArrayList<>(out);
    }

    private static void addIfValid(TreeSet<Integer> out, int i, int max, Consumer<String> notice) {
        if (i >= 1 && i <= max) out.add(i);
        else notice.accept("ignored out-of-range entry " + i);
    }

    /** 선택한 스캔 + 종단이 아닌 후손을 취소. 취소된 스캔 수 반환 */
    public static int apply(ScanRegistry registry, List<Scan> shown, List<Integer> selection) {
        int n = 0;
        for (int idx : selection) {
            Scan s = shown.get(idx - 1);
            n += registry.cancelTree(s.getId(), USER_CANCEL_REASON).size();
        }
        return n;
    }
}
