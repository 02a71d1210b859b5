package com.elementhunter.core.service.export;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;

/** {siteId}.json 경로 규칙 */
public final class SiteNaming {
    private SiteNaming() {}

    public static final Path DEFAULT_DIR = Paths.get("data", "sites");

    // 경로 구분자와 Windows 예약 문자, 제어문자
    private static final Pattern UNSAFE = Pattern.compile("[\\\\/:*?\"<>|\\p{Cntrl}]");
    private static final Pattern EDGE_DOTS_SPACES = Pattern.compile("^[.\\s]+|[.\\s]+$");

    public static Path jsonPath(Path baseDir, String siteId) {
        Path out = (baseDir == null ? DEFAULT_DIR : baseDir);
        return out.resolve(fileStem(siteId) + ".json");
    }

    /**
     * siteId 를 그대로(대소문자 유지) 쓰고 파일명에 올 수 없는 문자만 '-' 로 바꾼다.
     * 앞뒤 점/공백은 떼어낸다. 남는 게 없으면 "site".
     */
    public static String fileStem(String siteId) {
        if (siteId == null) return "site";
        String s = UNSAFE.matcher(siteId).replaceAll("-");
        s = EDGE_DOTS_SPACES.matcher(s).replaceAll("");
        return s.isEmpty() ? "site" : s;
    }
}
