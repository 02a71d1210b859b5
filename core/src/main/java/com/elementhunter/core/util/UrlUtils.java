package com.elementhunter.core.util;

import org.jsoup.internal.StringUtil;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/** origin / same-host 판정 / 상대 URL 해석 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    // 루트 위로 올라가는 "/.." 는 루트에서 멈춘다
    private static final Pattern LEADING_PARENT = Pattern.compile("^(/\\.\\.)+(?=/|$)");
    private static final String PATH_SAFE = "-._~!$&'()*+,;=:@/";

    /**
     * scheme://host[:port] 만 남긴 origin. 기본 포트(http:80, https:443)는 제거.
     */
    public static URI origin(URI u) {
        if (u == null) return null;
        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() == null ? "" : u.getHost().toLowerCase(Locale.ROOT);
        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }
        try {
            return new URI(scheme, null, host, port, null, null, null);
        } catch (URISyntaxException e) {
            // 파싱 실패 시 원본 유지(보수적)
            return u;
        }
    }

    /** origin 문자열(끝 슬래시 없음) */
    public static String originString(URI u) {
        URI o = origin(u);
        return o == null ? "" : o.toString();
    }

    /** host 기준 동일 호스트 판정(소문자 비교) */
    public static boolean sameHost(URI a, URI b) {
        if (a == null || b == null) return false;
        String ha = a.getHost() == null ? "" : a.getHost().toLowerCase(Locale.ROOT);
        String hb = b.getHost() == null ? "" : b.getHost().toLowerCase(Locale.ROOT);
        return ha.equals(hb);
    }

    /**
     * base origin 기준으로 href 를 절대 URI로 해석(jsoup abs:href 와 같은 관대한 해석).
     * '|', '{', '^', 단독 '%' 처럼 URI 에 그대로 못 쓰는 경로 문자는 퍼센트 인코딩하고
     * 점 세그먼트는 정리한다. query/fragment 는 버린다. 해석할 수 없으면 IllegalArgumentException.
     */
    public static URI resolve(URI base, String href) {
        if (href == null) throw new IllegalArgumentException("href is null");
        String abs = StringUtil.resolve(originString(base) + "/", href.trim());
        if (abs.isEmpty()) throw new IllegalArgumentException("unresolvable href: " + href);
        URL url;
        try {
            url = new URL(abs);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("unresolvable href: " + href, e);
        }
        String path = URI.create(encodePath(url.getPath())).normalize().getRawPath();
        path = LEADING_PARENT.matcher(path).replaceFirst("");
        String authority = url.getHost() + (url.getPort() >= 0 ? ":" + url.getPort() : "");
        return URI.create(url.getProtocol() + "://" + authority + path);
    }

    /** 경로에서 URI 에 허용되지 않는 문자만 UTF-8 퍼센트 인코딩. 유효한 %XX 는 그대로 */
    static String encodePath(String path) {
        StringBuilder sb = new StringBuilder(path.length() + 16);
        int i = 0;
        while (i < path.length()) {
            int cp = path.codePointAt(i);
            int len = Character.charCount(cp);
            if (cp == '%' && i + 2 < path.length() && isHex(path.charAt(i + 1)) && isHex(path.charAt(i + 2))) {
                sb.append('%');
            } else if (cp < 0x80 && (Character.isLetterOrDigit(cp) || PATH_SAFE.indexOf(cp) >= 0)) {
                sb.append((char) cp);
            } else {
                for (byte b : new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8)) {
                    sb.append('%').append(String.format(Locale.ROOT, "%02X", b & 0xff));
                }
            }
            i += len;
        }
        return sb.toString();
    }

    private static boolean isHex(char c) {
        return Character.digit(c, 16) >= 0;
    }

    /**
     * 절대 URL 변환(base 기준). 실패하면 원래 문자열을 그대로 돌려준다(이미지 URL 용).
     */
    public static String toAbsolute(URI base, String url) {
        if (url == null || url.isBlank() || base == null) return url;
        try {
            URI b = (base.getRawPath() == null || base.getRawPath().isEmpty()) ? base.resolve("/") : base;
            URI abs = b.resolve(URI.create(url.trim()));
            if (abs.getScheme() == null || abs.getHost() == null) return url;
            return abs.toString();
        } catch (IllegalArgumentException e) {
            return url;
        }
    }
}
