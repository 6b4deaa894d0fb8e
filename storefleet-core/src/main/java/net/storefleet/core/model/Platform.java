package net.storefleet.core.model;

import java.util.Locale;

/** 테넌트가 요청할 수 있는 스토어 플랫폼 (닫힌 집합) */
public enum Platform {
    WOOCOMMERCE, MAGENTO;

    public static Platform from(String s) {
        if (s == null) throw new IllegalArgumentException("platform is required");
        try { return Platform.valueOf(s.trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { throw new IllegalArgumentException("unsupported platform: " + s); }
    }

    public String code() { return name(); }

    /** compose 템플릿/로그 경로 등에 쓰는 소문자 키 */
    public String key() { return name().toLowerCase(Locale.ROOT); }
}
