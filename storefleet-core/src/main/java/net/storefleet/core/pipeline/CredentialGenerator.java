package net.storefleet.core.pipeline;

import net.storefleet.core.model.Credentials;
import net.storefleet.core.model.Tenant;

import java.security.SecureRandom;

/** 시도마다 새로운 DB/관리자 자격 증명 생성 */
public final class CredentialGenerator {
    static final int PASSWORD_LENGTH = 16;
    static final int ADMIN_USER_MAX = 60;

    // compose 보간($)과 YAML 앵커(&)에 걸리는 문자는 제외
    private static final String LETTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String DIGITS = "0123456789";
    private static final String SYMBOLS = "!@#%^*-_";
    private static final String ALPHABET = LETTERS + DIGITS + SYMBOLS;

    private final SecureRandom random;

    public CredentialGenerator() { this(new SecureRandom()); }

    public CredentialGenerator(SecureRandom random) { this.random = random; }

    public Credentials generate(Tenant tenant) {
        String dbName = "customer_" + tenant.id();
        return new Credentials(
                dbName,
                dbName,
                password(),
                password(),
                adminUser(tenant.email()),
                password()
        );
    }

    /** 각 문자군이 최소 하나씩 포함된 비밀번호 */
    String password() {
        while (true) {
            var sb = new StringBuilder(PASSWORD_LENGTH);
            for (int i = 0; i < PASSWORD_LENGTH; i++) {
                sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
            }
            String p = sb.toString();
            if (containsAny(p, LETTERS) && containsAny(p, DIGITS) && containsAny(p, SYMBOLS)) return p;
        }
    }

    /** 이메일 local-part 의 영숫자만, 없으면 admin */
    static String adminUser(String email) {
        if (email == null) return "admin";
        int at = email.indexOf('@');
        String local = at < 0 ? email : email.substring(0, at);
        String cleaned = local.replaceAll("[^a-zA-Z0-9]", "");
        if (cleaned.length() > ADMIN_USER_MAX) cleaned = cleaned.substring(0, ADMIN_USER_MAX);
        return cleaned.isEmpty() ? "admin" : cleaned;
    }

    private static boolean containsAny(String s, String chars) {
        for (int i = 0; i < s.length(); i++) {
            if (chars.indexOf(s.charAt(i)) >= 0) return true;
        }
        return false;
    }
}
