package net.storefleet.adapter.host.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.storefleet.core.model.Credentials;
import net.storefleet.core.spi.CredentialCipher;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * 자격 증명을 JSON 으로 직렬화해 AES-256-GCM 으로 봉인한다.
 * 저장 형식: {@code v1:base64(iv(12) || ciphertext+tag)}
 */
public final class AesGcmCredentialCipher implements CredentialCipher {
    static final String VERSION = "v1:";
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();
    private final ObjectMapper om = new ObjectMapper();

    public AesGcmCredentialCipher(byte[] key) {
        if (key == null || key.length != 32) {
            throw new IllegalArgumentException("credential key must be 32 bytes (AES-256)");
        }
        this.key = new SecretKeySpec(key.clone(), "AES");
    }

    /** base64 로 인코딩된 키 (설정 값) */
    public static AesGcmCredentialCipher fromBase64(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalArgumentException("storefleet.security.credential-key is required");
        }
        return new AesGcmCredentialCipher(Base64.getDecoder().decode(encoded.trim()));
    }

    @Override
    public String seal(Credentials credentials) throws Exception {
        byte[] iv = new byte[IV_BYTES];
        random.nextBytes(iv);
        byte[] sealed = cipher(Cipher.ENCRYPT_MODE, iv).doFinal(om.writeValueAsBytes(credentials));
        ByteBuffer buf = ByteBuffer.allocate(IV_BYTES + sealed.length).put(iv).put(sealed);
        return VERSION + Base64.getEncoder().encodeToString(buf.array());
    }

    @Override
    public Credentials open(String sealed) throws Exception {
        if (sealed == null || !sealed.startsWith(VERSION)) {
            throw new IllegalArgumentException("unsupported sealed credential format");
        }
        byte[] raw = Base64.getDecoder().decode(sealed.substring(VERSION.length()));
        if (raw.length <= IV_BYTES) throw new IllegalArgumentException("sealed credential too short");

        byte[] iv = new byte[IV_BYTES];
        System.arraycopy(raw, 0, iv, 0, IV_BYTES);
        byte[] plain = cipher(Cipher.DECRYPT_MODE, iv).doFinal(raw, IV_BYTES, raw.length - IV_BYTES);
        return om.readValue(plain, Credentials.class);
    }

    private Cipher cipher(int mode, byte[] iv) throws GeneralSecurityException {
        Cipher c = Cipher.getInstance("AES/GCM/NoPadding");
        c.init(mode, key, new GCMParameterSpec(TAG_BITS, iv));
        return c;
    }
}
