package net.storefleet.core.spi;

import net.storefleet.core.model.Credentials;

/** 저장용 자격 증명 암복호화 */
public interface CredentialCipher {
    String seal(Credentials credentials) throws Exception;

    Credentials open(String sealed) throws Exception;
}
