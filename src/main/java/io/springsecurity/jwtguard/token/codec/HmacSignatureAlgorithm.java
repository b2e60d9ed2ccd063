package io.springsecurity.jwtguard.token.codec;

import io.jsonwebtoken.security.SecureDigestAlgorithm;
import io.jsonwebtoken.security.SecureRequest;
import io.jsonwebtoken.security.SignatureException;
import io.jsonwebtoken.security.VerifySecureDigestRequest;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.MessageDigest;
import java.security.Provider;
import java.util.List;
import java.util.Optional;

/**
 * HMAC JWS algorithm accepting secrets of any length.
 *
 * <p>JJWT's {@code HS*} algorithms refuse keys shorter than the digest size. Shared secrets issued
 * elsewhere are often shorter, so HMAC codecs sign and verify through this class, registered under the
 * standard algorithm id.
 */
final class HmacSignatureAlgorithm implements SecureDigestAlgorithm<Key, Key> {

    static final List<HmacSignatureAlgorithm> ALL = List.of(
            new HmacSignatureAlgorithm("HS256", "HmacSHA256"),
            new HmacSignatureAlgorithm("HS384", "HmacSHA384"),
            new HmacSignatureAlgorithm("HS512", "HmacSHA512"));

    private final String id;
    private final String jcaName;

    private HmacSignatureAlgorithm(String id, String jcaName) {
        this.id = id;
        this.jcaName = jcaName;
    }

    /**
     * Replacement for the given algorithm, empty unless it is one of the JWA HMAC algorithms.
     */
    static Optional<HmacSignatureAlgorithm> replacing(SecureDigestAlgorithm<?, ?> algorithm) {
        return ALL.stream()
                .filter(hmac -> hmac.id.equals(algorithm.getId()))
                .findFirst();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public byte[] digest(SecureRequest<InputStream, Key> request) {
        Key key = request.getKey();
        if (!(key instanceof SecretKey)) {
            throw new io.jsonwebtoken.security.InvalidKeyException(
                    id + " requires a SecretKey, got " + (key == null ? "null" : key.getClass().getName()));
        }
        byte[] secret = key.getEncoded();
        if (secret == null || secret.length == 0) {
            throw new io.jsonwebtoken.security.InvalidKeyException(id + " secret cannot be empty");
        }

        try {
            Mac mac = newMac(request.getProvider());
            mac.init(new SecretKeySpec(secret, jcaName));
            InputStream payload = request.getPayload();
            byte[] buffer = new byte[1024];
            int read;
            while ((read = payload.read(buffer)) != -1) {
                mac.update(buffer, 0, read);
            }
            return mac.doFinal();
        } catch (GeneralSecurityException | IOException e) {
            throw new SignatureException("Unable to compute " + id + " signature: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean verify(VerifySecureDigestRequest<Key> request) {
        byte[] expected = digest(request);
        return MessageDigest.isEqual(expected, request.getDigest());
    }

    private Mac newMac(Provider provider) throws GeneralSecurityException {
        return provider == null ? Mac.getInstance(jcaName) : Mac.getInstance(jcaName, provider);
    }

    @Override
    public String toString() {
        return id;
    }
}
