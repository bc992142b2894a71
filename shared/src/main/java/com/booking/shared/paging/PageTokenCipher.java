package com.booking.shared.paging;

import com.booking.shared.error.MalformedPageTokenException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Seals page tokens so clients can neither read nor forge them.
 *
 * Layout: base64url( iv[12] || AES-256-GCM(json(PageToken)) || tag[16] ).
 * The AES key is derived from the configured secret with HMAC-SHA256, so any secret of at least
 * 16 bytes works. A token that fails authentication, decoding or parsing is reported as
 * {@link MalformedPageTokenException}; callers never fall back to the first page.
 */
@Slf4j
public class PageTokenCipher {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 16;
    private static final int MIN_SECRET_LENGTH = 16;
    private static final byte[] KEY_CONTEXT = "booking-page-token".getBytes(StandardCharsets.UTF_8);

    private final ObjectMapper objectMapper;
    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public PageTokenCipher(ObjectMapper objectMapper, String secretBase64) {
        this.objectMapper = objectMapper;
        this.key = deriveKey(secretBase64);
    }

    public String seal(PageToken token) {
        try {
            byte[] plaintext = objectMapper.writeValueAsBytes(token);
            byte[] iv = new byte[GCM_IV_LENGTH];
            random.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            byte[] encrypted = cipher.doFinal(plaintext);

            byte[] sealed = ByteBuffer.allocate(iv.length + encrypted.length).put(iv).put(encrypted).array();
            return Base64.getUrlEncoder().withoutPadding().encodeToString(sealed);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to seal page token", e);
        }
    }

    public PageToken unseal(String sealed) {
        byte[] bytes;
        try {
            bytes = Base64.getUrlDecoder().decode(sealed);
        } catch (IllegalArgumentException e) {
            throw new MalformedPageTokenException("page token is not valid base64url", e);
        }
        if (bytes.length <= GCM_IV_LENGTH + GCM_TAG_LENGTH) {
            throw new MalformedPageTokenException("page token is truncated");
        }

        byte[] iv = Arrays.copyOfRange(bytes, 0, GCM_IV_LENGTH);
        byte[] encrypted = Arrays.copyOfRange(bytes, GCM_IV_LENGTH, bytes.length);
        byte[] plaintext;
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            plaintext = cipher.doFinal(encrypted);
        } catch (GeneralSecurityException e) {
            log.debug("Rejected page token: reason={}", e.getClass().getSimpleName());
            throw new MalformedPageTokenException("page token failed authentication", e);
        }

        try {
            return objectMapper.readValue(plaintext, PageToken.class);
        } catch (Exception e) {
            throw new MalformedPageTokenException("page token payload is unreadable", e);
        }
    }

    private static SecretKeySpec deriveKey(String secretBase64) {
        if (secretBase64 == null || secretBase64.isBlank()) {
            throw new IllegalStateException("booking.paging.token-cipher-key is not configured");
        }
        byte[] secret = Base64.getDecoder().decode(secretBase64);
        if (secret.length < MIN_SECRET_LENGTH) {
            throw new IllegalStateException("booking.paging.token-cipher-key must decode to at least "
                    + MIN_SECRET_LENGTH + " bytes");
        }
        try {
            Mac hmac = Mac.getInstance("HmacSHA256");
            hmac.init(new SecretKeySpec(secret, "HmacSHA256"));
            return new SecretKeySpec(hmac.doFinal(KEY_CONTEXT), "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to derive page token key", e);
        }
    }
}
