package com.gt.wordreminder.util;

import java.security.SecureRandom;
import java.util.Base64;

// Generates unguessable tokens for quiz sessions. 16 random bytes give 22 URL safe characters, which
// keeps "q:<token>" well inside Telegram's 64 byte callback data limit.
public class TokenUtil {

    private static final int TOKEN_BYTES = 16;

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    public static String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(bytes);

        return ENCODER.encodeToString(bytes);
    }
}
