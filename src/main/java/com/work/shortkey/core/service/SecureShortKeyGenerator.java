package com.work.shortkey.core.service;

import java.security.SecureRandom;

import static com.work.shortkey.core.support.ValidationUtils.requireNonEmpty;
import static com.work.shortkey.core.support.ValidationUtils.requirePositive;

/**
 * 基于 SecureRandom 的生成器：每个字符一次 nextInt(charsetSize)，无取模偏差。
 */
public class SecureShortKeyGenerator implements ShortKeyGenerator {

    private static final int SALT_BYTES = 16;
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final char[] charset;
    private final SecureRandom random;

    public SecureShortKeyGenerator(String charset) {
        this(charset, new SecureRandom());
    }

    public SecureShortKeyGenerator(String charset, SecureRandom random) {
        this.charset = requireNonEmpty(charset, "charset").toCharArray();
        this.random = random;
    }

    @Override
    public String generate(int length) {
        requirePositive(length, "length");
        char[] out = new char[length];
        for (int i = 0; i < length; i++) {
            out[i] = charset[random.nextInt(charset.length)];
        }
        return new String(out);
    }

    @Override
    public String newSalt() {
        byte[] bytes = new byte[SALT_BYTES];
        random.nextBytes(bytes);
        char[] out = new char[SALT_BYTES * 2];
        for (int i = 0; i < SALT_BYTES; i++) {
            out[i * 2] = HEX[(bytes[i] >> 4) & 0x0f];
            out[i * 2 + 1] = HEX[bytes[i] & 0x0f];
        }
        return new String(out);
    }
}
