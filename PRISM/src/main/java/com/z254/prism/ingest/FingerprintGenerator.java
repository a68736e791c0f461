package com.z254.prism.ingest;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Derives the deduplication fingerprint of an alert.
 * <p>
 * The fingerprint is the first 16 hex digits of the MD5 of {@code service:host:title}, with
 * every run of digits in the title replaced by {@code X} so that alerts differing only in
 * counters or ids share a fingerprint.
 */
@Component
public class FingerprintGenerator {

    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final int LENGTH = 16;

    public String fingerprint(String service, String host, String title) {
        String normalizedTitle = DIGITS.matcher(title.trim()).replaceAll("X");
        String source = service + ":" + host + ":" + normalizedTitle;
        return HexFormat.of().formatHex(md5(source)).substring(0, LENGTH);
    }

    private static byte[] md5(String source) {
        try {
            return MessageDigest.getInstance("MD5").digest(source.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships MD5
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }
}
