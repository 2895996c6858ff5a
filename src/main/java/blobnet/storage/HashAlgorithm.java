package blobnet.storage;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Digest algorithms accepted for content addressing. Every wire name is six
 * characters long so that the identifier prefix {@code "<name>:"} is always seven.
 */
public enum HashAlgorithm {
    SHA256("sha256", "SHA-256", 32),
    SHA512("sha512", "SHA-512", 64);

    public static final int PREFIX_LENGTH = 7;

    private final String wireName;
    private final String jcaName;
    private final int digestLength;

    HashAlgorithm(String wireName, String jcaName, int digestLength) {
        this.wireName = wireName;
        this.jcaName = jcaName;
        this.digestLength = digestLength;
    }

    public String wireName() {
        return wireName;
    }

    public int digestLength() {
        return digestLength;
    }

    public MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(jcaName);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(jcaName + " algorithm not available", e);
        }
    }

    public static HashAlgorithm fromWireName(String wireName) {
        for (HashAlgorithm algorithm : values()) {
            if (algorithm.wireName.equals(wireName)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unsupported digest algorithm: " + wireName);
    }
}
