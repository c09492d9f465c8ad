package com.ufilename.core.env;

import com.ufilename.core.policy.NamingException;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Map;

/**
 * {@link HashProvider} over the JCA {@link MessageDigest} registry.
 *
 * Accepts the lowercase underscore names used in portable configs
 * ("sha256", "sha3_256") as well as standard JCA names ("SHA-256").
 */
public class MessageDigestHashProvider implements HashProvider {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("md5",        "MD5"),
            Map.entry("sha1",       "SHA-1"),
            Map.entry("sha224",     "SHA-224"),
            Map.entry("sha256",     "SHA-256"),
            Map.entry("sha384",     "SHA-384"),
            Map.entry("sha512",     "SHA-512"),
            Map.entry("sha512_224", "SHA-512/224"),
            Map.entry("sha512_256", "SHA-512/256"),
            Map.entry("sha3_224",   "SHA3-224"),
            Map.entry("sha3_256",   "SHA3-256"),
            Map.entry("sha3_384",   "SHA3-384"),
            Map.entry("sha3_512",   "SHA3-512"));

    @Override
    public boolean supports(String algorithm) {
        try {
            newDigest(algorithm);
            return true;
        } catch (NamingException e) {
            return false;
        }
    }

    @Override
    public byte[] digest(String algorithm, byte[] data) {
        return newDigest(algorithm).digest(data);
    }

    private static MessageDigest newDigest(String algorithm) {
        if (algorithm == null || algorithm.isBlank()) {
            throw new NamingException(NamingException.Kind.UNKNOWN_ALGORITHM,
                    "Hash algorithm name is empty");
        }
        String jcaName = ALIASES.getOrDefault(algorithm.strip().toLowerCase(Locale.ROOT), algorithm.strip());
        try {
            return MessageDigest.getInstance(jcaName);
        } catch (NoSuchAlgorithmException e) {
            throw new NamingException(NamingException.Kind.UNKNOWN_ALGORITHM,
                    "Unknown hash algorithm '" + algorithm + "'", e);
        }
    }
}
