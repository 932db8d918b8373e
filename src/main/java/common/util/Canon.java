package common.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Canon {
    // Deterministic serializer (ordered keys, no pretty)
    public static final ObjectMapper M = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private Canon() {}

    public static byte[] bytes(Object pojo) {
        try { return M.writeValueAsBytes(pojo); }
        catch (Exception e) { throw new RuntimeException(e); }
    }

    /** Hex SHA-256 of the canonical bytes; equal values give equal digests. */
    public static String digest(Object pojo) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return Hex.encode(sha.digest(bytes(pojo)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
