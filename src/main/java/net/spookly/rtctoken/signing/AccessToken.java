package net.spookly.rtctoken.signing;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.zip.CRC32;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Version 006 access token: an HMAC-SHA256 signed privilege table bound to an app,
 * channel and user.
 * <p>
 * Layout: {@code "006" + appId + base64(sig, crc32(channel), crc32(uid), message)} where
 * {@code message = (salt, ts, privileges)} and
 * {@code sig = HMAC(appCertificate, appId + channel + uid + message)}.
 */
public final class AccessToken {
    public static final String VERSION = "006";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final String appId;
    private final String appCertificate;
    private final String channelName;
    private final String uid;
    private final long salt;
    private final long messageTimestamp;
    private final SortedMap<Integer, Long> privileges = new TreeMap<>();

    /**
     * @param salt             random value mixed into the signed message (uint32)
     * @param messageTimestamp unix seconds after which the message itself is stale (uint32)
     */
    public AccessToken(String appId,
                       String appCertificate,
                       String channelName,
                       String uid,
                       long salt,
                       long messageTimestamp) {
        this.appId = requireValue(appId, "appId");
        this.appCertificate = requireValue(appCertificate, "appCertificate");
        this.channelName = channelName == null ? "" : channelName;
        this.uid = uid == null ? "" : uid;
        this.salt = salt;
        this.messageTimestamp = messageTimestamp;
    }

    public AccessToken addPrivilege(Privilege privilege, long expiresAt) {
        privileges.put(privilege.code(), expiresAt);
        return this;
    }

    /**
     * Pack, sign and encode the token.
     */
    public String build() {
        byte[] message = new ByteWriter()
                .putUint32(salt)
                .putUint32(messageTimestamp)
                .putPrivileges(privileges)
                .toByteArray();
        byte[] signature = sign(message);
        byte[] content = new ByteWriter()
                .putBytes(signature)
                .putUint32(crc32(channelName))
                .putUint32(crc32(uid))
                .putBytes(message)
                .toByteArray();
        return VERSION + appId + Base64.getEncoder().encodeToString(content);
    }

    private byte[] sign(byte[] message) {
        byte[] appIdBytes = appId.getBytes(StandardCharsets.UTF_8);
        byte[] channelBytes = channelName.getBytes(StandardCharsets.UTF_8);
        byte[] uidBytes = uid.getBytes(StandardCharsets.UTF_8);
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(appCertificate.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            mac.update(appIdBytes);
            mac.update(channelBytes);
            mac.update(uidBytes);
            return mac.doFinal(message);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to compute HMAC", e);
        }
    }

    private static long crc32(String value) {
        CRC32 crc = new CRC32();
        crc.update(value.getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }

    private static String requireValue(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }
}
