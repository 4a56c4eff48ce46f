package net.spookly.rtctoken.signing;

import java.io.ByteArrayOutputStream;
import java.util.Map;

/**
 * Little-endian packer for the access token wire format.
 */
final class ByteWriter {
    private static final int MAX_UINT16 = 0xFFFF;
    private static final long MAX_UINT32 = 0xFFFFFFFFL;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    ByteWriter putUint16(int value) {
        if (value < 0 || value > MAX_UINT16) {
            throw new IllegalArgumentException("value does not fit uint16: " + value);
        }
        out.write(value & 0xFF);
        out.write((value >>> 8) & 0xFF);
        return this;
    }

    ByteWriter putUint32(long value) {
        if (value < 0 || value > MAX_UINT32) {
            throw new IllegalArgumentException("value does not fit uint32: " + value);
        }
        out.write((int) (value & 0xFF));
        out.write((int) ((value >>> 8) & 0xFF));
        out.write((int) ((value >>> 16) & 0xFF));
        out.write((int) ((value >>> 24) & 0xFF));
        return this;
    }

    /**
     * Length-prefixed byte string.
     */
    ByteWriter putBytes(byte[] bytes) {
        putUint16(bytes.length);
        out.writeBytes(bytes);
        return this;
    }

    /**
     * Privilege table as a count followed by (key, value) pairs in iteration order.
     */
    ByteWriter putPrivileges(Map<Integer, Long> privileges) {
        putUint16(privileges.size());
        for (Map.Entry<Integer, Long> entry : privileges.entrySet()) {
            putUint16(entry.getKey());
            putUint32(entry.getValue());
        }
        return this;
    }

    byte[] toByteArray() {
        return out.toByteArray();
    }
}
