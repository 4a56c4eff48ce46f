package net.spookly.rtctoken.signing;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.TreeMap;

import org.junit.jupiter.api.Test;

class ByteWriterTest {
    @Test
    void packsLittleEndian() {
        byte[] bytes = new ByteWriter()
                .putUint16(0x0102)
                .putUint32(0xA0B0C0D0L)
                .toByteArray();

        assertArrayEquals(new byte[] {0x02, 0x01, (byte) 0xD0, (byte) 0xC0, (byte) 0xB0, (byte) 0xA0}, bytes);
    }

    @Test
    void prefixesByteStringsWithLength() {
        byte[] bytes = new ByteWriter().putBytes(new byte[] {7, 8, 9}).toByteArray();

        assertArrayEquals(new byte[] {3, 0, 7, 8, 9}, bytes);
    }

    @Test
    void packsPrivilegeTableInKeyOrder() {
        TreeMap<Integer, Long> privileges = new TreeMap<>();
        privileges.put(1000, 5L);
        privileges.put(1, 6L);

        byte[] bytes = new ByteWriter().putPrivileges(privileges).toByteArray();

        assertArrayEquals(new byte[] {2, 0, 1, 0, 6, 0, 0, 0, (byte) 0xE8, 0x03, 5, 0, 0, 0}, bytes);
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> new ByteWriter().putUint16(0x10000));
        assertThrows(IllegalArgumentException.class, () -> new ByteWriter().putUint32(-1));
    }
}
