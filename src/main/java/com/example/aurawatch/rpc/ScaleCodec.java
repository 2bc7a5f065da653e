package com.example.aurawatch.rpc;

import com.example.aurawatch.model.AuthorityKey;
import org.bouncycastle.util.encoders.Hex;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalLong;

/**
 * Decoding of the few SCALE values the monitor reads from the node.
 */
public final class ScaleCodec {

    /** DigestItem::PreRuntime variant index. */
    static final int PRE_RUNTIME = 6;

    private static final byte[] AURA_ENGINE_ID = {'a', 'u', 'r', 'a'};

    private ScaleCodec() {
    }

    public static byte[] fromHex(String hex) {
        String s = hex.startsWith("0x") ? hex.substring(2) : hex;
        return Hex.decode(s);
    }

    public static long readU64(byte[] bytes) {
        if (bytes.length < 8) {
            throw new IllegalArgumentException("u64 needs 8 bytes, got " + bytes.length);
        }
        return ByteBuffer.wrap(bytes, 0, 8).order(ByteOrder.LITTLE_ENDIAN).getLong();
    }

    public static byte[] encodeU64(long value) {
        return ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(value).array();
    }

    /**
     * Reads a compact-encoded length at {@code buf}'s position and advances it.
     */
    static int readCompact(ByteBuffer buf) {
        int first = buf.get() & 0xff;
        switch (first & 0b11) {
            case 0b00:
                return first >>> 2;
            case 0b01:
                return ((buf.get() & 0xff) << 8 | first) >>> 2;
            case 0b10: {
                long value = (first & 0xffL)
                    | (buf.get() & 0xffL) << 8
                    | (buf.get() & 0xffL) << 16
                    | (buf.get() & 0xffL) << 24;
                return Math.toIntExact(value >>> 2);
            }
            default:
                throw new IllegalArgumentException("compact big-integer lengths are not supported");
        }
    }

    /**
     * Decodes {@code Vec<[u8; 32]>}.
     */
    public static List<AuthorityKey> readAuthorities(byte[] bytes) {
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        int count = readCompact(buf);
        if (buf.remaining() < (long) count * AuthorityKey.KEY_LENGTH) {
            throw new IllegalArgumentException("authority list truncated: " + count + " keys declared, "
                + buf.remaining() + " bytes left");
        }
        List<AuthorityKey> keys = new ArrayList<>(count);
        byte[] key = new byte[AuthorityKey.KEY_LENGTH];
        for (int i = 0; i < count; i++) {
            buf.get(key);
            keys.add(AuthorityKey.of(key));
        }
        return keys;
    }

    /**
     * Extracts the slot from one hex-encoded digest log, if it is an Aura pre-runtime item.
     */
    public static OptionalLong readAuraSlot(String digestLogHex) {
        ByteBuffer buf = ByteBuffer.wrap(fromHex(digestLogHex));
        if (buf.remaining() < 5 || (buf.get() & 0xff) != PRE_RUNTIME) {
            return OptionalLong.empty();
        }
        byte[] engine = new byte[4];
        buf.get(engine);
        if (!Arrays.equals(engine, AURA_ENGINE_ID)) {
            return OptionalLong.empty();
        }
        int len = readCompact(buf);
        if (len < 8 || buf.remaining() < 8) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(buf.order(ByteOrder.LITTLE_ENDIAN).getLong());
    }

    /**
     * First Aura slot found among a header's digest logs.
     */
    public static OptionalLong readAuraSlot(List<String> digestLogs) {
        for (String log : digestLogs) {
            OptionalLong slot = readAuraSlot(log);
            if (slot.isPresent()) {
                return slot;
            }
        }
        return OptionalLong.empty();
    }
}
