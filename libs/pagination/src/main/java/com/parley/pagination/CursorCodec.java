package com.parley.pagination;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Encodes record ids as opaque cursor strings and back.
 * <p>
 * A cursor is the Base64 form of the id's decimal string. Decoding accepts only the exact string
 * {@link #encode(long)} produces for some positive id, so every accepted cursor maps to exactly one
 * id and every id to exactly one cursor. Pure and thread-safe.
 */
public final class CursorCodec {

    private static final Pattern DECIMAL = Pattern.compile("[0-9]{1,19}");

    private CursorCodec() {
        // utility class
    }

    /**
     * Encodes a record id as a cursor.
     *
     * @param id a store-assigned record id
     * @return the opaque cursor
     * @throws IllegalArgumentException if id is not positive
     */
    public static String encode(long id) {
        if (id <= 0) {
            throw new IllegalArgumentException("id must be positive, got " + id);
        }
        return Base64.getEncoder().encodeToString(Long.toString(id).getBytes(StandardCharsets.US_ASCII));
    }

    /**
     * Decodes a cursor back to the record id it was issued for.
     *
     * @param cursor a cursor previously returned by {@link #encode(long)}
     * @return the record id
     * @throws InvalidCursorException if the cursor is blank, malformed, or not canonical
     */
    public static long decode(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            throw new InvalidCursorException(cursor, "cursor is blank");
        }

        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(cursor);
        } catch (IllegalArgumentException e) {
            throw new InvalidCursorException(cursor, "not valid Base64", e);
        }

        String decimal = new String(raw, StandardCharsets.US_ASCII);
        if (!DECIMAL.matcher(decimal).matches()) {
            throw new InvalidCursorException(cursor, "does not encode a decimal id");
        }

        long id;
        try {
            id = Long.parseLong(decimal);
        } catch (NumberFormatException e) {
            throw new InvalidCursorException(cursor, "id out of range", e);
        }
        if (id <= 0) {
            throw new InvalidCursorException(cursor, "id must be positive");
        }
        // Rejects leading zeros and alternative paddings of the same id.
        if (!encode(id).equals(cursor)) {
            throw new InvalidCursorException(cursor, "not a canonical cursor");
        }
        return id;
    }
}
