package com.pocketdb.util;

import com.pocketdb.sql.ColumnClass;
import lombok.extern.slf4j.Slf4j;

import java.io.Reader;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Set;

/**
 * Converts driver values into canonical JSON values: null, {@link Boolean}, {@link Long},
 * {@link Double} or {@link String}. Nothing nested and nothing binary leaks out.
 *
 * <p>Never throws. A value that does not decode as its column class degrades to its textual form,
 * and to null when not even that is available.
 */
@Slf4j
public final class ValueMarshaller {
    private static final Set<String> TRUE_WORDS = Set.of("true", "t", "1", "yes", "y", "on");
    private static final Set<String> FALSE_WORDS = Set.of("false", "f", "0", "no", "n", "off");

    private ValueMarshaller() {
    }

    /**
     * Read column {@code columnIndex} of the current row.
     *
     * @param rs result set positioned on a row
     * @param columnIndex 1-based column index
     * @param columnClass class of the column's reported type
     * @param encoding rendering of binary payloads
     * @return canonical value
     */
    public static Object read(ResultSet rs, int columnIndex, ColumnClass columnClass, BinaryEncoding encoding) {
        try {
            Object raw;
            switch (columnClass) {
                case BINARY:
                    raw = rs.getBytes(columnIndex);
                    break;
                case TEXT:
                    raw = rs.getString(columnIndex);
                    break;
                default:
                    raw = rs.getObject(columnIndex);
                    break;
            }
            return marshal(columnClass, raw, encoding);
        } catch (Exception e) {
            log.debug("Column {} not readable as {}: {}", columnIndex, columnClass, e.getMessage());
            return readRaw(rs, columnIndex, encoding);
        }
    }

    /**
     * Convert an already fetched driver value.
     *
     * @param columnClass class of the column's reported type
     * @param raw driver value, may be null
     * @param encoding rendering of binary payloads
     * @return canonical value
     */
    public static Object marshal(ColumnClass columnClass, Object raw, BinaryEncoding encoding) {
        if (raw == null) {
            return null;
        }
        try {
            Object value;
            switch (columnClass) {
                case INTEGER:
                    value = toInteger(raw);
                    break;
                case FLOAT:
                    value = toFloat(raw);
                    break;
                case BOOLEAN:
                    value = toBoolean(raw);
                    break;
                case BINARY:
                    value = toBinaryText(raw, encoding);
                    break;
                default:
                    value = toText(raw, encoding);
                    break;
            }
            if (value != null) {
                return value;
            }
        } catch (Exception e) {
            log.debug("Value of type {} does not decode as {}, degrading to text", raw.getClass().getName(), columnClass);
        }
        return fallbackText(raw, encoding);
    }

    private static Object readRaw(ResultSet rs, int columnIndex, BinaryEncoding encoding) {
        try {
            byte[] bytes = rs.getBytes(columnIndex);
            return bytes != null ? encoding.encode(bytes) : null;
        } catch (Exception e) {
            log.debug("Column {} has no byte form: {}", columnIndex, e.getMessage());
        }
        try {
            return rs.getString(columnIndex);
        } catch (Exception e) {
            log.debug("Column {} has no string form: {}", columnIndex, e.getMessage());
            return null;
        }
    }

    private static Long toInteger(Object raw) {
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigInteger big) {
            return big.longValueExact();
        }
        if (raw instanceof BigDecimal dec) {
            return dec.longValueExact();
        }
        if (raw instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (raw instanceof String s) {
            return Long.parseLong(s.trim());
        }
        return null;
    }

    private static Double toFloat(Object raw) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s) {
            return Double.parseDouble(s.trim());
        }
        return null;
    }

    private static Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof Number n) {
            return n.longValue() != 0;
        }
        if (raw instanceof byte[] bytes && bytes.length == 1) {
            return bytes[0] != 0;
        }
        if (raw instanceof String s) {
            String v = s.trim().toLowerCase(Locale.ROOT);
            if (TRUE_WORDS.contains(v)) {
                return Boolean.TRUE;
            }
            if (FALSE_WORDS.contains(v)) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    private static String toBinaryText(Object raw, BinaryEncoding encoding) throws SQLException {
        if (raw instanceof byte[] bytes) {
            return encoding.encode(bytes);
        }
        if (raw instanceof Blob blob) {
            long length = blob.length();
            return length <= 0 ? "" : encoding.encode(blob.getBytes(1, (int) Math.min(length, Integer.MAX_VALUE)));
        }
        if (raw instanceof String s) {
            return s;
        }
        return null;
    }

    private static String toText(Object raw, BinaryEncoding encoding) throws Exception {
        if (raw instanceof String s) {
            return s;
        }
        if (raw instanceof Clob clob) {
            return readClob(clob);
        }
        if (raw instanceof byte[] || raw instanceof Blob) {
            return toBinaryText(raw, encoding);
        }
        if (raw instanceof BigDecimal dec) {
            return dec.toPlainString();
        }
        return String.valueOf(raw);
    }

    private static String fallbackText(Object raw, BinaryEncoding encoding) {
        try {
            if (raw instanceof byte[] bytes) {
                return encoding.encode(bytes);
            }
            return String.valueOf(raw);
        } catch (Exception e) {
            log.debug("Value of type {} has no text form: {}", raw.getClass().getName(), e.getMessage());
            return null;
        }
    }

    private static String readClob(Clob clob) throws Exception {
        try (Reader reader = clob.getCharacterStream()) {
            if (reader == null) {
                return "";
            }
            StringBuilder sb = new StringBuilder();
            char[] buf = new char[8192];
            int n;
            while ((n = reader.read(buf)) > 0) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        }
    }
}
