package org.carball.qdsclean.util;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZIP compression of query text in the format of SQL Server's COMPRESS over NVARCHAR,
 * so {@code CAST(DECOMPRESS([QueryText]) AS NVARCHAR(MAX))} reads it back.
 */
public final class QueryTextCompression {

    private QueryTextCompression() {
        // Utility class - prevent instantiation
    }

    public static byte[] compress(String text) {
        if (text == null) {
            return null;
        }
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(buffer)) {
            gzip.write(text.getBytes(StandardCharsets.UTF_16LE));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compress query text", e);
        }
        return buffer.toByteArray();
    }

    public static String decompress(byte[] compressed) {
        if (compressed == null) {
            return null;
        }
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return new String(gzip.readAllBytes(), StandardCharsets.UTF_16LE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to decompress query text", e);
        }
    }
}
