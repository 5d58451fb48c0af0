package com.sealedstore.crypto;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Binary ↔ Base64 conversion for every value that crosses into a text-oriented layer
 * (transport fields, vault columns, metadata blobs).
 *
 * Buffers are streamed through the codec in fixed 32 KiB windows so that arbitrarily
 * large file bodies never need one oversized intermediate copy.
 */
public final class ChunkedBase64 {

    /** Window size for both directions. */
    public static final int CHUNK_SIZE = 0x8000;

    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/]*={0,2}$");

    private ChunkedBase64() {
    }

    public static String encode(byte[] data) {
        if (data == null) {
            throw new InvalidInputException("Cannot encode null buffer");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(((data.length + 2) / 3) * 4);
        try (OutputStream encoder = Base64.getEncoder().wrap(out)) {
            for (int offset = 0; offset < data.length; offset += CHUNK_SIZE) {
                encoder.write(data, offset, Math.min(CHUNK_SIZE, data.length - offset));
            }
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return out.toString(StandardCharsets.US_ASCII);
    }

    /**
     * Decodes standard (non-URL) Base64. Surrounding whitespace is ignored; anything
     * else outside the alphabet is rejected with {@link InvalidInputException}.
     */
    public static byte[] decode(String text) {
        if (text == null) {
            throw new InvalidInputException("Invalid base64 input: null");
        }
        String clean = text.trim();
        if (!BASE64.matcher(clean).matches()) {
            throw new InvalidInputException("Invalid base64 format: contains invalid characters");
        }
        byte[] ascii = clean.getBytes(StandardCharsets.US_ASCII);
        ByteArrayOutputStream out = new ByteArrayOutputStream((ascii.length / 4) * 3);
        byte[] window = new byte[CHUNK_SIZE];
        try (InputStream decoder = Base64.getDecoder().wrap(new ByteArrayInputStream(ascii))) {
            int read;
            while ((read = decoder.read(window)) != -1) {
                out.write(window, 0, read);
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new InvalidInputException("Failed to decode base64: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }
}
