package io.jsonsift.cli.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads documents as UTF-8 text. A leading byte order mark is dropped; nothing else is checked,
 * malformed JSON is left to the query engine.
 */
public final class DocumentReader {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentReader.class);
    private static final char BOM = 0xFEFF;

    private DocumentReader() {
        // utility class
    }

    /**
     * @throws DocumentReadException if the file does not exist or cannot be read
     */
    public static String read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new DocumentReadException("Document not found: " + file, file.toString());
        }
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.toString());
        } catch (IOException e) {
            throw new DocumentReadException("Failed to read document: " + file, e, file.toString());
        }
    }

    /**
     * Reads {@code in} to the end without closing it.
     *
     * @param source how the input is named in errors and logs
     * @throws DocumentReadException if reading fails
     */
    public static String read(InputStream in, String source) {
        try {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            LOG.debug("Read {} characters from {}", text.length(), source);
            return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
        } catch (IOException e) {
            throw new DocumentReadException("Failed to read document from " + source, e, source);
        }
    }
}
