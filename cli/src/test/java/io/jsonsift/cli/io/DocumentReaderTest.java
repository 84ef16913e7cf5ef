package io.jsonsift.cli.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentReaderTest {

    @Test
    void readsFileAsUtf8(@TempDir Path dir) throws IOException {
        String text = "{\"name\":\"caf" + (char) 0xe9 + "\"}";
        Path file = Files.writeString(dir.resolve("doc.json"), text, StandardCharsets.UTF_8);

        assertThat(DocumentReader.read(file)).isEqualTo(text);
    }

    @Test
    void dropsByteOrderMark() {
        byte[] bytes = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, '[', '1', ']'};

        assertThat(DocumentReader.read(new ByteArrayInputStream(bytes), "<stdin>")).isEqualTo("[1]");
    }

    @Test
    void emptyInputIsEmptyText() {
        assertThat(DocumentReader.read(new ByteArrayInputStream(new byte[0]), "<stdin>")).isEmpty();
    }

    @Test
    void missingFileNamesThePath(@TempDir Path dir) {
        Path missing = dir.resolve("nope.json");

        assertThatThrownBy(() -> DocumentReader.read(missing))
                .isInstanceOf(DocumentReadException.class)
                .hasMessageContaining("nope.json");
    }

    @Test
    void streamFailureKeepsCause() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("pipe closed");
            }
        };

        assertThatThrownBy(() -> DocumentReader.read(broken, "<stdin>"))
                .isInstanceOf(DocumentReadException.class)
                .hasMessageContaining("<stdin>")
                .hasCauseInstanceOf(IOException.class);
    }
}
