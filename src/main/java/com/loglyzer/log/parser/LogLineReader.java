package com.loglyzer.log.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;

/**
 * Opens a log file as a lazy stream of lines. Files named {@code *.gz} are decompressed.
 * Invalid UTF-8 sequences are replaced rather than rejected.
 */
public class LogLineReader {

    private static final int BUFFER_SIZE = 1024 * 1024;

    /**
     * The returned stream must be closed by the caller. I/O errors while reading surface
     * as {@link UncheckedIOException} from the stream's terminal operation.
     */
    public Stream<String> lines(Path file) throws IOException {
        BufferedReader reader = createReader(file);
        return reader.lines().onClose(() -> {
            try {
                reader.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    BufferedReader createReader(Path file) throws IOException {
        if (Files.isDirectory(file)) {
            throw new IOException(file + " is a directory");
        }
        InputStream in = Files.newInputStream(file);
        try {
            if (isGzip(file)) {
                in = new GZIPInputStream(in, BUFFER_SIZE);
            }
        } catch (IOException e) {
            in.close();
            throw e;
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8), BUFFER_SIZE);
    }

    static boolean isGzip(Path file) {
        Path name = file.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(".gz");
    }
}
