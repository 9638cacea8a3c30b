package utilities;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

// Reads a pattern file one line at a time ('\n' or "\r\n" separated, UTF-8).
public class LineFileReader implements Iterable<String>, AutoCloseable {

    private final Path path;
    private final boolean skipBlankLines;
    private BufferedReader reader;
    private boolean opened;
    private boolean closed;

    public LineFileReader(Path path, boolean skipBlankLines) {
        this.path = Objects.requireNonNull(path, "path");
        this.skipBlankLines = skipBlankLines;
    }

    public void open() {
        if (opened) {
            return;
        }
        if (closed) {
            throw new IllegalStateException("Reader for " + path + " is already closed");
        }
        try {
            this.reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
            this.opened = true;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open " + path, e);
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        opened = false;
        if (reader != null) {
            try {
                reader.close();
            } finally {
                reader = null;
            }
        }
    }

    @Override
    public Iterator<String> iterator() {
        this.open();
        return new LineIterator(reader, skipBlankLines);
    }

    // All lines of the file, in order.
    public static List<String> readLines(Path path, boolean skipBlankLines) {
        List<String> lines = new ArrayList<>();
        try (LineFileReader r = new LineFileReader(path, skipBlankLines)) {
            for (String line : r) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close " + path, e);
        }
        return lines;
    }

    public static String readText(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    private static final class LineIterator implements Iterator<String> {

        private final BufferedReader reader;
        private final boolean skipBlankLines;
        private String nextLine;
        private boolean finished = false;

        LineIterator(BufferedReader reader, boolean skipBlankLines) {
            this.reader = reader;
            this.skipBlankLines = skipBlankLines;
        }

        @Override
        public boolean hasNext() {
            if (finished) return false;
            if (nextLine != null) return true;

            try {
                while (true) {
                    // readLine strips "\n" and "\r\n"
                    String line = reader.readLine();
                    if (line == null) {
                        finished = true;
                        return false;
                    }
                    if (skipBlankLines && line.isEmpty()) {
                        continue;
                    }
                    nextLine = line;
                    return true;
                }
            } catch (IOException e) {
                finished = true;
                throw new UncheckedIOException("Error reading lines", e);
            }
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more lines");
            }
            String line = nextLine;
            nextLine = null;
            return line;
        }
    }
}
