package org.pragmatica.sgf.parser;

import java.io.Closeable;
import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link CharSource} over a {@link Reader}, typically an SGF file.
 *
 * <p>Read failures are rethrown as {@link UncheckedIOException}.
 */
public final class ReaderCharSource implements CharSource, Closeable {
    private final PushbackReader reader;
    private int position;
    private int last = EOF;

    public ReaderCharSource(Reader reader) {
        // one slot for peek, one for putBack
        this.reader = new PushbackReader(reader, 2);
        this.position = 0;
    }

    /**
     * Open a UTF-8 encoded file.
     */
    public static ReaderCharSource open(Path path) throws IOException {
        return new ReaderCharSource(Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    @Override
    public int peek() {
        int c = read();
        if (c != EOF) {
            unread(c);
        }
        return c;
    }

    @Override
    public int next() {
        int c = read();
        if (c != EOF) {
            position++;
            last = c;
        }
        return c;
    }

    @Override
    public void putBack() {
        if (last == EOF) {
            throw new IllegalStateException("Nothing to put back");
        }
        unread(last);
        position--;
        last = EOF;
    }

    @Override
    public int position() {
        return position;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private int read() {
        try {
            return reader.read();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read SGF input at offset " + position, e);
        }
    }

    private void unread(int c) {
        try {
            reader.unread(c);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to push back SGF input at offset " + position, e);
        }
    }
}
