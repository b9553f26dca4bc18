package com.linlay.sessionrelay.stream.service;

import com.linlay.sessionrelay.stream.model.DecodedLine;
import com.linlay.sessionrelay.stream.model.MalformedEntryException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Pull-based framing of a newline-delimited record stream.
 * <p>
 * Each {@link #next()} blocks until one complete non-blank line is available (or the stream ends with an
 * unterminated trailing record) and returns it decoded. Decode failures come back as
 * {@link DecodedLine#malformed} items; only an IO failure of the underlying stream escapes, as
 * {@link UncheckedIOException}. Not thread-safe: one reader per stream.
 */
public class NdjsonLineIterator implements Iterator<DecodedLine> {

    private final BufferedReader reader;
    private final LogEntryDecoder decoder;
    private String pendingLine;
    private long lineNumber;
    private boolean exhausted;

    public NdjsonLineIterator(InputStream input, Charset charset, LogEntryDecoder decoder) {
        Objects.requireNonNull(input, "input cannot be null");
        this.reader = new BufferedReader(new InputStreamReader(input, charset == null ? Charset.defaultCharset() : charset));
        this.decoder = Objects.requireNonNull(decoder, "decoder cannot be null");
    }

    @Override
    public boolean hasNext() {
        if (pendingLine != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (!line.isBlank()) {
                    pendingLine = line;
                    return true;
                }
            }
        } catch (IOException ex) {
            exhausted = true;
            throw new UncheckedIOException("Failed to read record stream", ex);
        }
        exhausted = true;
        return false;
    }

    @Override
    public DecodedLine next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        String line = pendingLine;
        pendingLine = null;
        try {
            return DecodedLine.ok(lineNumber, decoder.decode(line));
        } catch (MalformedEntryException ex) {
            return DecodedLine.malformed(lineNumber, ex);
        }
    }
}
