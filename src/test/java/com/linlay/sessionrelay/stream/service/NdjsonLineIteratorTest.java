package com.linlay.sessionrelay.stream.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.sessionrelay.stream.model.DecodedLine;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NdjsonLineIteratorTest {

    private final LogEntryDecoder decoder = new LogEntryDecoder(new ObjectMapper());

    @Test
    void iteratorShouldFrameLinesAndReportMalformedOnesInPlace() {
        String input = "{\"type\":\"system\",\"uuid\":\"1\"}\n"
                + "\n"
                + "oops\n"
                + "{\"type\":\"result\",\"uuid\":\"2\"}";
        List<DecodedLine> lines = readAll(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));

        assertThat(lines).hasSize(3);
        assertThat(lines.get(0).entry().uuid()).isEqualTo("1");
        assertThat(lines.get(1).isMalformed()).isTrue();
        assertThat(lines.get(1).lineNumber()).isEqualTo(3);
        assertThat(lines.get(1).error().line()).isEqualTo("oops");
        assertThat(lines.get(2).entry().isResult()).isTrue();
    }

    @Test
    void iteratorShouldDecodeMultibyteText() {
        String input = "{\"type\":\"user\",\"message\":{\"content\":\"你好\"}}\n";
        List<DecodedLine> lines = readAll(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));

        assertThat(lines).hasSize(1);
        assertThat(lines.get(0).entry().messageContent().asText()).isEqualTo("你好");
    }

    @Test
    void iteratorShouldSurfaceReadFailures() {
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("pipe closed");
            }
        };
        NdjsonLineIterator iterator = new NdjsonLineIterator(broken, StandardCharsets.UTF_8, decoder);

        assertThatThrownBy(iterator::hasNext).isInstanceOf(UncheckedIOException.class);
        assertThat(iterator.hasNext()).isFalse();
    }

    private List<DecodedLine> readAll(InputStream input) {
        NdjsonLineIterator iterator = new NdjsonLineIterator(input, StandardCharsets.UTF_8, decoder);
        List<DecodedLine> lines = new ArrayList<>();
        iterator.forEachRemaining(lines::add);
        return lines;
    }
}
