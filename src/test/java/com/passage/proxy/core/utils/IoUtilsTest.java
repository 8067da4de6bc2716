package com.passage.proxy.core.utils;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import com.passage.proxy.core.exceptions.ProtocolException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IoUtilsTest {

    private static InputStream stream(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.ISO_8859_1));
    }

    @Test
    void readLine_handlesCrlfLfAndEof() throws IOException {
        InputStream in = stream("GET / HTTP/1.1\r\nHost: a\n\r\nlast");

        assertThat(IoUtils.readLine(in)).isEqualTo("GET / HTTP/1.1");
        assertThat(IoUtils.readLine(in)).isEqualTo("Host: a");
        assertThat(IoUtils.readLine(in)).isEmpty();
        assertThat(IoUtils.readLine(in)).isEqualTo("last");
        assertThat(IoUtils.readLine(in)).isNull();
    }

    @Test
    void readLine_tooLong_throwsProtocolException() {
        assertThatThrownBy(() -> IoUtils.readLine(stream("abcdef\n"), 5))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("5");
    }

    @Test
    void skipBody_positionsStreamAfterBody() throws IOException {
        InputStream in = stream("abcNEXT\n");

        IoUtils.skipBody(in, 3);

        assertThat(IoUtils.readLine(in)).isEqualTo("NEXT");
        assertThatThrownBy(() -> IoUtils.skipBody(stream("ab"), 5)).isInstanceOf(EOFException.class);
    }

    @Test
    void closeQuietly_swallowsCloseFailure() {
        AutoCloseable failing = () -> {
            throw new IOException("close failed");
        };

        assertThatCode(() -> IoUtils.closeQuietly(failing, "test")).doesNotThrowAnyException();
        assertThatCode(() -> IoUtils.closeQuietly(null)).doesNotThrowAnyException();
    }
}
