package com.cred.freestyle.warranty.service;

import com.cred.freestyle.warranty.exception.InvalidImportFileException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SerialCsvParser.
 */
@DisplayName("SerialCsvParser Tests")
class SerialCsvParserTest {

    private final SerialCsvParser parser = new SerialCsvParser();

    private static InputStream csv(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("parse - Should skip the header and read the first column of each row")
    void parse_SkipsHeaderAndReadsFirstColumn() {
        // Given
        String content = """
                serial_number,notes
                SN-001,first batch
                SN-002
                """;

        // When
        List<String> serials = parser.parse(csv(content));

        // Then
        assertThat(serials).containsExactly("SN-001", "SN-002");
    }

    @Test
    @DisplayName("parse - Should strip a byte order mark, quotes and blank lines")
    void parse_StripsBomQuotesAndBlankLines() {
        // Given
        String content = "\uFEFF\"Serial\"\r\n\r\n\"sn-003\",x\r\n  SN-004  \r\n";

        // When
        List<String> serials = parser.parse(csv(content));

        // Then
        assertThat(serials).containsExactly("sn-003", "SN-004");
    }

    @Test
    @DisplayName("parse - Leading blank lines: Header is the first non-empty line")
    void parse_LeadingBlankLines_HeaderIsFirstNonEmpty() {
        // Given
        String content = "\n\nserial\nSN-005\n";

        // When
        List<String> serials = parser.parse(csv(content));

        // Then
        assertThat(serials).containsExactly("SN-005");
    }

    @Test
    @DisplayName("parse - Header only: Should throw InvalidImportFileException")
    void parse_HeaderOnly_Throws() {
        assertThatThrownBy(() -> parser.parse(csv("serial_number\n")))
                .isInstanceOf(InvalidImportFileException.class)
                .hasMessageContaining("no serial numbers");
    }

    @Test
    @DisplayName("parse - Empty file: Should throw InvalidImportFileException")
    void parse_EmptyFile_Throws() {
        assertThatThrownBy(() -> parser.parse(csv("")))
                .isInstanceOf(InvalidImportFileException.class);
    }

    @Test
    @DisplayName("parse - Unreadable stream: Should throw InvalidImportFileException")
    void parse_UnreadableStream_Throws() {
        // Given
        InputStream broken = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("connection reset");
            }
        };

        // When / Then
        assertThatThrownBy(() -> parser.parse(broken))
                .isInstanceOf(InvalidImportFileException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
