package com.cred.freestyle.warranty.service;

import com.cred.freestyle.warranty.exception.InvalidImportFileException;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads serial numbers from an uploaded CSV file.
 *
 * Only the first column is used. The first non-empty line is a header and is
 * skipped. A UTF-8 byte order mark and surrounding double quotes are removed.
 *
 * @author Warranty Platform Team
 */
@Component
public class SerialCsvParser {

    private static final char BOM = '\uFEFF';

    /**
     * @param input CSV content
     * @return Raw serial numbers in file order (not normalized)
     * @throws InvalidImportFileException if the file cannot be read or has no data rows
     */
    public List<String> parse(InputStream input) {
        List<String> values = new ArrayList<>();
        boolean headerSkipped = false;

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String value = firstColumn(line);
                if (value.isEmpty()) {
                    continue;
                }
                if (!headerSkipped) {
                    headerSkipped = true;
                    continue;
                }
                values.add(value);
            }
        } catch (IOException e) {
            throw new InvalidImportFileException("Could not read CSV file", e);
        }

        if (values.isEmpty()) {
            throw new InvalidImportFileException("CSV file contains no serial numbers");
        }
        return values;
    }

    private static String firstColumn(String line) {
        String value = line;
        if (!value.isEmpty() && value.charAt(0) == BOM) {
            value = value.substring(1);
        }
        int comma = value.indexOf(',');
        if (comma >= 0) {
            value = value.substring(0, comma);
        }
        value = value.trim();
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1).trim();
        }
        return value;
    }
}
