package com.fifogains.jdbc.loader;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a delimited transaction export into a {@link RawTable}. The first record is the header;
 * rows in which every cell is blank are dropped.
 */
public final class CsvTableReader {

    private static final CsvMapper CSV_MAPPER =
            CsvMapper.builder().enable(CsvParser.Feature.WRAP_AS_ARRAY).build();
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    public RawTable read(Path path) throws LoaderException {
        Objects.requireNonNull(path, "path");
        String fileName = path.getFileName().toString();
        if (!fileName.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new LoaderException("Unsupported file type: " + fileName);
        }
        if (!Files.isReadable(path)) {
            throw new LoaderException("File is not readable: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException | RuntimeException ex) {
            throw new LoaderException("Failed to load file: " + path + ": " + ex.getMessage(), ex);
        }
    }

    public RawTable read(Reader reader) throws IOException {
        List<String> header = new ArrayList<>();
        List<RawRecord> rows = new ArrayList<>();
        try (MappingIterator<String[]> it = CSV_MAPPER.readerFor(String[].class).readValues(reader)) {
            if (it.hasNext()) {
                header = buildHeader(it.next());
            }
            int rowNumber = 0;
            while (it.hasNext()) {
                String[] cells = it.next();
                rowNumber++;
                if (isBlank(cells)) {
                    continue;
                }
                Map<String, Object> values = new LinkedHashMap<>();
                for (int i = 0; i < header.size(); i++) {
                    values.put(header.get(i), i < cells.length ? cells[i] : null);
                }
                rows.add(new RawRecord(rowNumber, values));
            }
        }
        return new RawTable(header, rows);
    }

    private static List<String> buildHeader(String[] cells) {
        List<String> header = new ArrayList<>(cells.length);
        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < cells.length; i++) {
            String name = cells[i] == null ? "" : cells[i];
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BYTE_ORDER_MARK) {
                name = name.substring(1);
            }
            int occurrences = seen.merge(name, 1, Integer::sum);
            // Repeated names get a numeric suffix so every column stays addressable.
            header.add(occurrences == 1 ? name : name + "." + (occurrences - 1));
        }
        return header;
    }

    private static boolean isBlank(String[] cells) {
        for (String cell : cells) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
