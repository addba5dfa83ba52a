/*
 * Copyright 2016-2019 The Hong Kong University of Science and Technology
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package mhcdata.Table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.zip.GZIPInputStream;

/**
 * A tab- or comma-separated file held in memory. The first line after the skipped ones is the header. Fields may
 * be wrapped in double quotes, in which case they can contain the delimiter, doubled quotes and line breaks.
 * Files whose name ends with ".gz" are decompressed on the fly.
 */
public class DelimitedTable {

    private static final Logger logger = LoggerFactory.getLogger(DelimitedTable.class);

    public static final char TAB = '\t';
    public static final char COMMA = ',';

    private final String path;
    private final Map<String, Integer> columnIndexMap = new LinkedHashMap<>();
    private final List<TableRow> rowList = new ArrayList<>();

    public DelimitedTable(String path, char delimiter, int skipLineNum) throws IOException {
        this.path = path;
        File file = new File(path);
        if (!file.exists() || file.isDirectory()) {
            throw new FileNotFoundException(String.format(Locale.US, "Cannot find the data file %s.", path));
        }

        try (BufferedReader reader = openReader(file)) {
            int lineNum = 0;
            for (int i = 0; i < skipLineNum; ++i) {
                if (reader.readLine() == null) {
                    throw new IOException(String.format(Locale.US, "%s ends before its header line.", path));
                }
                ++lineNum;
            }

            String line = reader.readLine();
            ++lineNum;
            if (line == null) {
                throw new IOException(String.format(Locale.US, "%s doesn't have a header line.", path));
            }
            if (line.startsWith("\uFEFF")) {
                line = line.substring(1);
            }
            String[] headerArray = splitLine(line, reader, delimiter, lineNum).cells;
            for (int i = 0; i < headerArray.length; ++i) {
                // pandas-style: a repeated column name refers to its first occurrence
                columnIndexMap.putIfAbsent(headerArray[i] == null ? "" : headerArray[i].trim(), i);
            }

            while ((line = reader.readLine()) != null) {
                ++lineNum;
                if (line.isEmpty()) {
                    continue;
                }
                int startLineNum = lineNum;
                SplitLine splitLine = splitLine(line, reader, delimiter, lineNum);
                lineNum = splitLine.lastLineNum;
                rowList.add(new TableRow(startLineNum, splitLine.cells));
            }
        }

        logger.debug("Read {} rows and {} columns from {}.", rowList.size(), columnIndexMap.size(), path);
    }

    public String getPath() {
        return path;
    }

    public List<TableRow> getRowList() {
        return rowList;
    }

    public boolean hasColumn(String column) {
        return columnIndexMap.containsKey(column);
    }

    public Set<String> getColumnSet() {
        return columnIndexMap.keySet();
    }

    public void requireColumns(String... columns) throws IOException {
        List<String> missingList = new ArrayList<>();
        for (String column : columns) {
            if (!columnIndexMap.containsKey(column)) {
                missingList.add(column);
            }
        }
        if (!missingList.isEmpty()) {
            throw new IOException(String.format(Locale.US, "%s doesn't have the column(s) %s.", path, String.join(", ", missingList)));
        }
    }

    /**
     * @return the cell, or null if it is empty.
     */
    public String getString(TableRow row, String column) throws IOException {
        Integer idx = columnIndexMap.get(column);
        if (idx == null) {
            throw new IOException(String.format(Locale.US, "%s doesn't have the column %s.", path, column));
        }
        String cell = row.getCell(idx);
        if (cell == null || cell.isEmpty()) {
            return null;
        }
        return cell;
    }

    /**
     * @return the cell as a number, or null if it is empty.
     * @throws IOException if the cell is not a number.
     */
    public Double getDouble(TableRow row, String column) throws IOException {
        String cell = getString(row, column);
        if (cell == null || cell.trim().isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(cell.trim());
        } catch (NumberFormatException ex) {
            throw new IOException(String.format(Locale.US, "%s line %d: the %s value (%s) is not a number.", path, row.lineNum, column, cell), ex);
        }
    }

    private static BufferedReader openReader(File file) throws IOException {
        InputStream inputStream = new FileInputStream(file);
        if (file.getName().endsWith(".gz")) {
            inputStream = new GZIPInputStream(inputStream);
        }
        return new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
    }

    private SplitLine splitLine(String line, BufferedReader reader, char delimiter, int lineNum) throws IOException {
        List<String> cellList = new ArrayList<>();
        StringBuilder cell = new StringBuilder(64);
        boolean inQuote = false;
        int idx = 0;
        while (true) {
            if (idx >= line.length()) {
                if (inQuote) {
                    // a quoted cell spans lines
                    String nextLine = reader.readLine();
                    if (nextLine == null) {
                        throw new IOException(String.format(Locale.US, "%s line %d: unterminated quoted field.", path, lineNum));
                    }
                    ++lineNum;
                    cell.append('\n');
                    line = nextLine;
                    idx = 0;
                    continue;
                }
                cellList.add(cell.toString());
                break;
            }

            char c = line.charAt(idx);
            if (inQuote) {
                if (c == '"') {
                    if (idx + 1 < line.length() && line.charAt(idx + 1) == '"') {
                        cell.append('"');
                        ++idx;
                    } else {
                        inQuote = false;
                    }
                } else {
                    cell.append(c);
                }
            } else if (c == '"' && cell.length() == 0) {
                inQuote = true;
            } else if (c == delimiter) {
                cellList.add(cell.toString());
                cell = new StringBuilder(64);
            } else {
                cell.append(c);
            }
            ++idx;
        }
        return new SplitLine(cellList.toArray(new String[0]), lineNum);
    }

    private static class SplitLine {

        final String[] cells;
        final int lastLineNum;

        SplitLine(String[] cells, int lastLineNum) {
            this.cells = cells;
            this.lastLineNum = lastLineNum;
        }
    }
}
