/*
 *    Copyright 2022 University of Michigan
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package edu.umich.andykong.glycocorrect.core;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reader for abundance tables: CSV without header, one record per glycoform (or glycation extent).
 * The first column holds the label, the second the abundance and the third its standard deviation.
 * Lines starting with '#' are comments.
 */
public class AbundanceFile {
    private static final Logger log = LoggerFactory.getLogger(AbundanceFile.class);

    public static final CSVFormat ABUNDANCE_FORMAT = CSVFormat.DEFAULT.builder()
            .setCommentMarker('#')
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .build();

    public static AbundanceDataset read(Path path) throws IOException, InputFormatException {
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(in, path.toString());
        }
    }

    /**
     * @param in reader positioned at the start of the table
     * @param name dataset name used in messages
     * @return the parsed dataset
     * @throws InputFormatException if the table has no data column or contains unparsable values
     */
    public static AbundanceDataset read(Reader in, String name) throws IOException, InputFormatException {
        List<CSVRecord> records;
        try (CSVParser parser = ABUNDANCE_FORMAT.parse(in)) {
            records = parser.getRecords();
        }

        int dataColumns = 0;
        for (CSVRecord record : records) {
            dataColumns = Math.max(dataColumns, record.size() - 1);
        }
        if (dataColumns == 0) {
            throw new InputFormatException(String.format("%s contains too few columns.", name));
        } else if (dataColumns == 1) {
            log.warn("{} lacks a column containing errors. Assuming errors of zero.", name);
        } else if (dataColumns > 2) {
            log.warn("{} contains {} additional columns, which will be ignored.", name, dataColumns - 2);
        }

        AbundanceDataset dataset = new AbundanceDataset(name);
        for (CSVRecord record : records) {
            String label = record.get(0);
            double value = parseCell(record, 1, name);
            double error = 0;
            if (record.size() > 2 && StringUtils.isNotBlank(record.get(2))) {
                error = parseCell(record, 2, name);
            }
            if (error < 0) {
                throw new InputFormatException(String.format("Negative error for '%s' in %s, line %d",
                        label, name, record.getRecordNumber()));
            }
            dataset.add(label, value, error);
        }
        return dataset;
    }

    private static double parseCell(CSVRecord record, int column, String name) throws InputFormatException {
        if (record.size() <= column) {
            throw new InputFormatException(String.format("Missing value for '%s' in %s, record %d",
                    record.get(0), name, record.getRecordNumber()));
        }
        try {
            return Double.parseDouble(record.get(column));
        } catch (NumberFormatException e) {
            throw new InputFormatException(String.format("Invalid number '%s' for '%s' in %s, record %d",
                    record.get(column), record.get(0), name, record.getRecordNumber()), e);
        }
    }
}
