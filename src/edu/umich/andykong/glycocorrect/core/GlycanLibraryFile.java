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

import edu.umich.andykong.glycocorrect.composition.Composition;
import edu.umich.andykong.glycocorrect.glyco.Glycan;
import edu.umich.andykong.glycocorrect.glyco.GlycanLibrary;
import edu.umich.andykong.glycocorrect.glyco.GlycanNomenclature;
import edu.umich.andykong.glycocorrect.glyco.NomenclatureException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reader for glycan library tables. CSV with a header row; columns:
 * <ul>
 *     <li>glycan (required): glycan name</li>
 *     <li>composition: e.g. "4 Hex, 4 HexNAc, 1 Fuc"; derived from the name if empty</li>
 *     <li>abundance: relative abundance weight, default 1</li>
 *     <li>sites: names of the sites the glycan occurs at, separated by spaces, commas or semicolons; all if empty</li>
 * </ul>
 */
public class GlycanLibraryFile {
    public static final String GLYCAN_COLUMN = "glycan";
    public static final String COMPOSITION_COLUMN = "composition";
    public static final String ABUNDANCE_COLUMN = "abundance";
    public static final String SITES_COLUMN = "sites";

    public static final CSVFormat LIBRARY_FORMAT = CSVFormat.DEFAULT.builder()
            .setCommentMarker('#')
            .setIgnoreEmptyLines(true)
            .setIgnoreSurroundingSpaces(true)
            .setHeader()
            .setSkipHeaderRecord(true)
            .build();

    public static GlycanLibrary read(Path path) throws IOException, InputFormatException, NomenclatureException {
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(in, path.toString());
        }
    }

    public static GlycanLibrary read(Reader in, String name) throws IOException, InputFormatException, NomenclatureException {
        GlycanLibrary library = new GlycanLibrary();
        try (CSVParser parser = LIBRARY_FORMAT.parse(in)) {
            if (!parser.getHeaderMap().containsKey(GLYCAN_COLUMN)) {
                throw new InputFormatException(String.format("%s lacks the required column '%s'.", name, GLYCAN_COLUMN));
            }
            for (CSVRecord record : parser) {
                library.add(parseGlycan(record, name));
            }
        }
        return library;
    }

    private static Glycan parseGlycan(CSVRecord record, String name) throws InputFormatException, NomenclatureException {
        String glycanName = optional(record, GLYCAN_COLUMN);
        if (glycanName.isEmpty()) {
            throw new InputFormatException(String.format("Missing glycan name in %s, record %d", name, record.getRecordNumber()));
        }

        String compositionStr = optional(record, COMPOSITION_COLUMN);
        Composition composition;
        if (compositionStr.isEmpty()) {
            composition = GlycanNomenclature.toComposition(glycanName);
        } else {
            try {
                composition = Composition.parse(compositionStr);
            } catch (IllegalArgumentException e) {
                throw new InputFormatException(String.format("Invalid composition for glycan %s in %s: %s",
                        glycanName, name, e.getMessage()), e);
            }
        }

        double abundance = Glycan.DEFAULT_ABUNDANCE;
        String abundanceStr = optional(record, ABUNDANCE_COLUMN);
        if (!abundanceStr.isEmpty()) {
            try {
                abundance = Double.parseDouble(abundanceStr);
            } catch (NumberFormatException e) {
                throw new InputFormatException(String.format("Invalid abundance '%s' for glycan %s in %s",
                        abundanceStr, glycanName, name), e);
            }
        }

        List<String> sites = new ArrayList<>();
        String sitesStr = optional(record, SITES_COLUMN);
        if (!sitesStr.isEmpty()) {
            sites.addAll(Arrays.asList(sitesStr.split("[\\s,;]+")));
        }
        return new Glycan(glycanName, composition, abundance, sites);
    }

    private static String optional(CSVRecord record, String column) {
        if (!record.isSet(column)) {
            return "";
        }
        return StringUtils.trimToEmpty(record.get(column));
    }
}
