package edu.umich.andykong.glycocorrect.graphexport;

import edu.umich.andykong.glycocorrect.correction.CorrectedGlycoform;
import edu.umich.andykong.glycocorrect.correction.CorrectionResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Writes corrected glycoform abundances as CSV, most abundant first, followed by one column per composition unit.
 */
public class GlycoformTableWriter {
    public static final String[] BASE_HEADER = {"glycoform", "abundance", "abundance_error", "corr_abundance", "corr_abundance_error"};

    public static void write(CorrectionResult result, Path path) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(result, out);
        }
    }

    /**
     * Write the table. The writer is flushed but not closed.
     */
    public static void write(CorrectionResult result, Writer out) throws IOException {
        TreeSet<String> units = new TreeSet<>();
        for (CorrectedGlycoform glycoform : result.glycoforms()) {
            units.addAll(glycoform.getGlycoform().getComposition().units());
        }
        List<String> header = new ArrayList<>(Arrays.asList(BASE_HEADER));
        header.addAll(units);

        List<CorrectedGlycoform> rows = new ArrayList<>(result.glycoforms());
        rows.sort(Comparator.comparingDouble((CorrectedGlycoform g) -> g.getCorrected().getValue()).reversed());

        CSVPrinter printer = new CSVPrinter(out, CSVFormat.DEFAULT.builder()
                .setHeader(header.toArray(new String[0]))
                .setRecordSeparator('\n')
                .build());
        for (CorrectedGlycoform glycoform : rows) {
            List<Object> record = new ArrayList<>(header.size());
            record.add(glycoform.getName());
            record.add(glycoform.getObserved().getValue());
            record.add(glycoform.getObserved().getError());
            record.add(glycoform.getCorrected().getValue());
            record.add(glycoform.getCorrected().getError());
            for (String unit : units) {
                record.add(glycoform.getGlycoform().getComposition().get(unit));
            }
            printer.printRecord(record);
        }
        printer.flush();
    }
}
