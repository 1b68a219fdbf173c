package edu.umich.andykong.glycocorrect.graphexport;

import edu.umich.andykong.glycocorrect.correction.ConversionEdge;
import edu.umich.andykong.glycocorrect.correction.CorrectedGlycoform;
import edu.umich.andykong.glycocorrect.correction.CorrectionResult;
import edu.umich.andykong.glycocorrect.utils.ValueWithUncertainty;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the glycation graph in Graphviz DOT format. Nodes are records "name|observed|corrected", edges are labelled
 * with the composition delta and the conversion rate in percent.
 */
public class DotGraphWriter {

    public static void write(CorrectionResult result, Path path) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(result, out);
        }
    }

    public static void write(CorrectionResult result, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);
        out.print("digraph glycation {\n");
        for (CorrectedGlycoform glycoform : result.glycoforms()) {
            out.printf("\t%d [shape=record, label=\"%s|%s|%s\"];\n",
                    glycoform.getGlycoform().getIndex(),
                    escapeRecordField(glycoform.getName()),
                    glycoform.getObserved(),
                    glycoform.getCorrected());
        }
        for (ConversionEdge edge : result.edges()) {
            out.printf("\t%d -> %d [label=\"%s: %s\"];\n", edge.getSource(), edge.getSink(),
                    escape(edge.getDelta().toString()), percent(edge.getRate()));
        }
        out.print("}\n");
        out.flush();
        if (out.checkError()) {
            throw new IOException("Error writing DOT graph");
        }
    }

    static String percent(ValueWithUncertainty rate) {
        return String.format("(%.2f+/-%.2f)%%", rate.getValue() * 100, rate.getError() * 100);
    }

    static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    // characters with a meaning inside record labels
    static String escapeRecordField(String s) {
        return escape(s).replaceAll("([{}<>|])", "\\\\$1");
    }
}
