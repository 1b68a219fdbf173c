package edu.umich.andykong.glycocorrect.graphexport;

import edu.umich.andykong.glycocorrect.correction.ConversionEdge;
import edu.umich.andykong.glycocorrect.correction.CorrectedGlycoform;
import edu.umich.andykong.glycocorrect.correction.CorrectionResult;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the glycation graph as GEXF 1.2 (e.g. for Gephi). Uncertain values are split into a value and an error
 * attribute.
 */
public class GexfGraphWriter {
    public static final String GEXF_NAMESPACE = "http://www.gexf.net/1.2draft";

    static final String[] NODE_ATTRIBUTES = {"abundance", "abundance_error", "corr_abundance", "corr_abundance_error", "mass", "theoretical_abundance"};
    static final String[] EDGE_ATTRIBUTES = {"c", "c_error"};

    public static void write(CorrectionResult result, Path path) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(result, out);
        }
    }

    public static void write(CorrectionResult result, Writer out) throws IOException {
        try {
            XMLStreamWriter xml = XMLOutputFactory.newInstance().createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement("gexf");
            xml.writeDefaultNamespace(GEXF_NAMESPACE);
            xml.writeAttribute("version", "1.2");
            xml.writeStartElement("graph");
            xml.writeAttribute("defaultedgetype", "directed");
            xml.writeAttribute("mode", "static");

            writeAttributeDeclarations(xml, "node", NODE_ATTRIBUTES);
            writeAttributeDeclarations(xml, "edge", EDGE_ATTRIBUTES);

            xml.writeStartElement("nodes");
            for (CorrectedGlycoform glycoform : result.glycoforms()) {
                xml.writeStartElement("node");
                xml.writeAttribute("id", Integer.toString(glycoform.getGlycoform().getIndex()));
                xml.writeAttribute("label", glycoform.getGlycoform().getLabel());
                writeAttributeValues(xml,
                        glycoform.getObserved().getValue(),
                        glycoform.getObserved().getError(),
                        glycoform.getCorrected().getValue(),
                        glycoform.getCorrected().getError(),
                        glycoform.getGlycoform().getMass(),
                        glycoform.getGlycoform().getTheoreticalAbundance());
                xml.writeEndElement();
            }
            xml.writeEndElement();

            xml.writeStartElement("edges");
            int id = 0;
            for (ConversionEdge edge : result.edges()) {
                xml.writeStartElement("edge");
                xml.writeAttribute("id", Integer.toString(id++));
                xml.writeAttribute("source", Integer.toString(edge.getSource()));
                xml.writeAttribute("target", Integer.toString(edge.getSink()));
                xml.writeAttribute("label", edge.getDelta().toString());
                writeAttributeValues(xml, edge.getRate().getValue(), edge.getRate().getError());
                xml.writeEndElement();
            }
            xml.writeEndElement();

            xml.writeEndElement();
            xml.writeEndElement();
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IOException("Error writing GEXF graph", e);
        }
        out.flush();
    }

    private static void writeAttributeDeclarations(XMLStreamWriter xml, String attributeClass, String[] titles)
            throws XMLStreamException {
        xml.writeStartElement("attributes");
        xml.writeAttribute("class", attributeClass);
        xml.writeAttribute("mode", "static");
        for (int i = 0; i < titles.length; i++) {
            xml.writeEmptyElement("attribute");
            xml.writeAttribute("id", Integer.toString(i));
            xml.writeAttribute("title", titles[i]);
            xml.writeAttribute("type", "double");
        }
        xml.writeEndElement();
    }

    private static void writeAttributeValues(XMLStreamWriter xml, double... values) throws XMLStreamException {
        xml.writeStartElement("attvalues");
        for (int i = 0; i < values.length; i++) {
            if (Double.isNaN(values[i])) {
                continue;
            }
            xml.writeEmptyElement("attvalue");
            xml.writeAttribute("for", Integer.toString(i));
            xml.writeAttribute("value", Double.toString(values[i]));
        }
        xml.writeEndElement();
    }
}
