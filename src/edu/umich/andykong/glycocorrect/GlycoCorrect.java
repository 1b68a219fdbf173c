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

package edu.umich.andykong.glycocorrect;

import com.google.common.io.MoreFiles;
import edu.umich.andykong.glycocorrect.core.AbundanceDataset;
import edu.umich.andykong.glycocorrect.core.AbundanceFile;
import edu.umich.andykong.glycocorrect.core.GlycanLibraryFile;
import edu.umich.andykong.glycocorrect.core.InputFormatException;
import edu.umich.andykong.glycocorrect.correction.AbundanceCorrector;
import edu.umich.andykong.glycocorrect.correction.ConversionRateTable;
import edu.umich.andykong.glycocorrect.correction.CorrectionResult;
import edu.umich.andykong.glycocorrect.correction.GlycationGraph;
import edu.umich.andykong.glycocorrect.correction.GlycationGraphBuilder;
import edu.umich.andykong.glycocorrect.correction.InconsistentModelException;
import edu.umich.andykong.glycocorrect.glyco.GlycanLibrary;
import edu.umich.andykong.glycocorrect.glyco.NomenclatureException;
import edu.umich.andykong.glycocorrect.graphexport.DotGraphWriter;
import edu.umich.andykong.glycocorrect.graphexport.GexfGraphWriter;
import edu.umich.andykong.glycocorrect.graphexport.GlycoformTableWriter;
import edu.umich.andykong.glycocorrect.paramhandling.BooleanParameter;
import edu.umich.andykong.glycocorrect.paramhandling.IntegerParameter;
import edu.umich.andykong.glycocorrect.paramhandling.ParameterGroup;
import edu.umich.andykong.glycocorrect.paramhandling.StringParameter;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GlycoCorrect {
	private static final Logger log = LoggerFactory.getLogger(GlycoCorrect.class);

	public static final String name = "GlycoCorrect";
	public static final String version = "1.0.0";

	// output file naming
	public static final String correctedSuffix = "_corr";
	public static final String tableExtension = ".csv";
	public static final String dotExtension = ".gv";
	public static final String gexfExtension = ".gexf";
	public static final String stdoutPath = "-";

	static ParameterGroup params;
	private static PrintStream console = System.out;

	public static ParameterGroup defaultParameters() {
		ParameterGroup group = new ParameterGroup("glycocorrect");
		group.addParam(new StringParameter("glycoforms", "", "CSV file of observed glycoform abundances"));
		group.addParam(new StringParameter("glycation", "", "CSV file of glycation abundances per added hexose count"));
		group.addParam(new StringParameter("glycan_library", "", "optional CSV glycan library"));
		group.addParam(new StringParameter("glycation_unit", "Hex", "monosaccharide added by glycation"));
		group.addParam(new IntegerParameter("sites", 0, 16, 0, "number of glycosylation sites, 0 to infer"));
		group.addParam(new BooleanParameter("normalize", false, "rescale corrected abundances to sum to 100"));
		group.addParam(new StringParameter("graph_output_format", "", new String[] {"", "dot", "gexf"}, "glycation graph format"));
		group.addParam(new StringParameter("output_path", "", "output directory, '-' to print the table to stdout"));
		return group;
	}

	public static void die(String s) {
		System.err.println("Fatal error: " + s);
		System.exit(1);
	}

	public static synchronized void print(String s) {
		console.println(s);
	}

	/**
	 * Reads a parameter file of {@code key = value} lines. Text after {@code //} is ignored.
	 */
	public static Map<String, String> parseParamFile(String fn) throws IOException {
		Path path;
		try {
			path = Paths.get(fn.replaceAll("['\"]", ""));
		} catch (InvalidPathException e) {
			throw new IllegalArgumentException(String.format("Malformed parameter path string: [%s]", fn), e);
		}
		if (!Files.exists(path)) {
			throw new IllegalArgumentException(String.format("Parameter file does not exist: [%s]", fn));
		}

		Map<String, String> values = new LinkedHashMap<>();
		try (BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			String cline;
			while ((cline = in.readLine()) != null) {
				int comments = cline.indexOf("//");
				if (comments >= 0)
					cline = cline.substring(0, comments);
				cline = cline.trim();
				if (cline.length() == 0 || cline.indexOf("=") < 0)
					continue;
				String key = cline.substring(0, cline.indexOf("=")).trim();
				String value = cline.substring(cline.indexOf("=") + 1).trim();
				values.put(key, value);
			}
		}
		return values;
	}

	/**
	 * Positional arguments are parameter files, read in order; {@code --key value} pairs override them.
	 * @throws IllegalArgumentException on unknown keys, invalid values or missing required inputs
	 */
	public static ParameterGroup init(String [] args) throws IOException {
		params = defaultParameters();
		Map<String, String> overrides = new LinkedHashMap<>();

		for (int i = 0; i < args.length; i++) {
			if (args[i].startsWith("--")) {
				if (i + 1 >= args.length)
					throw new IllegalArgumentException(String.format("Missing value for %s", args[i]));
				overrides.put(args[i].substring(2), args[i + 1]);
				i++;
			} else {
				for (Map.Entry<String, String> e : parseParamFile(args[i].trim()).entrySet()) {
					setParam(e.getKey(), e.getValue());
				}
			}
		}
		for (Map.Entry<String, String> e : overrides.entrySet()) {
			setParam(e.getKey(), e.getValue());
		}

		if (params.getString("glycoforms").isEmpty())
			throw new IllegalArgumentException("no glycoforms file specified!");
		if (params.getString("glycation").isEmpty())
			throw new IllegalArgumentException("no glycation file specified!");

		if (params.getString("output_path").equals(stdoutPath))
			console = System.err;
		else
			console = System.out;
		return params;
	}

	private static void setParam(String key, String value) {
		if (!params.hasParam(key))
			throw new IllegalArgumentException(String.format("Unknown parameter: %s", key));
		params.setParamValueFromString(key, value);
	}

	/**
	 * Directory receiving output files: {@code output_path}, or the directory of the glycoform file when unset.
	 */
	public static Path outputDirectory(ParameterGroup params) {
		String outputPath = params.getString("output_path");
		if (outputPath.isEmpty() || outputPath.equals(stdoutPath)) {
			Path parent = Paths.get(params.getString("glycoforms")).toAbsolutePath().getParent();
			return parent == null ? Paths.get(".") : parent;
		}
		return Paths.get(outputPath);
	}

	public static String datasetName(ParameterGroup params) {
		return MoreFiles.getNameWithoutExtension(Paths.get(params.getString("glycoforms")));
	}

	/**
	 * Reads the inputs named by {@code params}, corrects the glycoform abundances and writes the requested outputs.
	 */
	public static CorrectionResult run(ParameterGroup params)
			throws IOException, InputFormatException, NomenclatureException, InconsistentModelException {
		print("Reading input files");
		AbundanceDataset glycoforms = AbundanceFile.read(Paths.get(params.getString("glycoforms")));
		AbundanceDataset glycation = AbundanceFile.read(Paths.get(params.getString("glycation")));
		GlycanLibrary library = null;
		if (StringUtils.isNotBlank(params.getString("glycan_library")))
			library = GlycanLibraryFile.read(Paths.get(params.getString("glycan_library")));
		print(String.format("Read %d glycoforms and %d glycation levels", glycoforms.size(), glycation.size()));

		ConversionRateTable rates = ConversionRateTable.fromGlycation(glycation, params.getString("glycation_unit"));
		GlycationGraph graph = GlycationGraphBuilder.build(glycoforms, rates, library, params.getInt("sites"));
		print(String.format("Built glycation graph with %d nodes and %d edges", graph.size(), graph.edges().size()));

		CorrectionResult result = AbundanceCorrector.correct(graph);
		if (params.getBoolean("normalize"))
			result = result.normalize();
		print("Done correcting abundances\n");

		String outputPath = params.getString("output_path");
		Path outputDir = outputDirectory(params);
		String baseName = datasetName(params) + correctedSuffix;
		if (outputPath.equals(stdoutPath)) {
			Writer stdout = new OutputStreamWriter(System.out, StandardCharsets.UTF_8);
			GlycoformTableWriter.write(result, stdout);
			stdout.flush();
		} else {
			Files.createDirectories(outputDir);
			Path table = outputDir.resolve(baseName + tableExtension);
			GlycoformTableWriter.write(result, table);
			print("Wrote " + table);
		}

		String format = params.getString("graph_output_format");
		if (!format.isEmpty()) {
			Files.createDirectories(outputDir);
			if (format.equals("dot")) {
				Path graphFile = outputDir.resolve(baseName + dotExtension);
				DotGraphWriter.write(result, graphFile);
				print("Wrote " + graphFile);
			} else if (format.equals("gexf")) {
				Path graphFile = outputDir.resolve(baseName + gexfExtension);
				GexfGraphWriter.write(result, graphFile);
				print("Wrote " + graphFile);
			}
		}
		return result;
	}

	private static void printUsage() {
		out().printf("%s %s\n", name, version);
		out().println();
		out().printf("Usage:\n");
		out().printf("\tTo correct glycoform abundances:\n" +
				"\t\tjava -jar glycocorrect-%s.jar config_file.txt [--key value ...]\n", version);
		out().printf("\tParameters:\n");
		ParameterGroup defaults = defaultParameters();
		for (String key : new String[] {"glycoforms", "glycation", "glycan_library", "glycation_unit", "sites",
				"normalize", "graph_output_format", "output_path"}) {
			out().printf("\t\t%-20s %s\n", key, defaults.getParam(key).getDescription());
		}
		out().println();
	}

	private static PrintStream out() {
		return console;
	}

	public static void main(String [] args) {
		Locale.setDefault(new Locale("en","US"));

		if (args.length == 0) {
			printUsage();
			System.exit(0);
		}
		if (args.length == 1 && args[0].equals("--version")) {
			System.out.printf("%s version %s\n", name, version);
			System.exit(0);
		}

		try {
			init(args);
		} catch (IllegalArgumentException | IOException e) {
			die(e.getMessage());
			return;
		}

		print("");
		print(String.format("%s version %s", name, version));
		print("(c) 2022 University of Michigan\n");

		try {
			run(params);
		} catch (InputFormatException e) {
			die("Malformed input: " + e.getMessage());
		} catch (NomenclatureException e) {
			die(e.getMessage());
		} catch (InconsistentModelException e) {
			die(e.getMessage());
		} catch (IllegalArgumentException | IllegalStateException e) {
			log.error("Correction failed", e);
			die(e.getMessage());
		} catch (IOException e) {
			die("I/O error: " + e.getMessage());
		}
	}
}
