package com.eqtree;

import com.eqtree.json.EquationSerializer;
import com.eqtree.model.ParseBatch;
import com.eqtree.output.OutputFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "eqtree", mixinStandardHelpOptions = true, version = "1.0",
         description = "Parse algebraic equations (one per line) into classified expression trees")
public class EqTree implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(EqTree.class);

    @Parameters(index = "0", description = "Input .txt file, one equation per line")
    private File inputFile;

    @Option(names = {"-o", "--output"}, description = "Output .json file (default: input file with a .json suffix)")
    private File outputFile;

    @Option(names = {"-c", "--compact-output"}, description = "Compact output without whitespace")
    private boolean compactOutput = false;

    @Option(names = "--stdout", description = "Print the document instead of writing the output file")
    private boolean toStdout = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new EqTree()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        try {
            if (!inputFile.getName().toLowerCase().endsWith(".txt")) {
                throw new IllegalArgumentException("Input file must be a .txt file: " + inputFile);
            }
            if (!inputFile.isFile()) {
                throw new IOException("Input file not found: " + inputFile);
            }

            List<String> lines = Files.readAllLines(inputFile.toPath(), StandardCharsets.UTF_8);
            ParseBatch batch = new EquationParser().parseMany(lines);

            OutputFormatter formatter = new OutputFormatter(!compactOutput);
            String document = formatter.format(new EquationSerializer().toJson(batch, inputFile.getName()));

            if (toStdout) {
                System.out.println(document);
            } else {
                File target = resolveOutput();
                Files.writeString(target.toPath(), document + System.lineSeparator(), StandardCharsets.UTF_8);
                LOGGER.info("Parsed {} equations from {} -> {} ({} lines skipped)",
                        batch.count(), inputFile.getName(), target, batch.failures().size());
            }
            return 0;
        } catch (Exception e) {
            LOGGER.debug("eqtree failed", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    File resolveOutput() {
        File target = outputFile != null ? outputFile : inputFile;
        String name = target.getName();
        if (name.toLowerCase().endsWith(".json")) {
            return target;
        }
        int dot = name.lastIndexOf('.');
        String json = (dot > 0 ? name.substring(0, dot) : name) + ".json";
        return target.getParentFile() != null ? new File(target.getParentFile(), json) : new File(json);
    }
}
