package im.arun.markuptree.cli;

import im.arun.markuptree.config.ConfigLoader;
import im.arun.markuptree.config.MarkupTreeConfig;
import im.arun.markuptree.render.FormattingMode;
import im.arun.markuptree.service.MarkupTreeService;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for markuptree using Picocli.
 * Reads markup (or a JSON token stream), rebuilds the tree and prints it in the chosen format.
 */
@Command(
    name = "markuptree",
    description = "Rebuild a markup document as a node tree and print it in the chosen format",
    mixinStandardHelpOptions = true,
    version = "markuptree 1.0.0"
)
public class MarkupTreeCLI implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Input file (reads stdin when omitted)")
    private Path inputFile;

    @Option(names = {"-f", "--formatting"}, converter = FormattingModeConverter.class,
            description = "Output format: compact, indented, line-per-node, source")
    private FormattingMode formatting;

    @Option(names = {"-m", "--main"}, negatable = true,
            description = "Wrap generated source in a runnable class (source format only)")
    private Boolean includeMain;

    @Option(names = {"-i", "--input-format"}, description = "Input format: html or tokens (JSON token stream)")
    private String inputFormat;

    @Option(names = {"--indent"}, description = "Indentation unit for the indented format")
    private String indent;

    @Option(names = {"-o", "--output"}, description = "Output file path")
    private Path outputPath;

    @Option(names = {"--config"}, description = "Path to a config.yaml overriding the bundled defaults")
    private String configPath;

    @Override
    public Integer call() {
        String input;
        try {
            input = readInput();
        } catch (IOException e) {
            System.err.println("Error: failed to read input: " + e.getMessage());
            return 1;
        }

        if (input.isBlank()) {
            System.err.println("Error: input is empty" + (inputFile != null ? ": " + inputFile : ""));
            return 1;
        }

        MarkupTreeConfig config;
        try {
            config = new ConfigLoader(configPath).load(userOptions());
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        String output;
        try {
            output = new MarkupTreeService().process(input, config);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error processing input: " + e.getMessage());
            return 1;
        }

        try {
            if (outputPath != null) {
                Files.writeString(outputPath, output + "\n");
            } else {
                System.out.println(output);
            }
        } catch (IOException e) {
            System.err.println("Error: failed to write output: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    private String readInput() throws IOException {
        if (inputFile != null) {
            return Files.readString(inputFile);
        }
        if (System.console() != null) {
            // interactive terminal without piped input
            throw new IOException("no input file specified");
        }
        return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
    }

    private Map<String, Object> userOptions() {
        Map<String, Object> options = new HashMap<>();
        if (formatting != null) options.put("formatting", formatting);
        if (includeMain != null) options.put("include_entry_point", includeMain);
        if (inputFormat != null) options.put("input_format", inputFormat);
        if (indent != null) options.put("indent_unit", indent);
        if (inputFormat == null && inputFile != null && inputFile.toString().endsWith(".json")) {
            options.put("input_format", MarkupTreeService.INPUT_TOKENS);
        }
        return options;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MarkupTreeCLI()).execute(args);
        System.exit(exitCode);
    }
}
