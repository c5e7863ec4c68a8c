package org.dxworks.lolmark;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.lolmark.analyzer.LolmarkAnalyzer;
import org.dxworks.lolmark.error.CompilationException;
import org.dxworks.lolmark.model.DocumentAnalysis;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final String HTML_EXTENSION = ".html";
    private static final String REPORT_EXTENSION = ".analysis.json";

    public static void main(String[] args) throws Exception {
        int status = run(args, LolmarkConfig.load(), new BrowserLauncher());
        if (status != 0) {
            System.exit(status);
        }
    }

    // Exit status: 0 on success, 1 for a missing input or an invalid document, 2 for bad usage
    public static int run(String[] args, LolmarkConfig config, BrowserLauncher browser) throws IOException {
        if (args.length < 1 || args.length > 2) {
            System.err.println("Usage: java -jar lolmark.jar <input-file> [<output-file>]");
            System.err.println("  <input-file>:  Path to the lolmark source");
            System.err.println("  <output-file>: Path of the HTML page to write (default: input name with .html)");
            return 2;
        }

        Path input = Paths.get(args[0]);
        if (!Files.isRegularFile(input)) {
            System.err.println("Error: Input file does not exist: " + input);
            return 1;
        }
        Path output = args.length > 1 ? Paths.get(args[1]) : replaceExtension(input, HTML_EXTENSION);
        if (isSameFile(input, output)) {
            System.err.println("Error: Output would overwrite the input file: " + input.toAbsolutePath());
            System.err.println("  Pass a different <output-file>");
            return 2;
        }

        String source = readSource(input);
        if (!withinMaxLines(source, config.getMaxFileLines())) {
            System.err.println("Error: Input file has more than " + config.getMaxFileLines() + " lines: " + input);
            return 1;
        }

        System.out.println("Compiling " + input.toAbsolutePath());

        String html;
        try {
            html = LolmarkCompiler.from(config).compile(source);
        } catch (CompilationException e) {
            System.err.println(e.getMessage());
            return 1;
        }

        if (output.toAbsolutePath().getParent() != null) {
            Files.createDirectories(output.toAbsolutePath().getParent());
        }
        Files.writeString(output, html, StandardCharsets.UTF_8);
        System.out.println("Document is valid. HTML written to: " + output.toAbsolutePath());

        if (config.isWriteReport()) {
            Path report = replaceExtension(output, REPORT_EXTENSION);
            DocumentAnalysis analysis = analyzeFile(input);
            Files.writeString(report, MAPPER.writeValueAsString(analysis), StandardCharsets.UTF_8);
            System.out.println("Analysis written to: " + report.toAbsolutePath());
        }

        if (config.isOpenInBrowser()) {
            browser.open(output);
        }
        return 0;
    }

    public static String compileFile(Path filePath, LolmarkConfig config) throws IOException, CompilationException {
        return LolmarkCompiler.from(config).compile(readSource(filePath));
    }

    public static DocumentAnalysis analyzeFile(Path filePath) throws IOException {
        return new LolmarkAnalyzer().analyze(filePath.toString(), readSource(filePath));
    }

    public static String readSource(Path filePath) throws IOException {
        String sourceCode = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }
        return sourceCode;
    }

    static Path replaceExtension(Path file, String extension) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        return file.resolveSibling(baseName + extension);
    }

    private static boolean isSameFile(Path input, Path output) {
        return input.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize());
    }

    private static boolean withinMaxLines(String source, int maxFileLines) {
        return source.lines().limit((long) maxFileLines + 1L).count() <= maxFileLines;
    }
}
