package org.embedql.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.embedql.cli.CommandLineInterface;
import org.embedql.compiler.api.SourceFile;
import org.embedql.compiler.frontend.cache.AstCache;
import org.embedql.compiler.frontend.cache.ParsePass;
import org.embedql.compiler.frontend.extract.ExtractionOptions;
import org.embedql.compiler.frontend.extract.ITagExtractor;
import org.embedql.compiler.frontend.extract.MemoizedTagExtractor;
import org.embedql.compiler.frontend.extract.TagExtractorRegistry;
import org.embedql.compiler.frontend.io.ISourceReader;
import org.embedql.compiler.frontend.io.SourceFileScanner;
import org.embedql.compiler.frontend.module.IFileFilter;
import org.embedql.compiler.frontend.module.SourceModuleParser;
import org.embedql.compiler.frontend.parser.QueryDocumentParser;
import org.embedql.compiler.frontend.parser.ast.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that runs one build pass over a project directory: lists the candidate files,
 * applies the file filter and parses every remaining file through a shared AST cache.
 * <p>
 * Prints one line per parsed file to stdout and one line per failure to stderr. The exit
 * code is 1 if any file failed.
 */
@Command(
    name = "parse",
    description = "Parse the query literals embedded in the files of a project"
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    @Option(
        names = {"-b", "--base-dir"},
        required = true,
        description = "Project base directory; all file paths are relative to it"
    )
    private File baseDir;

    @Option(
        names = {"-x", "--extractor"},
        description = "Host language of the files (default: embedql.parser.extractor)"
    )
    private String extractorName;

    @Option(
        names = {"--no-validate-names"},
        description = "Do not enforce the module naming convention for definitions"
    )
    private boolean noValidateNames;

    @Option(
        names = {"-j", "--threads"},
        description = "Number of parser threads (default: embedql.build.parallelism)"
    )
    private Integer threads;

    @Parameters(
        arity = "0..*",
        paramLabel = "FILE",
        description = "Files to parse, relative to the base directory (default: scan the base directory)"
    )
    private List<String> relPaths = new ArrayList<>();

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Config config;
        try {
            config = parent.getConfig();
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        Path base = baseDir.toPath();
        if (!baseDir.isDirectory()) {
            err.println("Error: Base directory not found: " + baseDir.getAbsolutePath());
            return 1;
        }

        TagExtractorRegistry registry = TagExtractorRegistry.initialize();
        String name = extractorName != null ? extractorName : config.getString("embedql.parser.extractor");
        Optional<ITagExtractor> extractor = registry.get(name);
        if (extractor.isEmpty()) {
            err.println("Error: Unknown extractor '" + name + "'. Available: " + registry.names());
            return 1;
        }

        ExtractionOptions options = noValidateNames
                ? new ExtractionOptions(false)
                : ExtractionOptions.fromConfig(config.getConfig("embedql.parser"));
        int threadCount = threads != null ? threads : config.getInt("embedql.build.parallelism");
        if (threadCount < 1) {
            err.println("Error: Thread count must be at least 1, got " + threadCount);
            return 1;
        }

        SourceModuleParser parser = new SourceModuleParser(
                MemoizedTagExtractor.fromConfig(extractor.get(), config.getConfig("embedql.extraction-cache")),
                new QueryDocumentParser(),
                ISourceReader.fileSystem(),
                options);

        try {
            List<SourceFile> candidates = selectCandidates(parser.getFileFilter(base), base,
                    config.getStringList("embedql.parser.extensions"), err);
            if (candidates == null) {
                return 1;
            }
            log.info("Parsing {} file(s) below {} with the '{}' extractor", candidates.size(), base, name);

            AstCache cache = parser.getParser(base);
            ParsePass.Result result = new ParsePass(cache, threadCount).run(candidates);

            result.documents().forEach((relPath, document) -> out.println(describe(relPath, document)));
            result.failures().forEach((relPath, failure) -> err.println(relPath + ": " + failure.getMessage()));
            out.flush();
            err.flush();
            return result.isSuccess() ? 0 : 1;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Error: Interrupted");
            return 1;
        }
    }

    /**
     * Lists the files to parse and drops those the filter rejects. Explicitly named files
     * that cannot be read are reported and make the command fail.
     *
     * @return The candidates, or {@code null} if an explicitly named file is unreadable.
     */
    private List<SourceFile> selectCandidates(IFileFilter filter, Path base, List<String> extensions,
                                              PrintWriter err) throws IOException {
        List<SourceFile> files;
        if (relPaths.isEmpty()) {
            files = new SourceFileScanner(extensions).scan(base);
        } else {
            files = relPaths.stream().map(SourceFile::of).toList();
        }

        List<SourceFile> candidates = new ArrayList<>();
        boolean unreadable = false;
        for (SourceFile file : files) {
            try {
                if (filter.accept(file)) {
                    candidates.add(file);
                } else {
                    log.debug("Skipping {}: no embedded literals", file.relPath());
                }
            } catch (IOException e) {
                err.println(file.relPath() + ": Cannot read file: " + e.getMessage());
                unreadable = true;
            }
        }
        return unreadable ? null : candidates;
    }

    static String describe(String relPath, Document document) {
        return relPath + ": " + document.definitions().size() + " definition(s) " + document.definitionNames();
    }
}
