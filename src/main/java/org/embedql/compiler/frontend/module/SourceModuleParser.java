package org.embedql.compiler.frontend.module;

import org.embedql.compiler.api.SourceFile;
import org.embedql.compiler.diagnostics.MalformedLiteralException;
import org.embedql.compiler.diagnostics.PreconditionViolationException;
import org.embedql.compiler.frontend.cache.AstCache;
import org.embedql.compiler.frontend.extract.ExtractionOptions;
import org.embedql.compiler.frontend.extract.ITagExtractor;
import org.embedql.compiler.frontend.extract.LiteralSpan;
import org.embedql.compiler.frontend.extract.MemoizedTagExtractor;
import org.embedql.compiler.frontend.io.ISourceReader;
import org.embedql.compiler.frontend.parser.IDocumentParser;
import org.embedql.compiler.frontend.parser.QueryDocumentParser;
import org.embedql.compiler.frontend.parser.Source;
import org.embedql.compiler.frontend.parser.SyntaxException;
import org.embedql.compiler.frontend.parser.ast.Definition;
import org.embedql.compiler.frontend.parser.ast.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses the query-language literals embedded in a single project file.
 *
 * <p>For each file the parser reads the text, checks that the file contains the tag marker,
 * extracts the literals (through a memoizing extractor), parses every literal with the
 * grammar parser and concatenates the definitions into one combined document.
 *
 * <p>Any failure aborts the file: no partial document is ever returned. The marker check is a
 * precondition, not a user error; files must be passed through {@link #getFileFilter(Path)}
 * before they reach the parser.
 *
 * <p><strong>Thread Safety:</strong> instances hold no mutable state of their own and may be
 * used from several threads as long as the configured collaborators are thread-safe (the
 * built-in ones are).
 */
public class SourceModuleParser {

    private static final Logger log = LoggerFactory.getLogger(SourceModuleParser.class);

    /**
     * Substring every candidate file must contain. This is a cheap pre-check only: it can match
     * text outside any literal, in which case the file simply yields fewer literals.
     */
    public static final String TAG_MARKER = "graphql";

    private final ITagExtractor tagExtractor;
    private final IDocumentParser documentParser;
    private final ISourceReader sourceReader;
    private final ExtractionOptions options;

    /**
     * @param tagExtractor   The extractor, normally a {@link MemoizedTagExtractor}.
     * @param documentParser The grammar parser.
     * @param sourceReader   The filesystem collaborator.
     * @param options        Options passed through to the extractor.
     */
    public SourceModuleParser(ITagExtractor tagExtractor, IDocumentParser documentParser,
                              ISourceReader sourceReader, ExtractionOptions options) {
        this.tagExtractor = Objects.requireNonNull(tagExtractor, "tagExtractor");
        this.documentParser = Objects.requireNonNull(documentParser, "documentParser");
        this.sourceReader = Objects.requireNonNull(sourceReader, "sourceReader");
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Creates a parser with a fresh extraction memo around {@code tagExtractor}, the built-in
     * grammar parser, filesystem reads and default options.
     *
     * @param tagExtractor The host-language extractor.
     * @return A new parser.
     */
    public static SourceModuleParser create(ITagExtractor tagExtractor) {
        return new SourceModuleParser(new MemoizedTagExtractor(tagExtractor), new QueryDocumentParser(),
                ISourceReader.fileSystem(), ExtractionOptions.DEFAULT);
    }

    /**
     * Parses a file and returns its combined document.
     *
     * @param baseDir The project base directory.
     * @param file    The file, which must have passed the file filter.
     * @return The combined document; it has no definitions if the file contains the marker
     *         but no literal.
     * @throws IOException If the file cannot be read.
     * @throws PreconditionViolationException If the file does not contain the tag marker.
     * @throws MalformedLiteralException If a literal is rejected or yields no definition.
     * @throws org.embedql.compiler.diagnostics.ExtractionException If extraction fails.
     */
    public Document parseFile(Path baseDir, SourceFile file) throws IOException {
        return parseFileWithSources(baseDir, file).document();
    }

    /**
     * Parses a file and returns its combined document together with the literal texts.
     *
     * @param baseDir The project base directory.
     * @param file    The file, which must have passed the file filter.
     * @return The document and its sources, both in extraction order.
     * @throws IOException If the file cannot be read.
     * @throws PreconditionViolationException If the file does not contain the tag marker.
     * @throws MalformedLiteralException If a literal is rejected or yields no definition.
     * @throws org.embedql.compiler.diagnostics.ExtractionException If extraction fails.
     */
    public ParsedModule parseFileWithSources(Path baseDir, SourceFile file) throws IOException {
        String relPath = file.relPath();
        String text = sourceReader.readText(baseDir, relPath);
        if (!containsMarker(text)) {
            throw new PreconditionViolationException(
                    "SourceModuleParser: Files should be filtered before passed to the parser, "
                            + "got unfiltered file `" + relPath + "`.", relPath);
        }

        List<Definition> definitions = new ArrayList<>();
        List<String> sources = new ArrayList<>();
        for (LiteralSpan literal : tagExtractor.extract(text, baseDir, file, options)) {
            Document document = parseLiteral(literal);
            if (document.definitions().isEmpty()) {
                throw new MalformedLiteralException(
                        "SourceModuleParser: Expected query text to contain at least one definition "
                                + "(fragment, mutation, query, subscription) in `" + relPath + "`, got `"
                                + literal.text() + "`.", relPath, literal.text());
            }
            sources.add(literal.text());
            definitions.addAll(document.definitions());
        }

        log.debug("Parsed {}: {} literal(s), {} definition(s)", relPath, sources.size(), definitions.size());
        return new ParsedModule(new Document(definitions), sources);
    }

    /**
     * Returns a predicate that accepts exactly the files containing the tag marker, i.e. the
     * files {@link #parseFile} accepts.
     *
     * @param baseDir The project base directory.
     * @return The file filter.
     */
    public IFileFilter getFileFilter(Path baseDir) {
        return file -> containsMarker(sourceReader.readText(baseDir, file.relPath()));
    }

    /**
     * Creates an AST cache for a base directory that uses this parser on cache misses.
     *
     * @param baseDir The project base directory.
     * @return A new, empty cache.
     */
    public AstCache getParser(Path baseDir) {
        return new AstCache(baseDir, this::parseFile, sourceReader);
    }

    private Document parseLiteral(LiteralSpan literal) {
        Source source = new Source(literal.text(), literal.filePath(),
                literal.location().lineNumber(), literal.location().columnNumber());
        try {
            return documentParser.parse(source);
        } catch (SyntaxException e) {
            throw new MalformedLiteralException(
                    e.getMessage() + " in `" + literal.filePath() + "`", literal.filePath(), literal.text(), e);
        }
    }

    private static boolean containsMarker(String text) {
        return text.contains(TAG_MARKER);
    }
}
