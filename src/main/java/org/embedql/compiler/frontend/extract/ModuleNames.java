package org.embedql.compiler.frontend.extract;

import org.embedql.compiler.api.SourceInfo;
import org.embedql.compiler.diagnostics.ExtractionException;
import org.embedql.compiler.frontend.parser.ast.DefinitionKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Module naming convention shared by the tag extractors.
 * <p>
 * Every definition in a literal must be prefixed with the name of the module (file) that
 * contains it. Operations must additionally end in {@code Query}, {@code Mutation} or
 * {@code Subscription}. A fragment assigned to an object-property key must be named
 * {@code <Module>_<key>}.
 * <p>
 * Definition names are read with a lightweight header scan that only looks at tokens outside
 * of braces, parentheses and brackets. Malformed literals are not reported here; the grammar
 * parser reports them with full location information later.
 */
public final class ModuleNames {

    private static final Pattern IDENTIFIER = Pattern.compile("^[_A-Za-z][_0-9A-Za-z]*$");
    private static final Pattern SECONDARY_EXTENSIONS = Pattern.compile("(\\.(?!ios|android)[_a-zA-Z0-9\\-]+)+");
    private static final Pattern SEPARATOR_RUN = Pattern.compile("[^a-zA-Z0-9]+(\\w?)");
    private static final Pattern OPERATION_NAME = Pattern.compile("^(.*)(Mutation|Query|Subscription)$");

    /**
     * A definition header found by the scan.
     *
     * @param kind The definition kind.
     * @param name The definition name, or {@code null} for an anonymous operation.
     */
    public record Header(DefinitionKind kind, String name) {}

    private ModuleNames() {}

    /**
     * Derives the module name of a script file: the file name without its extensions,
     * the directory name for {@code index} files, camel-cased across separators.
     * For example {@code components/user-profile.react.js} yields {@code userProfile} and
     * {@code Button/index.js} yields {@code Button}.
     *
     * @param relPath The file path relative to the base directory.
     * @return The module name (not yet checked for validity).
     */
    public static String scriptModuleName(String relPath) {
        String normalized = relPath.replace('\\', '/');
        String[] segments = normalized.split("/");
        String fileName = segments[segments.length - 1];
        int lastDot = fileName.lastIndexOf('.');
        String baseName = lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
        baseName = SECONDARY_EXTENSIONS.matcher(baseName).replaceAll("");

        String moduleName = baseName;
        if ("index".equals(baseName) && segments.length > 1) {
            moduleName = segments[segments.length - 2];
        }
        return camelize(moduleName);
    }

    /**
     * Derives the module name of a Java file: the top-level type name, which by convention is
     * the file name without {@code .java}.
     *
     * @param relPath The file path relative to the base directory.
     * @return The module name (not yet checked for validity).
     */
    public static String javaModuleName(String relPath) {
        String normalized = relPath.replace('\\', '/');
        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        return fileName.endsWith(".java") ? fileName.substring(0, fileName.length() - ".java".length()) : fileName;
    }

    /**
     * Checks that all definitions of a literal follow the naming convention.
     *
     * @param literal    The literal to check.
     * @param moduleName The module name of the host file.
     * @throws ExtractionException If the module name is not an identifier or a definition
     *                             violates the convention.
     */
    public static void validate(LiteralSpan literal, String moduleName) {
        SourceInfo location = literal.location();
        if (!IDENTIFIER.matcher(moduleName).matches()) {
            throw new ExtractionException(
                    "Expected the module name to be a valid identifier, got `" + moduleName + "`.", location);
        }
        for (Header header : scanHeaders(literal.text())) {
            if (header.kind().isOperation()) {
                validateOperation(header, moduleName, location);
            } else {
                validateFragment(header, moduleName, literal.keyName(), location);
            }
        }
    }

    private static void validateOperation(Header header, String moduleName, SourceInfo location) {
        if (header.name() == null) {
            throw new ExtractionException(
                    "In module `" + moduleName + "`, an operation requires a name.", location);
        }
        if (!OPERATION_NAME.matcher(header.name()).matches() || !header.name().startsWith(moduleName)) {
            throw new ExtractionException(
                    "Operation names in graphql tags must be prefixed with the module name and end in "
                            + "\"Mutation\", \"Query\", or \"Subscription\". Got `" + header.name()
                            + "` in module `" + moduleName + "`.", location);
        }
    }

    private static void validateFragment(Header header, String moduleName, String keyName, SourceInfo location) {
        String name = header.name();
        if (keyName != null) {
            String expected = moduleName + "_" + keyName;
            if (!expected.equals(name)) {
                throw new ExtractionException(
                        "Container fragment names must be `<ModuleName>_<propName>`. Got `" + name
                                + "`, expected `" + expected + "`.", location);
            }
        } else if (name == null || !name.startsWith(moduleName)) {
            throw new ExtractionException(
                    "Fragment names in graphql tags must be prefixed with the module name. Got `" + name
                            + "` in module `" + moduleName + "`.", location);
        }
    }

    /**
     * Finds the definition headers of a literal without fully parsing it.
     *
     * @param text Query-language text.
     * @return The headers in order of appearance.
     */
    static List<Header> scanHeaders(String text) {
        List<Header> headers = new ArrayList<>();
        int braceDepth = 0;
        int otherDepth = 0;
        boolean expectDefinition = true;
        DefinitionKind pendingKind = null;

        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '#') {
                while (i < text.length() && text.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }
            if (c == '"') {
                i = skipString(text, i);
                continue;
            }
            boolean topLevel = braceDepth == 0 && otherDepth == 0;
            if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
                    i++;
                }
                if (!topLevel) {
                    continue;
                }
                String word = text.substring(start, i);
                if (pendingKind != null) {
                    headers.add(new Header(pendingKind, word));
                    pendingKind = null;
                } else if (expectDefinition) {
                    pendingKind = "fragment".equals(word)
                            ? DefinitionKind.FRAGMENT
                            : DefinitionKind.forOperationKeyword(word);
                    expectDefinition = false;
                }
                continue;
            }
            switch (c) {
                case '{' -> {
                    if (topLevel) {
                        if (expectDefinition) {
                            headers.add(new Header(DefinitionKind.QUERY, null));
                        } else if (pendingKind != null) {
                            headers.add(new Header(pendingKind, null));
                        }
                        pendingKind = null;
                    }
                    braceDepth++;
                }
                case '}' -> {
                    braceDepth = Math.max(0, braceDepth - 1);
                    if (braceDepth == 0 && otherDepth == 0) {
                        expectDefinition = true;
                    }
                }
                case '(', '[', '@' -> {
                    if (topLevel && pendingKind != null) {
                        headers.add(new Header(pendingKind, null));
                        pendingKind = null;
                    }
                    if (c != '@') {
                        otherDepth++;
                    }
                }
                case ')', ']' -> otherDepth = Math.max(0, otherDepth - 1);
                default -> {
                    // insignificant for the header scan
                }
            }
            i++;
        }
        return headers;
    }

    private static int skipString(String text, int start) {
        if (text.startsWith("\"\"\"", start)) {
            int end = text.indexOf("\"\"\"", start + 3);
            return end < 0 ? text.length() : end + 3;
        }
        int i = start + 1;
        while (i < text.length() && text.charAt(i) != '"' && text.charAt(i) != '\n') {
            i += text.charAt(i) == '\\' ? 2 : 1;
        }
        return Math.min(text.length(), i + 1);
    }

    private static String camelize(String name) {
        Matcher matcher = SEPARATOR_RUN.matcher(name);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group(1).toUpperCase()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
