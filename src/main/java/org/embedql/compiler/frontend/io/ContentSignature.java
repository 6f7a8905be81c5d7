package org.embedql.compiler.frontend.io;

import org.embedql.compiler.api.SourceFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes content signatures used by the extraction memo and the AST cache to detect that a
 * file's content changed.
 * <p>
 * The signature is the hex-encoded SHA-256 digest of the text. A precomputed hash supplied by
 * the build layer on the {@link SourceFile} takes precedence over reading the file.
 */
public final class ContentSignature {

    private ContentSignature() {
        // Utility class - no instantiation
    }

    /**
     * @param text The exact text to sign.
     * @return The hex-encoded SHA-256 digest of {@code text}.
     */
    public static String of(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Returns the signature of a project file: its precomputed hash if the build layer supplied
     * one, otherwise the digest of its current content.
     *
     * @param reader  Reader used when the file carries no hash.
     * @param baseDir The project base directory.
     * @param file    The file to sign.
     * @return The content signature.
     * @throws IOException If the file has to be read and cannot be.
     */
    public static String of(ISourceReader reader, Path baseDir, SourceFile file) throws IOException {
        if (file.hasHash()) {
            return file.hash();
        }
        return of(reader.readText(baseDir, file.relPath()));
    }
}
