package com.plang.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves imports as files relative to the importing file, or to a base directory
 * for the root source. Unit ids are normalised absolute paths.
 */
public class FileImportResolver implements ImportResolver {

    private static final Logger log = LoggerFactory.getLogger(FileImportResolver.class);

    private final Path baseDirectory;

    public FileImportResolver(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    @Override
    public Optional<ResolvedImport> resolve(String path, String importer) {
        Path dir = importer != null ? Path.of(importer).getParent() : baseDirectory;
        Path file = (dir != null ? dir : baseDirectory).resolve(path).toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            log.debug("Import {} not found at {}", path, file);
            return Optional.empty();
        }
        try {
            return Optional.of(new ResolvedImport(file.toString(), Files.readString(file)));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read import " + file, e);
        }
    }
}
