package com.phillippitts.cipherseal.service.files;

import com.phillippitts.cipherseal.exception.WatermarkProcessingExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.regex.Pattern;

/**
 * Spools uploads to temporary files and removes them once a request is done.
 *
 * <p>Only the extension of a client-supplied file name is kept, and only if it is a short
 * alphanumeric token; the rest of the name never reaches the file system.
 */
@Component
public class TemporaryFileManager {

    private static final Logger LOG = LogManager.getLogger(TemporaryFileManager.class);

    private static final String PREFIX = "cipherseal-";
    private static final Pattern SAFE_EXTENSION = Pattern.compile("[A-Za-z0-9]{1,10}");

    private final Path directory;

    /** Uses the JVM default temporary directory. */
    public TemporaryFileManager() {
        this(null);
    }

    /**
     * @param directory directory for temporary files; null for the JVM default
     */
    public TemporaryFileManager(Path directory) {
        this.directory = directory;
    }

    /**
     * Copies {@code content} to a new temporary file.
     *
     * @param content          upload stream; closed by this method
     * @param originalFilename client file name, used only for its extension (may be null)
     * @param defaultExtension extension to use when the name has none, without the dot
     * @return path of the spooled file
     */
    public Path spool(InputStream content, String originalFilename, String defaultExtension) {
        Path file = null;
        try (InputStream in = content) {
            file = create("input", extensionOr(originalFilename, defaultExtension));
            Files.copy(in, file, StandardCopyOption.REPLACE_EXISTING);
            return file;
        } catch (IOException e) {
            delete(file);
            throw WatermarkProcessingExceptionBuilder.create("Error saving uploaded file")
                    .operation("spool_upload")
                    .cause(e)
                    .build();
        }
    }

    /**
     * Reserves an output path with the given extension. The file exists and is empty.
     */
    public Path createOutput(String originalFilename, String defaultExtension) {
        try {
            return create("output", extensionOr(originalFilename, defaultExtension));
        } catch (IOException e) {
            throw WatermarkProcessingExceptionBuilder.create("Error creating temporary output file")
                    .operation("create_output")
                    .cause(e)
                    .build();
        }
    }

    /** Removes the given files if they exist. Null entries are ignored; failures are logged. */
    public void delete(Path... paths) {
        for (Path path : paths) {
            if (path == null) {
                continue;
            }
            try {
                if (Files.deleteIfExists(path)) {
                    LOG.debug("Removed temporary file: {}", path);
                }
            } catch (IOException e) {
                LOG.warn("Could not remove temporary file {}: {}", path, e.getMessage());
            }
        }
    }

    /** Extension of {@code filename} if it is safe, else {@code defaultExtension}. */
    static String extensionOr(String filename, String defaultExtension) {
        if (filename != null) {
            int dot = filename.lastIndexOf('.');
            if (dot >= 0) {
                String ext = filename.substring(dot + 1);
                if (SAFE_EXTENSION.matcher(ext).matches()) {
                    return ext;
                }
            }
        }
        return defaultExtension;
    }

    private Path create(String role, String extension) throws IOException {
        String suffix = "_" + role + "." + extension;
        return directory == null
                ? Files.createTempFile(PREFIX, suffix)
                : Files.createTempFile(directory, PREFIX, suffix);
    }
}
