package com.github.yoep.provider.local;

import com.github.yoep.fetcher.adapter.ProviderException;
import org.apache.commons.io.FilenameUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * The subtitle files of the library directory.
 * The index is built once per worker and reused for every listing executed by that worker.
 *
 * @param files The subtitle files, sorted by name.
 */
record LibraryIndex(List<Path> files) {
    static final String CONTEXT_KEY = "local-library.index";
    static final String EXTENSION = "srt";

    static LibraryIndex load(Path directory) {
        try (Stream<Path> files = Files.list(directory)) {
            return new LibraryIndex(files
                    .filter(Files::isRegularFile)
                    .filter(e -> FilenameUtils.isExtension(e.getFileName().toString().toLowerCase(Locale.ROOT), EXTENSION))
                    .sorted()
                    .toList());
        } catch (IOException ex) {
            throw new ProviderException(LocalLibraryProviderFactory.NAME, "Failed to index library " + directory, ex);
        }
    }
}
