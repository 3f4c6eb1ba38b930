package net.fiddleserver.service.gist;

import java.util.Map;
import java.util.Optional;
import net.fiddleserver.domain.gist.GistFile;

/**
 * Chooses the playground source file of a gist.
 *
 * <p>The first file whose name ends with the source extension wins. Without such a file the first
 * file of the mapping is used. Both steps follow the order in which the gist API listed the files;
 * that order is not guaranteed to be stable, and selection keeps it as-is.</p>
 */
final class GistFileSelector {

    private GistFileSelector() {
    }

    static Optional<GistFile> select(Map<String, GistFile> files, String sourceExtension) {
        if (files == null || files.isEmpty()) {
            return Optional.empty();
        }
        if (sourceExtension != null && !sourceExtension.isEmpty()) {
            for (Map.Entry<String, GistFile> entry : files.entrySet()) {
                if (entry.getKey().endsWith(sourceExtension) && entry.getValue() != null) {
                    return Optional.of(entry.getValue());
                }
            }
        }
        return Optional.ofNullable(files.values().iterator().next());
    }
}
