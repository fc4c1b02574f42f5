package com.github.yoep.fetcher.scan;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which languages are still worth searching for a video, based on the subtitles already next to it.
 */
public class ScanFilter {
    /**
     * Get the wanted languages which still need to be searched.
     *
     * @param existingLanguages    The languages of the labeled subtitle files next to the video.
     * @param hasUnlabeledSubtitle Indicates if a subtitle file without language label is next to the video.
     * @param wanted               The wanted languages.
     * @param multi                Indicates if one subtitle per language is wanted.
     * @param force                Indicates if existing subtitles should be ignored.
     * @return Returns the languages to search, an empty set when no search is needed.
     */
    public Set<String> needsSearch(Set<String> existingLanguages, boolean hasUnlabeledSubtitle, Set<String> wanted,
                                   boolean multi, boolean force) {
        Objects.requireNonNull(existingLanguages, "existingLanguages cannot be null");
        Objects.requireNonNull(wanted, "wanted cannot be null");
        if (force)
            return Collections.unmodifiableSet(new LinkedHashSet<>(wanted));

        if (multi) {
            var result = new LinkedHashSet<>(wanted);
            result.removeAll(existingLanguages);
            return Collections.unmodifiableSet(result);
        }

        return hasUnlabeledSubtitle ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(wanted));
    }
}
