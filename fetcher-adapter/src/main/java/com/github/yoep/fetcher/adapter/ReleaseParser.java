package com.github.yoep.fetcher.adapter;

import com.github.yoep.fetcher.adapter.model.ReleaseInfo;

/**
 * Infers the metadata of a subtitle release name.
 */
public interface ReleaseParser {
    /**
     * Parse the given release name.
     *
     * @param release The release name of a subtitle candidate.
     * @return Returns the inferred release information, {@link ReleaseInfo#unknown()} when nothing could be inferred.
     */
    ReleaseInfo parse(String release);
}
