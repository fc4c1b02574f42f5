package com.github.yoep.fetcher.ranking;

/**
 * A criterion used to rank subtitle candidates.
 * Criteria are used as an ordered list, in which the first criterion is the most significant one.
 */
public enum RankCriterion {
    /**
     * Prefer languages which come first in the language preference.
     */
    LANGUAGE_INDEX,
    /**
     * Prefer providers which come first in the provider preference.
     */
    PROVIDER_INDEX,
    /**
     * Prefer a higher confidence reported by the provider.
     */
    PROVIDER_CONFIDENCE,
    /**
     * Prefer candidates whose release name matches the video metadata.
     */
    MATCHING_CONFIDENCE
}
