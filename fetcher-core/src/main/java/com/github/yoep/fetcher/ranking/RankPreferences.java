package com.github.yoep.fetcher.ranking;

import lombok.Builder;

import java.util.List;

/**
 * The ordered preferences against which candidates are ranked.
 *
 * @param languages The preferred languages, most preferred first.
 * @param providers The preferred providers, most preferred first.
 */
@Builder
public record RankPreferences(List<String> languages, List<String> providers) {
    public RankPreferences {
        languages = languages != null ? List.copyOf(languages) : List.of();
        providers = providers != null ? List.copyOf(providers) : List.of();
    }
}
