package com.github.yoep.fetcher.ranking;

import com.github.yoep.fetcher.adapter.model.Subtitle;
import com.github.yoep.fetcher.adapter.model.Video;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Orders subtitle candidates best first.
 * <p>
 * Every criterion yields a non-negative component where higher is better. Candidates are compared on the
 * component of the first criterion, then on the next one for ties, and so on. Candidates which are equal on
 * every criterion keep their original order.
 */
@Slf4j
public class RankingEngine {
    static final int CONFIDENCE_SCALE = 1000;

    private final MatchingConfidence matchingConfidence;

    public RankingEngine(MatchingConfidence matchingConfidence) {
        Objects.requireNonNull(matchingConfidence, "matchingConfidence cannot be null");
        this.matchingConfidence = matchingConfidence;
    }

    /**
     * Rank the given candidates of a video.
     *
     * @param subtitles   The candidates of the video.
     * @param video       The video the candidates belong to.
     * @param criteria    The criteria, most significant first.
     * @param preferences The language and provider preferences.
     * @return Returns a new list with the candidates ordered best first.
     */
    public List<Subtitle> rank(List<Subtitle> subtitles, Video video, List<RankCriterion> criteria, RankPreferences preferences) {
        Objects.requireNonNull(subtitles, "subtitles cannot be null");
        Objects.requireNonNull(video, "video cannot be null");
        Objects.requireNonNull(criteria, "criteria cannot be null");
        Objects.requireNonNull(preferences, "preferences cannot be null");
        var scored = new ArrayList<ScoredSubtitle>(subtitles.size());

        for (var subtitle : subtitles) {
            scored.add(new ScoredSubtitle(subtitle, key(subtitle, video, criteria, preferences)));
        }

        Comparator<ScoredSubtitle> byKey = (first, second) -> Arrays.compare(first.key(), second.key());
        // List.sort is stable, equal keys keep their listing order
        scored.sort(byKey.reversed());
        return scored.stream()
                .map(ScoredSubtitle::subtitle)
                .toList();
    }

    /**
     * Prepend {@link RankCriterion#LANGUAGE_INDEX} to the given criteria so the candidates are grouped per language.
     *
     * @param criteria The configured criteria.
     * @return Returns a new criteria list starting with the language index.
     */
    public static List<RankCriterion> languageFirst(List<RankCriterion> criteria) {
        var result = new ArrayList<RankCriterion>();
        result.add(RankCriterion.LANGUAGE_INDEX);
        criteria.stream()
                .filter(e -> e != RankCriterion.LANGUAGE_INDEX)
                .forEach(result::add);
        return result;
    }

    private int[] key(Subtitle subtitle, Video video, List<RankCriterion> criteria, RankPreferences preferences) {
        var key = new int[criteria.size()];

        for (int i = 0; i < criteria.size(); i++) {
            key[i] = switch (criteria.get(i)) {
                case LANGUAGE_INDEX -> inverseIndex(preferences.languages(), subtitle.getLanguage());
                case PROVIDER_INDEX -> inverseIndex(preferences.providers(), subtitle.getProviderName());
                case PROVIDER_CONFIDENCE -> scale(subtitle.getConfidence());
                case MATCHING_CONFIDENCE -> scale(matchingConfidence.compute(video, subtitle));
            };
        }

        return key;
    }

    /**
     * Get the inverse index of the value, the first preference having the highest value.
     * Values which are not preferred at all rank below every preferred value.
     */
    private static int inverseIndex(List<String> preferences, String value) {
        var index = preferences.indexOf(value);
        return index == -1 ? 0 : preferences.size() - index;
    }

    private static int scale(double confidence) {
        return (int) (confidence * CONFIDENCE_SCALE);
    }

    private record ScoredSubtitle(Subtitle subtitle, int[] key) {
    }
}
