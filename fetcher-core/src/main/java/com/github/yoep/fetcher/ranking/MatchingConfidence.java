package com.github.yoep.fetcher.ranking;

import com.github.yoep.fetcher.adapter.ReleaseParser;
import com.github.yoep.fetcher.adapter.model.*;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Computes how plausible it is that a subtitle release belongs to a video, based on the release name.
 * <p>
 * Each agreement between the release and the video metadata is a single bit, followed by the number of
 * keywords they share. The achieved bit pattern is divided by the pattern of a perfect match, which has
 * every agreement bit set and all keywords of the video shared.
 * For an episode the bits are series, season and episode; for a movie they are title and year.
 */
@Slf4j
public class MatchingConfidence {
    /**
     * The minimum number of bits used for the shared keyword count.
     */
    static final int KEYWORD_BITS = 3;

    private final ReleaseParser releaseParser;

    public MatchingConfidence(ReleaseParser releaseParser) {
        Objects.requireNonNull(releaseParser, "releaseParser cannot be null");
        this.releaseParser = releaseParser;
    }

    /**
     * Compute the matching confidence of the subtitle for the given video.
     *
     * @param video    The video the subtitle is ranked for.
     * @param subtitle The subtitle candidate.
     * @return Returns the confidence in the range [0, 1], 0 when the candidate has no release name.
     */
    public double compute(Video video, Subtitle subtitle) {
        Objects.requireNonNull(video, "video cannot be null");
        Objects.requireNonNull(subtitle, "subtitle cannot be null");
        if (!subtitle.hasRelease())
            return 0;

        var release = releaseParser.parse(subtitle.getRelease());
        var videoKeywords = video.getKeywords();
        var releaseKeywords = new HashSet<>(release.keywords());
        releaseKeywords.addAll(subtitle.getKeywords());
        var sharedKeywords = Math.min(countShared(videoKeywords, releaseKeywords), videoKeywords.size());
        var keywordBits = Math.max(KEYWORD_BITS, Integer.SIZE - Integer.numberOfLeadingZeros(videoKeywords.size()));

        var confidence = switch (video.getKind()) {
            case EPISODE -> episodeConfidence((Episode) video, release, sharedKeywords, keywordBits);
            case MOVIE -> movieConfidence((Movie) video, release, sharedKeywords, keywordBits);
            case UNKNOWN -> 0.0;
        };
        log.trace("Matching confidence of {} for {} is {}", subtitle.getRelease(), video.getPath(), confidence);
        return confidence;
    }

    private static double episodeConfidence(Episode video, ReleaseInfo release, int sharedKeywords, int keywordBits) {
        var series = false;
        var season = false;
        var episode = false;

        if (release.kind() == VideoKind.EPISODE) {
            series = release.series() != null && StringUtils.equalsIgnoreCase(release.series(), video.getSeries());
            season = release.season() != null && release.season() == video.getSeason();
            episode = release.episode() != null && release.episode() == video.getEpisode();
        }

        var achieved = pack(new boolean[]{series, season, episode}, sharedKeywords, keywordBits);
        var best = pack(new boolean[]{true, true, true}, video.getKeywords().size(), keywordBits);
        return (double) achieved / best;
    }

    private static double movieConfidence(Movie video, ReleaseInfo release, int sharedKeywords, int keywordBits) {
        var title = false;
        var year = false;

        if (release.kind() == VideoKind.MOVIE) {
            title = release.title() != null && StringUtils.equalsIgnoreCase(release.title(), video.getTitle());
            year = release.year() != null && video.getYear().map(release.year()::equals).orElse(false);
        }

        var achieved = pack(new boolean[]{title, year}, sharedKeywords, keywordBits);
        var best = pack(new boolean[]{true, true}, video.getKeywords().size(), keywordBits);
        return (double) achieved / best;
    }

    private static long pack(boolean[] agreements, int keywords, int keywordBits) {
        var result = 0L;

        for (var agreement : agreements) {
            result = (result << 1) | (agreement ? 1 : 0);
        }

        return (result << keywordBits) | keywords;
    }

    private static int countShared(Set<String> videoKeywords, Set<String> releaseKeywords) {
        return (int) videoKeywords.stream()
                .filter(releaseKeywords::contains)
                .count();
    }
}
