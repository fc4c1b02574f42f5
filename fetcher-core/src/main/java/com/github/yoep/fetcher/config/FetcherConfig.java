package com.github.yoep.fetcher.config;

import com.github.yoep.fetcher.SubtitleFetcher;
import com.github.yoep.fetcher.adapter.ReleaseParser;
import com.github.yoep.fetcher.adapter.SubtitleProviderFactory;
import com.github.yoep.fetcher.adapter.VideoFactory;
import com.github.yoep.fetcher.adapter.model.ReleaseInfo;
import com.github.yoep.fetcher.adapter.model.UnknownVideo;
import com.github.yoep.fetcher.config.properties.FetcherProperties;
import com.github.yoep.fetcher.lifecycle.FetcherController;
import com.github.yoep.fetcher.providers.ProviderRegistry;
import com.github.yoep.fetcher.ranking.MatchingConfidence;
import com.github.yoep.fetcher.ranking.RankingEngine;
import com.github.yoep.fetcher.scan.ScanFilter;
import com.github.yoep.fetcher.scan.VideoScanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(FetcherProperties.class)
public class FetcherConfig {
    @Bean
    public ProviderRegistry providerRegistry(ObjectProvider<SubtitleProviderFactory> factories) {
        return new ProviderRegistry(factories.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean(VideoFactory.class)
    public VideoFactory videoFactory() {
        log.debug("No video factory available, videos won't be identified");
        return UnknownVideo::new;
    }

    @Bean
    @ConditionalOnMissingBean(ReleaseParser.class)
    public ReleaseParser releaseParser() {
        log.debug("No release parser available, matching confidence will always be 0");
        return release -> ReleaseInfo.unknown();
    }

    @Bean
    public RankingEngine rankingEngine(ReleaseParser releaseParser) {
        return new RankingEngine(new MatchingConfidence(releaseParser));
    }

    @Bean
    public VideoScanner videoScanner() {
        return new VideoScanner();
    }

    @Bean
    public FetcherController fetcherController(FetcherProperties properties, ProviderRegistry providerRegistry) {
        return new FetcherController(properties.getWorkers(), providerRegistry);
    }

    @Bean
    public SubtitleFetcher subtitleFetcher(FetcherProperties properties,
                                           FetcherController fetcherController,
                                           ProviderRegistry providerRegistry,
                                           VideoFactory videoFactory,
                                           VideoScanner videoScanner,
                                           RankingEngine rankingEngine) {
        return new SubtitleFetcher(properties, fetcherController, providerRegistry, videoFactory, videoScanner,
                new ScanFilter(), rankingEngine);
    }
}
