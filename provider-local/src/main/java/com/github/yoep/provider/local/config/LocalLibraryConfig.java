package com.github.yoep.provider.local.config;

import com.github.yoep.fetcher.config.properties.FetcherProperties;
import com.github.yoep.provider.local.LocalLibraryProviderFactory;
import com.github.yoep.provider.local.config.properties.LocalLibraryProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "fetcher.local", name = "directory")
@EnableConfigurationProperties({LocalLibraryProperties.class, FetcherProperties.class})
public class LocalLibraryConfig {
    @Bean
    public LocalLibraryProviderFactory localLibraryProviderFactory(LocalLibraryProperties properties,
                                                                   FetcherProperties fetcherProperties) {
        return new LocalLibraryProviderFactory(properties, fetcherProperties);
    }
}
