package com.github.yoep.fetcher;

import com.github.yoep.fetcher.config.FetcherConfig;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import({
        FetcherConfig.class
})
public class AutoConfiguration {
}
