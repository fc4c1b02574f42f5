package com.github.yoep.provider.local;

import com.github.yoep.provider.local.config.LocalLibraryConfig;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import({
        LocalLibraryConfig.class
})
public class AutoConfiguration {
}
