package com.github.yoep.popcorn.backend;

import com.github.yoep.popcorn.backend.config.*;
import com.github.yoep.popcorn.backend.config.properties.PopcornProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import({
        PopcornProperties.class,
        CliConfig.class,
        MediaConfig.class,
        PlayerConfig.class,
        RestConfig.class,
        StreamConfig.class,
        ThreadConfig.class,
})
public class BackendAutoConfiguration {
}
