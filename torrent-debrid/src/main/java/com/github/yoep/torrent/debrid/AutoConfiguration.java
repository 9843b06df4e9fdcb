package com.github.yoep.torrent.debrid;

import com.github.yoep.torrent.debrid.config.DebridConfig;
import com.github.yoep.torrent.debrid.config.DebridProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import({
        DebridProperties.class,
        DebridConfig.class
})
public class AutoConfiguration {
}
