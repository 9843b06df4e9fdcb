package com.github.yoep.popcorn.backend.media.providers.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamsResponse {
    private List<Stream> streams;

    public List<Stream> getStreams() {
        return Optional.ofNullable(streams).orElse(Collections.emptyList());
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Stream {
        private String name;
        private String title;
        private String url;
        private String infoHash;
        /**
         * The file index within the torrent, which can be a number, a numeric string or null.
         */
        private JsonNode fileIdx;
        private List<String> sources;
    }
}
