package com.github.yoep.torrent.debrid.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The torrent information as returned by "/torrents/info/{id}".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TorrentInfoResponse {
    private String id;
    private String filename;
    /**
     * The status of the torrent within the service, e.g. "waiting_files_selection" or "downloaded".
     */
    private String status;
    private Double progress;
    private List<File> files;
    private List<String> links;

    public List<File> getFiles() {
        return Optional.ofNullable(files)
                .orElse(Collections.emptyList());
    }

    public List<String> getLinks() {
        return Optional.ofNullable(links)
                .orElse(Collections.emptyList());
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class File {
        private int id;
        private String path;
        private long bytes;
        private int selected;
    }
}
