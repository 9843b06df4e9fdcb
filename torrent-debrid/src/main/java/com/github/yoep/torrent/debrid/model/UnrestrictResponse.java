package com.github.yoep.torrent.debrid.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UnrestrictResponse {
    private String id;
    private String filename;
    private String mimeType;
    private Long filesize;
    private String link;
    private String host;
    /**
     * The unrestricted, playable url.
     */
    private String download;
    private Integer streamable;
}
