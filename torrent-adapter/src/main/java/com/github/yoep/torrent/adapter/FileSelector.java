package com.github.yoep.torrent.adapter;

import com.github.yoep.torrent.adapter.model.TorrentFile;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Picks the file of a (multi-file) torrent which should be unlocked.
 */
public final class FileSelector {
    /**
     * The extensions of files which are considered to be a video.
     */
    static final String[] VIDEO_EXTENSIONS = {".mkv", ".mp4", ".avi", ".mov", ".m4v", ".wmv", ".webm", ".ts"};

    private FileSelector() {
    }

    /**
     * Select the file which should be unlocked from the given manifest.
     * <ol>
     *     <li>a valid explicit index always wins, even when it points to a non-video file</li>
     *     <li>the largest video file, the first one wins on equal sizes</li>
     *     <li>the first file of the manifest</li>
     * </ol>
     *
     * @param files         The file manifest of the torrent.
     * @param explicitIndex The 0-based index of the file to play, or null when unknown.
     * @return Returns the remote id of the selected file, or {@link TorrentFile#NONE} when the manifest is empty.
     */
    public static int select(List<TorrentFile> files, Integer explicitIndex) {
        if (files == null || files.isEmpty()) {
            return TorrentFile.NONE;
        }

        if (explicitIndex != null && explicitIndex >= 0 && explicitIndex < files.size()) {
            return files.get(explicitIndex).getId();
        }

        var bestId = TorrentFile.NONE;
        var bestSize = -1L;

        for (var file : files) {
            if (!isVideo(file.getPath())) {
                continue;
            }

            if (file.getSize() > bestSize) {
                bestId = file.getId();
                bestSize = file.getSize();
            }
        }

        return bestId != TorrentFile.NONE ? bestId : files.get(0).getId();
    }

    /**
     * Check if the given path looks like a video file based on its extension.
     *
     * @param path The file path to verify.
     * @return Returns true when the path ends with a known video extension.
     */
    public static boolean isVideo(String path) {
        return StringUtils.endsWithAny(StringUtils.lowerCase(path), VIDEO_EXTENSIONS);
    }
}
