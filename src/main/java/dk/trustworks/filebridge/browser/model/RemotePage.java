package dk.trustworks.filebridge.browser.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of browse results.
 *
 * @param nextCursor set only when the folder listing was cut off by the page cap; pass it back
 *                   as {@code cursor} to continue
 */
public record RemotePage(
    List<RemoteNode> files,
    List<RemoteNode> folders,
    @JsonProperty("current_path") String currentPath,
    @JsonProperty("parent_path") String parentPath,
    @JsonProperty("next_cursor") String nextCursor
) {
    public RemotePage {
        files = files == null ? List.of() : List.copyOf(files);
        folders = folders == null ? List.of() : List.copyOf(folders);
    }

    public static RemotePage containers(List<RemoteNode> folders, String currentPath, String parentPath) {
        return new RemotePage(List.of(), folders, currentPath, parentPath, null);
    }
}
