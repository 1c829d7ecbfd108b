package com.example.strmmirror.domain.model;

import java.util.Set;
import lombok.Value;

/**
 * A BDMV disc-image directory collapsed to its largest stream file.
 */
@Value
public class DiscImageGroup {

    String rootPath;

    RemoteEntry primaryMember;

    Set<String> suppressedMembers;

    public boolean contains(String path) {
        return path.startsWith(rootPath + "/");
    }
}
