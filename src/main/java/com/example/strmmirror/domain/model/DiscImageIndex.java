package com.example.strmmirror.domain.model;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class DiscImageIndex {

    private static final DiscImageIndex EMPTY = new DiscImageIndex(Collections.emptyList());

    private final List<DiscImageGroup> groups;
    private final Set<String> primaryPaths = new HashSet<>();
    private final Set<String> suppressedPaths = new HashSet<>();

    public DiscImageIndex(List<DiscImageGroup> groups) {
        this.groups = Collections.unmodifiableList(groups);
        for (DiscImageGroup group : groups) {
            primaryPaths.add(group.getPrimaryMember().getPath());
            suppressedPaths.addAll(group.getSuppressedMembers());
        }
    }

    public static DiscImageIndex empty() {
        return EMPTY;
    }

    public List<DiscImageGroup> getGroups() {
        return groups;
    }

    public boolean isPrimary(String path) {
        return primaryPaths.contains(path);
    }

    public boolean isSuppressed(String path) {
        return suppressedPaths.contains(path);
    }

    public boolean isInsideGroup(String path) {
        for (DiscImageGroup group : groups) {
            if (group.contains(path)) {
                return true;
            }
        }
        return false;
    }
}
