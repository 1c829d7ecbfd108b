package com.example.strmmirror.application.service;

import com.example.strmmirror.domain.model.DiscImageGroup;
import com.example.strmmirror.domain.model.DiscImageIndex;
import com.example.strmmirror.domain.model.MediaExtensions;
import com.example.strmmirror.domain.model.RemoteEntry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds Blu-ray style {@code BDMV/STREAM} layouts and picks the feature stream of each.
 */
@Component
public class DiscImageResolver {

    private static final Logger log = LoggerFactory.getLogger(DiscImageResolver.class);

    /** Largest size first, then lexicographic path so equal sizes resolve the same way every run. */
    private static final Comparator<RemoteEntry> FEATURE_ORDER = Comparator
            .comparingLong(RemoteEntry::getSize).reversed()
            .thenComparing(RemoteEntry::getPath);

    public DiscImageIndex resolve(List<RemoteEntry> entries) {
        List<DiscImageGroup> groups = new ArrayList<>();
        for (RemoteEntry candidate : entries) {
            if (!candidate.isDirectory()
                    || !LocalPathMapper.DISC_MARKER.equals(candidate.getName().toUpperCase(Locale.ROOT))) {
                continue;
            }
            String rootPath = candidate.getPath();
            List<RemoteEntry> members = new ArrayList<>();
            for (RemoteEntry entry : entries) {
                if (!entry.isDirectory()
                        && isStreamDirectory(entry.getParentPath(), rootPath)
                        && MediaExtensions.DISC_VIDEO.equals(entry.getSuffix())) {
                    members.add(entry);
                }
            }
            if (members.isEmpty()) {
                log.info("DISC_IMAGE_EMPTY root={} no {} files under {}", rootPath,
                        MediaExtensions.DISC_VIDEO, LocalPathMapper.STREAM_DIR);
                continue;
            }

            members.sort(FEATURE_ORDER);
            RemoteEntry primary = members.get(0);
            Set<String> suppressed = new LinkedHashSet<>();
            for (int i = 1; i < members.size(); i++) {
                suppressed.add(members.get(i).getPath());
            }
            groups.add(new DiscImageGroup(rootPath, primary, suppressed));
            log.info("DISC_IMAGE_RESOLVED root={} primary={} size={} suppressed={}",
                    rootPath, primary.getPath(), primary.getSize(), suppressed.size());
        }
        return groups.isEmpty() ? DiscImageIndex.empty() : new DiscImageIndex(groups);
    }

    private static boolean isStreamDirectory(String parentPath, String rootPath) {
        String prefix = rootPath + "/";
        return parentPath.startsWith(prefix)
                && LocalPathMapper.STREAM_DIR.equalsIgnoreCase(parentPath.substring(prefix.length()));
    }
}
