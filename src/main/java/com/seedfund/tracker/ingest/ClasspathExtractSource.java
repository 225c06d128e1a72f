package com.seedfund.tracker.ingest;

import com.seedfund.tracker.config.TrackerConstants;
import com.seedfund.tracker.config.TrackerProperties;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Loads tracking extracts from resources matching {@code tracker.extract-file-pattern}, ordered
 * by file name so vintages are processed the same way on every run.
 */
@Component
public class ClasspathExtractSource implements ExtractSource {

    private final TrackerProperties trackerProperties;

    public ClasspathExtractSource(TrackerProperties trackerProperties) {
        this.trackerProperties = trackerProperties;
    }

    @Override
    public List<SourceExtract> loadAll() {
        String pattern = trackerProperties.getExtractFilePattern();
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            String location = pattern.contains(":") ? pattern : "classpath*:" + pattern;
            Resource[] resources = resolver.getResources(location);

            List<Resource> valid = new ArrayList<>();
            for (Resource resource : resources) {
                if (resource != null && resource.exists() && resource.getFilename() != null) {
                    valid.add(resource);
                }
            }
            valid.sort(Comparator.comparing(Resource::getFilename));

            List<SourceExtract> extracts = new ArrayList<>(valid.size());
            for (Resource resource : valid) {
                byte[] content = resource.getInputStream().readAllBytes();
                if (content.length == 0) {
                    throw new IllegalStateException(TrackerConstants.MSG_RESOURCE_EMPTY.formatted(resource.getFilename()));
                }
                extracts.add(new SourceExtract(resource.getFilename(), content));
            }

            if (extracts.isEmpty()) {
                throw new IllegalStateException(TrackerConstants.MSG_NO_EXTRACTS.formatted(pattern));
            }
            return extracts;
        } catch (IOException ex) {
            throw new IllegalStateException(TrackerConstants.MSG_RESOURCE_READ_FAILED.formatted(pattern), ex);
        }
    }
}
