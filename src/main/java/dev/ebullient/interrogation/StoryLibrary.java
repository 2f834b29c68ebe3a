package dev.ebullient.interrogation;

import java.io.IOException;
import java.io.Reader;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.Enumeration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.annotation.PostConstruct;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.interrogation.model.Story;

/**
 * Story data loaded from YAML or JSON files: the configured stories directory
 * first, then {@code stories/} on the classpath. Stories may also be
 * registered programmatically.
 */
@Singleton
public class StoryLibrary implements StoryProvider {
    private static final Logger log = Logger.getLogger(StoryLibrary.class);

    static final String CLASSPATH_DIR = "stories";

    @ConfigProperty(name = "interrogation.stories.dir", defaultValue = "${user.home}/.interrogation/stories")
    String storiesDir;

    private final ObjectMapper jsonMapper;
    private final Yaml yaml;
    private final Map<String, Story> stories = new ConcurrentHashMap<>();

    public StoryLibrary() {
        jsonMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        yaml = new Yaml(new LoaderOptions());
    }

    @PostConstruct
    void init() {
        if (storiesDir != null && !storiesDir.isBlank()) {
            loadDirectory(Path.of(storiesDir));
        }
        loadClasspath();
        log.infof("Loaded %d stories", stories.size());
    }

    @Override
    public Optional<Story> findStory(String storyId) {
        if (storyId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(stories.get(storyId));
    }

    public Collection<Story> stories() {
        return Collections.unmodifiableCollection(stories.values());
    }

    public void register(Story story) {
        if (story == null || StringUtils.isBlank(story.id())) {
            throw new IllegalArgumentException("Story must have an id");
        }
        Story previous = stories.put(story.id(), story);
        if (previous != null) {
            log.debugf("Replaced story %s", story.id());
        }
    }

    /**
     * Load every story file in a directory. Files that fail to parse are
     * logged and skipped.
     */
    public int loadDirectory(Path dir) {
        if (!Files.isDirectory(dir)) {
            log.debugf("Story directory %s does not exist", dir);
            return 0;
        }
        int count = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.{yaml,yml,json}")) {
            for (Path file : files) {
                try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                    if (add(readStory(reader), file.getFileName().toString())) {
                        count++;
                    }
                } catch (Exception e) {
                    log.errorf(e, "Failed to load story %s: %s", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.errorf(e, "Failed to list stories in %s", dir);
        }
        return count;
    }

    private void loadClasspath() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        try {
            Enumeration<URL> roots = cl.getResources(CLASSPATH_DIR);
            while (roots.hasMoreElements()) {
                URL root = roots.nextElement();
                if ("file".equals(root.getProtocol())) {
                    loadDirectory(Path.of(root.toURI()));
                } else {
                    log.debugf("Skipping non-directory story root %s", root);
                }
            }
        } catch (IOException | URISyntaxException e) {
            log.errorf(e, "Failed to scan classpath for stories: %s", e.getMessage());
        }
    }

    Story readStory(Reader reader) {
        Object raw = yaml.load(reader);
        return jsonMapper.convertValue(raw, Story.class);
    }

    private boolean add(Story story, String source) {
        if (story == null) {
            log.warnf("Empty story file %s", source);
            return false;
        }
        if (StringUtils.isBlank(story.id())) {
            // fall back to the file name
            String name = source.replaceFirst("\\.(ya?ml|json)$", "");
            story = new Story(StringUtils.slugify(name), story.title(), story.fullStory(),
                    story.characters(), story.locations());
        }
        if (stories.putIfAbsent(story.id(), story) != null) {
            log.warnf("Duplicate story id %s in %s; keeping the first one", story.id(), source);
            return false;
        }
        log.debugf("Loaded story %s (%s) from %s", story.id(), story.title(), source);
        return true;
    }
}
