package me.bechberger.phidetect;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import me.bechberger.phidetect.config.DetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Loads {@link DetectionConfig}s from YAML.
 * <p>
 * A configuration is either a preset on the classpath ({@code presets/<name>.yaml}) or a file.
 * Its {@code parent} is resolved the same way and merged in, recursively.
 */
public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    static final String PRESET_DIRECTORY = "presets/";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    /**
     * Load a preset by name, or a YAML file if {@code nameOrPath} names an existing file.
     *
     * @throws IOException if the preset is unknown, a file cannot be read or parsed,
     *                     or the parent chain contains a cycle
     */
    public DetectionConfig load(String nameOrPath) throws IOException {
        return load(nameOrPath, new LinkedHashSet<>());
    }

    public DetectionConfig load(Path file) throws IOException {
        return load(file.toString(), new LinkedHashSet<>());
    }

    /**
     * Parse YAML text; a parent is resolved like in {@link #load(String)}.
     */
    public DetectionConfig parse(String yaml) throws IOException {
        DetectionConfig config = mapper.readValue(yaml, DetectionConfig.class);
        return resolveParent(config, new LinkedHashSet<>());
    }

    public DetectionConfig loadPreset(String name) throws IOException {
        return load(name);
    }

    private DetectionConfig load(String nameOrPath, Set<String> visiting) throws IOException {
        if (!visiting.add(nameOrPath)) {
            throw new IOException("Cyclic parent chain: " + String.join(" -> ", visiting) + " -> " + nameOrPath);
        }
        DetectionConfig config = read(nameOrPath);
        return resolveParent(config, visiting);
    }

    private DetectionConfig resolveParent(DetectionConfig config, Set<String> visiting) throws IOException {
        if (config.hasParent()) {
            DetectionConfig parent = load(config.getParent(), visiting);
            config.mergeWith(parent);
        }
        return config;
    }

    private DetectionConfig read(String nameOrPath) throws IOException {
        Path path = Path.of(nameOrPath);
        if (Files.isRegularFile(path)) {
            logger.info("Loading configuration from {}", path.toAbsolutePath());
            return mapper.readValue(path.toFile(), DetectionConfig.class);
        }
        String resource = PRESET_DIRECTORY + nameOrPath + ".yaml";
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Unknown preset or missing file: " + nameOrPath);
            }
            logger.info("Loading configuration preset {}", nameOrPath);
            return mapper.readValue(in, DetectionConfig.class);
        }
    }
}
