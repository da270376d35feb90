package com.tabletop.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads all available rule presets at startup.
 * <p>
 * Presets are loaded from two locations (in order):
 * <ol>
 *   <li>Classpath: {@code classpath:presets/*.json}: built-in variants shipped with the engine</li>
 *   <li>External folder: {@code ./presets/} by default: user-written rule documents</li>
 * </ol>
 * If an external preset has the same {@code id} as a built-in one, the external one wins.
 */
@Component
@Slf4j
public class RulePresetLoader {

    static final String ID_KEY = "id";
    static final String NAME_KEY = "name";
    static final String DESCRIPTION_KEY = "description";

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final RuleDocumentCodec codec;
    private final Path externalDir;

    /** All loaded presets keyed by their id. */
    @Getter
    private final Map<String, RulePreset> presets = new LinkedHashMap<>();

    public RulePresetLoader(ObjectMapper objectMapper, RuleDocumentCodec codec,
                            @Value("${engine.presets.external-dir:presets}") String externalDir) {
        this.objectMapper = objectMapper;
        this.codec = codec;
        this.externalDir = Paths.get(externalDir);
    }

    @PostConstruct
    public void loadPresets() {
        loadClasspathPresets();
        loadExternalPresets();

        if (presets.isEmpty()) {
            log.warn("No rule presets found; matches can only be created from explicit rules");
        } else {
            log.info("Loaded {} preset(s): {}", presets.size(), presets.keySet());
        }
    }

    public List<RulePreset> getAvailablePresets() {
        return List.copyOf(presets.values());
    }

    /**
     * Get a specific preset by its id.
     *
     * @throws IllegalArgumentException if the preset id is unknown
     */
    public RulePreset getPreset(String presetId) {
        RulePreset preset = presets.get(presetId);
        if (preset == null) {
            throw new IllegalArgumentException("Unknown preset: " + presetId
                    + ". Available presets: " + presets.keySet());
        }
        return preset;
    }

    // ── classpath presets ───────────────────────────────────────────────

    private void loadClasspathPresets() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:presets/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    RulePreset preset = toPreset(objectMapper.readValue(is, DOCUMENT_TYPE), resource.getFilename());
                    presets.put(preset.id(), preset);
                    log.info("Loaded built-in preset '{}' ({}) from classpath", preset.name(), preset.id());
                } catch (IOException | RuntimeException e) {
                    log.error("Failed to load classpath preset: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for presets: {}", e.getMessage());
        }
    }

    // ── external presets (./presets/ folder) ────────────────────────────

    private void loadExternalPresets() {
        if (!Files.isDirectory(externalDir)) {
            log.debug("No external presets directory found at '{}'", externalDir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(externalDir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(this::loadExternalPresetFile);
        } catch (IOException e) {
            log.error("Error reading external presets directory", e);
        }
    }

    private void loadExternalPresetFile(Path path) {
        try {
            RulePreset preset = toPreset(objectMapper.readValue(path.toFile(), DOCUMENT_TYPE),
                    path.getFileName().toString());
            presets.put(preset.id(), preset);
            log.info("Loaded custom preset '{}' ({}) from {}", preset.name(), preset.id(), path);
        } catch (Exception e) {
            log.error("Failed to load custom preset: {}", path, e);
        }
    }

    private RulePreset toPreset(Map<String, Object> doc, String fileName) {
        String id = stringOrNull(doc.get(ID_KEY));
        if (id == null || id.isBlank()) {
            id = fileName.endsWith(".json") ? fileName.substring(0, fileName.length() - 5) : fileName;
        }
        String name = stringOrNull(doc.get(NAME_KEY));
        return new RulePreset(id,
                name != null ? name : id,
                stringOrNull(doc.get(DESCRIPTION_KEY)),
                codec.fromDocument(doc));
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}
