package com.phillippitts.essaydefense.service.prompt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * Reads templates from {@code classpath:templates/<kind>/<name>.txt} and caches them.
 */
@Component
public class ClasspathTemplateSource implements TemplateSource {

    private static final Logger LOG = LogManager.getLogger(ClasspathTemplateSource.class);

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private final ResourceLoader resourceLoader;
    private final ConcurrentMap<String, Optional<String>> cache = new ConcurrentHashMap<>();

    public ClasspathTemplateSource(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    @Override
    public Optional<String> find(TemplateKind kind, String name) {
        if (name == null || !SAFE_NAME.matcher(name).matches()) {
            return Optional.empty();
        }
        return cache.computeIfAbsent(kind.directory() + "/" + name, this::load);
    }

    private Optional<String> load(String path) {
        Resource resource = resourceLoader.getResource("classpath:templates/" + path + ".txt");
        if (!resource.exists()) {
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
            return text.isEmpty() ? Optional.empty() : Optional.of(text);
        } catch (IOException e) {
            LOG.warn("Cannot read template {}: {}", path, e.toString());
            return Optional.empty();
        }
    }
}
