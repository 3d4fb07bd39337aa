package com.phillippitts.essaydefense.service.grading;

import com.phillippitts.essaydefense.config.properties.GradingProperties;
import com.phillippitts.essaydefense.exception.EssayDefenseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Loads the grading rubric once at startup. A missing rubric fails startup.
 */
@Component
public class RubricProvider {

    private static final Logger LOG = LogManager.getLogger(RubricProvider.class);

    private final String rubric;

    @Autowired
    public RubricProvider(ResourceLoader resourceLoader, GradingProperties properties) {
        Resource resource = resourceLoader.getResource(properties.getRubric());
        try (InputStream in = resource.getInputStream()) {
            this.rubric = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new EssayDefenseException("Cannot load grading rubric from " + properties.getRubric(), e);
        }
        LOG.info("Loaded grading rubric from {} ({} chars)", properties.getRubric(), rubric.length());
    }

    RubricProvider(String rubric) {
        this.rubric = rubric;
    }

    public String rubric() {
        return rubric;
    }
}
