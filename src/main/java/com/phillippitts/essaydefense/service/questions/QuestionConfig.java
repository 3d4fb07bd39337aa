package com.phillippitts.essaydefense.service.questions;

import com.phillippitts.essaydefense.config.properties.DefenseProperties;
import com.phillippitts.essaydefense.exception.EssayDefenseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/**
 * Loads the question bank at startup and wires the selector.
 */
@Configuration
public class QuestionConfig {

    private static final Logger LOG = LogManager.getLogger(QuestionConfig.class);

    @Bean
    public QuestionBank questionBank(DefenseProperties properties, ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(properties.getQuestionBank());
        try (InputStream in = resource.getInputStream()) {
            QuestionBank bank = QuestionBankLoader.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            LOG.info("Loaded question bank from {} ({} questions)", properties.getQuestionBank(), bank.size());
            return bank;
        } catch (IOException e) {
            throw new EssayDefenseException("Cannot read question bank: " + properties.getQuestionBank(), e);
        }
    }

    @Bean
    public QuestionSelector questionSelector(QuestionBank questionBank) {
        return new QuestionSelector(questionBank, new SecureRandom());
    }
}
