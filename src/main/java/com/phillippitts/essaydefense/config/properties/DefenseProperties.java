package com.phillippitts.essaydefense.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Submission intake and defense settings.
 */
@ConfigurationProperties(prefix = "defense")
@Validated
public class DefenseProperties {

    /** Maximum essay length in characters. Longer essays are rejected at intake. */
    @Positive(message = "Max essay length must be positive")
    private int maxEssayLength = 15000;

    /** Number of content questions drawn per submission. */
    @Min(value = 0, message = "Content question count must not be negative")
    private int contentQuestionCount = 3;

    /** Number of process questions drawn per submission. */
    @Min(value = 0, message = "Process question count must not be negative")
    private int processQuestionCount = 2;

    /** Calls shorter than this many seconds are excluded from grading. */
    @Min(value = 0, message = "Min call length must not be negative")
    private int minCallLengthSeconds = 60;

    /** Classpath resource holding the question bank. */
    @NotBlank
    private String questionBank = "classpath:questions.json";

    /** Examiner persona template name under templates/personality. */
    @NotBlank
    private String personalityTemplate = "default";

    /** Examination flow template name under templates/flow. */
    @NotBlank
    private String flowTemplate = "default";

    /** Opening utterance template name under templates/first-message. */
    @NotBlank
    private String firstMessageTemplate = "default";

    public int getMaxEssayLength() {
        return maxEssayLength;
    }

    public void setMaxEssayLength(int maxEssayLength) {
        this.maxEssayLength = maxEssayLength;
    }

    public int getContentQuestionCount() {
        return contentQuestionCount;
    }

    public void setContentQuestionCount(int contentQuestionCount) {
        this.contentQuestionCount = contentQuestionCount;
    }

    public int getProcessQuestionCount() {
        return processQuestionCount;
    }

    public void setProcessQuestionCount(int processQuestionCount) {
        this.processQuestionCount = processQuestionCount;
    }

    public int getMinCallLengthSeconds() {
        return minCallLengthSeconds;
    }

    public void setMinCallLengthSeconds(int minCallLengthSeconds) {
        this.minCallLengthSeconds = minCallLengthSeconds;
    }

    public String getQuestionBank() {
        return questionBank;
    }

    public void setQuestionBank(String questionBank) {
        this.questionBank = questionBank;
    }

    public String getPersonalityTemplate() {
        return personalityTemplate;
    }

    public void setPersonalityTemplate(String personalityTemplate) {
        this.personalityTemplate = personalityTemplate;
    }

    public String getFlowTemplate() {
        return flowTemplate;
    }

    public void setFlowTemplate(String flowTemplate) {
        this.flowTemplate = flowTemplate;
    }

    public String getFirstMessageTemplate() {
        return firstMessageTemplate;
    }

    public void setFirstMessageTemplate(String firstMessageTemplate) {
        this.firstMessageTemplate = firstMessageTemplate;
    }
}
