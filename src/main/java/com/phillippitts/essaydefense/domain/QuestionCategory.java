package com.phillippitts.essaydefense.domain;

/**
 * Question bank partitions. Content questions probe what the essay argues,
 * process questions probe how the student wrote it.
 */
public enum QuestionCategory {
    CONTENT,
    PROCESS
}
