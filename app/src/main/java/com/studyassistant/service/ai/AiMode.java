package com.studyassistant.service.ai;

import com.studyassistant.entity.AIContent.ContentKind;

/**
 * What an AI request is for. Each mode carries the system instruction sent
 * with the request and the kind under which its answer is archived.
 */
public enum AiMode {

    EXPLAIN(
            "You are a patient tutor. Explain the topic the student gives you clearly and "
                    + "concisely, with one short example. Use plain language.",
            ContentKind.EXPLANATION),

    SUMMARIZE(
            "You summarize study material for a student. Keep the key ideas, definitions and "
                    + "facts; drop filler. Use short bullet points.",
            ContentKind.SUMMARY),

    PRACTICE_QUESTIONS(
            "You write practice questions for a student. Generate 3-4 open-ended or short "
                    + "factual recall questions on the topic given. Do not include the answers.",
            ContentKind.QUESTIONS),

    QUIZ(
            "You generate multiple-choice quizzes. Reply with JSON only: an array of objects, "
                    + "each with \"question\" (string), \"choices\" (exactly 4 strings), "
                    + "\"correct_index\" (integer 0-3) and \"explanation\" (string). "
                    + "No markdown, no text outside the JSON.",
            null),

    CHAT(
            "You are a friendly study assistant. Answer the student's questions helpfully and "
                    + "keep answers focused on learning.",
            ContentKind.CHAT_SNAPSHOT);

    private final String systemInstruction;
    private final ContentKind contentKind;

    AiMode(String systemInstruction, ContentKind contentKind) {
        this.systemInstruction = systemInstruction;
        this.contentKind = contentKind;
    }

    public String getSystemInstruction() {
        return systemInstruction;
    }

    /**
     * Kind used when an answer in this mode is saved to the archive;
     * null for quizzes, which are stored as quiz results instead.
     */
    public ContentKind getContentKind() {
        return contentKind;
    }
}
