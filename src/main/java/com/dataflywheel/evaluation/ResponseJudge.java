package com.dataflywheel.evaluation;

import java.io.IOException;
import java.util.List;

import com.dataflywheel.records.ChatMessage;

/**
 * Scores how closely a free-text completion matches the ground-truth completion.
 * Implementations return a value in [0,1].
 */
public interface ResponseJudge {
    double similarity(String reference, String candidate, List<ChatMessage> conversation) throws IOException;

    String name();
}
