package com.dataflywheel.evaluation;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import com.dataflywheel.records.ChatMessage;

public class LexicalResponseJudge implements ResponseJudge {

    @Override
    public double similarity(String reference, String candidate, List<ChatMessage> conversation) {
        String normalizedReference = normalize(reference);
        String normalizedCandidate = normalize(candidate);
        if (normalizedReference.equals(normalizedCandidate)) {
            return 1.0;
        }

        Set<String> referenceTokens = tokens(normalizedReference);
        Set<String> candidateTokens = tokens(normalizedCandidate);
        if (referenceTokens.isEmpty() || candidateTokens.isEmpty()) {
            return 0.0;
        }
        Set<String> overlap = new HashSet<>(referenceTokens);
        overlap.retainAll(candidateTokens);
        if (overlap.isEmpty()) {
            return 0.0;
        }
        double precision = overlap.size() / (double) candidateTokens.size();
        double recall = overlap.size() / (double) referenceTokens.size();
        return 2 * precision * recall / (precision + recall);
    }

    @Override
    public String name() {
        return "lexical-overlap";
    }

    private static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").strip();
    }

    private static Set<String> tokens(String normalized) {
        return Arrays.stream(normalized.split("[^\\p{L}\\p{N}]+"))
                .filter(token -> !token.isBlank())
                .collect(Collectors.toSet());
    }
}
