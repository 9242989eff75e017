package com.dataflywheel.evaluation;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.dataflywheel.records.ChatMessage;
import com.dataflywheel.records.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ToolCallMatcher {
    private final ObjectMapper mapper = new ObjectMapper();

    public double score(ChatMessage expected, ChatMessage actual) {
        List<ToolCall> expectedCalls = expected.toolCalls();
        List<ToolCall> actualCalls = actual == null ? List.of() : actual.toolCalls();
        if (expectedCalls.isEmpty()) {
            return actualCalls.isEmpty() ? 1.0 : 0.0;
        }

        // calls are paired regardless of order: best-scoring pairs first, each call used at most once
        double[][] scores = new double[expectedCalls.size()][actualCalls.size()];
        for (int i = 0; i < expectedCalls.size(); i++) {
            for (int j = 0; j < actualCalls.size(); j++) {
                scores[i][j] = scoreCall(expectedCalls.get(i), actualCalls.get(j));
            }
        }
        boolean[] expectedUsed = new boolean[expectedCalls.size()];
        boolean[] actualUsed = new boolean[actualCalls.size()];
        double total = 0.0;
        while (true) {
            int bestExpected = -1;
            int bestActual = -1;
            double bestScore = 0.0;
            for (int i = 0; i < expectedCalls.size(); i++) {
                for (int j = 0; j < actualCalls.size(); j++) {
                    if (!expectedUsed[i] && !actualUsed[j] && scores[i][j] > bestScore) {
                        bestExpected = i;
                        bestActual = j;
                        bestScore = scores[i][j];
                    }
                }
            }
            if (bestExpected < 0) {
                break;
            }
            expectedUsed[bestExpected] = true;
            actualUsed[bestActual] = true;
            total += bestScore;
        }
        // unexpected extra calls count against the match
        return total / Math.max(expectedCalls.size(), actualCalls.size());
    }

    double scoreCall(ToolCall expected, ToolCall actual) {
        if (expected.function() == null || actual.function() == null) {
            return 0.0;
        }
        if (!Objects.equals(expected.function().name(), actual.function().name())) {
            return 0.0;
        }
        JsonNode expectedArgs = parseArguments(expected.function().arguments());
        JsonNode actualArgs = parseArguments(actual.function().arguments());
        if (expectedArgs == null || actualArgs == null) {
            return normalizeRaw(expected.function().arguments()).equals(normalizeRaw(actual.function().arguments())) ? 1.0 : 0.0;
        }
        if (expectedArgs.equals(actualArgs)) {
            return 1.0;
        }
        if (!expectedArgs.isObject() || !actualArgs.isObject()) {
            return 0.0;
        }
        return keyAgreement(expectedArgs, actualArgs);
    }

    private double keyAgreement(JsonNode expectedArgs, JsonNode actualArgs) {
        Set<String> keys = new HashSet<>();
        expectedArgs.fieldNames().forEachRemaining(keys::add);
        actualArgs.fieldNames().forEachRemaining(keys::add);
        if (keys.isEmpty()) {
            return 1.0;
        }
        int matching = 0;
        Iterator<String> names = keys.iterator();
        while (names.hasNext()) {
            String key = names.next();
            JsonNode left = expectedArgs.get(key);
            JsonNode right = actualArgs.get(key);
            if (left != null && left.equals(right)) {
                matching++;
            }
        }
        return matching / (double) keys.size();
    }

    private JsonNode parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String normalizeRaw(String arguments) {
        return arguments == null ? "" : arguments.strip();
    }
}
