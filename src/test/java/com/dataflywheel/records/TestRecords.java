package com.dataflywheel.records;

import java.util.List;
import java.util.stream.IntStream;

public final class TestRecords {
    public static final String BASELINE_MODEL = "base-70b";

    private TestRecords() {
    }

    public static InteractionRecord freeText(long timestamp, String workloadId, String clientId, String prompt, String answer) {
        ChatRequest request = new ChatRequest(BASELINE_MODEL, List.of(ChatMessage.of("user", prompt)), List.of());
        return new InteractionRecord(timestamp, workloadId, clientId, request,
                ChatResponse.of(BASELINE_MODEL, ChatMessage.of("assistant", answer)));
    }

    public static InteractionRecord toolCalling(long timestamp, String workloadId, String clientId, String prompt, ToolCall call) {
        ChatRequest request = new ChatRequest(BASELINE_MODEL, List.of(ChatMessage.of("user", prompt)), List.of());
        return new InteractionRecord(timestamp, workloadId, clientId, request,
                ChatResponse.of(BASELINE_MODEL, ChatMessage.assistantToolCalls(List.of(call))));
    }

    /**
     * Records whose ground truth answer to "question-i" is "answer-i".
     */
    public static List<InteractionRecord> numbered(int count, long firstTimestamp, String workloadId, String clientId) {
        return IntStream.range(0, count)
                .mapToObj(i -> freeText(firstTimestamp + i, workloadId, clientId, "question-" + i, "answer-" + i))
                .toList();
    }
}
