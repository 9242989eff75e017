package com.dataflywheel.evaluation;

import java.io.IOException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.dataflywheel.exception.PerRecordEvaluationException;
import com.dataflywheel.inference.ModelClient;
import com.dataflywheel.records.ChatMessage;
import com.dataflywheel.records.ChatRequest;
import com.dataflywheel.records.ChatResponse;

public class LlmResponseJudge implements ResponseJudge {
    private static final Pattern RATING = Pattern.compile("\\b(10|[0-9])\\b");
    private static final String INSTRUCTIONS = """
            You compare an assistant answer against a reference answer for the same conversation.
            Rate how well the candidate preserves the meaning and the facts of the reference on a scale from 0 to 10,
            where 10 means equivalent and 0 means unrelated or contradictory. Reply with the number only.""";

    private final ModelClient judgeClient;
    private final String judgeModel;

    public LlmResponseJudge(ModelClient judgeClient, String judgeModel) {
        this.judgeClient = judgeClient;
        this.judgeModel = judgeModel;
    }

    @Override
    public double similarity(String reference, String candidate, List<ChatMessage> conversation) throws IOException {
        ChatRequest request = new ChatRequest(
                judgeModel,
                List.of(
                        ChatMessage.of("system", INSTRUCTIONS),
                        ChatMessage.of("user", buildPrompt(reference, candidate, conversation))),
                List.of());
        ChatResponse response = judgeClient.complete(request);
        return parseRating(response.message().contentOrEmpty());
    }

    @Override
    public String name() {
        return judgeModel;
    }

    static double parseRating(String content) {
        Matcher matcher = RATING.matcher(content);
        if (!matcher.find()) {
            throw new PerRecordEvaluationException("Judge reply carried no 0-10 rating: " + abbreviate(content));
        }
        return Integer.parseInt(matcher.group(1)) / 10.0;
    }

    private static String buildPrompt(String reference, String candidate, List<ChatMessage> conversation) {
        StringBuilder builder = new StringBuilder("Conversation:\n");
        for (ChatMessage message : conversation) {
            builder.append(message.role()).append(": ").append(message.contentOrEmpty()).append('\n');
        }
        builder.append("\nReference answer:\n").append(reference == null ? "" : reference)
                .append("\n\nCandidate answer:\n").append(candidate == null ? "" : candidate)
                .append('\n');
        return builder.toString();
    }

    private static String abbreviate(String content) {
        return content.length() <= 80 ? content : content.substring(0, 80) + "...";
    }
}
