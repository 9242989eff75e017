package com.dataflywheel.evaluation;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.dataflywheel.exception.PerRecordEvaluationException;
import com.dataflywheel.records.ChatMessage;
import com.dataflywheel.records.ChatRequest;
import com.dataflywheel.records.ChatResponse;
import com.dataflywheel.runtime.AppConfig;

import okhttp3.OkHttpClient;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlmResponseJudgeTest {

    @Test
    void shouldAskJudgeModelAndNormalizeRating() throws Exception {
        List<ChatRequest> seen = new ArrayList<>();
        LlmResponseJudge judge = new LlmResponseJudge(request -> {
            seen.add(request);
            return ChatResponse.of(request.model(), ChatMessage.of("assistant", "8"));
        }, "judge-70b");

        double score = judge.similarity("Use the reset link.", "Click reset.", List.of(ChatMessage.of("user", "reset my password")));

        assertEquals(0.8, score, 1e-9);
        assertEquals("judge-70b", seen.get(0).model());
        String prompt = seen.get(0).messages().get(1).content();
        assertTrue(prompt.contains("user: reset my password"));
        assertTrue(prompt.contains("Reference answer:\nUse the reset link."));
        assertTrue(prompt.contains("Candidate answer:\nClick reset."));
    }

    @Test
    void shouldParseFirstRatingInVerboseReply() {
        assertEquals(1.0, LlmResponseJudge.parseRating("Rating: 10 out of 10"), 1e-9);
        assertEquals(0.0, LlmResponseJudge.parseRating("0"), 1e-9);
    }

    @Test
    void shouldFailRecordWhenReplyHasNoRating() {
        assertThrows(PerRecordEvaluationException.class, () -> LlmResponseJudge.parseRating("They look similar."));
    }

    @Test
    void shouldPickJudgeFromConfig() {
        AppConfig.JudgeConfig local = new AppConfig.JudgeConfig();
        assertInstanceOf(LexicalResponseJudge.class, ResponseJudges.fromConfig(local, new OkHttpClient(), name -> null));

        AppConfig.JudgeConfig remote = new AppConfig.JudgeConfig();
        remote.setType("remote");
        remote.setUrl("http://judge.local:8002");
        remote.setModelId("judge-70b");
        remote.setApiKeyEnv("JUDGE_KEY");
        ResponseJudge judge = ResponseJudges.fromConfig(remote, new OkHttpClient(), name -> "secret");

        assertInstanceOf(LlmResponseJudge.class, judge);
        assertEquals("judge-70b", judge.name());
    }
}
