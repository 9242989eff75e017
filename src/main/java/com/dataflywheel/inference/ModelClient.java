package com.dataflywheel.inference;

import java.io.IOException;

import com.dataflywheel.records.ChatRequest;
import com.dataflywheel.records.ChatResponse;

@FunctionalInterface
public interface ModelClient {
    ChatResponse complete(ChatRequest request) throws IOException;
}
