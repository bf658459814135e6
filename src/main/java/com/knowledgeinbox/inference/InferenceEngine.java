package com.knowledgeinbox.inference;

public interface InferenceEngine {
    String generate(InferenceRequest request);
}
