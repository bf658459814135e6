package com.knowledgeinbox.inference;

import java.util.List;

public record Answer(String question, String text, List<Citation> citations) {
}
