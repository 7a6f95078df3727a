package uk.gegc.questionbot.features.chat.domain;

public record ChatDocument(String fileName, String content, String caption) {
}
