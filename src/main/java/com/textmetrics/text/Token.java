package com.textmetrics.text;

public record Token(
    String term,
    int position
) {
}
