package com.mortalitysentinel.core.format;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Plain-text chat webhook payload, serialized as {@code {"text": "..."}}.
 *
 * @since 1.0.0
 */
public final class ChatMessage {

    private final String text;

    public ChatMessage(String text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    @JsonProperty("text")
    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChatMessage that))
            return false;
        return text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "ChatMessage{" + text.length() + " chars}";
    }
}
