package com.example.cloudinvestigator.planner;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single chat completion message.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    private Role role;
    private String content;

    public enum Role {
        SYSTEM, USER, ASSISTANT
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(Role.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(Role.USER, content);
    }
}
