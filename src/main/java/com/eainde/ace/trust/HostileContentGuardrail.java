package com.eainde.ace.trust;

import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.guardrail.InputGuardrail;
import dev.langchain4j.guardrail.InputGuardrailResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Input guardrail that stops a user message carrying prompt-injection signatures before it
 * reaches a model. Register it on an AI service or agent as an input guardrail.
 */
@Slf4j
@Component
public class HostileContentGuardrail implements InputGuardrail {

    private final TrustSourceTagger tagger;

    public HostileContentGuardrail(TrustSourceTagger tagger) {
        this.tagger = tagger;
    }

    @Override
    public InputGuardrailResult validate(UserMessage userMessage) {
        HostileDetection detection = tagger.detectHostilePatterns(textOf(userMessage));
        if (!detection.hostile()) {
            return success();
        }
        log.warn("Rejected user message matching {}", detection.patternIds());
        return fatal("Message rejected: hostile content detected " + detection.patternIds());
    }

    private static String textOf(UserMessage message) {
        if (message == null) {
            return null;
        }
        StringBuilder text = new StringBuilder();
        for (Content content : message.contents()) {
            if (content instanceof TextContent textContent) {
                if (!text.isEmpty()) {
                    text.append('\n');
                }
                text.append(textContent.text());
            }
        }
        return text.toString();
    }
}
