package com.example.LlmCouncil.service;

import com.example.LlmCouncil.config.CouncilProperties;
import com.example.LlmCouncil.exception.ModelInvocationException;
import com.example.LlmCouncil.model.Conversation;
import com.example.LlmCouncil.model.ModelCall;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Short conversation title from the first question.
 */
@Service
@RequiredArgsConstructor
public class TitleGenerator {

    private static final Logger log = LoggerFactory.getLogger(TitleGenerator.class);

    private static final int MAX_TITLE_LENGTH = 50;
    private static final int TITLE_MAX_TOKENS = 32;

    private final ModelInvocationService modelInvocationService;
    private final CouncilProperties properties;

    public String generate(String question) {
        if (!properties.title().enabled()) {
            return Conversation.DEFAULT_TITLE;
        }
        String prompt = """
                Generate a very short title (3-5 words maximum) that summarizes the following question.
                The title should be concise and descriptive. Do not use quotes or punctuation in the title.

                Question: %s

                Title:""".formatted(question);

        try {
            String reply = modelInvocationService.invoke(ModelCall.of(null, properties.title().model(), prompt,
                    TITLE_MAX_TOKENS, properties.title().timeout())).text();
            return clean(reply);
        } catch (ModelInvocationException e) {
            log.warn("Title generation failed, keeping default title: {}", e.getMessage());
            return Conversation.DEFAULT_TITLE;
        }
    }

    static String clean(String reply) {
        if (reply == null) {
            return Conversation.DEFAULT_TITLE;
        }
        String title = reply.strip();
        int newline = title.indexOf('\n');
        if (newline > 0) {
            title = title.substring(0, newline).strip();
        }
        title = title.replaceAll("^[\"']+|[\"']+$", "").strip();
        if (title.isEmpty()) {
            return Conversation.DEFAULT_TITLE;
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            title = title.substring(0, MAX_TITLE_LENGTH - 3) + "...";
        }
        return title;
    }
}
