package com.example.LlmCouncil.service;

import com.example.LlmCouncil.exception.ModelInvocationException;
import com.example.LlmCouncil.model.ModelCall;
import com.example.LlmCouncil.model.ModelReply;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Model invocation over Spring AI ChatClients.
 * The target model is set per call through ChatOptions, so a single OpenRouter client
 * serves every "vendor/model" id in the catalog.
 */
@Service
@RequiredArgsConstructor
public class ChatClientModelInvocationService implements ModelInvocationService {

    private static final Logger log = LoggerFactory.getLogger(ChatClientModelInvocationService.class);

    static final String DEFAULT_PROVIDER = "openrouter";

    private final Map<String, ChatClient> chatClients;

    @Override
    public ModelReply invoke(ModelCall call) {
        ChatClient chatClient = resolveClient(call.modelId());

        // Run on boundedElastic so the timeout bounds the blocking HTTP call
        return Mono.fromCallable(() -> doInvoke(chatClient, call))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(call.timeout())
                .onErrorMap(e -> !(e instanceof ModelInvocationException), e -> translate(call, e))
                .block();
    }

    private ModelReply doInvoke(ChatClient chatClient, ModelCall call) {
        log.debug("[{}] querying {} (maxTokens={}, timeout={})",
                call.label(), call.modelId(), call.maxTokens(), call.timeout());

        ChatOptions options = ChatOptions.builder()
                .model(call.modelId())
                .maxTokens(call.maxTokens())
                .build();

        ChatClient.ChatClientRequestSpec request = chatClient.prompt().options(options);
        if (call.context() != null && !call.context().isBlank()) {
            request = request.system("Conversation History:\n" + call.context());
        }

        ChatResponse response = request.user(call.prompt()).call().chatResponse();

        String text = (response != null && response.getResult() != null && response.getResult().getOutput() != null)
                ? response.getResult().getOutput().getText()
                : null;
        if (text == null || text.isBlank()) {
            throw new ModelInvocationException(call.modelId(), "Empty or null content in response from " + call.modelId());
        }

        Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        Integer promptTokens = usage != null ? usage.getPromptTokens() : null;
        Integer completionTokens = usage != null ? usage.getCompletionTokens() : null;
        log.debug("[{}] {} returned {} chars (prompt={} completion={} tokens)",
                call.label(), call.modelId(), text.length(), promptTokens, completionTokens);

        return new ModelReply(call.modelId(), text, promptTokens, completionTokens);
    }

    private ModelInvocationException translate(ModelCall call, Throwable e) {
        if (e instanceof TimeoutException) {
            return new ModelInvocationException(call.modelId(),
                    call.modelId() + " timed out after " + call.timeout(), e);
        }
        return new ModelInvocationException(call.modelId(),
                "Error querying " + call.modelId() + ": " + rootCauseMessage(e), e);
    }

    /**
     * Resolve ChatClient bean for a model id.
     * Supported lookup keys:
     *  - "openrouterChatClient" for "vendor/model" ids
     *  - "<prefix>ChatClient" for bare ids such as "deepseek-chat"
     * Fallback:
     *  - the OpenRouter client
     *  - any available ChatClient if nothing matches
     */
    ChatClient resolveClient(String modelId) {
        String provider = providerOf(modelId);
        if (chatClients.containsKey(provider + "ChatClient")) {
            return chatClients.get(provider + "ChatClient");
        }
        ChatClient fallback = chatClients.get(DEFAULT_PROVIDER + "ChatClient");
        if (fallback != null) {
            return fallback;
        }
        return chatClients.values().stream().findFirst()
                .orElseThrow(() -> new IllegalStateException("No ChatClient beans are available"));
    }

    static String providerOf(String modelId) {
        if (modelId == null || modelId.isBlank() || modelId.contains("/")) {
            return DEFAULT_PROVIDER;
        }
        int dash = modelId.indexOf('-');
        return dash > 0 ? modelId.substring(0, dash).toLowerCase() : modelId.toLowerCase();
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = Optional.ofNullable(cause.getMessage()).orElse(cause.getClass().getSimpleName());
        return msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
