package com.example.LlmCouncil.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.deepseek.DeepSeekChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AiConfig {

    /**
     * OpenRouter is the default ChatClient. It is reached through the OpenAI-compatible
     * client with spring.ai.openai.base-url pointing at OpenRouter, so any catalog model id
     * of the form "vendor/model" is routed here.
     */
    @Bean
    @Primary
    @ConditionalOnBean(OpenAiChatModel.class)
    public ChatClient openrouterChatClient(OpenAiChatModel model) {
        return ChatClient.builder(model).build();
    }

    /**
     * Direct DeepSeek client for bare "deepseek-*" model ids.
     * Only created when a DeepSeekChatModel bean exists, so a missing DeepSeek key does not break startup.
     */
    @Bean
    @ConditionalOnBean(DeepSeekChatModel.class)
    public ChatClient deepseekChatClient(DeepSeekChatModel model) {
        return ChatClient.builder(model).build();
    }

    /**
     * If no ChatClient beans are registered (e.g. missing @ConditionalOnBean matches),
     * build a default client using OpenRouter when available, otherwise fall back to DeepSeek.
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(ChatClient.class)
    public ChatClient defaultChatClient(
            ObjectProvider<OpenAiChatModel> openAiProvider,
            ObjectProvider<DeepSeekChatModel> deepSeekProvider
    ) {
        OpenAiChatModel openAiModel = openAiProvider.getIfAvailable();
        if (openAiModel != null) {
            return ChatClient.builder(openAiModel).build();
        }

        DeepSeekChatModel deepseekModel = deepSeekProvider.getIfAvailable();
        if (deepseekModel != null) {
            return ChatClient.builder(deepseekModel).build();
        }

        throw new IllegalStateException("No ChatModel beans are available to build a ChatClient");
    }

    /**
     * Runs council pipelines off the request thread. A run outlives its subscriber so that
     * an in-flight stage can finish and checkpoint after the client disconnects.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor() {
        return Executors.newCachedThreadPool();
    }
}
