package dev.onboarding.backend;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.onboarding.config.AnalysisSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Backend for OpenAI-compatible chat models. Every request asks for a JSON-object reply and
 * returns the text of the model's message.
 */
public final class OpenAiChatBackend implements TextBackend {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatBackend.class);

    private final ChatModel chatModel;
    private final String modelName;

    public OpenAiChatBackend(ChatModel chatModel, String modelName) {
        this.chatModel = chatModel;
        this.modelName = modelName;
    }

    public static OpenAiChatBackend fromSettings(AnalysisSettings settings) {
        ChatModel model = OpenAiChatModel.builder()
            .baseUrl(settings.baseUrl())
            .apiKey(settings.apiKey())
            .modelName(settings.model())
            .temperature(settings.temperature())
            .timeout(settings.requestTimeout())
            .build();
        return new OpenAiChatBackend(model, settings.model());
    }

    @Override
    public String invoke(String systemInstruction, String userContent, int maxTokens) throws BackendException {
        ChatRequest request = ChatRequest.builder()
            .messages(SystemMessage.from(systemInstruction), UserMessage.from(userContent))
            .maxOutputTokens(maxTokens)
            .responseFormat(ResponseFormat.JSON)
            .build();

        long start = System.currentTimeMillis();
        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException e) {
            throw new BackendException(describe(e), e);
        }
        log.debug("Model {} replied in {} ms", modelName, System.currentTimeMillis() - start);

        AiMessage message = response == null ? null : response.aiMessage();
        String text = message == null ? null : message.text();
        if (text == null || text.isBlank()) {
            throw new BackendException("Model returned empty content");
        }
        return text;
    }

    @Override
    public String getName() {
        return "openai:" + modelName;
    }

    private static String describe(RuntimeException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
