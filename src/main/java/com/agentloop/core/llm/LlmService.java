package com.agentloop.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Thin wrapper over Spring AI's {@link ChatClient} used by the planner, summarizer and
 * reflector adapters.
 * <p>
 * Structured calls append the JSON schema of the target type to the user prompt via
 * {@link BeanOutputConverter}; when the converter rejects the answer, a lenient Jackson
 * parse of the (possibly fenced) JSON is tried before giving up.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final ObjectMapper lenientMapper;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.chat.options.model:default}") String model) {
        this.chatClient = builder.build();
        this.lenientMapper = new ObjectMapper()
                .registerModule(new ParameterNamesModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        log.info("LlmService initialized, model: {}", model);
    }

    /**
     * Sends a system and user prompt and maps the JSON answer onto {@code outputType}.
     *
     * @throws LlmEmptyResponseException if the model returns nothing
     * @throws LlmParseException if the answer cannot be parsed
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        var converter = new BeanOutputConverter<>(outputType);
        String response = call(systemPrompt, userPrompt + "\n\n" + converter.getFormat(), outputType.getSimpleName());
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Converter rejected response for {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseLeniently(response, outputType);
        }
    }

    /**
     * Sends a system and user prompt and returns the answer text, stripped.
     *
     * @throws LlmEmptyResponseException if the model returns nothing
     */
    public String textCall(String systemPrompt, String userPrompt) {
        return call(systemPrompt, userPrompt, "text").strip();
    }

    private String call(String systemPrompt, String userPrompt, String expected) {
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
        log.info("LLM call complete -> {} ({}s)", expected,
                String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException(expected);
        }
        return response;
    }

    <T> T parseLeniently(String json, Class<T> outputType) {
        String cleaned = stripFences(json);
        try {
            T result = lenientMapper.readValue(cleaned, outputType);
            log.info("Lenient parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e) {
            log.error("Lenient parsing failed for {}: {}", outputType.getSimpleName(), e.getMessage());
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), json, e);
        }
    }

    static String stripFences(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
