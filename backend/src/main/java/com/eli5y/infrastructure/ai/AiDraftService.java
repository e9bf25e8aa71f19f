package com.eli5y.infrastructure.ai;

import com.eli5y.domain.formula.model.FormulaDraft;
import com.eli5y.domain.formula.service.DraftService;
import com.openai.client.OpenAIClient;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Asks OpenAI for a first-draft explanation of a formula.
 * The reply is parsed but not checked against the formula; that is the aligner's job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiDraftService implements DraftService {

    private final OpenAIClient openAIClient;
    private final PromptBuilder promptBuilder;
    private final DraftParser draftParser;

    @Value("${openai.model}")
    private String model;

    @Value("${openai.max-tokens}")
    private int maxTokens;

    @PostConstruct
    void logSystemPromptInfo() {
        String systemPrompt = promptBuilder.getSystemPrompt();
        int estimatedTokens = systemPrompt.length() / 4;
        log.info("Draft system prompt length: {} chars, estimated ~{} tokens", systemPrompt.length(), estimatedTokens);
    }

    @Override
    public FormulaDraft draft(String latex) {
        long start = System.currentTimeMillis();
        LlmCallResult result = callOpenAI(promptBuilder.getSystemPrompt(), promptBuilder.buildDraftUserMessage(latex));
        long elapsed = System.currentTimeMillis() - start;

        FormulaDraft draft = draftParser.parse(result.content());
        log.info("Draft: {}ms | {} components | in={} out={} (reasoning={}) tokens",
                elapsed, draft.components().size(),
                result.promptTokens(), result.completionTokens(), result.reasoningTokens());
        return draft;
    }

    /**
     * Raw OpenAI call with JSON output.
     */
    public LlmCallResult callOpenAI(String systemPrompt, String userMessage) {
        try {
            ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                    .model(model)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(systemPrompt)
                    .addUserMessage(userMessage)
                    .responseFormat(ResponseFormatJsonObject.builder().build())
                    .build();

            ChatCompletion completion = openAIClient.chat().completions().create(params);

            long promptTokens = 0;
            long completionTokens = 0;
            long reasoningTokens = 0;

            if (completion.usage().isPresent()) {
                var usage = completion.usage().get();
                promptTokens = usage.promptTokens();
                completionTokens = usage.completionTokens();
                reasoningTokens = usage.completionTokensDetails()
                        .flatMap(d -> d.reasoningTokens())
                        .orElse(0L);
            }

            String content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElseThrow(() -> new AiDraftException("OpenAI response has no content"));

            return new LlmCallResult(content.trim(), promptTokens, completionTokens, reasoningTokens);
        } catch (AiDraftException e) {
            throw e;
        } catch (Exception e) {
            log.error("OpenAI API call failed [{}]", model, e);
            throw new AiDraftException("Formula explanation service is temporarily unavailable", e);
        }
    }
}
