package com.shinmonzen.backend.services.invoices.vision;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionContentPart;
import com.openai.models.chat.completions.ChatCompletionContentPartImage;
import com.openai.models.chat.completions.ChatCompletionContentPartText;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.shinmonzen.backend.config.VisionModelProperties;
import com.shinmonzen.backend.services.invoices.pdf.RenderedPage;

import lombok.extern.slf4j.Slf4j;

/**
 * Chat-completions call with one text part and one base64 PNG part per page.
 */
@Slf4j
public class OpenAiVisionModelClient implements VisionModelClient {

    private final VisionModelProperties properties;

    private volatile OpenAIClient client;

    public OpenAiVisionModelClient(VisionModelProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean isAvailable() {
        return properties.isConfigured();
    }

    @Override
    public String complete(String prompt, List<RenderedPage> pages) {
        if (!isAvailable()) {
            throw new IllegalStateException("OpenAI api key is not configured");
        }

        List<ChatCompletionContentPart> parts = new ArrayList<>();
        parts.add(ChatCompletionContentPart.ofText(ChatCompletionContentPartText.builder().text(prompt).build()));
        for (RenderedPage page : pages) {
            String dataUrl = "data:image/png;base64," + Base64.getEncoder().encodeToString(page.png());
            parts.add(ChatCompletionContentPart.ofImageUrl(ChatCompletionContentPartImage.builder()
                    .imageUrl(ChatCompletionContentPartImage.ImageUrl.builder().url(dataUrl).build())
                    .build()));
        }

        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(properties.getModel())
                .maxCompletionTokens(properties.getMaxTokens())
                .addUserMessageOfArrayOfContentParts(parts)
                .build();

        long start = System.currentTimeMillis();
        try {
            ChatCompletion completion = getOrCreateClient().chat().completions().create(params);
            long elapsed = System.currentTimeMillis() - start;

            if (completion.choices().isEmpty()) {
                throw new VisionModelException("Vision model returned no choices");
            }
            ChatCompletion.Choice choice = completion.choices().get(0);
            String content = choice.message().content().orElse("");
            log.info("[VisionModel] Completed: model={} pages={} elapsedMs={} responseLen={} finishReason={}",
                    properties.getModel(), pages.size(), elapsed, content.length(), choice.finishReason());
            if (content.isBlank()) {
                throw new VisionModelException("Vision model returned an empty message");
            }
            return content;
        } catch (VisionModelException e) {
            throw e;
        } catch (RuntimeException e) {
            long elapsed = System.currentTimeMillis() - start;
            throw new VisionModelException("Vision model call failed after " + elapsed + " ms: " + e.getMessage(), e);
        }
    }

    private OpenAIClient getOrCreateClient() {
        OpenAIClient current = client;
        if (current != null) return current;

        synchronized (this) {
            if (client != null) return client;
            OpenAIOkHttpClient.Builder builder = OpenAIOkHttpClient.builder()
                    .apiKey(properties.getApiKey().trim())
                    .timeout(Duration.ofSeconds(Math.max(1, properties.getTimeoutSeconds())))
                    // never retried: a failed call ends the session with zero records
                    .maxRetries(0);
            if (properties.getBaseUrl() != null && !properties.getBaseUrl().isBlank()) {
                builder.baseUrl(properties.getBaseUrl().trim());
            }
            client = builder.build();
            return client;
        }
    }
}
