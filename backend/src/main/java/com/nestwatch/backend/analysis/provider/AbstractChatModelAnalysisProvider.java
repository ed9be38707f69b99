package com.nestwatch.backend.analysis.provider;

import com.nestwatch.backend.analysis.config.AnalysisGatewayProperties;
import com.nestwatch.backend.analysis.provider.model.AnalysisPrompt;
import com.nestwatch.backend.analysis.provider.model.GenerationParams;
import com.nestwatch.backend.analysis.provider.model.ProviderCompletion;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/** Shared plumbing for providers backed by a Spring AI {@link ChatModel}. */
public abstract class AbstractChatModelAnalysisProvider implements AnalysisProvider {

  private static final Logger log = LoggerFactory.getLogger(AbstractChatModelAnalysisProvider.class);

  private final String name;
  private final AnalysisGatewayProperties.Provider providerConfig;
  private final ChatModel chatModel;

  protected AbstractChatModelAnalysisProvider(
      String name, AnalysisGatewayProperties.Provider providerConfig, ChatModel chatModel) {
    Assert.hasText(name, "name must not be blank");
    Assert.notNull(providerConfig, "providerConfig must not be null");
    Assert.notNull(chatModel, "chatModel must not be null");
    this.name = name;
    this.providerConfig = providerConfig;
    this.chatModel = chatModel;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public String model() {
    return providerConfig.getModel();
  }

  @Override
  public boolean isHealthy() {
    return providerConfig.isEnabled() && StringUtils.hasText(providerConfig.getModel());
  }

  protected AnalysisGatewayProperties.Provider providerConfig() {
    return providerConfig;
  }

  protected abstract ChatOptions buildOptions(GenerationParams params);

  @Override
  public ProviderCompletion generate(AnalysisPrompt prompt, GenerationParams params) {
    GenerationParams effective =
        params.withOverrides(providerConfig.getMaxTokens(), providerConfig.getTemperature());
    List<Message> messages = new ArrayList<>(2);
    if (StringUtils.hasText(prompt.systemText())) {
      messages.add(new SystemMessage(prompt.systemText()));
    }
    messages.add(new UserMessage(prompt.userText()));

    ChatResponse response;
    try {
      response = chatModel.call(new Prompt(messages, buildOptions(effective)));
    } catch (RuntimeException ex) {
      ProviderException failure = ProviderErrorClassifier.toProviderException(name, ex);
      log.debug("Provider '{}' call failed with {}", name, failure.kind());
      throw failure;
    }
    return toCompletion(response);
  }

  private ProviderCompletion toCompletion(ChatResponse response) {
    Generation generation = response != null ? response.getResult() : null;
    String text =
        generation != null && generation.getOutput() != null ? generation.getOutput().getText() : null;
    if (!StringUtils.hasText(text)) {
      throw ProviderException.invalidResponse(name, "Provider returned an empty completion");
    }
    ChatResponseMetadata metadata = response.getMetadata();
    Usage usage = metadata != null ? metadata.getUsage() : null;
    String model =
        metadata != null && StringUtils.hasText(metadata.getModel()) ? metadata.getModel() : model();
    if (usage == null) {
      return new ProviderCompletion(text, model, null, null, null);
    }
    Integer promptTokens = positiveOrNull(usage.getPromptTokens());
    Integer completionTokens = positiveOrNull(usage.getCompletionTokens());
    Integer totalTokens = positiveOrNull(usage.getTotalTokens());
    return new ProviderCompletion(text, model, promptTokens, completionTokens, totalTokens);
  }

  // EmptyUsage reports zeros rather than nulls
  private Integer positiveOrNull(Number value) {
    if (value == null || value.longValue() <= 0) {
      return null;
    }
    return Math.toIntExact(value.longValue());
  }
}
