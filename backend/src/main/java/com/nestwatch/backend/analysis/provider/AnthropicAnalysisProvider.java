package com.nestwatch.backend.analysis.provider;

import com.nestwatch.backend.analysis.config.AnalysisGatewayProperties;
import com.nestwatch.backend.analysis.config.AnalysisProviderType;
import com.nestwatch.backend.analysis.provider.model.GenerationParams;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

public class AnthropicAnalysisProvider extends AbstractChatModelAnalysisProvider {

  public AnthropicAnalysisProvider(
      String name, AnalysisGatewayProperties.Provider providerConfig, ChatModel chatModel) {
    super(name, providerConfig, chatModel);
  }

  public static AnthropicAnalysisProvider create(
      String name, AnalysisGatewayProperties.Provider providerConfig) {
    Assert.state(
        providerConfig.getType() == AnalysisProviderType.ANTHROPIC,
        () -> "Invalid provider type for Anthropic adapter: " + providerConfig.getType());
    AnthropicApi.Builder apiBuilder = AnthropicApi.builder();
    if (StringUtils.hasText(providerConfig.getBaseUrl())) {
      apiBuilder.baseUrl(providerConfig.getBaseUrl());
    }
    apiBuilder.apiKey(StringUtils.hasText(providerConfig.getApiKey()) ? providerConfig.getApiKey() : "unset");
    AnthropicChatModel chatModel =
        AnthropicChatModel.builder()
            .anthropicApi(apiBuilder.build())
            .defaultOptions(AnthropicChatOptions.builder().model(providerConfig.getModel()).build())
            .retryTemplate(OpenAiAnalysisProvider.singleAttempt())
            .build();
    return new AnthropicAnalysisProvider(name, providerConfig, chatModel);
  }

  @Override
  public boolean isHealthy() {
    return super.isHealthy() && StringUtils.hasText(providerConfig().getApiKey());
  }

  @Override
  protected ChatOptions buildOptions(GenerationParams params) {
    return AnthropicChatOptions.builder()
        .model(providerConfig().getModel())
        .maxTokens(params.maxTokens())
        .temperature(params.temperature())
        .build();
  }
}
