package com.nestwatch.backend.analysis.provider;

import com.nestwatch.backend.analysis.config.AnalysisGatewayProperties;
import com.nestwatch.backend.analysis.config.AnalysisProviderType;
import com.nestwatch.backend.analysis.provider.model.GenerationParams;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

public class OpenAiAnalysisProvider extends AbstractChatModelAnalysisProvider {

  public OpenAiAnalysisProvider(
      String name, AnalysisGatewayProperties.Provider providerConfig, ChatModel chatModel) {
    super(name, providerConfig, chatModel);
  }

  public static OpenAiAnalysisProvider create(
      String name, AnalysisGatewayProperties.Provider providerConfig) {
    Assert.state(
        providerConfig.getType() == AnalysisProviderType.OPENAI,
        () -> "Invalid provider type for OpenAI adapter: " + providerConfig.getType());
    OpenAiApi.Builder apiBuilder = OpenAiApi.builder();
    if (StringUtils.hasText(providerConfig.getBaseUrl())) {
      apiBuilder.baseUrl(providerConfig.getBaseUrl());
    }
    apiBuilder.apiKey(StringUtils.hasText(providerConfig.getApiKey()) ? providerConfig.getApiKey() : "unset");
    OpenAiChatModel chatModel =
        OpenAiChatModel.builder()
            .openAiApi(apiBuilder.build())
            .defaultOptions(OpenAiChatOptions.builder().model(providerConfig.getModel()).build())
            .retryTemplate(singleAttempt())
            .build();
    return new OpenAiAnalysisProvider(name, providerConfig, chatModel);
  }

  @Override
  public boolean isHealthy() {
    return super.isHealthy() && StringUtils.hasText(providerConfig().getApiKey());
  }

  @Override
  protected ChatOptions buildOptions(GenerationParams params) {
    return OpenAiChatOptions.builder()
        .model(providerConfig().getModel())
        .maxTokens(params.maxTokens())
        .temperature(params.temperature())
        .build();
  }

  // the gateway owns retries by advancing along the provider chain
  static RetryTemplate singleAttempt() {
    return RetryTemplate.builder().maxAttempts(1).build();
  }
}
