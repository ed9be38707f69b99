package com.nestwatch.backend.analysis.provider;

import com.nestwatch.backend.analysis.config.AnalysisGatewayProperties;
import com.nestwatch.backend.analysis.config.AnalysisProviderType;
import com.nestwatch.backend.analysis.provider.model.GenerationParams;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/** Self-hosted model served through an Ollama-compatible runtime. No data leaves the cluster. */
public class LocalAnalysisProvider extends AbstractChatModelAnalysisProvider {

  private static final String DEFAULT_BASE_URL = "http://localhost:11434";

  public LocalAnalysisProvider(
      String name, AnalysisGatewayProperties.Provider providerConfig, ChatModel chatModel) {
    super(name, providerConfig, chatModel);
  }

  public static LocalAnalysisProvider create(
      String name, AnalysisGatewayProperties.Provider providerConfig) {
    Assert.state(
        providerConfig.getType() == AnalysisProviderType.LOCAL,
        () -> "Invalid provider type for local adapter: " + providerConfig.getType());
    String baseUrl =
        StringUtils.hasText(providerConfig.getBaseUrl()) ? providerConfig.getBaseUrl() : DEFAULT_BASE_URL;
    OllamaChatModel chatModel =
        OllamaChatModel.builder()
            .ollamaApi(OllamaApi.builder().baseUrl(baseUrl).build())
            .defaultOptions(OllamaOptions.builder().model(providerConfig.getModel()).build())
            .build();
    return new LocalAnalysisProvider(name, providerConfig, chatModel);
  }

  @Override
  protected ChatOptions buildOptions(GenerationParams params) {
    return OllamaOptions.builder()
        .model(providerConfig().getModel())
        .numPredict(params.maxTokens())
        .temperature(params.temperature())
        .build();
  }
}
