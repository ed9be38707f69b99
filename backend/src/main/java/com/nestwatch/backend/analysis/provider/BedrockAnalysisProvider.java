package com.nestwatch.backend.analysis.provider;

import com.nestwatch.backend.analysis.config.AnalysisGatewayProperties;
import com.nestwatch.backend.analysis.config.AnalysisProviderType;
import com.nestwatch.backend.analysis.provider.model.GenerationParams;
import org.springframework.ai.bedrock.converse.BedrockProxyChatModel;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;

/** AWS Bedrock through the Converse API. Credentials come from the default AWS provider chain. */
public class BedrockAnalysisProvider extends AbstractChatModelAnalysisProvider {

  private static final String DEFAULT_REGION = "us-east-1";

  public BedrockAnalysisProvider(
      String name, AnalysisGatewayProperties.Provider providerConfig, ChatModel chatModel) {
    super(name, providerConfig, chatModel);
  }

  public static BedrockAnalysisProvider create(
      String name, AnalysisGatewayProperties.Provider providerConfig) {
    Assert.state(
        providerConfig.getType() == AnalysisProviderType.BEDROCK,
        () -> "Invalid provider type for Bedrock adapter: " + providerConfig.getType());
    BedrockProxyChatModel chatModel =
        BedrockProxyChatModel.builder()
            .credentialsProvider(DefaultCredentialsProvider.create())
            .region(Region.of(resolveRegion(providerConfig)))
            .timeout(providerConfig.getTimeout())
            .defaultOptions(ToolCallingChatOptions.builder().model(providerConfig.getModel()).build())
            .build();
    return new BedrockAnalysisProvider(name, providerConfig, chatModel);
  }

  @Override
  public boolean isHealthy() {
    return super.isHealthy() && StringUtils.hasText(resolveRegion(providerConfig()));
  }

  @Override
  protected ChatOptions buildOptions(GenerationParams params) {
    return ToolCallingChatOptions.builder()
        .model(providerConfig().getModel())
        .maxTokens(params.maxTokens())
        .temperature(params.temperature())
        .build();
  }

  private static String resolveRegion(AnalysisGatewayProperties.Provider providerConfig) {
    return StringUtils.hasText(providerConfig.getRegion()) ? providerConfig.getRegion() : DEFAULT_REGION;
  }
}
