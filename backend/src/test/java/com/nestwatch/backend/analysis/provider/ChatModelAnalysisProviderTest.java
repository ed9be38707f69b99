package com.nestwatch.backend.analysis.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.nestwatch.backend.analysis.config.AnalysisGatewayProperties;
import com.nestwatch.backend.analysis.config.AnalysisProviderType;
import com.nestwatch.backend.analysis.provider.model.AnalysisPrompt;
import com.nestwatch.backend.analysis.provider.model.GenerationParams;
import com.nestwatch.backend.analysis.provider.model.ProviderCompletion;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.openai.OpenAiChatOptions;

class ChatModelAnalysisProviderTest {

  private static final AnalysisPrompt PROMPT = new AnalysisPrompt("system rules", "Context:\nTotals=1");
  private static final GenerationParams PARAMS = new GenerationParams(600, 0.0);

  private ChatModel chatModel;

  @BeforeEach
  void setUp() {
    chatModel = mock(ChatModel.class);
  }

  @Test
  void openAiAdapterSendsBothMessagesAndCappedOptions() {
    AnalysisGatewayProperties.Provider config = config(AnalysisProviderType.OPENAI, "gpt-4o-mini");
    config.setApiKey("sk-test");
    config.setMaxTokens(300);
    when(chatModel.call(any(Prompt.class))).thenReturn(response("{}", 120, 40));
    OpenAiAnalysisProvider provider = new OpenAiAnalysisProvider("openai", config, chatModel);

    ProviderCompletion completion = provider.generate(PROMPT, PARAMS);

    ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
    verify(chatModel).call(captor.capture());
    Prompt sent = captor.getValue();
    assertThat(sent.getInstructions())
        .extracting(message -> message.getMessageType())
        .containsExactly(MessageType.SYSTEM, MessageType.USER);
    assertThat(sent.getOptions()).isInstanceOf(OpenAiChatOptions.class);
    OpenAiChatOptions options = (OpenAiChatOptions) sent.getOptions();
    assertThat(options.getModel()).isEqualTo("gpt-4o-mini");
    assertThat(options.getMaxTokens()).isEqualTo(300);
    assertThat(options.getTemperature()).isEqualTo(0.0);
    assertThat(completion.text()).isEqualTo("{}");
    assertThat(completion.promptTokens()).isEqualTo(120);
    assertThat(completion.completionTokens()).isEqualTo(40);
    assertThat(completion.hasNativeUsage()).isTrue();
    assertThat(provider.isHealthy()).isTrue();
  }

  @Test
  void anthropicAdapterUsesAnthropicOptions() {
    AnalysisGatewayProperties.Provider config = config(AnalysisProviderType.ANTHROPIC, "claude-3-5-sonnet-20241022");
    config.setTemperature(0.2);
    when(chatModel.call(any(Prompt.class))).thenReturn(response("{}", 0, 0));
    AnthropicAnalysisProvider provider = new AnthropicAnalysisProvider("anthropic", config, chatModel);

    ProviderCompletion completion = provider.generate(PROMPT, PARAMS);

    ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
    verify(chatModel).call(captor.capture());
    AnthropicChatOptions options = (AnthropicChatOptions) captor.getValue().getOptions();
    assertThat(options.getMaxTokens()).isEqualTo(600);
    assertThat(options.getTemperature()).isEqualTo(0.2);
    assertThat(completion.hasNativeUsage()).isFalse();
    assertThat(provider.isHealthy()).isFalse();
  }

  @Test
  void localAdapterUsesOllamaOptions() {
    AnalysisGatewayProperties.Provider config = config(AnalysisProviderType.LOCAL, "llama3.1:8b");
    when(chatModel.call(any(Prompt.class))).thenReturn(response("{}", 10, 5));
    LocalAnalysisProvider provider = new LocalAnalysisProvider("nemo_local", config, chatModel);

    provider.generate(PROMPT, PARAMS);

    ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
    verify(chatModel).call(captor.capture());
    OllamaOptions options = (OllamaOptions) captor.getValue().getOptions();
    assertThat(options.getModel()).isEqualTo("llama3.1:8b");
    assertThat(options.getNumPredict()).isEqualTo(600);
    assertThat(provider.isHealthy()).isTrue();
  }

  @Test
  void vendorErrorsBecomeProviderExceptions() {
    AnalysisGatewayProperties.Provider config = config(AnalysisProviderType.OPENAI, "gpt-4o-mini");
    when(chatModel.call(any(Prompt.class)))
        .thenThrow(new RuntimeException("429 - {\"error\":{\"code\":\"insufficient_quota\"}}"));
    OpenAiAnalysisProvider provider = new OpenAiAnalysisProvider("openai", config, chatModel);

    assertThatThrownBy(() -> provider.generate(PROMPT, PARAMS))
        .isInstanceOfSatisfying(
            ProviderException.class,
            ex -> {
              assertThat(ex.provider()).isEqualTo("openai");
              assertThat(ex.kind()).isEqualTo(ProviderErrorKind.QUOTA_EXHAUSTED);
            });
  }

  @Test
  void blankCompletionIsInvalidResponse() {
    AnalysisGatewayProperties.Provider config = config(AnalysisProviderType.OPENAI, "gpt-4o-mini");
    when(chatModel.call(any(Prompt.class))).thenReturn(response(" ", 0, 0));
    OpenAiAnalysisProvider provider = new OpenAiAnalysisProvider("openai", config, chatModel);

    assertThatThrownBy(() -> provider.generate(PROMPT, PARAMS))
        .isInstanceOfSatisfying(
            ProviderException.class, ex -> assertThat(ex.kind()).isEqualTo(ProviderErrorKind.INVALID_RESPONSE));
  }

  private static AnalysisGatewayProperties.Provider config(AnalysisProviderType type, String model) {
    AnalysisGatewayProperties.Provider config = new AnalysisGatewayProperties.Provider();
    config.setType(type);
    config.setModel(model);
    return config;
  }

  private static ChatResponse response(String text, int promptTokens, int completionTokens) {
    ChatResponseMetadata metadata =
        ChatResponseMetadata.builder()
            .usage(new DefaultUsage(promptTokens, completionTokens, promptTokens + completionTokens))
            .build();
    return new ChatResponse(List.of(new Generation(new AssistantMessage(text))), metadata);
  }
}
