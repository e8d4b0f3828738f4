package com.flamingo.ai.docstructure.service.structure.vision;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.docstructure.exception.LlmServiceException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.awt.image.BufferedImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("VisionModelClient Tests")
class VisionModelClientTest {

  @Mock private ChatModel chatModel;

  private VisionModelClient client;
  private final BufferedImage image = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);

  @BeforeEach
  void setUp() {
    client = new VisionModelClient(chatModel, "gpt-4o");
  }

  @Test
  @DisplayName("should send the prompt and a PNG image in one user message")
  void shouldSendPromptAndImage() {
    when(chatModel.chat(any(ChatMessage.class)))
        .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("| a | b |")).build());

    String answer = client.describe(image, "extract the text");

    assertThat(answer).isEqualTo("| a | b |");
    ArgumentCaptor<ChatMessage> captor = ArgumentCaptor.forClass(ChatMessage.class);
    verify(chatModel).chat(captor.capture());
    UserMessage message = (UserMessage) captor.getValue();
    assertThat(message.contents()).hasSize(2);
    assertThat(((TextContent) message.contents().get(0)).text()).isEqualTo("extract the text");
    ImageContent imageContent = (ImageContent) message.contents().get(1);
    assertThat(imageContent.image().mimeType()).isEqualTo("image/png");
    assertThat(imageContent.image().base64Data()).isNotBlank();
  }

  @Test
  @DisplayName("should wrap model failures")
  void shouldWrapFailures() {
    when(chatModel.chat(any(ChatMessage.class))).thenThrow(new RuntimeException("timeout"));

    assertThatThrownBy(() -> client.describe(image, "extract"))
        .isInstanceOf(LlmServiceException.class)
        .hasMessageContaining("gpt-4o")
        .hasMessageContaining("timeout");
  }
}
