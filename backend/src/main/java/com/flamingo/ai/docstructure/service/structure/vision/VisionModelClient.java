package com.flamingo.ai.docstructure.service.structure.vision;

import com.flamingo.ai.docstructure.exception.LlmServiceException;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import javax.imageio.ImageIO;

/** Sends one image plus an instruction prompt to a vision model and returns its text answer. */
public class VisionModelClient {

  private final ChatModel chatModel;
  private final String modelName;

  public VisionModelClient(ChatModel chatModel, String modelName) {
    this.chatModel = chatModel;
    this.modelName = modelName;
  }

  /**
   * Describes an image.
   *
   * @param image image to describe
   * @param prompt extraction instructions
   * @return the model's answer
   * @throws LlmServiceException if encoding fails or the model call fails
   */
  public String describe(BufferedImage image, String prompt) {
    String base64;
    try {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      ImageIO.write(image, "png", out);
      base64 = Base64.getEncoder().encodeToString(out.toByteArray());
    } catch (IOException e) {
      throw new LlmServiceException("Failed to encode image for " + modelName, e);
    }

    try {
      ChatResponse response =
          chatModel.chat(
              UserMessage.from(TextContent.from(prompt), ImageContent.from(base64, "image/png")));
      String text = response.aiMessage().text();
      return text == null ? "" : text;
    } catch (RuntimeException e) {
      throw new LlmServiceException("Vision model " + modelName + " failed: " + e.getMessage(), e);
    }
  }

  public String getModelName() {
    return modelName;
  }
}
