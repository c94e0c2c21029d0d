package com.aiadvent.chatcore.chat.provider;

import com.aiadvent.chatcore.chat.persistence.StoredMessage;
import com.aiadvent.chatcore.chat.stream.StreamCancelledException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.util.StringUtils;

public class SpringAiChatResponder implements ChatResponder {

  private static final int MAX_ERROR_LENGTH = 500;

  private final ChatModel chatModel;

  public SpringAiChatResponder(ChatModel chatModel) {
    this.chatModel = chatModel;
  }

  @Override
  public String streamResponse(ChatPrompt prompt, Consumer<String> onToken) {
    StringBuilder aggregate = new StringBuilder();
    try {
      chatModel
          .stream(toPrompt(prompt))
          .map(this::extractText)
          .filter(StringUtils::hasLength)
          .doOnNext(
              token -> {
                aggregate.append(token);
                onToken.accept(token);
              })
          .blockLast();
    } catch (StreamCancelledException cancelled) {
      throw cancelled;
    } catch (RuntimeException ex) {
      throw new ChatProviderException(buildErrorMessage(ex), ex);
    }
    return aggregate.toString();
  }

  Prompt toPrompt(ChatPrompt prompt) {
    List<Message> messages = new ArrayList<>(prompt.messages().size());
    for (StoredMessage message : prompt.messages()) {
      if (message.isUser()) {
        messages.add(new UserMessage(message.content()));
      } else {
        messages.add(new AssistantMessage(message.content()));
      }
    }
    return new Prompt(messages);
  }

  private String extractText(ChatResponse response) {
    if (response == null) {
      return "";
    }
    Generation generation = response.getResult();
    if (generation == null || generation.getOutput() == null) {
      return "";
    }
    String text = generation.getOutput().getText();
    return text != null ? text : "";
  }

  private String buildErrorMessage(Throwable error) {
    String message = error.getMessage();
    if (!StringUtils.hasText(message)) {
      message = error.getClass().getSimpleName();
    }
    String normalized = message.replaceAll("\\s+", " ").trim();
    if (normalized.length() > MAX_ERROR_LENGTH) {
      normalized = normalized.substring(0, MAX_ERROR_LENGTH) + "...";
    }
    return "Failed to stream response from model: " + normalized;
  }
}
