package com.aiadvent.chatcore.chat.provider;

import java.util.function.Consumer;

/**
 * Produces one assistant response token by token.
 *
 * <p>Implementations block the calling thread until the response is finished, hand every token
 * to {@code onToken} in the order it was produced and return the aggregated text. An exception
 * thrown by {@code onToken} must abort the response and propagate unchanged.
 */
public interface ChatResponder {

  String streamResponse(ChatPrompt prompt, Consumer<String> onToken);
}
