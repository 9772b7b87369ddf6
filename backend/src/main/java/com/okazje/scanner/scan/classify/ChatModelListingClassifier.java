package com.okazje.scanner.scan.classify;

import com.okazje.scanner.scan.model.Listing;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class ChatModelListingClassifier implements ListingClassifier {
    private static final Logger log = LoggerFactory.getLogger(ChatModelListingClassifier.class);

    private final ChatModel chatModel;
    private final ListingPromptBuilder promptBuilder;

    public ChatModelListingClassifier(ChatModel chatModel, ListingPromptBuilder promptBuilder) {
        this.chatModel = chatModel;
        this.promptBuilder = promptBuilder;
    }

    @Override
    public String classify(Listing listing) {
        ChatResponse response;
        try {
            response = chatModel.chat(List.of(
                SystemMessage.from(promptBuilder.systemPrompt()),
                UserMessage.from(promptBuilder.userPrompt(listing))
            ));
        } catch (RuntimeException e) {
            log.warn("Classifier call failed for {}: {}", listing.id(), e.getMessage());
            throw new ClassifierException(e.getMessage(), e);
        }
        if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
            throw new ClassifierException("empty response from model");
        }
        return response.aiMessage().text();
    }
}
