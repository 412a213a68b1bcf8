package com.autonomous.socialcrew.service;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class SlackService {

    @Value("${slack.bot.token:}")
    private String slackBotToken;

    private final Slack slack = Slack.getInstance();

    /**
     * Posts a message to a channel and returns the message timestamp, or null when Slack
     * rejected it.
     */
    public String postMessage(String channel, String message) {
        try {
            MethodsClient methods = slack.methods(slackBotToken);

            ChatPostMessageRequest request = ChatPostMessageRequest.builder()
                .channel(channel)
                .text(message)
                .build();

            ChatPostMessageResponse response = methods.chatPostMessage(request);

            if (response.isOk()) {
                return response.getTs();
            } else {
                log.warn("Failed to post message to {}: {}", channel, response.getError());
                return null;
            }
        } catch (Exception e) {
            log.warn("Failed to post message to {}: {}", channel, e.getMessage());
            return null;
        }
    }
}
