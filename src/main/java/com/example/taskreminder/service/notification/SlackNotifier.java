package com.example.taskreminder.service.notification;

import com.example.taskreminder.config.SlackProperties;
import com.example.taskreminder.exception.ExternalServiceException;
import com.slack.api.Slack;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Delivers reminder messages to a Slack channel through chat.postMessage.
 * <p>
 * The task's chat id is used as the Slack channel id. Failed calls throw
 * {@link ExternalServiceException}; the circuit breaker records them and its
 * fallback turns any failure, including an open circuit, into {@code false}.
 */
@Slf4j
@Service
public class SlackNotifier implements Notifier {

    private final SlackProperties slackProperties;
    private final Slack slack;

    @Autowired
    public SlackNotifier(SlackProperties slackProperties) {
        this(slackProperties, Slack.getInstance());
    }

    SlackNotifier(SlackProperties slackProperties, Slack slack) {
        this.slackProperties = slackProperties;
        this.slack = slack;
    }

    @Override
    @CircuitBreaker(name = "slack", fallbackMethod = "sendFallback")
    public boolean send(String chatId, String text) {
        if (!slackProperties.isEnabled() || slackProperties.getBotToken() == null || slackProperties.getBotToken().isBlank()) {
            log.warn("Slack delivery is disabled or bot token not configured. Message for chat {} was not sent.", chatId);
            return false;
        }

        try {
            var request = ChatPostMessageRequest.builder()
                    .channel(chatId)
                    .text(text)
                    .mrkdwn(true)
                    .build();
            var response = slack.methods(slackProperties.getBotToken()).chatPostMessage(request);

            if (!response.isOk()) {
                throw new ExternalServiceException("Slack", "chat.postMessage to " + chatId + " failed: " + response.getError());
            }

            log.info("Message delivered to Slack chat {}", chatId);
            return true;
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error sending Slack message to chat {}: {}", chatId, e.getMessage());
            throw new ExternalServiceException("Slack", e);
        }
    }

    @SuppressWarnings("unused")
    private boolean sendFallback(String chatId, String text, Throwable t) {
        log.warn("Slack delivery to chat {} failed: {}", chatId, t.getMessage());
        return false;
    }
}
