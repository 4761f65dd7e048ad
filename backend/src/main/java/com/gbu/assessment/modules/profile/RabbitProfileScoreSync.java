package com.gbu.assessment.modules.profile;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.UUID;

/**
 * Publishes score updates to the profile exchange. A broker outage costs the
 * update, never the submit that triggered it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RabbitProfileScoreSync implements ProfileScoreSync {

    private final RabbitTemplate rabbitTemplate;
    private final Clock clock;

    @Value("${profile-sync.exchange:profile.exchange}")
    private String exchange;

    @Value("${profile-sync.routing-key:profile.aptitude-score}")
    private String routingKey;

    @Override
    public void updateAptitudeScore(UUID userId, BigDecimal score) {
        AptitudeScoreMessage message = new AptitudeScoreMessage(userId, score, clock.instant());
        try {
            rabbitTemplate.convertAndSend(exchange, routingKey, message);
            log.debug("Published aptitude score {} for user {}", score, userId);
        } catch (AmqpException e) {
            log.warn("Failed to publish aptitude score for user {}: {}", userId, e.getMessage());
        }
    }
}
