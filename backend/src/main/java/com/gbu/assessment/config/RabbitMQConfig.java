package com.gbu.assessment.config;

import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RabbitMQConfig {

    public static final String PROFILE_SCORE_QUEUE = "profile.aptitude-score";

    // Dead-letter infrastructure for score updates the profile service rejects
    public static final String PROFILE_DLX_NAME = "profile.dlx";
    public static final String PROFILE_SCORE_DLQ = "profile.aptitude-score.dlq";

    @Value("${profile-sync.exchange:profile.exchange}")
    private String profileExchange;

    @Value("${profile-sync.routing-key:profile.aptitude-score}")
    private String profileRoutingKey;

    @Bean
    public DirectExchange profileExchange() {
        return ExchangeBuilder.directExchange(profileExchange).durable(true).build();
    }

    @Bean
    public Queue profileScoreQueue() {
        return QueueBuilder.durable(PROFILE_SCORE_QUEUE)
                .withArgument("x-dead-letter-exchange", PROFILE_DLX_NAME)
                .withArgument("x-dead-letter-routing-key", PROFILE_SCORE_QUEUE)
                .build();
    }

    @Bean
    public DirectExchange profileDeadLetterExchange() {
        return ExchangeBuilder.directExchange(PROFILE_DLX_NAME).durable(true).build();
    }

    @Bean
    public Queue profileScoreDlq() {
        return QueueBuilder.durable(PROFILE_SCORE_DLQ).build();
    }

    @Bean
    public Binding profileScoreDlqBinding() {
        return BindingBuilder.bind(profileScoreDlq())
                .to(profileDeadLetterExchange())
                .with(PROFILE_SCORE_QUEUE);
    }

    @Bean
    public Binding profileScoreBinding() {
        return BindingBuilder.bind(profileScoreQueue()).to(profileExchange()).with(profileRoutingKey);
    }

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(jsonMessageConverter());
        return template;
    }
}
