package org.stocktake.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ 配置类
 * - 严重缺货提醒的交换机、队列、绑定
 * - 仅在 spring.rabbitmq.listener.simple.enabled=true 时启用
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "spring.rabbitmq.listener.simple.enabled", havingValue = "true", matchIfMissing = false)
public class RabbitMQConfig {

    // 严重缺货提醒交换机
    public static final String CRITICAL_ALERT_EXCHANGE = "stocktake.alert.exchange";
    // 严重缺货提醒队列（设备本地通知进程消费）
    public static final String CRITICAL_ALERT_QUEUE = "stocktake.alert.critical.queue";
    public static final String CRITICAL_ALERT_ROUTING_KEY = "stocktake.alert.critical";

    @Bean
    public DirectExchange criticalAlertExchange() {
        return new DirectExchange(CRITICAL_ALERT_EXCHANGE, true, false);
    }

    @Bean
    public Queue criticalAlertQueue() {
        return QueueBuilder.durable(CRITICAL_ALERT_QUEUE)
                // 提醒超过10分钟未消费即失去意义
                .ttl(600000)
                .build();
    }

    @Bean
    public Binding criticalAlertBinding(Queue criticalAlertQueue, DirectExchange criticalAlertExchange) {
        return BindingBuilder.bind(criticalAlertQueue)
                .to(criticalAlertExchange)
                .with(CRITICAL_ALERT_ROUTING_KEY);
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(new Jackson2JsonMessageConverter());
        rabbitTemplate.setConfirmCallback((correlationData, ack, cause) -> {
            if (!ack) {
                log.warn("[提醒消息未被Broker确认] cause={}", cause);
            }
        });
        return rabbitTemplate;
    }
}
