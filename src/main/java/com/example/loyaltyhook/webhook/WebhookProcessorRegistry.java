package com.example.loyaltyhook.webhook;

import com.example.loyaltyhook.model.WebhookTopic;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 主题处理器工厂：每个主题恰好绑定一个处理器。
 */
@Component
@Slf4j
public class WebhookProcessorRegistry {

    private final Map<WebhookTopic, WebhookProcessor> processors;

    public WebhookProcessorRegistry(List<WebhookProcessor> processors) {
        Map<WebhookTopic, WebhookProcessor> byTopic = new EnumMap<>(WebhookTopic.class);
        for (WebhookProcessor processor : processors) {
            WebhookProcessor previous = byTopic.put(processor.topic(), processor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate processors for topic " + processor.topic() + ": "
                        + previous.getClass().getSimpleName() + ", " + processor.getClass().getSimpleName());
            }
        }
        for (WebhookTopic topic : WebhookTopic.values()) {
            if (!byTopic.containsKey(topic)) {
                log.warn("No processor registered for webhook topic {}", topic);
            }
        }
        this.processors = Collections.unmodifiableMap(byTopic);
    }

    /**
     * 根据主题获取对应处理器。
     *
     * @param topic 主题
     * @return 处理器，未注册时为空
     */
    public Optional<WebhookProcessor> getProcessor(WebhookTopic topic) {
        return Optional.ofNullable(processors.get(topic));
    }
}
