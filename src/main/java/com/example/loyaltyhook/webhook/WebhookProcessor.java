package com.example.loyaltyhook.webhook;

import com.example.loyaltyhook.model.ProcessingResult;
import com.example.loyaltyhook.model.WebhookContext;
import com.example.loyaltyhook.model.WebhookTopic;

/**
 * 单个 Webhook 主题的业务处理。
 * 实现只关心业务本身，验签、解析、异常兜底与响应渲染由 {@link WebhookHandler} 统一完成。
 */
public interface WebhookProcessor {

    WebhookTopic topic();

    /**
     * Process a verified, parsed delivery.
     * Validation problems and business no-ops are reported through the result;
     * backend failures may be thrown and are converted by the handler.
     */
    ProcessingResult processWebhook(WebhookContext context);
}
