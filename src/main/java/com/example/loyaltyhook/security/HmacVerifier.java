package com.example.loyaltyhook.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * HMAC-SHA256 验签实现（Base64 编码摘要）。
 */
@Component
@Slf4j
public class HmacVerifier implements VerifierStrategy {

    private static final String HMAC_SHA256 = "HmacSHA256";
    private static final String SIGNATURE_PREFIX = "sha256=";

    /**
     * 校验 HMAC 签名。
     *
     * @param rawBody         原始请求体
     * @param signatureHeader 签名请求头
     * @param secret          共享密钥
     * @return 校验通过返回 true
     */
    @Override
    public boolean verify(byte[] rawBody, String signatureHeader, String secret) {
        if (rawBody == null) {
            return false;
        }
        if (secret == null || secret.isEmpty()) {
            log.warn("HMAC verification failed: shared secret is not configured");
            return false;
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            log.warn("HMAC verification failed: signature header missing");
            return false;
        }

        try {
            // 1. 计算期望的 HMAC
            String expected = calculateHmac(rawBody, secret);

            // 2. 规范化签名（去掉 "sha256=" 前缀）
            String cleanSignature = signatureHeader.trim();
            if (cleanSignature.startsWith(SIGNATURE_PREFIX)) {
                cleanSignature = cleanSignature.substring(SIGNATURE_PREFIX.length());
            }

            // 3. 常量时间比较，防止计时攻击
            return MessageDigest.isEqual(
                    cleanSignature.getBytes(StandardCharsets.UTF_8),
                    expected.getBytes(StandardCharsets.UTF_8));

        } catch (GeneralSecurityException e) {
            log.error("HMAC verification error", e);
            return false;
        }
    }

    /**
     * 计算 HMAC 值。
     *
     * @param data 原文字节
     * @param key  密钥
     * @return Base64 编码的 HMAC
     */
    public String calculateHmac(byte[] data, String key) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(HMAC_SHA256);
        mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
        return Base64.getEncoder().encodeToString(mac.doFinal(data));
    }
}
