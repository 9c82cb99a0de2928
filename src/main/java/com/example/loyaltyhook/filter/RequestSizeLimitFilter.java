package com.example.loyaltyhook.filter;

import com.example.loyaltyhook.config.WebhookProperties;
import com.example.loyaltyhook.exception.PayloadTooLargeException;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;

/**
 * 限制 /webhooks/** 请求体大小。
 * 先检查 Content-Length，再包装输入流按实际读取字节计数，
 * 分块传输（无 Content-Length）的请求同样受限。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RequestSizeLimitFilter implements Filter {

    static final String WEBHOOK_PATH_PREFIX = "/webhooks/";

    private final WebhookProperties webhookProperties;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        String path = httpRequest.getRequestURI();

        if (path == null || !path.startsWith(WEBHOOK_PATH_PREFIX)) {
            chain.doFilter(request, response);
            return;
        }

        long maxBytes = webhookProperties.getMaxBodyBytes();
        long contentLength = request.getContentLengthLong();
        if (contentLength > maxBytes) {
            log.warn("Rejected request to {} with Content-Length: {}", path, contentLength);
            reject((HttpServletResponse) response);
            return;
        }

        try {
            chain.doFilter(new SizeLimitServletRequestWrapper(httpRequest, maxBytes), response);
        } catch (PayloadTooLargeException e) {
            log.warn("Stream exceeded limit for {}: read {} bytes", path, e.getBytesRead());
            if (!response.isCommitted()) {
                reject((HttpServletResponse) response);
            }
        }
    }

    private void reject(HttpServletResponse response) throws IOException {
        response.sendError(HttpServletResponse.SC_REQUEST_ENTITY_TOO_LARGE, "Payload too large");
    }

    private static class SizeLimitServletRequestWrapper extends HttpServletRequestWrapper {
        private final long maxBytes;
        private ServletInputStream inputStream;
        private BufferedReader reader;

        SizeLimitServletRequestWrapper(HttpServletRequest request, long maxBytes) {
            super(request);
            this.maxBytes = maxBytes;
        }

        @Override
        public ServletInputStream getInputStream() throws IOException {
            if (inputStream == null) {
                inputStream = new SizeLimitInputStream(super.getInputStream(), maxBytes);
            }
            return inputStream;
        }

        @Override
        public BufferedReader getReader() throws IOException {
            if (reader == null) {
                String encoding = getCharacterEncoding();
                reader = new BufferedReader(new InputStreamReader(getInputStream(),
                        encoding == null ? "UTF-8" : encoding));
            }
            return reader;
        }
    }

    private static class SizeLimitInputStream extends ServletInputStream {
        private final ServletInputStream delegate;
        private final long maxBytes;
        private long bytesRead = 0;

        SizeLimitInputStream(ServletInputStream delegate, long maxBytes) {
            this.delegate = delegate;
            this.maxBytes = maxBytes;
        }

        @Override
        public int read() throws IOException {
            int b = delegate.read();
            if (b != -1) {
                count(1);
            }
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int n = delegate.read(b, off, len);
            if (n > 0) {
                count(n);
            }
            return n;
        }

        private void count(int n) {
            bytesRead += n;
            if (bytesRead > maxBytes) {
                throw new PayloadTooLargeException(bytesRead);
            }
        }

        @Override
        public boolean isFinished() {
            return delegate.isFinished();
        }

        @Override
        public boolean isReady() {
            return delegate.isReady();
        }

        @Override
        public void setReadListener(ReadListener listener) {
            delegate.setReadListener(listener);
        }
    }
}
