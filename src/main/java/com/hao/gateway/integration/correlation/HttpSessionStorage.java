package com.hao.gateway.integration.correlation;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Optional;

/**
 * 基于 Servlet HttpSession 的会话存储
 *
 * 从 RequestContextHolder 取当前请求；不在请求线程上时视为会话不可用。
 */
@Component
public class HttpSessionStorage implements SessionStorage {

    @Override
    public Optional<String> get(String key) {
        HttpSession session = currentRequest().getSession(false);
        if (session == null) {
            return Optional.empty();
        }
        Object value = session.getAttribute(key);
        return value instanceof String ? Optional.of((String) value) : Optional.empty();
    }

    @Override
    public void set(String key, String value) {
        currentRequest().getSession(true).setAttribute(key, value);
    }

    @Override
    public void remove(String key) {
        HttpSession session = currentRequest().getSession(false);
        if (session != null) {
            session.removeAttribute(key);
        }
    }

    private HttpServletRequest currentRequest() {
        ServletRequestAttributes attributes =
                (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            throw new SessionStorageUnavailableException("No request bound to the current thread");
        }
        return attributes.getRequest();
    }
}
