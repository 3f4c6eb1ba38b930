package net.fiddleserver.support.security;

import lombok.extern.slf4j.Slf4j;
import net.fiddleserver.application.sandbox.AntiForgeryTokenProvider;
import org.springframework.security.web.csrf.CsrfToken;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Reads the CSRF token Spring Security attached to the current servlet request.
 */
@Component
@Slf4j
public class CsrfRequestTokenProvider implements AntiForgeryTokenProvider {

    @Override
    public String currentToken() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes servletAttributes)) {
            throw new IllegalStateException("Anti-forgery token requested outside of a servlet request");
        }
        Object token = servletAttributes.getRequest().getAttribute(CsrfToken.class.getName());
        if (token instanceof CsrfToken csrfToken) {
            return csrfToken.getToken();
        }
        log.debug("No CSRF token bound to request {}; rendering an empty anti-forgery token",
            servletAttributes.getRequest().getRequestURI());
        return "";
    }
}
