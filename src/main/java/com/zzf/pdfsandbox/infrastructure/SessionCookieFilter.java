package com.zzf.pdfsandbox.infrastructure;

import com.zzf.pdfsandbox.session.ResolvedSession;
import com.zzf.pdfsandbox.session.SessionStore;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.Cookie;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Binds every {@code /api} request to a session. The token travels in the {@value #COOKIE_NAME} cookie;
 * a missing or malformed cookie gets a fresh token and workspace.
 */
@Component
public class SessionCookieFilter extends OncePerRequestFilter {
    public static final String COOKIE_NAME = "SANDBOX_SESSION";
    public static final String SESSION_ATTRIBUTE = "sandbox.session";
    public static final String WORKSPACE_ATTRIBUTE = "sandbox.workspace";
    static final String MDC_KEY = "session";

    private final SessionStore sessionStore;

    public SessionCookieFilter(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        // admin endpoints act on other sessions and must not create one of their own
        return uri == null || !uri.startsWith("/api/") || uri.startsWith("/api/admin/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        ResolvedSession session = sessionStore.resolve(readCookie(request));
        if (session.isIssued()) {
            Cookie cookie = new Cookie(COOKIE_NAME, session.getToken());
            cookie.setHttpOnly(true);
            cookie.setPath("/");
            response.addCookie(cookie);
        }
        request.setAttribute(SESSION_ATTRIBUTE, session.getToken());
        request.setAttribute(WORKSPACE_ATTRIBUTE, session.getWorkspace());
        MDC.put(MDC_KEY, SessionStore.shortId(session.getToken()));
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    public static String token(HttpServletRequest request) {
        return (String) request.getAttribute(SESSION_ATTRIBUTE);
    }

    public static Path workspace(HttpServletRequest request) {
        return (Path) request.getAttribute(WORKSPACE_ATTRIBUTE);
    }

    private static String readCookie(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (COOKIE_NAME.equals(cookie.getName())) {
                return cookie.getValue();
            }
        }
        return null;
    }
}
