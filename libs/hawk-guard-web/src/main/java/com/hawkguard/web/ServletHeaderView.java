package com.hawkguard.web;

import com.hawkguard.guard.HeaderView;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/**
 * {@link HeaderView} over a servlet request. The container matches names ignoring case.
 */
public final class ServletHeaderView implements HeaderView {

    private final HttpServletRequest request;

    public ServletHeaderView(HttpServletRequest request) {
        this.request = request;
    }

    @Override
    public List<String> values(String name) {
        Enumeration<String> values = request.getHeaders(name);
        return values == null ? List.of() : Collections.list(values);
    }
}
