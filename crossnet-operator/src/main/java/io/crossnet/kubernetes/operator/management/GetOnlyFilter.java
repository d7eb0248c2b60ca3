/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.management;

import java.io.IOException;
import java.net.HttpURLConnection;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;

/**
 * Answers every request that is not a {@code GET} with {@code 405 Method Not Allowed}, and passes
 * {@code GET}s down the chain. The request body is never read.
 */
public final class GetOnlyFilter extends Filter {

    public static final Filter INSTANCE = new GetOnlyFilter();

    static final String ALLOWED_METHOD = "GET";

    private GetOnlyFilter() {
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        if (ALLOWED_METHOD.equalsIgnoreCase(exchange.getRequestMethod())) {
            chain.doFilter(exchange);
            return;
        }
        try (exchange) {
            exchange.getResponseHeaders().add("Allow", ALLOWED_METHOD);
            exchange.sendResponseHeaders(HttpURLConnection.HTTP_BAD_METHOD, -1);
        }
    }

    @Override
    public String description() {
        return "rejects methods other than GET";
    }
}
