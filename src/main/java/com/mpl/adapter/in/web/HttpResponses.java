package com.mpl.adapter.in.web;

import com.mpl.domain.exception.CalculationException;
import com.mpl.domain.exception.NotFoundException;
import com.mpl.domain.exception.PersistenceException;
import com.mpl.domain.exception.StaleCaseException;
import com.mpl.domain.exception.ValidationException;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes JSON responses and maps failures to HTTP status codes
 */
@Slf4j
public final class HttpResponses {

    private HttpResponses() {
    }

    public static void send(RoutingContext context, int statusCode, ApiResponse response) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(JsonObject.mapFrom(response).encode());
    }

    public static void ok(RoutingContext context, ApiResponse response) {
        send(context, 200, response);
    }

    public static void sendError(RoutingContext context, int statusCode, String message) {
        send(context, statusCode, ApiResponse.error(message));
    }

    public static void sendFailure(RoutingContext context, Throwable error) {
        int statusCode = statusFor(error);
        if (statusCode >= 500) {
            log.error("Request {} {} failed", context.request().method(), context.request().path(), error);
        } else {
            log.warn("Request {} {} rejected ({}): {}", context.request().method(), context.request().path(),
                    statusCode, error.getMessage());
        }

        if (error instanceof ValidationException validation) {
            send(context, statusCode, ApiResponse.error("Validation failed", validation.getErrors()));
        } else {
            sendError(context, statusCode, error.getMessage());
        }
    }

    public static int statusFor(Throwable error) {
        if (error instanceof ValidationException || error instanceof DecodeException) {
            return 400;
        }
        if (error instanceof NotFoundException) {
            return 404;
        }
        if (error instanceof StaleCaseException || error instanceof IllegalStateException) {
            return 409;
        }
        if (error instanceof CalculationException || error instanceof PersistenceException) {
            return 500;
        }
        if (error instanceof IllegalArgumentException) {
            return 400;
        }
        return 500;
    }

    /**
     * @return the request body, or null after answering 400 when it is missing or not JSON
     */
    public static JsonObject requireBody(RoutingContext context) {
        try {
            JsonObject body = context.body().asJsonObject();
            if (body == null) {
                log.warn("Request body is null");
                sendError(context, 400, "Request body is required");
            }
            return body;
        } catch (DecodeException e) {
            sendError(context, 400, "Invalid request format: " + e.getMessage());
            return null;
        }
    }
}
