package com.eventengine.cockpit.api;

import com.eventengine.cockpit.facade.UnknownAggregateTypeException;
import com.eventengine.cockpit.schema.ConfigurationIntegrityException;
import com.eventengine.platform.engine.AggregateNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Translates cockpit failures into JSON error responses: {@code {"error": "<message>"}}.
 */
final class ErrorResponses {

    private static final Logger log = LoggerFactory.getLogger(ErrorResponses.class);

    private ErrorResponses() {}

    static HttpStatus statusOf(Throwable error) {
        if (error instanceof UnresolvedRouteException
                || error instanceof UnknownAggregateTypeException
                || error instanceof AggregateNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (error instanceof MissingParameterException || error instanceof InvalidParameterException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static ResponseEntity<Object> from(Throwable error) {
        HttpStatus status = statusOf(error);
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();

        if (status.is5xxServerError()) {
            if (error instanceof ConfigurationIntegrityException) {
                log.error("Engine configuration is inconsistent: {}", message);
            } else {
                log.error("Cockpit request failed", error);
            }
        } else {
            log.warn("Cockpit request rejected ({}): {}", status.value(), message);
        }

        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
