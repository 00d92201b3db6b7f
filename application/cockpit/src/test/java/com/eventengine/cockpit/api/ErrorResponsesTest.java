package com.eventengine.cockpit.api;

import com.eventengine.cockpit.facade.UnknownAggregateTypeException;
import com.eventengine.cockpit.schema.ConfigurationIntegrityException;
import com.eventengine.cockpit.schema.ConfigurationIntegrityException.Kind;
import com.eventengine.platform.engine.AggregateNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorResponsesTest {

    @Test
    void clientFaultsMapTo4xx() {
        assertThat(ErrorResponses.statusOf(new UnresolvedRouteException("nope"))).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(ErrorResponses.statusOf(new UnknownAggregateTypeException("Invoice"))).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(ErrorResponses.statusOf(new AggregateNotFoundException("User", "u-9"))).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(ErrorResponses.statusOf(new MissingParameterException("limit"))).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ErrorResponses.statusOf(new InvalidParameterException("limit", "x", "an integer")))
                .isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void integrityAndUnexpectedFaultsMapTo500() {
        assertThat(ErrorResponses.statusOf(new ConfigurationIntegrityException(Kind.EVENT, "E", "User", "has no payload schema")))
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(ErrorResponses.statusOf(new IllegalStateException("broken")))
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void bodyCarriesMessageOrTypeName() {
        var withMessage = ErrorResponses.from(new MissingParameterException("limit"));
        var withoutMessage = ErrorResponses.from(new IllegalStateException());

        assertThat(withMessage.getBody()).isEqualTo(Map.of("error", "Missing required query parameter limit"));
        assertThat(withoutMessage.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(withoutMessage.getBody()).isEqualTo(Map.of("error", "IllegalStateException"));
    }
}
