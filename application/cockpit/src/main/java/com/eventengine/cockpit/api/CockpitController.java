package com.eventengine.cockpit.api;

import com.eventengine.cockpit.facade.AggregateReadFacade;
import com.eventengine.cockpit.schema.SchemaAggregator;
import com.eventengine.cockpit.schema.SchemaDocument;
import com.eventengine.platform.base.Result;
import com.eventengine.platform.engine.EventEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Cockpit API. The operation is chosen by the last path segment:
 *
 * GET {base}/schema                                                 - aggregate-centric message schema
 * GET {base}/load-aggregates?aggregateType=&limit=                  - state documents of one type
 * GET {base}/load-aggregate?aggregateType=&aggregateId=[&version=]  - state of one aggregate
 * GET {base}/load-aggregate-events?aggregateType=&aggregateId=      - event history of one aggregate
 */
@RestController
public class CockpitController {

    private static final Logger log = LoggerFactory.getLogger(CockpitController.class);

    private final EventEngine eventEngine;
    private final AggregateReadFacade facade;

    public CockpitController(EventEngine eventEngine, AggregateReadFacade facade) {
        this.eventEngine = eventEngine;
        this.facade = facade;
    }

    @GetMapping("${cockpit.http.base-path:/api/ee-cockpit}/**")
    public Mono<ResponseEntity<Object>> handle(ServerHttpRequest request) {
        String path = request.getPath().pathWithinApplication().value();
        MultiValueMap<String, String> queryParams = request.getQueryParams();
        // engine and store calls may block (Kafka scans)
        return Mono.fromCallable(() -> dispatch(path, queryParams))
                .subscribeOn(Schedulers.boundedElastic());
    }

    ResponseEntity<Object> dispatch(String path, MultiValueMap<String, String> queryParams) {
        log.debug("Cockpit request {} {}", path, queryParams);
        QueryParams params = new QueryParams(queryParams);

        return Result.<Result<?>>of(() -> execute(CockpitRoute.resolve(path), params))
                .flatMap(result -> result.map(value -> (Object) value))
                .fold(ErrorResponses::from, ResponseEntity::ok);
    }

    private Result<?> execute(CockpitRoute route, QueryParams params) {
        return switch (route) {
            case SCHEMA -> Result.of(this::compileSchema);
            case LOAD_AGGREGATES -> facade.listAggregates(
                    params.required("aggregateType"),
                    params.requiredInt("limit"));
            case LOAD_AGGREGATE -> facade.loadAggregateState(
                    params.required("aggregateType"),
                    params.required("aggregateId"),
                    params.optionalInt("version"));
            case LOAD_AGGREGATE_EVENTS -> facade.loadAggregateEvents(
                    params.required("aggregateType"),
                    params.required("aggregateId"));
        };
    }

    private SchemaDocument compileSchema() {
        var config = eventEngine.compileCacheableConfig();
        var definitions = SchemaAggregator.definitionsOf(eventEngine.messageBoxSchema());
        return SchemaAggregator.buildSchemaDocument(config, definitions);
    }
}
