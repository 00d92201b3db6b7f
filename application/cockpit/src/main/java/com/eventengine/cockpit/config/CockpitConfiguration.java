package com.eventengine.cockpit.config;

import com.eventengine.cockpit.facade.AggregateReadFacade;
import com.eventengine.platform.config.CockpitConfig;
import com.eventengine.platform.engine.EventEngine;
import com.eventengine.platform.store.DocumentStore;
import com.eventengine.platform.store.InMemoryDocumentStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the cockpit collaborators. Each bean backs off if the host application provides its own.
 */
@Configuration
public class CockpitConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CockpitConfig cockpitConfig() {
        return CockpitConfig.load();
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentStore documentStore() {
        return new InMemoryDocumentStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventEngine eventEngine(CockpitConfig cockpitConfig, DocumentStore documentStore) {
        return new EngineBootstrap(cockpitConfig, documentStore).start();
    }

    @Bean
    public AggregateReadFacade aggregateReadFacade(EventEngine eventEngine, DocumentStore documentStore) {
        return new AggregateReadFacade(eventEngine, documentStore);
    }
}
