package com.moviecsv.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Stellt die Micrometer-Registry für die Stufen-Timer des Builds bereit.
 */
@ApplicationScoped
public class MetricsProducer {

	@Produces
	@Singleton
	MeterRegistry meterRegistry() {
		return new SimpleMeterRegistry();
	}
}
