package com.shelfkeep.loanservice.config;

import com.shelfkeep.observability.MetricFactory;
import com.shelfkeep.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics and tracing helpers from {@code shelfkeep-observability}.
 *
 * <p>The tracer comes from {@link GlobalOpenTelemetry}; it is a no-op unless an OpenTelemetry
 * SDK or agent is installed in the process.
 */
@Configuration
public class ObservabilityConfig {

    static final String INSTRUMENTATION_SCOPE = "com.shelfkeep.loanservice";

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, LoanServiceProperties properties) {
        return new MetricFactory(meterRegistry, properties.name());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }
}
