package com.example.scvl.monitoring;

import com.example.scvl.repository.AppUserRepository;
import com.example.scvl.repository.PageRepository;
import com.example.scvl.repository.PageViewRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class CustomMetrics {

    public CustomMetrics(MeterRegistry registry,
                         AppUserRepository userRepository,
                         PageRepository pageRepository,
                         PageViewRepository pageViewRepository) {

        Gauge.builder("app.users.total", userRepository::count)
             .description("Total number of registered users")
             .register(registry);

        Gauge.builder("app.pages.total", pageRepository::count)
             .description("Total number of shortened pages")
             .register(registry);

        Gauge.builder("app.pageviews.total", pageViewRepository::count)
             .description("Total number of recorded page views")
             .register(registry);
    }
}
