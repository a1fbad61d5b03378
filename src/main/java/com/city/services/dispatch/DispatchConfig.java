package com.city.services.dispatch;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.city.services.bus.config.CityProperties;
import com.city.services.core.publisher.BusPublisher;
import com.city.services.council.registry.TemplateDirectoryScanner;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Wires the emergency dispatch center.
 *
 * <p>Disable with {@code city.dispatch.enabled=false} to run a council-only node.</p>
 */
@Configuration
@EnableConfigurationProperties(DispatchProperties.class)
@ConditionalOnProperty(prefix = "city.dispatch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DispatchConfig {

    @Bean
    @ConditionalOnMissingBean
    public DepartmentClassifier departmentClassifier() {
        return new RuleTableClassifier();
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler dispatchScheduler() {
        return Schedulers.newSingle("city-dispatch");
    }

    @Bean
    public DispatchRouter dispatchRouter(CityProperties city,
                                         BusPublisher publisher,
                                         DepartmentClassifier classifier,
                                         DispatchProperties props,
                                         Clock clock,
                                         @Qualifier("dispatchScheduler") Scheduler dispatchScheduler) {
        TemplateDirectoryScanner registry = new TemplateDirectoryScanner(
                Path.of(props.getRegistryDirectory()), List.of("generic_department.rb"), props.getStaticDepartments());
        return new DispatchRouter(city.getDispatchName(), city.getCouncilName(), publisher, classifier,
                new DepartmentDirectory(), registry, props, clock, dispatchScheduler);
    }
}
