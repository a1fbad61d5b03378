package com.city.services.council;

import java.io.File;
import java.nio.file.Path;
import java.time.Clock;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.city.services.bus.config.CityProperties;
import com.city.services.core.publisher.BusPublisher;
import com.city.services.council.health.HealthProtocol;
import com.city.services.council.notify.FallbackPolicy;
import com.city.services.council.notify.NotificationDispatcher;
import com.city.services.council.policy.DecisionLedger;
import com.city.services.council.policy.RecommendationEvaluator;
import com.city.services.council.process.OsProcessLauncher;
import com.city.services.council.process.ProcessLauncher;
import com.city.services.council.registry.RegistryScanner;
import com.city.services.council.registry.TemplateDirectoryScanner;
import com.city.services.council.supervisor.ProcessSupervisor;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Wires the council: registry, launcher, supervisor, health protocol, decision policy,
 * notification dispatcher and the orchestrator itself.
 *
 * <p>Disable with {@code city.council.enabled=false} to run a dispatch-only node.</p>
 */
@Configuration
@EnableConfigurationProperties(CouncilProperties.class)
@ConditionalOnProperty(prefix = "city.council", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CouncilConfig {

    @Bean
    public RegistryScanner registryScanner(CouncilProperties props) {
        CouncilProperties.Registry r = props.getRegistry();
        return new TemplateDirectoryScanner(Path.of(r.getDirectory()), r.getExcludedFiles(), r.getStaticDepartments());
    }

    @Bean
    public ProcessLauncher processLauncher(CouncilProperties props) {
        CouncilProperties.Launch launch = props.getLaunch();
        String dir = launch.getWorkingDirectory() != null
                ? launch.getWorkingDirectory()
                : props.getRegistry().getDirectory();
        return new OsProcessLauncher(launch.getCommand(), new File(dir), launch.getTerminationGrace());
    }

    @Bean
    public HealthProtocol healthProtocol(BusPublisher publisher, CityProperties city) {
        return new HealthProtocol(publisher, city.getCouncilName());
    }

    @Bean
    public ProcessSupervisor processSupervisor(ProcessLauncher launcher,
                                               HealthProtocol healthProtocol,
                                               Clock clock,
                                               CouncilProperties props) {
        return new ProcessSupervisor(launcher, healthProtocol, clock, props.getSupervision());
    }

    @Bean
    public DecisionLedger decisionLedger(CouncilProperties props) {
        return new DecisionLedger(props.getPolicy().getLedgerCapacity());
    }

    @Bean
    public RecommendationEvaluator recommendationEvaluator(CouncilProperties props, Clock clock) {
        return new RecommendationEvaluator(props.getPolicy(), clock);
    }

    @Bean
    public FallbackPolicy fallbackPolicy(ProcessSupervisor supervisor) {
        return new FallbackPolicy(supervisor, FallbackPolicy.DISPATCH_CENTER);
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(BusPublisher publisher,
                                                         ProcessSupervisor supervisor,
                                                         FallbackPolicy fallbackPolicy,
                                                         Clock clock,
                                                         CityProperties city,
                                                         CouncilProperties props) {
        return new NotificationDispatcher(publisher, supervisor, fallbackPolicy, clock,
                city.getCouncilName(), props.getRoutingConsumers(), props.getPolicy().getChangeEffectiveDelay());
    }

    @Bean
    public DepartmentProvisioner departmentProvisioner(RegistryScanner registryScanner) {
        return new RegistryProvisioner(registryScanner);
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler councilScheduler() {
        return Schedulers.newSingle("city-council");
    }

    @Bean
    public CityCouncil cityCouncil(CityProperties city,
                                   RegistryScanner registryScanner,
                                   ProcessSupervisor supervisor,
                                   HealthProtocol healthProtocol,
                                   RecommendationEvaluator evaluator,
                                   DecisionLedger ledger,
                                   NotificationDispatcher notifier,
                                   DepartmentProvisioner provisioner,
                                   BusPublisher publisher,
                                   CouncilProperties props,
                                   Clock clock,
                                   @Qualifier("councilScheduler") Scheduler councilScheduler) {
        return new CityCouncil(city.getCouncilName(), city.getBroadcastName(), registryScanner, supervisor,
                healthProtocol, evaluator, ledger, notifier, provisioner, publisher, props, clock, councilScheduler);
    }
}
