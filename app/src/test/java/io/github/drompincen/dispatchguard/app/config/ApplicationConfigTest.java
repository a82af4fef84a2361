package io.github.drompincen.dispatchguard.app.config;

import io.github.drompincen.dispatchguard.runtime.settings.DispatchDefaultsProperties;
import io.github.drompincen.dispatchguard.runtime.settings.DispatchSettingsProvider;
import io.github.drompincen.dispatchguard.runtime.settings.PropertiesDispatchSettingsProvider;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class ApplicationConfigTest {

    @Configuration
    @EnableConfigurationProperties(DispatchDefaultsProperties.class)
    static class DefaultsConfig {
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(DefaultsConfig.class, PropertiesDispatchSettingsProvider.class, ClockConfig.class);

    @Test
    void bindsDispatchDefaults() {
        runner.withPropertyValues(
                        "dispatchguard.defaults.dispatch-manager.name=Kobayashi Ken",
                        "dispatchguard.defaults.dispatch-manager.department=派遣事業部",
                        "dispatchguard.defaults.dispatch-complaint-contact.name=Sato Hanako",
                        "dispatchguard.defaults.dispatch-complaint-contact.phone=086-000-0000")
                .run(context -> {
                    DispatchSettingsProvider provider = context.getBean(DispatchSettingsProvider.class);
                    assertThat(provider.defaultDispatchManager().name()).isEqualTo("Kobayashi Ken");
                    assertThat(provider.defaultDispatchManager().department()).isEqualTo("派遣事業部");
                    assertThat(provider.defaultDispatchComplaintContact().phone()).isEqualTo("086-000-0000");
                });
    }

    @Test
    void clockDefaultsToTokyo() {
        runner.run(context -> assertThat(context.getBean(Clock.class).getZone()).isEqualTo(ZoneId.of("Asia/Tokyo")));
    }

    @Test
    void clockZoneIsConfigurable() {
        runner.withPropertyValues("dispatchguard.zone=UTC")
                .run(context -> assertThat(context.getBean(Clock.class).getZone()).isEqualTo(ZoneId.of("UTC")));
    }

    @Test
    void schedulerPoolSizeIsConfigurable() {
        new ApplicationContextRunner()
                .withUserConfiguration(SchedulerConfig.class)
                .withPropertyValues("dispatchguard.scheduler.pool-size=3")
                .run(context -> {
                    ThreadPoolTaskScheduler scheduler = context.getBean(ThreadPoolTaskScheduler.class);
                    assertThat(scheduler.getThreadNamePrefix()).isEqualTo("compliance-");
                    assertThat(scheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(3);
                });
    }
}
