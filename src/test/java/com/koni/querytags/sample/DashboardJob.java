package com.koni.querytags.sample;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Creates a dashboard for every name received. Started by hand in tests.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DashboardJob {

    private final DashboardRepository dashboardRepository;

    @KafkaListener(id = "dashboard-job", topics = "dashboards", autoStartup = "false")
    public void perform(String name) {
        Dashboard saved = dashboardRepository.save(new Dashboard(name));
        log.info("Dashboard created: id={}, name={}", saved.getId(), saved.getName());
    }
}
