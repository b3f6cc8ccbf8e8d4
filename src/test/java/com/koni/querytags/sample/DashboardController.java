package com.koni.querytags.sample;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@RestController
@RequiredArgsConstructor
public class DashboardController {

    private final DashboardRepository dashboardRepository;

    @GetMapping("/dashboards")
    public List<String> index() {
        return dashboardRepository.findAll().stream()
                .map(Dashboard::getName)
                .collect(Collectors.toList());
    }

    @GetMapping("/dashboards/async")
    public Callable<List<String>> asyncIndex() {
        return this::index;
    }
}
