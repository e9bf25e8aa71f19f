package com.eli5y.interfaces.api;

import com.eli5y.interfaces.api.dto.StatusResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class StatusController {

    @Value("${app.version:0.1.0}")
    private String version;

    @Value("${app.environment:development}")
    private String environment;

    @GetMapping("/")
    public StatusResponse root() {
        return new StatusResponse("Eli5y API is running", version, environment);
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy");
    }
}
