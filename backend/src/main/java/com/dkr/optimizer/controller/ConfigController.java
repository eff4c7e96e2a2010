package com.dkr.optimizer.controller;

import com.dkr.optimizer.config.OptimizerSettings;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/config")
@CrossOrigin(origins = "*")
public class ConfigController {
    private final OptimizerSettings settings;

    public ConfigController(OptimizerSettings settings) {
        this.settings = settings;
    }

    @GetMapping("/optimizer")
    public Map<String, Object> getOptimizerSettings() {
        return Map.of(
                "tierTargets", settings.getTierTargets(),
                "difficultyK", settings.getDifficultyK(),
                "requirementEpsilon", settings.getRequirementEpsilon(),
                "leaderboardBaseUrl", settings.getLeaderboardBaseUrl()
        );
    }
}
