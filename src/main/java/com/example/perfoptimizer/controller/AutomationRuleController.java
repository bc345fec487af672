package com.example.perfoptimizer.controller;

import com.example.perfoptimizer.automation.AutomationRule;
import com.example.perfoptimizer.automation.AutomationRuleEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/automation-rules")
@RequiredArgsConstructor
public class AutomationRuleController {

    private final AutomationRuleEngine ruleEngine;

    @GetMapping
    public ResponseEntity<List<AutomationRule>> listRules() {
        return ResponseEntity.ok(ruleEngine.getRules());
    }

    @GetMapping("/{id}")
    public ResponseEntity<AutomationRule> getRule(@PathVariable String id) {
        return ruleEngine.getRule(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<AutomationRule> addRule(@RequestBody AutomationRule rule) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ruleEngine.addRule(rule));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> removeRule(@PathVariable String id) {
        return ruleEngine.removeRule(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @PostMapping("/{id}/enable")
    public ResponseEntity<AutomationRule> enableRule(@PathVariable String id) {
        return ruleEngine.setEnabled(id, true)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/disable")
    public ResponseEntity<AutomationRule> disableRule(@PathVariable String id) {
        return ruleEngine.setEnabled(id, false)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
