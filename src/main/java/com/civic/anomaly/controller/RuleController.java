package com.civic.anomaly.controller;

import com.civic.anomaly.controller.dto.ActivationRequest;
import com.civic.anomaly.model.DetectionRule;
import com.civic.anomaly.model.RuleCategory;
import com.civic.anomaly.model.RuleUpdate;
import com.civic.anomaly.service.RuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/rules")
@Tag(name = "Rules", description = "Detection rule registry")
public class RuleController {

    private final RuleService ruleService;

    public RuleController(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @GetMapping
    @Operation(summary = "List rules")
    public ResponseEntity<List<DetectionRule>> listRules(
            @Parameter(description = "statistical, behavioral, temporal or pattern")
            @RequestParam(required = false) String category,
            @RequestParam(defaultValue = "false") boolean activeOnly) {
        RuleCategory ruleCategory = category != null ? RuleCategory.fromValue(category) : null;
        return ResponseEntity.ok(ruleService.listRules(ruleCategory, activeOnly));
    }

    @GetMapping("/{name}")
    @Operation(summary = "Get a rule by name")
    public ResponseEntity<DetectionRule> getRule(@PathVariable String name) {
        DetectionRule rule = ruleService.getRule(name);
        if (rule == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(rule);
    }

    @PostMapping
    @Operation(summary = "Create a rule",
               description = "Name must be unique and the method must belong to the category")
    public ResponseEntity<DetectionRule> createRule(@RequestBody DetectionRule rule) {
        return ResponseEntity.ok(ruleService.createRule(rule));
    }

    @PutMapping("/{name}")
    @Operation(summary = "Update a rule", description = "Threshold, severity, description and params can be changed")
    public ResponseEntity<DetectionRule> updateRule(@PathVariable String name, @RequestBody RuleUpdate changes) {
        return ResponseEntity.ok(ruleService.updateRule(name, changes));
    }

    @PostMapping("/{name}/activation")
    @Operation(summary = "Activate or deactivate a rule")
    public ResponseEntity<DetectionRule> setActive(@PathVariable String name, @RequestBody ActivationRequest request) {
        return ResponseEntity.ok(ruleService.setActive(name, request.active()));
    }
}
