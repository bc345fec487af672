package com.example.perfoptimizer.automation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AutomationAction {

    private ActionType type;
    private String target;

    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    /** Runs only if this action fails. Its own rollback is ignored. */
    private AutomationAction rollback;
}
