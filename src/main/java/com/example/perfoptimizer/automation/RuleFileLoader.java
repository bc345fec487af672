package com.example.perfoptimizer.automation;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Loads automation rules from *.yml / *.yaml files, one rule per file.
 * A file without an id gets its file name as id. Unreadable or empty files are skipped.
 */
@Slf4j
@Component
public class RuleFileLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public List<AutomationRule> load(String directory) {
        List<AutomationRule> loaded = new ArrayList<>();
        if (directory == null || directory.isBlank()) {
            return loaded;
        }
        File dir = new File(directory);
        if (!dir.isDirectory()) {
            log.warn("Rules directory {} does not exist", dir.getAbsolutePath());
            return loaded;
        }

        File[] files = dir.listFiles((d, name) -> name.endsWith(".yml") || name.endsWith(".yaml"));
        if (files == null || files.length == 0) {
            log.info("No automation rule files found in {}", directory);
            return loaded;
        }
        Arrays.sort(files, Comparator.comparing(File::getName));

        for (File file : files) {
            try {
                AutomationRule rule = yamlMapper.readValue(file, AutomationRule.class);
                if (rule == null) {
                    log.warn("Automation rule file {} is empty, skipping", file.getName());
                    continue;
                }
                if (rule.getId() == null) {
                    rule.setId(file.getName().replace(".yml", "").replace(".yaml", ""));
                }
                if (rule.getActions() == null) {
                    rule.setActions(new ArrayList<>());
                }
                loaded.add(rule);
                log.info("Loaded automation rule: {} ({} actions)", rule.getName(), rule.getActions().size());
            } catch (IOException | RuntimeException e) {
                log.error("Failed to load automation rule {}: {}", file.getName(), e.getMessage());
            }
        }
        return loaded;
    }
}
