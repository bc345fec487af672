package com.example.perfoptimizer.automation;

import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Lets rules in application.yml use the short condition spellings.
 */
@Component
@ConfigurationPropertiesBinding
public class ConditionConverter implements Converter<String, Condition> {

    @Override
    public Condition convert(String source) {
        return Condition.from(source);
    }
}
