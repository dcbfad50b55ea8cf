package io.jobwarden.core;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

public class ConditionOperatorRegistry {

    private final Map<String, ConditionOperator> operatorsByName;

    public ConditionOperatorRegistry(List<? extends ConditionOperator> operators) {
        this.operatorsByName = operators.stream()
                .collect(Collectors.toUnmodifiableMap(
                        ConditionOperator::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate ConditionOperator name: " + a.name());
                        }
                ));
    }

    public ConditionOperator getRequired(String name) {
        ConditionOperator operator = name == null ? null : operatorsByName.get(name);
        if (operator == null) {
            throw new JobConfigurationException("Unknown condition operator: " + name);
        }
        return operator;
    }

    public Set<String> names() {
        return operatorsByName.keySet();
    }
}
