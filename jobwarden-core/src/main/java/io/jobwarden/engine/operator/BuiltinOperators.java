package io.jobwarden.engine.operator;

import io.jobwarden.core.ConditionOperator;
import io.jobwarden.core.ConditionOperatorRegistry;

import java.util.ArrayList;
import java.util.List;

public final class BuiltinOperators {
    private BuiltinOperators() {
    }

    public static List<ConditionOperator> all() {
        List<ConditionOperator> ops = new ArrayList<>();
        ops.add(SetMembershipOperator.is());
        ops.add(SetMembershipOperator.isNot());
        for (RelativeTimeOperator.Mode mode : RelativeTimeOperator.Mode.values()) {
            ops.add(new RelativeTimeOperator(mode));
        }
        ops.add(AbsoluteTimeOperator.before());
        ops.add(AbsoluteTimeOperator.after());
        return ops;
    }

    /**
     * Registry with the built-ins plus {@code extra} operators.
     */
    public static ConditionOperatorRegistry registry(List<? extends ConditionOperator> extra) {
        List<ConditionOperator> ops = all();
        if (extra != null) {
            ops.addAll(extra);
        }
        return new ConditionOperatorRegistry(ops);
    }

    public static ConditionOperatorRegistry registry() {
        return registry(List.of());
    }
}
