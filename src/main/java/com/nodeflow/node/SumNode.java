package com.nodeflow.node;

import com.nodeflow.api.PortConfig;
import com.nodeflow.engine.Flow;
import com.nodeflow.engine.TypeRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Adds its numeric inputs. Missing values (unconnected inputs without default,
 * or outputs that were never set) count as zero.
 *
 * Output is a {@code Double}.
 */
public class SumNode extends AbstractNode {
    public static final String OPERANDS = "operands";

    public SumNode(Flow flow) {
        this(flow, 2);
    }

    public SumNode(Flow flow, int operands) {
        super(flow, "sum", operands(operands), List.of(PortConfig.data("sum", TypeRegistry.DOUBLE)));
        setProperty(OPERANDS, operands);
    }

    public static SumNode fromProperties(Flow flow, Map<String, Object> properties) {
        Object n = properties.get(OPERANDS);
        return new SumNode(flow, n instanceof Number num ? num.intValue() : 2);
    }

    private static List<PortConfig> operands(int n) {
        if (n < 1)
            throw new IllegalArgumentException("A sum needs at least one operand: " + n);
        List<PortConfig> l = new ArrayList<>(n);
        for (int i = 0; i < n; i++)
            l.add(PortConfig.data("in" + i));
        return l;
    }

    /** Appends another operand input. */
    public void addOperand() {
        createInput(PortConfig.data("in" + inputs().size()));
        setProperty(OPERANDS, inputs().size());
    }

    @Override
    public void updateEvent(int input) {
        double sum = 0;
        for (int i = 0; i < inputs().size(); i++) {
            Object v = input(i);
            if (v == null)
                continue;
            if (!(v instanceof Number n))
                throw new IllegalArgumentException("Operand " + i + " of '" + title() + "' is not a number: " + v);
            sum += n.doubleValue();
        }
        setOutput(0, sum);
    }
}
