package com.nodeflow.node;

import com.nodeflow.api.PortConfig;
import com.nodeflow.engine.Flow;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Applies a function to the values of all its inputs and emits the result.
 *
 * The function receives the input values in port order. It is not persisted;
 * a registry that loads function nodes must supply it.
 */
public class FunctionNode extends AbstractNode {
    private final Function<List<Object>, Object> fn;

    public FunctionNode(Flow flow, String title, int arity, Function<List<Object>, Object> fn) {
        super(flow, title, ports(arity), List.of(PortConfig.data("result")));
        this.fn = fn;
    }

    private static List<PortConfig> ports(int arity) {
        List<PortConfig> l = new ArrayList<>(arity);
        for (int i = 0; i < arity; i++)
            l.add(PortConfig.data("arg" + i));
        return l;
    }

    @Override
    public void updateEvent(int input) {
        List<Object> args = new ArrayList<>(inputs().size());
        for (int i = 0; i < inputs().size(); i++)
            args.add(input(i));
        setOutput(0, fn.apply(args));
    }
}
