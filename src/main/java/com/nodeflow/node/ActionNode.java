package com.nodeflow.node;

import com.nodeflow.api.PortConfig;
import com.nodeflow.engine.Flow;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Control flow step: when its exec input fires it reads its data input,
 * records the value and fires its exec output.
 *
 * Ports: in[0] exec, in[1] data "value"; out[0] exec. Updates caused by
 * anything but the exec input are ignored.
 */
public class ActionNode extends AbstractNode {
    private static final Logger log = LogManager.getLogger(ActionNode.class);

    private final List<Object> seen = new ArrayList<>();

    public ActionNode(Flow flow) {
        this(flow, "action");
    }

    public ActionNode(Flow flow, String title) {
        super(flow, title, List.of(PortConfig.exec("exec"), PortConfig.data("value")),
                List.of(PortConfig.exec("then")));
    }

    @Override
    public void updateEvent(int input) {
        if (input != 0)
            return;
        Object v = input(1);
        seen.add(v);
        log.debug("'{}' fired with {}", title(), v);
        execOutput(0);
    }

    /** Values read, one per firing. */
    public List<Object> seen() {
        return seen;
    }
}
