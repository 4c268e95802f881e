package com.nodeflow;

import com.nodeflow.engine.Flow;
import com.nodeflow.web.FlowControlServer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * NodeFlow: a node/port dataflow engine.
 *
 * <h2>Model</h2>
 * <p>
 * A {@link Flow} holds nodes whose output ports connect to input ports. How
 * and how often data propagates is decided by the flow's executor, selected
 * through its algorithm mode:
 * <ul>
 * <li><b>data</b>: eager depth-first push;</li>
 * <li><b>data opt</b>: push with at most one activation per connection and
 * execution;</li>
 * <li><b>exec</b>: control flow along exec connections, data pulled on
 * demand;</li>
 * <li><b>manual</b>: nothing propagates on its own, a driver decides.</li>
 * </ul>
 * A {@link com.nodeflow.player.FlowPlayer} runs a flow like a program, and
 * keeps ticking frame-driven nodes at a target frame rate until stopped.
 *
 * <p>
 * Running this class starts a {@link FlowControlServer}:
 * {@code NodeFlow [--port N] [flow.json ...]}.
 */
public final class NodeFlow {
    private static final Logger log = LogManager.getLogger(NodeFlow.class);

    public static final int DEFAULT_PORT = 7070;

    private NodeFlow() {
        // Prevent instantiation of utility class
    }

    /** Entry point: a session with the built-in node types. */
    public static FlowSession session() {
        return new FlowSession();
    }

    public static void main(String[] args) throws IOException {
        int port = DEFAULT_PORT;
        FlowSession session = session();
        for (int i = 0; i < args.length; i++) {
            if ("--port".equals(args[i]) && i + 1 < args.length) {
                port = Integer.parseInt(args[++i]);
            } else {
                Flow f = session.importFlow(session.serializer().read(Path.of(args[i])));
                log.info("Imported '{}' from {}", f.title(), args[i]);
            }
        }

        FlowControlServer server = new FlowControlServer(session).start(port);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.stop();
            session.shutdown();
        }, "nodeflow-shutdown"));
    }
}
