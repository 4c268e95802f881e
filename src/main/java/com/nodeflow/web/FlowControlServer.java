package com.nodeflow.web;

import com.nodeflow.FlowSession;
import com.nodeflow.engine.Flow;
import com.nodeflow.player.GraphActionResponse;
import com.nodeflow.player.GraphPlayer;
import com.nodeflow.player.GraphStateEvent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.websocket.WsContext;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * HTTP and WebSocket control surface of a {@link FlowSession}.
 *
 * Routes:
 * - {@code GET /api/flows}: title, state, algorithm mode, node count and frame
 * count of every flow;
 * - {@code GET /api/flows/{name}}: structural export of a flow;
 * - {@code POST /api/flows/{name}/{action}}: play, pause, resume or stop. Plays
 * run asynchronously. SUCCESS answers 200, NO_GRAPH 404, NOT_ALLOWED 409 and an
 * unknown action 400;
 * - {@code /ws/flows}: pushes every player state change to all clients.
 */
public class FlowControlServer {
    private static final Logger log = LogManager.getLogger(FlowControlServer.class);

    private static final String JSON = "application/json";

    private final FlowSession session;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Set<WsContext> sessions = ConcurrentHashMap.newKeySet();
    private final Map<String, Consumer<GraphStateEvent>> stateSubscriptions = new ConcurrentHashMap<>();
    private final Consumer<Flow> onFlowCreated = this::watch;
    private final Consumer<Flow> onFlowDeleted = f -> stateSubscriptions.remove(f.title());
    private Javalin app;

    public FlowControlServer(FlowSession session) {
        this.session = session;
    }

    /**
     * Starts the server.
     *
     * @param port port to listen on, 0 for any free port
     */
    public FlowControlServer start(int port) {
        log.info("Starting flow control server on port {}", port);
        for (Flow f : session.flows())
            watch(f);
        session.flowCreated.subscribe(onFlowCreated);
        session.flowDeleted.subscribe(onFlowDeleted);

        app = Javalin.create().start(port);

        app.get("/api/flows", ctx -> json(ctx, 200, listFlows()));

        app.get("/api/flows/{name}", ctx -> {
            String export = session.exportJson(ctx.pathParam("name"));
            if (export == null) {
                json(ctx, 404, Map.of("error", "No flow named " + ctx.pathParam("name")));
                return;
            }
            ctx.status(200).contentType(JSON).result(export);
        });

        app.post("/api/flows/{name}/{action}", ctx -> {
            String name = ctx.pathParam("name");
            String action = ctx.pathParam("action");
            GraphActionResponse r;
            switch (action) {
                case "play" -> r = session.play(name, true);
                case "pause" -> r = session.pause(name);
                case "resume" -> r = session.resume(name);
                case "stop" -> r = session.stop(name);
                default -> {
                    json(ctx, 400, Map.of("error", "Unknown action " + action));
                    return;
                }
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("flow", name);
            body.put("action", action);
            body.put("response", r.name());
            json(ctx, statusOf(r), body);
        });

        app.ws("/ws/flows", ws -> {
            ws.onConnect(ctx -> {
                log.info("WebSocket Client Connected: {}", ctx.sessionId());
                sessions.add(ctx);
            });
            ws.onClose(ctx -> {
                log.info("WebSocket Client Disconnected: {}", ctx.sessionId());
                sessions.remove(ctx);
            });
            ws.onError(ctx -> {
                log.error("WebSocket Client Error: {}", ctx.sessionId(), ctx.error());
                sessions.remove(ctx);
            });
        });
        return this;
    }

    static int statusOf(GraphActionResponse r) {
        return switch (r) {
            case SUCCESS -> 200;
            case NO_GRAPH -> 404;
            case NOT_ALLOWED -> 409;
        };
    }

    private List<Map<String, Object>> listFlows() {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Flow f : session.flows()) {
            GraphPlayer p = session.player(f.title());
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("title", f.title());
            m.put("state", p == null ? null : p.state().name());
            m.put("algorithmMode", f.algorithmMode().label());
            m.put("nodes", f.nodes().size());
            m.put("frameCount", p == null ? 0 : p.graphTime().frameCount());
            result.add(m);
        }
        return result;
    }

    private void json(Context ctx, int status, Object body) throws JsonProcessingException {
        ctx.status(status).contentType(JSON).result(mapper.writeValueAsString(body));
    }

    private void watch(Flow flow) {
        GraphPlayer p = session.player(flow.title());
        if (p == null || stateSubscriptions.containsKey(flow.title()))
            return;
        Consumer<GraphStateEvent> cb = e -> {
            Map<String, Object> msg = new LinkedHashMap<>();
            msg.put("flow", flow.title());
            msg.put("oldState", e.getOldState().name());
            msg.put("newState", e.getNewState().name());
            msg.put("frameCount", p.graphTime().frameCount());
            try {
                broadcast(mapper.writeValueAsString(msg));
            } catch (JsonProcessingException ex) {
                log.error("Failed to serialize state change of '{}'", flow.title(), ex);
            }
        };
        stateSubscriptions.put(flow.title(), cb);
        p.events().subscribeStateChanged(cb);
    }

    /** Sends a JSON payload to every connected WebSocket client. */
    public void broadcast(String jsonPayload) {
        if (sessions.isEmpty())
            return;
        for (WsContext ctx : sessions) {
            if (ctx.session.isOpen())
                ctx.send(jsonPayload);
        }
    }

    /** The port the server listens on. */
    public int port() {
        return app.port();
    }

    public void stop() {
        session.flowCreated.unsubscribe(onFlowCreated);
        session.flowDeleted.unsubscribe(onFlowDeleted);
        for (Map.Entry<String, Consumer<GraphStateEvent>> e : stateSubscriptions.entrySet()) {
            GraphPlayer p = session.player(e.getKey());
            if (p != null)
                p.events().unsubscribeStateChanged(e.getValue());
        }
        stateSubscriptions.clear();
        if (app != null) {
            app.stop();
            sessions.clear();
        }
    }
}
