package com.nodeflow;

import com.nodeflow.engine.Flow;
import com.nodeflow.engine.TypeRegistry;
import com.nodeflow.io.FlowDefinition;
import com.nodeflow.io.FlowLoader;
import com.nodeflow.io.FlowSerializer;
import com.nodeflow.io.NodeRegistry;
import com.nodeflow.player.FlowPlayer;
import com.nodeflow.player.GraphActionResponse;
import com.nodeflow.player.GraphPlayer;
import com.nodeflow.player.GraphState;
import com.nodeflow.util.Event;
import com.nodeflow.util.IdCounter;

import com.lmax.disruptor.util.DaemonThreadFactory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Top-level container of an application: named flows, one player per flow, the
 * node registry and the id counter all flows share.
 *
 * Player actions are addressed by flow title and answered with a
 * {@link GraphActionResponse}; an unknown title yields
 * {@link GraphActionResponse#NO_GRAPH}. Asynchronous plays run on daemon
 * threads.
 */
public class FlowSession implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(FlowSession.class);

    private static final long STOP_TIMEOUT_MS = 5_000;

    public final Event<Flow> flowCreated = new Event<>();
    public final Event<Flow> flowDeleted = new Event<>();

    private final IdCounter ids;
    private final NodeRegistry registry;
    private final TypeRegistry types;
    private final FlowSerializer serializer = new FlowSerializer();
    private final FlowLoader loader;
    private final int frames;

    private final Map<String, Flow> flows = new LinkedHashMap<>();
    private final Map<String, GraphPlayer> players = new LinkedHashMap<>();
    private final ExecutorService playerThreads = Executors.newCachedThreadPool(DaemonThreadFactory.INSTANCE);

    public FlowSession() {
        this(new NodeRegistry(), FlowPlayer.DEFAULT_FRAMES);
    }

    /** @param frames target frame rate of the players this session creates */
    public FlowSession(NodeRegistry registry, int frames) {
        this.ids = new IdCounter();
        this.registry = registry;
        this.types = new TypeRegistry();
        this.loader = new FlowLoader(registry, types);
        this.frames = frames;
    }

    public IdCounter ids() {
        return ids;
    }

    public NodeRegistry registry() {
        return registry;
    }

    public TypeRegistry types() {
        return types;
    }

    public FlowSerializer serializer() {
        return serializer;
    }

    /**
     * @throws IllegalArgumentException if a flow with this title exists
     */
    public Flow createFlow(String title) {
        Flow flow = new Flow(title, ids, types);
        register(flow);
        return flow;
    }

    private void register(Flow flow) {
        synchronized (this) {
            if (flows.containsKey(flow.title()))
                throw new IllegalArgumentException("Flow already exists: " + flow.title());
            flows.put(flow.title(), flow);
            players.put(flow.title(), new FlowPlayer(flow, frames));
        }
        log.info("Created flow '{}'", flow.title());
        flowCreated.emit(flow);
    }

    /** Stops the flow's player, destroys the flow and forgets it. */
    public boolean deleteFlow(String title) {
        Flow flow;
        GraphPlayer player;
        synchronized (this) {
            flow = flows.remove(title);
            player = players.remove(title);
        }
        if (flow == null)
            return false;
        stopAndWait(title, player);
        flow.destroy();
        flowDeleted.emit(flow);
        return true;
    }

    public synchronized Flow flow(String title) {
        return flows.get(title);
    }

    public synchronized GraphPlayer player(String title) {
        return players.get(title);
    }

    public synchronized List<String> flowTitles() {
        return new ArrayList<>(flows.keySet());
    }

    public synchronized List<Flow> flows() {
        return new ArrayList<>(flows.values());
    }

    // ── Player actions ──────────────────────────────────────────

    /** Plays on the calling thread, returning once the player stopped. */
    public GraphActionResponse play(String title) {
        return play(title, false);
    }

    public GraphActionResponse play(String title, boolean async) {
        GraphPlayer p = player(title);
        if (p == null)
            return GraphActionResponse.NO_GRAPH;
        return async ? p.playAsync(playerThreads) : p.play();
    }

    public GraphActionResponse pause(String title) {
        GraphPlayer p = player(title);
        return p == null ? GraphActionResponse.NO_GRAPH : p.pause();
    }

    public GraphActionResponse resume(String title) {
        GraphPlayer p = player(title);
        return p == null ? GraphActionResponse.NO_GRAPH : p.resume();
    }

    public GraphActionResponse stop(String title) {
        GraphPlayer p = player(title);
        return p == null ? GraphActionResponse.NO_GRAPH : p.stop();
    }

    // ── Import / export ──────────────────────────────────────────

    /** Structural export of the flow, or null if there is none with this title. */
    public FlowDefinition exportFlow(String title) {
        Flow f = flow(title);
        return f == null ? null : serializer.export(f);
    }

    public String exportJson(String title) {
        FlowDefinition def = exportFlow(title);
        return def == null ? null : serializer.toJson(def);
    }

    /**
     * Loads a definition as a new flow. A taken title gets a numeric suffix.
     */
    public Flow importFlow(FlowDefinition def) {
        String base = def.getTitle() == null ? "flow" : def.getTitle();
        String title;
        synchronized (this) {
            title = base;
            for (int i = 1; flows.containsKey(title); i++)
                title = base + " (" + i + ")";
        }
        FlowLoader.LoadResult result = loader.load(def, title, ids);
        register(result.flow());
        return result.flow();
    }

    public Flow importJson(String json) {
        return importFlow(serializer.parse(json));
    }

    // ── Lifecycle ──────────────────────────────────────────

    /** Stops every player and destroys every flow. */
    public void shutdown() {
        for (String title : flowTitles())
            deleteFlow(title);
        playerThreads.shutdown();
        try {
            if (!playerThreads.awaitTermination(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS))
                log.warn("Player threads still running after shutdown");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Session shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    private static void stopAndWait(String title, GraphPlayer player) {
        if (player == null || player.state() == GraphState.STOPPED)
            return;
        player.stop();
        if (!player.awaitState(GraphState.STOPPED, STOP_TIMEOUT_MS))
            log.warn("Player of flow '{}' did not stop within {} ms", title, STOP_TIMEOUT_MS);
    }
}
