package com.nodeflow.player;

import java.util.concurrent.TimeUnit;

/**
 * Timing of a player: target frame rate, frames played, elapsed and delta time.
 *
 * Written by the player loop only; the volatile fields let other threads read
 * a recent value. Times are in seconds.
 */
public final class GraphTime {
    private volatile int frames;
    private volatile long frameCount;
    private volatile double time;
    private volatile double deltaTime;

    public GraphTime(int frames) {
        setFrames(frames);
    }

    /** Target frames per second. */
    public int frames() {
        return frames;
    }

    /** Frames started since play. Incremented at the start of each frame. */
    public long frameCount() {
        return frameCount;
    }

    /** Seconds played. */
    public double time() {
        return time;
    }

    /** Duration of the last frame in seconds. */
    public double deltaTime() {
        return deltaTime;
    }

    /** Frame duration the player tries to keep, in seconds. */
    public double frameDuration() {
        return 1.0 / frames;
    }

    public long frameDurationNanos() {
        return TimeUnit.SECONDS.toNanos(1) / frames;
    }

    public double avgFps() {
        double t = time;
        return t == 0.0 ? 0.0 : frameCount / t;
    }

    public double currentFps() {
        double d = deltaTime;
        return d == 0.0 ? 0.0 : 1.0 / d;
    }

    void setFrames(int frames) {
        if (frames < 1)
            throw new IllegalArgumentException("Frame rate must be positive: " + frames);
        this.frames = frames;
    }

    void nextFrame() {
        frameCount++;
    }

    void setDeltaTime(double deltaTime) {
        this.deltaTime = deltaTime;
        this.time += deltaTime;
    }

    void reset() {
        frameCount = 0;
        time = 0.0;
        deltaTime = 0.0;
    }

    @Override
    public String toString() {
        return String.format("GraphTime[fps=%d, frame=%d, time=%.3fs, avgFps=%.1f]", frames, frameCount, time, avgFps());
    }
}
