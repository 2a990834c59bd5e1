package com.gentoro.clicky.loop;

/** Draws one frame of the host UI. */
@FunctionalInterface
public interface FrameRenderer {
  /** @return {@code false} once the host window has been closed */
  boolean renderFrame();
}
