package com.gentoro.clicky.loop;

/** Renderer used without a window: draws nothing and runs until the loop is stopped. */
public final class HeadlessRenderer implements FrameRenderer {
  @Override
  public boolean renderFrame() {
    return true;
  }
}
