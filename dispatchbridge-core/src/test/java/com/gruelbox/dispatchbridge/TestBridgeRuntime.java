package com.gruelbox.dispatchbridge;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.Test;

class TestBridgeRuntime {

  private static final class Player {}

  private static final class Playlist {}

  @Test
  void classCallbacksAreSharedPerKind() {
    StubHostLoop hostLoop = new StubHostLoop();
    try (BridgeRuntime runtime = BridgeRuntime.builder().hostLoop(hostLoop).build()) {
      CallbackRegistry players = runtime.classCallbacks(Player.class);
      assertThat(runtime.classCallbacks(Player.class), sameInstance(players));
      assertThat(runtime.classCallbacks(Playlist.class), not(sameInstance(players)));

      List<String> calls = new CopyOnWriteArrayList<>();
      runtime.classCallbacks(Player.class).register("x", origin -> calls.add(origin.getLabel()));
      DispatchBridge player = runtime.newBridge(Player.class).label("player").build();
      DispatchBridge playlist = runtime.newBridge(Playlist.class).label("playlist").build();

      assertTrue(player.dispatch("x"));
      assertFalse(playlist.dispatch("x"));
      hostLoop.runPending();
      assertThat(calls, contains("player"));
      assertThat(player.getKind(), equalTo(Player.class));
    }
  }

  @Test
  void bridgesCannotBeCreatedBeforeAttach() {
    StubHostLoop hostLoop = new StubHostLoop();
    try (BridgeRuntime runtime =
        BridgeRuntime.builder().hostLoop(hostLoop).attachImmediately(false).build()) {
      assertFalse(runtime.notifier().isAttached());
      assertThrows(IllegalArgumentException.class, () -> runtime.newBridge(Player.class).build());

      runtime.attach();
      runtime.attach();
      assertTrue(runtime.notifier().isAttached());
      runtime.newBridge(Player.class).build();
    }
  }

  @Test
  void closeMakesFurtherDispatchFatal() {
    StubHostLoop hostLoop = new StubHostLoop();
    BridgeRuntime runtime = BridgeRuntime.builder().hostLoop(hostLoop).build();
    DispatchBridge bridge = runtime.newBridge(Player.class).build();
    bridge.registerCallback("ready", origin -> {});
    runtime.close();
    assertThrows(NotifierNotAttachedException.class, () -> bridge.dispatch("ready"));
  }

  @Test
  void defaultHostLoopRunsCallbacksOnDedicatedThread() throws InterruptedException {
    try (BridgeRuntime runtime = BridgeRuntime.builder().build()) {
      DispatchBridge bridge = runtime.newBridge(Player.class).build();
      CountDownLatch latch = new CountDownLatch(1);
      List<String> threads = new CopyOnWriteArrayList<>();
      bridge.registerCallback(
          "ready",
          origin -> {
            threads.add(Thread.currentThread().getName());
            latch.countDown();
          });
      bridge.dispatch("ready");
      assertTrue(latch.await(10, SECONDS));
      assertThat(threads, contains("dispatchbridge-host-loop"));
    }
  }

  @Test
  void rejectsNullKind() {
    try (BridgeRuntime runtime = BridgeRuntime.builder().hostLoop(new StubHostLoop()).build()) {
      assertThrows(IllegalArgumentException.class, () -> runtime.classCallbacks(null));
    }
  }
}
