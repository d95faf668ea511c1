package com.gruelbox.dispatchbridge;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TestDispatchBridge {

  private StubHostLoop hostLoop;
  private CrossThreadNotifier notifier;
  private List<String> ignored;

  @BeforeEach
  void setUp() {
    hostLoop = new StubHostLoop();
    ignored = new CopyOnWriteArrayList<>();
    notifier =
        CrossThreadNotifier.builder()
            .listener(
                new DispatchListener() {
                  @Override
                  public void ignored(DispatchBridge bridge, String name) {
                    ignored.add(bridge.getLabel() + "." + name);
                  }
                })
            .build();
    notifier.attach(hostLoop);
  }

  @Test
  void dispatchRunsRegisteredCallbackOnceOnHostLoop() {
    DispatchBridge bridge = DispatchBridge.builder().notifier(notifier).label("track").build();
    List<DispatchBridge> origins = new CopyOnWriteArrayList<>();
    AtomicReference<Boolean> onHostThread = new AtomicReference<>();
    bridge.registerCallback(
        "ready",
        origin -> {
          origins.add(origin);
          onHostThread.set(hostLoop.isHostThread());
        });

    assertTrue(bridge.dispatch("ready"));
    assertThat(origins.size(), equalTo(0));

    hostLoop.runPending();
    assertThat(origins, contains(bridge));
    assertTrue(onHostThread.get());

    hostLoop.runPending();
    assertThat(origins.size(), equalTo(1));
  }

  @Test
  void dispatchOfUnknownNameIsSilentNoOp() {
    DispatchBridge bridge = DispatchBridge.builder().notifier(notifier).label("track").build();
    assertThat(bridge.unregisterCallback("never"), equalTo(0));

    assertTimeoutPreemptively(Duration.ofSeconds(5), () -> assertFalse(bridge.dispatch("never")));
    assertThat(hostLoop.pendingCount(), equalTo(0));
    assertFalse(notifier.isSlotOccupied());
    assertThat(ignored, contains("track.never"));
  }

  @Test
  void unregisteredCallbackIsNoLongerDispatched() {
    DispatchBridge bridge = DispatchBridge.builder().notifier(notifier).build();
    AtomicInteger calls = new AtomicInteger();
    bridge.registerCallback("ready", origin -> calls.incrementAndGet());

    assertThat(bridge.unregisterCallback("ready"), equalTo(1));
    assertFalse(bridge.dispatch("ready"));
    hostLoop.runPending();
    assertThat(calls.get(), equalTo(0));
  }

  @Test
  void classWideCallbackIsFallback() {
    CallbackRegistry classWide = new CallbackRegistry();
    List<String> calls = new CopyOnWriteArrayList<>();
    classWide.register("x", origin -> calls.add("class " + origin.getLabel()));
    DispatchBridge one =
        DispatchBridge.builder().notifier(notifier).classCallbacks(classWide).label("one").build();
    DispatchBridge two =
        DispatchBridge.builder().notifier(notifier).classCallbacks(classWide).label("two").build();
    two.registerCallback("x", origin -> calls.add("own " + origin.getLabel()));

    assertTrue(one.dispatch("x"));
    hostLoop.runPending();
    assertTrue(two.dispatch("x"));
    hostLoop.runPending();

    assertThat(calls, contains("class one", "own two"));
  }

  @Test
  void doneBeforeAwaitReturnsImmediately() {
    DispatchBridge bridge = DispatchBridge.builder().notifier(notifier).build();
    bridge.done();
    bridge.done();
    assertTimeoutPreemptively(Duration.ofSeconds(5), () -> bridge.await());
    assertThat(bridge.waitSignal().state(), equalTo(WaitSignal.State.IDLE));
  }

  @Test
  void boundedAwaitTimesOutWhenHandlerNeverSignals() throws InterruptedException {
    DispatchBridge bridge = DispatchBridge.builder().notifier(notifier).build();
    bridge.registerCallback("ready", origin -> {});
    bridge.dispatch("ready");
    hostLoop.runPending();
    assertFalse(bridge.await(Duration.ofMillis(50)));
  }

  @Test
  void awaitOnHostThreadIsRejected() {
    DispatchBridge bridge = DispatchBridge.builder().notifier(notifier).build();
    AtomicReference<Throwable> thrown = new AtomicReference<>();
    bridge.registerCallback(
        "ready",
        origin -> thrown.set(assertThrows(IllegalStateException.class, () -> origin.await())));
    bridge.dispatch("ready");
    hostLoop.runPending();
    assertThat(thrown.get().getMessage(), containsString("host loop thread"));
  }

  @Test
  void roundTripWithRealHostLoop() {
    try (ExecutorHostLoop realLoop = ExecutorHostLoop.builder().threadName("test-host").build()) {
      CrossThreadNotifier realNotifier = CrossThreadNotifier.builder().build();
      realNotifier.attach(realLoop);
      DispatchBridge bridge = DispatchBridge.builder().notifier(realNotifier).build();
      List<String> threads = new CopyOnWriteArrayList<>();
      bridge.registerCallback(
          "ready",
          origin -> {
            threads.add(Thread.currentThread().getName());
            origin.done();
          });

      assertTimeoutPreemptively(
          Duration.ofSeconds(10),
          () -> {
            for (int i = 0; i < 20; i++) {
              assertTrue(bridge.dispatchAndAwait("ready"));
            }
          });
      assertThat(threads.size(), equalTo(20));
      assertTrue(threads.stream().allMatch("test-host"::equals));
      assertFalse(bridge.dispatchAndAwait("unknown"));
    }
  }

  @Test
  void hostObjectIsCreatedOnceLazily() {
    AtomicInteger created = new AtomicInteger();
    DispatchBridge bridge =
        DispatchBridge.builder()
            .notifier(notifier)
            .hostObjectFactory(
                HostObjectFactory.using(
                    b -> {
                      created.incrementAndGet();
                      return "wrapper of " + b.getLabel();
                    }))
            .label("track")
            .build();
    assertThat(created.get(), equalTo(0));
    Object first = bridge.getHostObject();
    assertThat(bridge.getHostObject(), sameInstance(first));
    assertThat(first, equalTo("wrapper of track"));
    assertThat(created.get(), equalTo(1));
  }

  @Test
  void hostObjectDefaultsToBridge() {
    DispatchBridge bridge = DispatchBridge.builder().notifier(notifier).build();
    assertThat(bridge.getHostObject(), sameInstance(bridge));
  }

  @Test
  void defaultLabelUsesKind() {
    DispatchBridge bridge = DispatchBridge.builder().notifier(notifier).kind(String.class).build();
    assertThat(bridge.getLabel(), containsString("String@"));
    assertThat(bridge.getKind(), equalTo(String.class));
  }

  @Test
  void buildRequiresAttachedNotifier() {
    IllegalArgumentException missing =
        assertThrows(IllegalArgumentException.class, () -> DispatchBridge.builder().build());
    assertThat(missing.getMessage(), equalTo("DispatchBridge.notifier may not be null"));

    CrossThreadNotifier unattached = CrossThreadNotifier.builder().build();
    IllegalArgumentException detached =
        assertThrows(
            IllegalArgumentException.class,
            () -> DispatchBridge.builder().notifier(unattached).build());
    assertThat(detached.getMessage(), containsString("DispatchBridge.notifier must be attached"));
  }

  @Test
  void blankLabelIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> DispatchBridge.builder().notifier(notifier).label(" ").build());
  }
}
