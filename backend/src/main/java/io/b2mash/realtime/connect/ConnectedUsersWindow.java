package io.b2mash.realtime.connect;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Sliding window over the last six connected-user samples of a tenant. The window starts as
 * {@code [1]} so a fresh connection needs six real zero samples before it counts as idle. A
 * non-zero sample only shifts the window; it never clears it.
 */
public final class ConnectedUsersWindow {

  static final int SIZE = 6;

  private final Deque<Integer> samples = new ArrayDeque<>(SIZE);

  private ConnectedUsersWindow() {
    samples.addLast(1);
  }

  public static ConnectedUsersWindow seeded() {
    return new ConnectedUsersWindow();
  }

  public void record(int connectedUsers) {
    samples.addLast(connectedUsers);
    while (samples.size() > SIZE) {
      samples.removeFirst();
    }
  }

  public boolean isIdle() {
    return samples.size() == SIZE && samples.stream().allMatch(count -> count == 0);
  }

  public List<Integer> samples() {
    return List.copyOf(samples);
  }
}
