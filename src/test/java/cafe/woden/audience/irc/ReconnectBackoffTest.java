package cafe.woden.audience.irc;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReconnectBackoffTest {

  @Test
  void delayDoublesUntilTheCap() {
    List<Long> delays = new ArrayList<>();
    for (int retry = 0; retry <= 6; retry++) {
      delays.add(ReconnectBackoff.delaySeconds(retry));
    }

    assertEquals(List.of(1L, 2L, 4L, 8L, 16L, 30L, 30L), delays);
  }

  @Test
  void hugeRetryCountsStayCapped() {
    assertEquals(30L, ReconnectBackoff.delaySeconds(62));
    assertEquals(30L, ReconnectBackoff.delaySeconds(Integer.MAX_VALUE));
    assertEquals(1L, ReconnectBackoff.delaySeconds(-3));
  }

  @Test
  void customCapIsHonored() {
    assertEquals(4L, ReconnectBackoff.delaySeconds(5, 4));
  }
}
