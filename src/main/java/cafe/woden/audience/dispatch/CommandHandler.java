package cafe.woden.audience.dispatch;

import java.util.List;

/** Handles one inbound command. */
@FunctionalInterface
public interface CommandHandler {

  /**
   * @param origin sender prefix, or null when the line had none
   * @param params parameter tokens, or null when the line carried no parameters at all
   */
  void handle(String origin, List<String> params);
}
