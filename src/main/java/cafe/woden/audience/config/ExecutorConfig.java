package cafe.woden.audience.config;

import cafe.woden.audience.util.DaemonThreads;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * App-owned executors, one single-thread scheduler per workload.
 *
 * <p>Spring owns their lifecycle; the Rx schedulers wrap the same threads.
 */
@Configuration
public class ExecutorConfig {
  public static final String CHAT_RECONNECT_SCHEDULER = "chatReconnectScheduler";
  public static final String CHAT_HEARTBEAT_SCHEDULER = "chatHeartbeatScheduler";
  public static final String JOIN_WINDOW_SCHEDULER = "joinWindowScheduler";
  public static final String DIRECTORY_SCHEDULER = "directoryScheduler";

  public static final String CHAT_HEARTBEAT_RX_SCHEDULER = "chatHeartbeatRxScheduler";
  public static final String JOIN_WINDOW_RX_SCHEDULER = "joinWindowRxScheduler";
  public static final String DIRECTORY_RX_SCHEDULER = "directoryRxScheduler";

  @Bean(name = CHAT_RECONNECT_SCHEDULER, destroyMethod = "shutdownNow")
  public ScheduledExecutorService chatReconnectScheduler() {
    return DaemonThreads.newSingleThreadScheduledExecutor("audience-chat-connection");
  }

  /** Idle watchdog; the reconnect thread is parked inside the transport while a session is open. */
  @Bean(name = CHAT_HEARTBEAT_SCHEDULER, destroyMethod = "shutdownNow")
  public ScheduledExecutorService chatHeartbeatScheduler() {
    return DaemonThreads.newSingleThreadScheduledExecutor("audience-chat-heartbeat");
  }

  @Bean(name = JOIN_WINDOW_SCHEDULER, destroyMethod = "shutdownNow")
  public ScheduledExecutorService joinWindowScheduler() {
    return DaemonThreads.newSingleThreadScheduledExecutor("audience-join-window");
  }

  /** All REST traffic runs here, one request at a time. */
  @Bean(name = DIRECTORY_SCHEDULER, destroyMethod = "shutdownNow")
  public ScheduledExecutorService directoryScheduler() {
    return DaemonThreads.newSingleThreadScheduledExecutor("audience-directory");
  }

  @Bean(name = CHAT_HEARTBEAT_RX_SCHEDULER)
  public Scheduler chatHeartbeatRxScheduler(
      @Qualifier(CHAT_HEARTBEAT_SCHEDULER) ScheduledExecutorService exec) {
    return Schedulers.from(exec);
  }

  @Bean(name = JOIN_WINDOW_RX_SCHEDULER)
  public Scheduler joinWindowRxScheduler(
      @Qualifier(JOIN_WINDOW_SCHEDULER) ScheduledExecutorService exec) {
    return Schedulers.from(exec);
  }

  @Bean(name = DIRECTORY_RX_SCHEDULER)
  public Scheduler directoryRxScheduler(
      @Qualifier(DIRECTORY_SCHEDULER) ScheduledExecutorService exec) {
    return Schedulers.from(exec);
  }
}
