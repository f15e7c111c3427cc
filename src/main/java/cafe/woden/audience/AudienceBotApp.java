package cafe.woden.audience;

import cafe.woden.audience.config.AudienceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "IRCafe Audience",
    sharedModules = {"config", "util"})
@EnableConfigurationProperties(AudienceProperties.class)
public class AudienceBotApp {

  public static void main(String[] args) {
    SpringApplication.run(AudienceBotApp.class, args);
  }
}
