package cafe.woden.audience.architecture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import cafe.woden.audience.AudienceBotApp;
import cafe.woden.audience.app.AudienceService;
import cafe.woden.audience.channel.ChannelRegistry;
import cafe.woden.audience.directory.DirectoryLookupService;
import cafe.woden.audience.dispatch.ChatEventDispatcher;
import cafe.woden.audience.irc.ChatConnection;
import org.junit.jupiter.api.Test;
import org.springframework.modulith.core.ApplicationModule;
import org.springframework.modulith.core.ApplicationModules;

class SpringModulithModulesTest {

  @Test
  void applicationModulesCanBeDiscovered() {
    assertThatCode(() -> ApplicationModules.of(AudienceBotApp.class)).doesNotThrowAnyException();
  }

  @Test
  void coreTypesResolveToTheirOwnModules() {
    ApplicationModules modules = ApplicationModules.of(AudienceBotApp.class);

    assertThat(moduleFor(modules, ChatConnection.class).getBasePackage().getName())
        .isEqualTo("cafe.woden.audience.irc");
    assertThat(moduleFor(modules, ChannelRegistry.class).getBasePackage().getName())
        .isEqualTo("cafe.woden.audience.channel");
    assertThat(moduleFor(modules, DirectoryLookupService.class).getBasePackage().getName())
        .isEqualTo("cafe.woden.audience.directory");
    assertThat(moduleFor(modules, ChatEventDispatcher.class).getBasePackage().getName())
        .isEqualTo("cafe.woden.audience.dispatch");
    assertThat(moduleFor(modules, AudienceService.class).getBasePackage().getName())
        .isEqualTo("cafe.woden.audience.app");
  }

  @Test
  void moduleVerificationPassesWithCurrentBoundaries() {
    ApplicationModules.of(AudienceBotApp.class).verify();
  }

  private static ApplicationModule moduleFor(ApplicationModules modules, Class<?> type) {
    return modules
        .getModuleByType(type)
        .orElseThrow(() -> new AssertionError("No module discovered for type " + type.getName()));
  }
}
