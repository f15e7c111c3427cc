package cafe.woden.audience.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import cafe.woden.audience.directory.DirectoryApi;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(
    packages = "cafe.woden.audience",
    importOptions = {ImportOption.DoNotIncludeTests.class})
class ArchitectureGuardrailsTest {

  @ArchTest
  static final ArchRule irc_should_not_depend_on_channel_state_or_dispatch =
      noClasses()
          .that()
          .resideInAPackage("cafe.woden.audience.irc..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "cafe.woden.audience.channel..",
              "cafe.woden.audience.dispatch..",
              "cafe.woden.audience.directory..",
              "cafe.woden.audience.app..")
          .because("the connection only publishes parsed lines; reacting to them is dispatch's job");

  @ArchTest
  static final ArchRule channel_model_should_stay_free_of_io =
      noClasses()
          .that()
          .resideInAPackage("cafe.woden.audience.channel..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "cafe.woden.audience.irc..",
              "cafe.woden.audience.directory..",
              "cafe.woden.audience.dispatch..",
              "java.net..")
          .because("channel state is a plain in-memory model shared by handlers and the facade");

  @ArchTest
  static final ArchRule only_the_helix_client_should_speak_http =
      noClasses()
          .that()
          .resideOutsideOfPackages("cafe.woden.audience.directory..", "cafe.woden.audience.irc..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("java.net.http..")
          .because("REST and websocket access is confined to their adapters");

  @ArchTest
  static final ArchRule pipelines_should_use_the_directory_api_abstraction =
      noClasses()
          .that()
          .resideInAnyPackage("cafe.woden.audience.dispatch..", "cafe.woden.audience.app..")
          .should()
          .dependOnClassesThat()
          .haveSimpleName("HelixApiClient")
          .because("callers go through " + DirectoryApi.class.getSimpleName());

  @ArchTest
  static final ArchRule outward_ports_should_be_interfaces =
      classes()
          .that()
          .resideInAPackage("cafe.woden.audience.app.api..")
          .and()
          .haveSimpleNameEndingWith("Port")
          .should()
          .beInterfaces();

  @ArchTest
  static final ArchRule nothing_should_depend_on_the_app_module =
      noClasses()
          .that()
          .resideOutsideOfPackages("cafe.woden.audience.app..", "cafe.woden.audience")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("cafe.woden.audience.app..")
          .because("the facade sits on top; lower modules never call back into it");
}
