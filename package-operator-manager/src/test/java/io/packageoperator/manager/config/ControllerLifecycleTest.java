package io.packageoperator.manager.config;

import static io.packageoperator.manager.TestObjects.CONFIG_MAP;
import static io.packageoperator.manager.TestObjects.NAMESPACE;
import static io.packageoperator.manager.TestObjects.deployment;
import static io.packageoperator.manager.TestObjects.template;
import static io.packageoperator.manager.TestObjects.templateObject;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.packageoperator.api.ObjectDeployment;
import io.packageoperator.api.ObjectKey;
import io.packageoperator.api.ObjectSet;
import io.packageoperator.api.ObjectSetTemplatePhase;
import io.packageoperator.api.PackageOperatorApi;
import io.packageoperator.reconciler.Conditions;
import io.packageoperator.store.InMemoryObjectStore;
import io.packageoperator.store.ListOptions;
import io.packageoperator.store.NotFoundException;
import io.packageoperator.store.ResourceCodec;
import io.packageoperator.store.TypedClient;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class ControllerLifecycleTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(10);

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(
              AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
          .withUserConfiguration(Config.class, ManagerConfiguration.class)
          .withPropertyValues(
              "package-operator.controllers.workers=2",
              "package-operator.controllers.teardown-poll-interval=100ms");

  @Test
  void rollsOutAndRemovesADeployment() {
    contextRunner.run(
        context -> {
          ControllerLifecycle lifecycle = context.getBean(ControllerLifecycle.class);
          assertThat(lifecycle.isRunning()).isTrue();
          InMemoryObjectStore store = context.getBean(InMemoryObjectStore.class);
          ResourceCodec codec = new ResourceCodec();
          TypedClient<ObjectDeployment> deployments =
              new TypedClient<>(store, PackageOperatorApi.OBJECT_DEPLOYMENT, codec);
          TypedClient<ObjectSet> objectSets = new TypedClient<>(store, PackageOperatorApi.OBJECT_SET, codec);

          ObjectDeployment created = deployments.create(deployment("web",
              template(ObjectSetTemplatePhase.inline("deploy", List.of(templateObject("settings", "a"))))));

          await().atMost(TIMEOUT).untilAsserted(() -> {
            ObjectDeployment current = deployments.get(created.metadata().key());
            assertThat(Conditions.isTrue(current.status().conditions(), PackageOperatorApi.CONDITION_AVAILABLE))
                .isTrue();
          });
          assertThat(store.get(CONFIG_MAP, ObjectKey.of(NAMESPACE, "settings"))).isNotNull();
          List<ObjectSet> revisions = objectSets.list(ListOptions.inNamespace(NAMESPACE));
          assertThat(revisions).hasSize(1);
          assertThat(revisions.get(0).status().phase()).isEqualTo(ObjectSet.Phase.AVAILABLE);

          deployments.delete(created.metadata().key());

          await().atMost(TIMEOUT).untilAsserted(() -> {
            assertThat(objectSets.list(ListOptions.inNamespace(NAMESPACE))).isEmpty();
            assertThat(configMapExists(store)).isFalse();
          });
        });
  }

  @Test
  void stopsBothControllersOnShutdown() {
    contextRunner.run(
        context -> {
          ControllerLifecycle lifecycle = context.getBean(ControllerLifecycle.class);
          assertThat(lifecycle.deploymentLoop()).isNotNull();
          assertThat(lifecycle.objectSetLoop()).isNotNull();

          lifecycle.stop();

          assertThat(lifecycle.isRunning()).isFalse();
        });
  }

  private static boolean configMapExists(InMemoryObjectStore store) {
    try {
      store.get(CONFIG_MAP, ObjectKey.of(NAMESPACE, "settings"));
      return true;
    } catch (NotFoundException e) {
      return false;
    }
  }

  @Configuration
  @EnableConfigurationProperties(PackageOperatorProperties.class)
  static class Config {

    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }
}
